package com.jasmin.webloghunter;

import com.jasmin.webloghunter.config.HunterProperties;
import com.jasmin.webloghunter.reporters.ReportWriter;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = "hunter.min-requests=25")
class WeblogHunterApplicationTests {

    @Autowired
    private HunterProperties properties;

    @Autowired
    private List<ReportWriter> writers;

    @Test
    void contextLoads() {
        assertEquals(25, properties.getMinRequests());
        assertEquals(10, properties.getTopIps());
        assertEquals("logs", properties.getLogRoot());
        assertEquals(List.of("html", "json", "md"), writers.stream().map(ReportWriter::format).sorted().collect(Collectors.toList()));
    }
}
