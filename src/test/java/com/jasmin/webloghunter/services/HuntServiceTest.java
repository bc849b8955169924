package com.jasmin.webloghunter.services;

import com.jasmin.webloghunter.models.AnalysisResult;
import com.jasmin.webloghunter.models.LogEvent;
import com.jasmin.webloghunter.models.ReadSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

public class HuntServiceTest {

    @Mock
    private LogSourceService logSourceService;

    @Mock
    private ThreatAnalyzer threatAnalyzer;

    @InjectMocks
    private HuntService huntService;

    @BeforeEach
    public void setUp() {
        MockitoAnnotations.openMocks(this);
    }

    @Test
    public void testHuntCopiesReadCounters() {
        Path input = Path.of("/var/log/nginx");
        List<LogEvent> events = List.of(LogEvent.builder().address("10.0.0.1").path("/").build());
        when(logSourceService.readAll(input)).thenReturn(new ReadSummary(events, 7, 3));
        when(threatAnalyzer.analyze(events, 50, 10)).thenReturn(AnalysisResult.builder()
                .parsedEvents(1)
                .topSuspiciousIps(List.of())
                .toolsFirstSeen(List.of())
                .vulnerableEndpoints(List.of())
                .allEvents(events)
                .build());

        AnalysisResult result = huntService.hunt(input, 50, 10);

        assertEquals(3, result.getFilesRead());
        assertEquals(7, result.getParseFailures());
        assertEquals(1, result.getParsedEvents());
        assertSame(events, result.getAllEvents());
        verify(threatAnalyzer).analyze(events, 50, 10);
    }
}
