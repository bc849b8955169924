package com.jasmin.webloghunter.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "hunter")
public class HunterProperties {

    /** Minimum requests an address needs before it is scored. */
    @Min(1)
    private int minRequests = 50;

    /** Number of top suspicious addresses to report. */
    @Min(1)
    private int topIps = 10;

    /** Worker threads used to read log files in parallel. */
    @Min(1)
    private int threads = 4;

    /** Raw events written to the JSON report (0 => none). */
    @Min(0)
    private int eventDumpCap = 20000;

    /** Directory the HTTP endpoints may read from; {@code input} paths are resolved against it. */
    @NotBlank
    private String logRoot = "logs";

    /** Endpoints named in summary blocks. */
    @Min(1)
    private int endpointSummaryCap = 10;
}
