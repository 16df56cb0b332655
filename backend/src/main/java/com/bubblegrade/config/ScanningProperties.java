package com.bubblegrade.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Queue and worker settings shared with the vision worker.
 */
@Data
@ConfigurationProperties(prefix = "scanning")
public class ScanningProperties {

    /** Redis list the vision worker pops jobs from */
    private String jobQueue = "scan_jobs";

    /** Redis list the vision worker pushes detection results onto */
    private String resultQueue = "scan_results";

    /** Redis list holding result messages that were dropped, with the drop reason */
    private String deadLetterQueue = "scan_results:dead";

    private boolean deadLetterEnabled = true;

    /** Blocking-pop timeout; bounds how long a stop request waits for the loop */
    private int popTimeoutSeconds = 5;

    /** Pause after a failed iteration before popping again */
    private long errorBackoffMillis = 1000;

    /** Start the result consumer with the application context */
    private boolean consumerAutoStartup = true;

    /** Directory shared with the vision worker; job image paths are relative to it */
    private String imageStorageDir = "/data/scans";

    /** Upper bound on sections computed in parallel for one report */
    private int reportParallelism = 8;
}
