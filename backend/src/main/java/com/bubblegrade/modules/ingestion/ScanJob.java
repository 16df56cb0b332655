package com.bubblegrade.modules.ingestion;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Job handed to the vision worker. Published as an application event by the
 * scan lifecycle and pushed to the job queue once the creating transaction
 * has committed.
 */
public record ScanJob(
        @JsonProperty("scan_id") String scanId,
        @JsonProperty("image_path") String imagePath,
        @JsonProperty("template_id") String templateId) {
}
