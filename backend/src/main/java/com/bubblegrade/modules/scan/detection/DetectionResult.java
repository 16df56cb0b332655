package com.bubblegrade.modules.scan.detection;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Optional;

/**
 * Result message pushed by the vision worker for one scan, and the detection
 * facts stored on the scan afterwards (possibly patched by manual edits).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DetectionResult(
        @JsonProperty("scan_id") String scanId,
        @JsonProperty("template_id") String templateId,
        @JsonProperty("status") DetectionResultStatus status,
        @JsonProperty("detections") List<QuestionDetection> detections,
        @JsonProperty("quality_metrics") QualityMetrics qualityMetrics,
        @JsonProperty("warnings") List<DetectionIssue> warnings,
        @JsonProperty("errors") List<DetectionIssue> errors,
        @JsonProperty("processing_time_ms") Long processingTimeMs,
        @JsonProperty("timestamp") String timestamp) {

    public DetectionResult {
        detections = detections == null ? List.of() : List.copyOf(detections);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public DetectionResult withDetections(List<QuestionDetection> newDetections) {
        return new DetectionResult(scanId, templateId, status, newDetections, qualityMetrics, warnings, errors,
                processingTimeMs, timestamp);
    }

    @JsonIgnore
    public Optional<DetectionIssue> firstError() {
        return errors.isEmpty() ? Optional.empty() : Optional.of(errors.get(0));
    }

    @JsonIgnore
    public Optional<QuestionDetection> detectionFor(int questionId) {
        return detections.stream().filter(d -> d.questionId() == questionId).findFirst();
    }
}
