package com.bubblegrade.modules.scan.detection;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/** A warning or error raised by the vision worker, e.g. {@code PAPER_NOT_DETECTED}. */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DetectionIssue(
        @JsonProperty("code") String code,
        @JsonProperty("message") String message,
        @JsonProperty("question_id") Integer questionId,
        @JsonProperty("stage") String stage) {
}
