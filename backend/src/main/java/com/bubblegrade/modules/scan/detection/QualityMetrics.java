package com.bubblegrade.modules.scan.detection;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QualityMetrics(
        @JsonProperty("blur_score") Double blurScore,
        @JsonProperty("brightness_mean") Double brightnessMean,
        @JsonProperty("brightness_std") Double brightnessStd,
        @JsonProperty("skew_angle") Double skewAngle,
        @JsonProperty("perspective_correction_applied") Boolean perspectiveCorrectionApplied) {
}
