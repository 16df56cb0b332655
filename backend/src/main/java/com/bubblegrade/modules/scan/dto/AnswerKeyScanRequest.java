package com.bubblegrade.modules.scan.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class AnswerKeyScanRequest {

    @NotBlank(message = "Image is required")
    private String image;

    @NotBlank(message = "Template id is required")
    private String templateId;
}
