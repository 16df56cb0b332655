package com.bubblegrade.modules.scan.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.UUID;

@Data
public class SubmitScanRequest {

    /** Base64-encoded JPEG of the answer sheet */
    @NotBlank(message = "Image is required")
    private String image;

    @NotNull(message = "Exam id is required")
    private UUID examId;

    @NotNull(message = "Student id is required")
    private UUID studentId;

    /** Reuse the student's latest active scan instead of superseding it */
    private Boolean redo;
}
