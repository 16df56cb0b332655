package com.bubblegrade.modules.scan.dto;

import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

import java.util.List;
import java.util.Map;

@Data
public class UpdateAnswersRequest {

    /** Question id to the options the reviewer reads as marked; an empty list clears the answer */
    @NotEmpty(message = "Answers are required")
    private Map<Integer, List<String>> answers;
}
