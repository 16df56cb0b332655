package com.bubblegrade.modules.report.dto;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class SummaryReport {
    private String gradeName;
    private String className;
    private String examName;
    private String academicYear;
    private List<SummaryRow> sections;
    private SummaryRow overall;
}
