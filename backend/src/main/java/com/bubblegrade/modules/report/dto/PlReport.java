package com.bubblegrade.modules.report.dto;

import com.bubblegrade.modules.report.ReportView;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class PlReport {
    private ReportView view;
    private List<PlSectionReport> sections;
    /** Only for the overall view */
    private PlSectionReport overall;
}
