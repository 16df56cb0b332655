package com.bubblegrade.modules.report.dto;

import com.bubblegrade.modules.report.ReportView;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class ItemReport {
    private ReportView view;
    private List<ItemSectionReport> sections;
    private ItemOverallReport overall;
}
