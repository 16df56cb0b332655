package com.bubblegrade.modules.report.dto;

import com.bubblegrade.modules.report.DistributionRow;
import com.bubblegrade.modules.report.PerformanceStatistics;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class PlSectionReport {
    private String sectionId;
    private String sectionName;
    /** Rounded to two decimals */
    private PerformanceStatistics statistics;
    private List<DistributionRow> distribution;
    private double totalPoints;
    private int studentCount;
    private int scanCount;
    private int numberOfItems;
}
