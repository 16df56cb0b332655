package com.bubblegrade.modules.report.dto;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class SummaryRow {
    private String sectionId;
    private String sectionName;
    private int studentsTookExam;
    private int totalStudents;
    private double mean;
    private double pl;
    private double mps;
    private double hso;
    private double lso;
}
