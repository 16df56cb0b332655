package com.bubblegrade.modules.report.dto;

import com.bubblegrade.modules.report.ItemRow;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class ItemOverallReport {
    private List<ItemRow> items;
    private int totalStudentsTookExam;
    private int totalQuestions;
    private int totalCorrect;
    private long totalPossible;
    private double overallPercentage;
}
