package com.bubblegrade.modules.report.dto;

import com.bubblegrade.modules.report.ItemRow;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class ItemSectionReport {
    private String sectionId;
    private String sectionName;
    private List<ItemRow> items;
    private int totalStudents;
    private int totalQuestions;
    private int studentsTookExam;
    private int sectionTotalCorrect;
}
