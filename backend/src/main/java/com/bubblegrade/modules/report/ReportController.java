package com.bubblegrade.modules.report;

import com.bubblegrade.modules.report.dto.ItemReport;
import com.bubblegrade.modules.report.dto.PlReport;
import com.bubblegrade.modules.report.dto.SummaryReport;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/api/reports")
@RequiredArgsConstructor
@PreAuthorize("hasAnyRole('ADMIN','TEACHER')")
@Tag(name = "Reports", description = "Performance level and item analysis per section")
public class ReportController {

    private final ReportService reportService;

    @GetMapping("/pl-entries")
    @Operation(summary = "Score distribution, mean, PL and MPS per section (and overall)")
    public ResponseEntity<PlReport> getPlEntries(
            @RequestParam(name = "grade_id", required = false) UUID gradeId,
            @RequestParam(name = "class_id", required = false) UUID classId,
            @RequestParam(name = "exam_id", required = false) UUID examId,
            @RequestParam(name = "view", required = false) String view) {
        return ResponseEntity.ok(reportService.getPlEntries(gradeId, classId, examId, ReportView.fromParam(view)));
    }

    @GetMapping("/item-entries")
    @Operation(summary = "Per-question correct counts, remarks and ranks per section (and overall)")
    public ResponseEntity<ItemReport> getItemEntries(
            @RequestParam(name = "grade_id", required = false) UUID gradeId,
            @RequestParam(name = "class_id", required = false) UUID classId,
            @RequestParam(name = "exam_id", required = false) UUID examId,
            @RequestParam(name = "view", required = false) String view) {
        return ResponseEntity.ok(reportService.getItemEntries(gradeId, classId, examId, ReportView.fromParam(view)));
    }

    @GetMapping("/summary")
    @Operation(summary = "One summary row per section plus the overall row")
    public ResponseEntity<SummaryReport> getSummary(
            @RequestParam(name = "grade_id", required = false) UUID gradeId,
            @RequestParam(name = "class_id", required = false) UUID classId,
            @RequestParam(name = "exam_id", required = false) UUID examId) {
        return ResponseEntity.ok(reportService.getSummary(gradeId, classId, examId));
    }
}
