package com.bubblegrade.modules.scan;

import com.bubblegrade.modules.scan.dto.*;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/scans")
@RequiredArgsConstructor
@PreAuthorize("hasAnyRole('ADMIN','TEACHER')")
@Tag(name = "Scans", description = "Answer sheet upload, polling, correction and review")
public class ScanController {

    private final ScanService scanService;

    @PostMapping
    @Operation(summary = "Upload a student's answer sheet (202, detection runs asynchronously)")
    public ResponseEntity<ScanDto> submit(@Valid @RequestBody SubmitScanRequest request) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(scanService.submit(request));
    }

    @PostMapping("/answer-key")
    @Operation(summary = "Upload an answer-key sheet for a template (never graded)")
    public ResponseEntity<ScanDto> submitAnswerKey(@Valid @RequestBody AnswerKeyScanRequest request) {
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(scanService.submitAnswerKeyScan(request.getImage(), request.getTemplateId()));
    }

    @GetMapping
    @Operation(summary = "List scans of an exam, optionally for one student")
    public ResponseEntity<List<ScanDto>> list(
            @RequestParam UUID examId,
            @RequestParam(required = false) UUID studentId,
            @RequestParam(defaultValue = "false") boolean includeOutdated) {
        return ResponseEntity.ok(scanService.listScans(examId, studentId, includeOutdated));
    }

    @GetMapping("/{scanId}")
    @Operation(summary = "Get a scan; poll until 'terminal' is true")
    public ResponseEntity<ScanDto> get(@PathVariable String scanId) {
        return ResponseEntity.ok(scanService.getScan(scanId));
    }

    @PutMapping("/{scanId}/answers")
    @Operation(summary = "Correct detected answers and regrade")
    public ResponseEntity<ScanDto> updateAnswers(@PathVariable String scanId,
            @Valid @RequestBody UpdateAnswersRequest request) {
        return ResponseEntity.ok(scanService.updateAnswers(scanId, request.getAnswers()));
    }

    @PostMapping("/{scanId}/review")
    @Operation(summary = "Mark a scan as reviewed")
    public ResponseEntity<ScanDto> review(@PathVariable String scanId,
            @Valid @RequestBody(required = false) ReviewRequest request) {
        return ResponseEntity.ok(scanService.markReviewed(scanId, request != null ? request.getReviewNotes() : null));
    }
}
