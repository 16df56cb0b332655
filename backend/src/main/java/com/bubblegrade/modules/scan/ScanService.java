package com.bubblegrade.modules.scan;

import com.bubblegrade.exception.BusinessException;
import com.bubblegrade.exception.ResourceNotFoundException;
import com.bubblegrade.exception.UnauthorizedAccessException;
import com.bubblegrade.modules.exam.Exam;
import com.bubblegrade.modules.exam.ExamRepository;
import com.bubblegrade.modules.ingestion.ScanJob;
import com.bubblegrade.modules.roster.StudentRepository;
import com.bubblegrade.modules.scan.detection.DetectionResult;
import com.bubblegrade.modules.scan.detection.QuestionDetection;
import com.bubblegrade.modules.scan.dto.ScanDto;
import com.bubblegrade.modules.scan.dto.SubmitScanRequest;
import com.bubblegrade.modules.storage.ScanImageStore;
import com.bubblegrade.security.SecurityUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class ScanService {

    private final ScanStore scanStore;
    private final ScanStateMachine stateMachine;
    private final DuplicateScanResolver duplicateResolver;
    private final ScanGrader scanGrader;
    private final ExamRepository examRepository;
    private final StudentRepository studentRepository;
    private final ScanImageStore imageStore;
    private final SecurityUtils securityUtils;
    private final ApplicationEventPublisher eventPublisher;

    /**
     * Accepts a student's answer sheet. Older active scans for the same exam
     * and student are superseded, or with {@code redo} the latest one is reset
     * and reused. The detection job is queued after commit.
     */
    @Transactional
    public ScanDto submit(SubmitScanRequest request) {
        Exam exam = examRepository.findByIdAndIsActiveTrue(request.getExamId())
                .orElseThrow(() -> new ResourceNotFoundException("Exam", request.getExamId().toString()));
        checkExamAccess(exam);
        if (!studentRepository.existsById(request.getStudentId())) {
            throw new ResourceNotFoundException("Student", request.getStudentId().toString());
        }
        if (exam.getTemplateId() == null || exam.getTemplateId().isBlank()) {
            throw new BusinessException("Exam " + exam.getId() + " has no template");
        }

        byte[] image = decodeImage(request.getImage());
        boolean redoRequested = Boolean.TRUE.equals(request.getRedo());

        List<Scan> existing = scanStore.find(
                new ScanQuery.ByExamAndStudent(exam.getId(), request.getStudentId(), true));
        SubmissionPlan plan = duplicateResolver.plan(existing, redoRequested);

        String imagePath = imageStore.store(image);
        Scan saved;
        try {
            saved = persistSubmission(exam, request.getStudentId(), plan, imagePath);
        } catch (RuntimeException e) {
            imageStore.delete(imagePath);
            throw e;
        }

        eventPublisher.publishEvent(new ScanJob(saved.scanId(), saved.imagePath(), saved.templateId()));
        return toDto(saved, plan.isRedo());
    }

    private Scan persistSubmission(Exam exam, UUID studentId, SubmissionPlan plan, String imagePath) {
        String activeScanId = plan.reuse().map(Scan::scanId).orElseGet(() -> UUID.randomUUID().toString());
        for (Scan stale : plan.toOutdate()) {
            scanStore.save(stateMachine.markOutdated(stale, activeScanId));
            log.info("Scan {} outdated by {} (exam={}, student={})", stale.scanId(), activeScanId, exam.getId(),
                    studentId);
        }

        Scan saved;
        if (plan.isRedo()) {
            saved = scanStore.save(stateMachine.resetForRedo(plan.reuse().get(), imagePath));
            log.info("Scan {} reset for redo with image {}", saved.scanId(), imagePath);
        } else {
            saved = scanStore.save(stateMachine.create(activeScanId, exam.getId(), studentId,
                    exam.getClassId(), exam.getTemplateId(), imagePath));
            log.info("Scan {} created for exam {} and student {}", saved.scanId(), exam.getId(), studentId);
        }
        return saved;
    }

    /** Answer-key sheet: detected like any other scan, never graded. */
    @Transactional
    public ScanDto submitAnswerKeyScan(String image, String templateId) {
        String imagePath = imageStore.store(decodeImage(image));
        Scan saved = scanStore.save(stateMachine.create(UUID.randomUUID().toString(), null, null, null,
                templateId, imagePath));
        log.info("Answer-key scan {} created for template {}", saved.scanId(), templateId);
        eventPublisher.publishEvent(new ScanJob(saved.scanId(), saved.imagePath(), saved.templateId()));
        return toDto(saved, false);
    }

    @Transactional(readOnly = true)
    public ScanDto getScan(String scanId) {
        Scan scan = loadAccessible(scanId);
        return toDto(scan, false);
    }

    @Transactional(readOnly = true)
    public List<ScanDto> listScans(UUID examId, UUID studentId, boolean includeOutdated) {
        Exam exam = examRepository.findById(examId)
                .orElseThrow(() -> new ResourceNotFoundException("Exam", examId.toString()));
        checkExamAccess(exam);

        List<Scan> scans;
        if (studentId != null) {
            scans = scanStore.find(new ScanQuery.ByExamAndStudent(examId, studentId, false)).stream()
                    .filter(scan -> includeOutdated || scan.status() != ScanStatus.OUTDATED)
                    .toList();
        } else {
            scans = scanStore.find(new ScanQuery.ByExam(examId, includeOutdated));
        }
        return scans.stream().map(scan -> toDto(scan, false)).toList();
    }

    /**
     * Applies a reviewer's reading of the sheet and regrades. Only questions
     * whose selection actually changes are flagged as manually edited.
     */
    @Transactional
    public ScanDto updateAnswers(String scanId, Map<Integer, List<String>> answers) {
        Scan scan = loadAccessible(scanId);
        if (!scan.hasDetection()) {
            throw new BusinessException("Scan " + scanId + " has no detection results and cannot be edited");
        }

        Map<Integer, List<String>> requested = new TreeMap<>();
        answers.forEach((questionId, selection) ->
                requested.put(questionId, QuestionDetection.normalize(selection)));

        List<QuestionDetection> detections = new ArrayList<>();
        List<Integer> changed = new ArrayList<>();
        for (QuestionDetection detection : scan.detection().detections()) {
            List<String> selection = requested.remove(detection.questionId());
            if (selection != null && !detection.hasSameSelection(selection)) {
                detections.add(detection.withManualSelection(selection));
                changed.add(detection.questionId());
            } else {
                detections.add(detection);
            }
        }
        // questions the worker did not report at all
        requested.forEach((questionId, selection) -> {
            detections.add(QuestionDetection.manual(questionId, selection));
            changed.add(questionId);
        });

        if (changed.isEmpty()) {
            log.debug("Answer edit for scan {} changed nothing", scanId);
            return toDto(scan, false);
        }

        DetectionResult edited = scan.detection().withDetections(detections);
        String editor = securityUtils.getCurrentUserId();

        Scan updated;
        if (scan.isLinkedToExam()) {
            ScanGrader.Attempt attempt = scanGrader.grade(scan, edited);
            updated = stateMachine.applyManualEdit(scan, edited, changed, editor, attempt.result(),
                    attempt.failure());
        } else {
            updated = stateMachine.applyManualEdit(scan, edited, changed, editor, null, null);
        }

        Scan saved = scanStore.save(updated);
        log.info("Scan {} answers edited by {} (questions={}, status={})", scanId, editor, changed,
                saved.status().getValue());
        return toDto(saved, false);
    }

    @Transactional
    public ScanDto markReviewed(String scanId, String reviewNotes) {
        Scan scan = loadAccessible(scanId);
        String reviewer = securityUtils.getCurrentUserId();
        Scan saved = scanStore.save(stateMachine.markReviewed(scan, reviewer, reviewNotes));
        log.info("Scan {} marked as reviewed by {}", scanId, reviewer);
        return toDto(saved, false);
    }

    private Scan loadAccessible(String scanId) {
        Scan scan = scanStore.load(scanId)
                .orElseThrow(() -> new ResourceNotFoundException("Scan", scanId));
        if (scan.isLinkedToExam() && securityUtils.isTeacher()) {
            Exam exam = examRepository.findById(scan.examId())
                    .orElseThrow(() -> new ResourceNotFoundException("Exam", scan.examId().toString()));
            checkExamAccess(exam);
        }
        return scan;
    }

    private void checkExamAccess(Exam exam) {
        if (securityUtils.isTeacher() && !Objects.equals(exam.getCreatedBy(), securityUtils.getCurrentUserId())) {
            throw new UnauthorizedAccessException("You can only work with scans of your own exams");
        }
    }

    private static byte[] decodeImage(String image) {
        String payload = image;
        int comma = payload.indexOf(',');
        // accept data URLs as sent by browsers
        if (payload.startsWith("data:") && comma > 0) {
            payload = payload.substring(comma + 1);
        }
        try {
            byte[] bytes = Base64.getMimeDecoder().decode(payload);
            if (bytes.length == 0) {
                throw new BusinessException("Image is empty");
            }
            return bytes;
        } catch (IllegalArgumentException e) {
            throw new BusinessException("Image is not valid base64");
        }
    }

    static ScanDto toDto(Scan scan, boolean redo) {
        return ScanDto.builder()
                .scanId(scan.scanId())
                .examId(scan.examId())
                .studentId(scan.studentId())
                .classId(scan.classId())
                .templateId(scan.templateId())
                .imagePath(scan.imagePath())
                .status(scan.status())
                .terminal(scan.status().isTerminalForPolling())
                .redo(redo)
                .detection(scan.detection())
                .grading(scan.grading())
                .errorCode(scan.errorCode())
                .errorMessage(scan.errorMessage())
                .processingStartedAt(scan.processingStartedAt())
                .processingCompletedAt(scan.processingCompletedAt())
                .processingTimeMs(scan.processingTimeMs())
                .gradedAt(scan.gradedAt())
                .gradedBy(scan.gradedBy())
                .reviewedBy(scan.reviewedBy())
                .reviewedAt(scan.reviewedAt())
                .reviewNotes(scan.reviewNotes())
                .createdAt(scan.createdAt())
                .updatedAt(scan.updatedAt())
                .auditLog(scan.auditLog())
                .build();
    }
}
