package com.bubblegrade.modules.scan;

import com.bubblegrade.exception.ConcurrentSubmissionException;
import com.bubblegrade.modules.grading.GradingResult;
import com.bubblegrade.modules.scan.detection.DetectionResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * {@link ScanStore} over the {@code scans} table. JSON-shaped facts are kept
 * in jsonb columns and mapped with the application's ObjectMapper.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JpaScanStore implements ScanStore {

    private static final TypeReference<List<AuditEntry>> AUDIT_LOG = new TypeReference<>() {
    };

    private final ScanEntityRepository repository;
    private final ObjectMapper objectMapper;

    @Override
    public Optional<Scan> load(String scanId) {
        return repository.findById(scanId).map(this::toSnapshot);
    }

    @Override
    public Scan save(Scan scan) {
        ScanEntity entity = repository.findById(scan.scanId()).orElse(null);
        if (entity == null) {
            entity = new ScanEntity();
        } else if (scan.version() != null && !scan.version().equals(entity.getVersion())) {
            throw new ObjectOptimisticLockingFailureException(ScanEntity.class, scan.scanId());
        }
        copyInto(scan, entity);
        try {
            // flush so the active-scan index is checked inside this call
            return toSnapshot(repository.saveAndFlush(entity));
        } catch (DataIntegrityViolationException e) {
            log.warn("Rejected write for scan {} (exam={}, student={}): another active scan exists",
                    scan.scanId(), scan.examId(), scan.studentId());
            throw new ConcurrentSubmissionException(
                    "Another active scan already exists for this exam and student", e);
        }
    }

    @Override
    public List<Scan> find(ScanQuery query) {
        List<ScanEntity> rows;
        if (query instanceof ScanQuery.ByExamAndStudent q) {
            rows = q.activeOnly()
                    ? repository.findByExamIdAndStudentIdAndStatusNotInOrderByCreatedAtDesc(
                            q.examId(), q.studentId(), ScanStatus.RETIRED)
                    : repository.findByExamIdAndStudentIdOrderByCreatedAtDesc(q.examId(), q.studentId());
        } else if (query instanceof ScanQuery.ByExamForStudents q) {
            if (q.studentIds().isEmpty() || q.statuses().isEmpty()) {
                return List.of();
            }
            rows = repository.findForStudents(q.examId(), q.studentIds(), q.statuses());
        } else if (query instanceof ScanQuery.ByExam q) {
            rows = q.includeOutdated()
                    ? repository.findByExamIdOrderByCreatedAtDesc(q.examId())
                    : repository.findByExamIdAndStatusNotOrderByCreatedAtDesc(q.examId(), ScanStatus.OUTDATED);
        } else {
            throw new IllegalArgumentException("Unsupported scan query: " + query);
        }
        return rows.stream().map(this::toSnapshot).toList();
    }

    private void copyInto(Scan scan, ScanEntity entity) {
        entity.setScanId(scan.scanId());
        entity.setExamId(scan.examId());
        entity.setStudentId(scan.studentId());
        entity.setClassId(scan.classId());
        entity.setTemplateId(scan.templateId());
        entity.setImagePath(scan.imagePath());
        entity.setStatus(scan.status());
        entity.setDetection(write(scan.detection()));
        entity.setGrading(write(scan.grading()));
        entity.setErrorCode(scan.errorCode());
        entity.setErrorMessage(scan.errorMessage());
        entity.setProcessingStartedAt(scan.processingStartedAt());
        entity.setProcessingCompletedAt(scan.processingCompletedAt());
        entity.setProcessingTimeMs(scan.processingTimeMs());
        entity.setGradedAt(scan.gradedAt());
        entity.setGradedBy(scan.gradedBy());
        entity.setReviewedBy(scan.reviewedBy());
        entity.setReviewedAt(scan.reviewedAt());
        entity.setReviewNotes(scan.reviewNotes());
        entity.setAuditLog(write(scan.auditLog()));
        entity.setCreatedAt(scan.createdAt());
        entity.setUpdatedAt(scan.updatedAt());
    }

    private Scan toSnapshot(ScanEntity entity) {
        return Scan.builder()
                .scanId(entity.getScanId())
                .examId(entity.getExamId())
                .studentId(entity.getStudentId())
                .classId(entity.getClassId())
                .templateId(entity.getTemplateId())
                .imagePath(entity.getImagePath())
                .status(entity.getStatus())
                .detection(read(entity.getDetection(), DetectionResult.class))
                .grading(read(entity.getGrading(), GradingResult.class))
                .errorCode(entity.getErrorCode())
                .errorMessage(entity.getErrorMessage())
                .processingStartedAt(entity.getProcessingStartedAt())
                .processingCompletedAt(entity.getProcessingCompletedAt())
                .processingTimeMs(entity.getProcessingTimeMs())
                .gradedAt(entity.getGradedAt())
                .gradedBy(entity.getGradedBy())
                .reviewedBy(entity.getReviewedBy())
                .reviewedAt(entity.getReviewedAt())
                .reviewNotes(entity.getReviewNotes())
                .auditLog(readAuditLog(entity.getAuditLog()))
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .version(entity.getVersion())
                .build();
    }

    private String write(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T read(String json, Class<T> type) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt " + type.getSimpleName() + " column", e);
        }
    }

    private List<AuditEntry> readAuditLog(String json) {
        if (json == null) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, AUDIT_LOG);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt audit_log column", e);
        }
    }
}
