package com.bubblegrade.modules.scan;

import com.bubblegrade.exception.ConcurrentSubmissionException;
import com.bubblegrade.modules.grading.GradingEngine;
import com.bubblegrade.modules.scan.detection.DetectionResult;
import com.bubblegrade.support.Fixtures;
import com.bubblegrade.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static com.bubblegrade.support.Fixtures.ambiguous;
import static com.bubblegrade.support.Fixtures.answered;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JpaScanStoreTest {

    private static final UUID EXAM_ID = UUID.randomUUID();
    private static final UUID STUDENT_ID = UUID.randomUUID();

    @Mock
    private ScanEntityRepository repository;

    private final ScanStateMachine machine =
            new ScanStateMachine(new MutableClock(Instant.parse("2026-03-02T08:00:00Z")));
    private JpaScanStore store;

    @BeforeEach
    void setUp() {
        store = new JpaScanStore(repository, Fixtures.objectMapper());
    }

    private Scan gradedScan() {
        DetectionResult detection = Fixtures.success("scan-1", ambiguous(1, "A", "B"), answered(2, "B"));
        Scan scan = machine.create("scan-1", EXAM_ID, STUDENT_ID, null, Fixtures.TEMPLATE, "a.jpg");
        scan = machine.applyDetection(scan, detection);
        return machine.applyGrading(scan,
                new GradingEngine().grade("scan-1", EXAM_ID, detection, Fixtures.twoQuestionKey(EXAM_ID)),
                "system");
    }

    @Test
    void newScanIsWrittenWithJsonColumnsAndReadBack() {
        Scan scan = gradedScan();
        when(repository.findById("scan-1")).thenReturn(Optional.empty());
        when(repository.saveAndFlush(any(ScanEntity.class))).thenAnswer(invocation -> {
            ScanEntity entity = invocation.getArgument(0);
            entity.setVersion(0L);
            return entity;
        });

        Scan saved = store.save(scan);

        ArgumentCaptor<ScanEntity> written = ArgumentCaptor.forClass(ScanEntity.class);
        verify(repository).saveAndFlush(written.capture());
        assertThat(written.getValue().getStatus()).isEqualTo(ScanStatus.NEEDS_REVIEW);
        assertThat(written.getValue().getDetection()).contains("\"question_id\":1");
        assertThat(written.getValue().getGrading()).contains("\"needs_manual_review\":true");
        assertThat(written.getValue().getAuditLog()).contains("Graded");

        assertThat(saved.version()).isZero();
        assertThat(saved.detection()).isEqualTo(scan.detection());
        assertThat(saved.grading()).isEqualTo(scan.grading());
        assertThat(saved.auditLog()).extracting(AuditEntry::message)
                .containsExactlyElementsOf(scan.auditLog().stream().map(AuditEntry::message).toList());
        assertThat(saved.auditLog()).extracting(AuditEntry::timestamp)
                .containsExactlyElementsOf(scan.auditLog().stream().map(AuditEntry::timestamp).toList());
        assertThat(saved.processingStartedAt()).isEqualTo(scan.processingStartedAt());
    }

    @Test
    void staleSnapshotIsRejected() {
        ScanEntity current = new ScanEntity();
        current.setScanId("scan-1");
        current.setVersion(3L);
        when(repository.findById("scan-1")).thenReturn(Optional.of(current));
        Scan stale = gradedScan().toBuilder().version(2L).build();

        assertThatThrownBy(() -> store.save(stale)).isInstanceOf(ObjectOptimisticLockingFailureException.class);
        verify(repository, never()).saveAndFlush(any());
    }

    @Test
    void activeScanIndexViolationIsAConcurrentSubmission() {
        Scan scan = machine.create("scan-2", EXAM_ID, STUDENT_ID, null, Fixtures.TEMPLATE, "b.jpg");
        when(repository.findById("scan-2")).thenReturn(Optional.empty());
        when(repository.saveAndFlush(any(ScanEntity.class)))
                .thenThrow(new DataIntegrityViolationException("uq_scans_active_exam_student"));

        assertThatThrownBy(() -> store.save(scan))
                .isInstanceOf(ConcurrentSubmissionException.class)
                .hasCauseInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    void unreadableJsonColumnFailsLoudly() {
        ScanEntity entity = new ScanEntity();
        entity.setScanId("scan-1");
        entity.setStatus(ScanStatus.DETECTED);
        entity.setDetection("{not json");
        when(repository.findById("scan-1")).thenReturn(Optional.of(entity));

        assertThatThrownBy(() -> store.load("scan-1"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("DetectionResult");
    }

    @Test
    void queriesReachTheMatchingRepositoryMethods() {
        store.find(new ScanQuery.ByExamAndStudent(EXAM_ID, STUDENT_ID, true));
        verify(repository).findByExamIdAndStudentIdAndStatusNotInOrderByCreatedAtDesc(EXAM_ID, STUDENT_ID,
                ScanStatus.RETIRED);

        store.find(new ScanQuery.ByExamAndStudent(EXAM_ID, STUDENT_ID, false));
        verify(repository).findByExamIdAndStudentIdOrderByCreatedAtDesc(EXAM_ID, STUDENT_ID);

        store.find(new ScanQuery.ByExamForStudents(EXAM_ID, List.of(STUDENT_ID), Set.of(ScanStatus.GRADED)));
        verify(repository).findForStudents(EXAM_ID, List.of(STUDENT_ID), Set.of(ScanStatus.GRADED));

        store.find(new ScanQuery.ByExam(EXAM_ID, true));
        verify(repository).findByExamIdOrderByCreatedAtDesc(EXAM_ID);

        store.find(new ScanQuery.ByExam(EXAM_ID, false));
        verify(repository).findByExamIdAndStatusNotOrderByCreatedAtDesc(EXAM_ID, ScanStatus.OUTDATED);
    }

    @Test
    void emptyStudentSetSkipsTheDatabase() {
        assertThat(store.find(new ScanQuery.ByExamForStudents(EXAM_ID, List.of(), Set.of(ScanStatus.GRADED))))
                .isEmpty();
        verifyNoInteractions(repository);
    }
}
