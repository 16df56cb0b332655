package com.bubblegrade.modules.scan;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface ScanEntityRepository extends JpaRepository<ScanEntity, String> {

        List<ScanEntity> findByExamIdAndStudentIdOrderByCreatedAtDesc(UUID examId, UUID studentId);

        List<ScanEntity> findByExamIdAndStudentIdAndStatusNotInOrderByCreatedAtDesc(UUID examId, UUID studentId,
                        Collection<ScanStatus> statuses);

        List<ScanEntity> findByExamIdOrderByCreatedAtDesc(UUID examId);

        List<ScanEntity> findByExamIdAndStatusNotOrderByCreatedAtDesc(UUID examId, ScanStatus status);

        @Query("SELECT s FROM ScanEntity s WHERE s.examId = :examId AND s.studentId IN :studentIds " +
                        "AND s.status IN :statuses ORDER BY s.createdAt DESC")
        List<ScanEntity> findForStudents(@Param("examId") UUID examId,
                        @Param("studentIds") Collection<UUID> studentIds,
                        @Param("statuses") Collection<ScanStatus> statuses);
}
