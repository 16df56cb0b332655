package com.bubblegrade.modules.exam;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.UUID;

/**
 * Exam definition owned by the exam-management side. This service only reads
 * it: the answer key and policy are kept as jsonb in the shape the vision
 * worker's answer-key scan produces.
 */
@Entity
@Table(name = "exams")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Exam {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(name = "template_id", nullable = false, length = 100)
    private String templateId;

    @Column(name = "class_id")
    private UUID classId;

    /** JSON array of {question_id, correct, points} */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(nullable = false, columnDefinition = "jsonb")
    private String answers;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "grading_policy", columnDefinition = "jsonb")
    private String gradingPolicy;

    @Column(name = "question_count")
    private Integer questionCount;

    @Column(name = "total_points")
    private Double totalPoints;

    @Column(name = "created_by", nullable = false, length = 100)
    private String createdBy;

    @Column(name = "is_active")
    @Builder.Default
    private Boolean isActive = true;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private ExamStatus status = ExamStatus.DRAFT;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    public enum ExamStatus {
        DRAFT, ACTIVE, COMPLETED, ARCHIVED
    }
}
