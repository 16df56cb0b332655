package com.bubblegrade.modules.roster;

import jakarta.persistence.*;
import lombok.*;

import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

/**
 * A class taught to one or more sections. Named to avoid clashing with
 * {@link java.lang.Class}.
 */
@Entity
@Table(name = "classes")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SchoolClass {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(name = "grade_id")
    private UUID gradeId;

    @Column(name = "academic_year", length = 20)
    private String academicYear;

    @Column(name = "teacher_id", length = 100)
    private String teacherId;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "class_sections", joinColumns = @JoinColumn(name = "class_id"))
    @Column(name = "section_id", nullable = false)
    @Builder.Default
    private Set<UUID> sectionIds = new HashSet<>();

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private ClassStatus status = ClassStatus.ACTIVE;

    public enum ClassStatus {
        ACTIVE, ARCHIVED, COMPLETED
    }
}
