package com.bubblegrade.modules.roster;

import jakarta.persistence.*;
import lombok.*;

import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

@Entity
@Table(name = "students")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Student {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    /** School-issued student number */
    @Column(name = "student_number", nullable = false, unique = true, length = 50)
    private String studentNumber;

    @Column(name = "first_name", nullable = false, length = 100)
    private String firstName;

    @Column(name = "last_name", nullable = false, length = 100)
    private String lastName;

    /** Null for records created before sections existed. */
    @Column(name = "section_id")
    private UUID sectionId;

    @ElementCollection
    @CollectionTable(name = "student_classes", joinColumns = @JoinColumn(name = "student_id"))
    @Column(name = "class_id", nullable = false)
    @Builder.Default
    private Set<UUID> classIds = new HashSet<>();

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private StudentStatus status = StudentStatus.ACTIVE;

    public enum StudentStatus {
        ACTIVE, INACTIVE, GRADUATED
    }
}
