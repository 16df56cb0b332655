package com.bubblegrade.modules.roster;

import jakarta.persistence.*;
import lombok.*;

import java.util.UUID;

@Entity
@Table(name = "sections")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Section {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    /** Short code such as "SEC-A" */
    @Column(nullable = false, unique = true, length = 50)
    private String code;

    @Column(length = 100)
    private String name;

    @Column(name = "grade_id")
    private UUID gradeId;

    @Column(name = "is_active")
    @Builder.Default
    private Boolean isActive = true;

    public String displayName() {
        if (name != null && !name.isBlank()) {
            return name;
        }
        return code != null ? code : "Unnamed Section";
    }
}
