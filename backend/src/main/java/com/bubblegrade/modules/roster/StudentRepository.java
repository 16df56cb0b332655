package com.bubblegrade.modules.roster;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface StudentRepository extends JpaRepository<Student, UUID> {

        /**
         * Active students of a section. Students without a section assignment
         * count in every section of a class they belong to.
         */
        @Query("SELECT s.id FROM Student s WHERE s.status = com.bubblegrade.modules.roster.Student.StudentStatus.ACTIVE " +
                        "AND (s.sectionId = :sectionId OR (s.sectionId IS NULL AND :classId MEMBER OF s.classIds))")
        List<UUID> findActiveIdsInSection(@Param("sectionId") UUID sectionId, @Param("classId") UUID classId);
}
