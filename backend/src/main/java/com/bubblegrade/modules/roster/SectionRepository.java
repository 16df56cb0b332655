package com.bubblegrade.modules.roster;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface SectionRepository extends JpaRepository<Section, UUID> {

    List<Section> findByIdInAndIsActiveTrueOrderByNameAsc(Collection<UUID> ids);
}
