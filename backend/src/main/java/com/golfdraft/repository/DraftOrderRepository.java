package com.golfdraft.repository;

import com.golfdraft.model.DraftOrderEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface DraftOrderRepository extends JpaRepository<DraftOrderEntry, UUID> {
    List<DraftOrderEntry> findByCompetitionIdOrderByPositionAsc(UUID competitionId);

    long deleteByCompetitionId(UUID competitionId);
}
