package com.golfdraft.repository;

import com.golfdraft.model.DraftPick;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface DraftPickRepository extends JpaRepository<DraftPick, UUID> {
    List<DraftPick> findByCompetitionIdOrderByPickNumberAsc(UUID competitionId);

    long countByCompetitionId(UUID competitionId);

    boolean existsByCompetitionIdAndGolferId(UUID competitionId, UUID golferId);

    Optional<DraftPick> findByIdAndCompetitionId(UUID id, UUID competitionId);

    long deleteByCompetitionId(UUID competitionId);
}
