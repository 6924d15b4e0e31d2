package com.golfdraft.repository;

import com.golfdraft.model.CompetitionScore;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface CompetitionScoreRepository extends JpaRepository<CompetitionScore, UUID> {
    List<CompetitionScore> findByCompetitionIdOrderByFinalPositionAsc(UUID competitionId);

    boolean existsByCompetitionId(UUID competitionId);

    List<CompetitionScore> findByUserId(UUID userId);

    List<CompetitionScore> findByUserIdIn(Collection<UUID> userIds);

    long deleteByCompetitionId(UUID competitionId);
}
