package com.golfdraft.repository;

import com.golfdraft.model.CompetitionParticipant;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface CompetitionParticipantRepository extends JpaRepository<CompetitionParticipant, UUID> {
    List<CompetitionParticipant> findByCompetitionIdOrderByJoinedAtAsc(UUID competitionId);

    boolean existsByCompetitionIdAndUserId(UUID competitionId, UUID userId);

    long countByCompetitionId(UUID competitionId);

    long deleteByCompetitionIdAndUserId(UUID competitionId, UUID userId);
}
