package com.golfdraft.repository;

import com.golfdraft.model.Competition;
import com.golfdraft.model.DraftStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface CompetitionRepository extends JpaRepository<Competition, UUID> {
    Optional<Competition> findFirstByTournamentIdAndPublicCompetitionTrueOrderByCreatedAtAsc(UUID tournamentId);

    Optional<Competition> findByInviteCode(String inviteCode);

    boolean existsByInviteCode(String inviteCode);

    boolean existsByIdAndDraftStatusAndDraftScheduledAtLessThanEqual(
            UUID id,
            DraftStatus draftStatus,
            OffsetDateTime scheduledAt
    );

    List<Competition> findByIdIn(Collection<UUID> ids);

    /**
     * Row lock serializing draft mutations, finalization and resets for one competition.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select c from Competition c where c.id = :competitionId")
    Optional<Competition> findByIdForUpdate(@Param("competitionId") UUID competitionId);
}
