package com.golfdraft.repository;

import com.golfdraft.model.TournamentResult;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface TournamentResultRepository extends JpaRepository<TournamentResult, UUID> {
    List<TournamentResult> findByTournamentId(UUID tournamentId);

    Optional<TournamentResult> findByTournamentIdAndGolferId(UUID tournamentId, UUID golferId);

    List<TournamentResult> findByTournamentIdAndPosition(UUID tournamentId, Integer position);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE TournamentResult r SET r.manualOverride = false " +
            "WHERE r.tournamentId = :tournamentId AND r.manualOverride = true")
    int clearManualOverrides(@Param("tournamentId") UUID tournamentId);
}
