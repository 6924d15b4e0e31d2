package com.golfdraft.repository;

import com.golfdraft.model.CompetitionBounty;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface CompetitionBountyRepository extends JpaRepository<CompetitionBounty, UUID> {
    Optional<CompetitionBounty> findByCompetitionId(UUID competitionId);

    long deleteByCompetitionId(UUID competitionId);
}
