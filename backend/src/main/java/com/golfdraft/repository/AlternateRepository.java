package com.golfdraft.repository;

import com.golfdraft.model.Alternate;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface AlternateRepository extends JpaRepository<Alternate, UUID> {
    List<Alternate> findByCompetitionId(UUID competitionId);

    Optional<Alternate> findByCompetitionIdAndUserId(UUID competitionId, UUID userId);

    long deleteByCompetitionId(UUID competitionId);
}
