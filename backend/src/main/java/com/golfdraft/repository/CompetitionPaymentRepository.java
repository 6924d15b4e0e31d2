package com.golfdraft.repository;

import com.golfdraft.model.CompetitionPayment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface CompetitionPaymentRepository extends JpaRepository<CompetitionPayment, UUID> {
    List<CompetitionPayment> findByCompetitionIdOrderByPaymentTypeAscAmountDesc(UUID competitionId);

    List<CompetitionPayment> findByCompetitionIdIn(Collection<UUID> competitionIds);

    long deleteByCompetitionId(UUID competitionId);
}
