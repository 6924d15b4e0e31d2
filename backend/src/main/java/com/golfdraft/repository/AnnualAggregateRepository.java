package com.golfdraft.repository;

import com.golfdraft.model.AnnualAggregate;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface AnnualAggregateRepository extends JpaRepository<AnnualAggregate, UUID> {
    Optional<AnnualAggregate> findByUserIdAndYear(UUID userId, Integer year);

    List<AnnualAggregate> findByYear(Integer year);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select a from AnnualAggregate a where a.userId = :userId and a.year = :year")
    Optional<AnnualAggregate> findByUserIdAndYearForUpdate(@Param("userId") UUID userId, @Param("year") Integer year);
}
