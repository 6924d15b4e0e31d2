package com.golfdraft.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Running season totals for one participant. Only finalization adds to a row and only
 * a finalization reset subtracts from it.
 */
@Getter
@Setter
@Entity
@Table(name = "annual_leaderboard")
public class AnnualAggregate {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "aggregate_year", nullable = false, updatable = false)
    private Integer year;

    @Column(name = "total_competitions", nullable = false)
    private Integer totalCompetitions = 0;

    @Column(name = "competitions_won", nullable = false)
    private Integer competitionsWon = 0;

    @Column(name = "total_winnings", nullable = false, precision = 10, scale = 2)
    private BigDecimal totalWinnings = BigDecimal.ZERO;

    @Column(name = "total_bounties", nullable = false, precision = 10, scale = 2)
    private BigDecimal totalBounties = BigDecimal.ZERO;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();
}
