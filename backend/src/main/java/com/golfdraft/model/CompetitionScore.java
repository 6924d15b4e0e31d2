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
 * Frozen team result written at finalization. The aggregate columns record exactly what
 * was added to the participant's annual row so a reset can take back the same amounts.
 */
@Getter
@Setter
@Entity
@Table(name = "competition_scores")
public class CompetitionScore {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "competition_id", nullable = false, updatable = false)
    private UUID competitionId;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "team_score_strokes", nullable = false)
    private Integer teamScoreStrokes;

    @Column(name = "team_score_to_par", nullable = false)
    private Integer teamScoreToPar;

    @Column(name = "final_position", nullable = false)
    private Integer finalPosition;

    @Column(name = "score_breakdown", length = 4000)
    private String scoreBreakdownJson;

    @Column(name = "aggregate_year", nullable = false)
    private Integer aggregateYear;

    @Column(name = "net_winnings", nullable = false, precision = 10, scale = 2)
    private BigDecimal netWinnings = BigDecimal.ZERO;

    @Column(name = "net_bounties", nullable = false, precision = 10, scale = 2)
    private BigDecimal netBounties = BigDecimal.ZERO;

    @Column(name = "calculated_at", nullable = false)
    private OffsetDateTime calculatedAt = OffsetDateTime.now();
}
