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

@Getter
@Setter
@Entity
@Table(name = "competition_bounties")
public class CompetitionBounty {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "competition_id", nullable = false, updatable = false)
    private UUID competitionId;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "golfer_id", nullable = false)
    private UUID golferId;

    @Column(name = "pick_round", nullable = false)
    private Integer pickRound;

    @Column(name = "bounty_amount", nullable = false, precision = 10, scale = 2)
    private BigDecimal bountyAmount;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();
}
