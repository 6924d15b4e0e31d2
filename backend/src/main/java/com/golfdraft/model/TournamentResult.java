package com.golfdraft.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * One golfer's outcome in a tournament as delivered by the results feed.
 * Rows with {@code manualOverride} set were corrected by an administrator and are
 * left alone by later feed snapshots.
 */
@Getter
@Setter
@Entity
@Table(name = "tournament_results")
public class TournamentResult {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "tournament_id", nullable = false, updatable = false)
    private UUID tournamentId;

    @Column(name = "golfer_id", nullable = false, updatable = false)
    private UUID golferId;

    @Column(name = "position")
    private Integer position;

    @Column(name = "total_strokes")
    private Integer totalStrokes;

    @Column(name = "total_to_par")
    private Integer totalToPar;

    @Column(name = "made_cut")
    private Boolean madeCut;

    @Column(name = "withdrew", nullable = false)
    private boolean withdrew;

    @Column(name = "round_to_par", length = 512)
    private String roundToParJson;

    @Column(name = "manual_override", nullable = false)
    private boolean manualOverride;

    @Column(name = "last_updated", nullable = false)
    private OffsetDateTime lastUpdated = OffsetDateTime.now();

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();
}
