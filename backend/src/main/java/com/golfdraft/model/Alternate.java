package com.golfdraft.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;
import java.util.UUID;

@Getter
@Setter
@Entity
@Table(name = "alternates")
public class Alternate {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "competition_id", nullable = false, updatable = false)
    private UUID competitionId;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "golfer_id", nullable = false)
    private UUID golferId;

    @Column(name = "selected_at", nullable = false)
    private OffsetDateTime selectedAt = OffsetDateTime.now();
}
