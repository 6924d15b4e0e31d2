package com.golfdraft.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;
import java.util.UUID;

@Getter
@Setter
@Entity
@Table(name = "competitions")
public class Competition {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "tournament_id", nullable = false, updatable = false)
    private UUID tournamentId;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @Column(name = "created_by", nullable = false, updatable = false)
    private UUID createdBy;

    @Column(name = "is_public", nullable = false)
    private boolean publicCompetition;

    @Column(name = "invite_code", length = 16)
    private String inviteCode;

    @Column(name = "invite_expires_at")
    private OffsetDateTime inviteExpiresAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "draft_status", nullable = false, length = 32)
    private DraftStatus draftStatus = DraftStatus.NOT_STARTED;

    @Column(name = "draft_scheduled_at")
    private OffsetDateTime draftScheduledAt;

    @Column(name = "draft_started_at")
    private OffsetDateTime draftStartedAt;

    @Column(name = "draft_completed_at")
    private OffsetDateTime draftCompletedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();
}
