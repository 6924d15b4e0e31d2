package com.golfdraft.service;

import com.golfdraft.dto.TournamentResultRequests;
import com.golfdraft.dto.TournamentResultResponses;
import com.golfdraft.mapper.GolfDraftResponseMapper;
import com.golfdraft.model.Golfer;
import com.golfdraft.model.RoundToParJsonCodec;
import com.golfdraft.model.Tournament;
import com.golfdraft.model.TournamentResult;
import com.golfdraft.repository.GolferRepository;
import com.golfdraft.repository.TournamentRepository;
import com.golfdraft.repository.TournamentResultRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.time.OffsetDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Stores normalized results snapshots delivered by the feed collaborator.
 */
@Service
public class TournamentResultService {

    private static final Logger log = LoggerFactory.getLogger(TournamentResultService.class);

    private final TournamentRepository tournamentRepository;
    private final TournamentResultRepository tournamentResultRepository;
    private final GolferRepository golferRepository;
    private final GolfDraftResponseMapper golfDraftResponseMapper;

    public TournamentResultService(
            TournamentRepository tournamentRepository,
            TournamentResultRepository tournamentResultRepository,
            GolferRepository golferRepository,
            GolfDraftResponseMapper golfDraftResponseMapper
    ) {
        this.tournamentRepository = tournamentRepository;
        this.tournamentResultRepository = tournamentResultRepository;
        this.golferRepository = golferRepository;
        this.golfDraftResponseMapper = golfDraftResponseMapper;
    }

    /**
     * Upserts every row of the snapshot. Rows an administrator corrected are skipped unless
     * the snapshot asks for overrides to be cleared.
     */
    @Transactional
    public TournamentResultResponses.SnapshotIngestion ingestSnapshot(
            UUID tournamentId,
            TournamentResultRequests.ResultsSnapshotRequest request
    ) {
        Tournament tournament = tournamentRepository.findByIdForUpdate(tournamentId)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND,
                        "Tournament not found: " + tournamentId
                ));

        Set<UUID> golferIds = request.results().stream()
                .map(TournamentResultRequests.GolferResultSnapshot::golferId)
                .collect(Collectors.toSet());
        Set<UUID> knownGolferIds = golferRepository.findByIdIn(golferIds).stream()
                .map(Golfer::getId)
                .collect(Collectors.toSet());
        if (knownGolferIds.size() != golferIds.size()) {
            golferIds.removeAll(knownGolferIds);
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unknown golfers in snapshot: " + golferIds);
        }

        if (request.clearOverrides()) {
            int cleared = tournamentResultRepository.clearManualOverrides(tournamentId);
            log.info("Cleared {} manual overrides for tournament {}", cleared, tournamentId);
        }

        Map<UUID, TournamentResult> existing = tournamentResultRepository.findByTournamentId(tournamentId).stream()
                .collect(Collectors.toMap(TournamentResult::getGolferId, Function.identity()));

        OffsetDateTime now = OffsetDateTime.now();
        int upserted = 0;
        int skipped = 0;
        for (TournamentResultRequests.GolferResultSnapshot snapshot : request.results()) {
            TournamentResult result = existing.get(snapshot.golferId());
            if (result == null) {
                result = new TournamentResult();
                result.setId(UUID.randomUUID());
                result.setTournamentId(tournamentId);
                result.setGolferId(snapshot.golferId());
                result.setCreatedAt(now);
            } else if (result.isManualOverride()) {
                skipped++;
                continue;
            }
            result.setPosition(snapshot.position());
            result.setTotalStrokes(snapshot.totalStrokes());
            result.setTotalToPar(snapshot.totalToPar());
            result.setMadeCut(snapshot.madeCut());
            result.setWithdrew(snapshot.withdrew());
            result.setRoundToParJson(RoundToParJsonCodec.toJson(normalizeRounds(snapshot.roundToPar())));
            result.setLastUpdated(now);
            existing.put(snapshot.golferId(), tournamentResultRepository.save(result));
            upserted++;
        }

        if (request.tournamentStatus() != null && request.tournamentStatus() != tournament.getStatus()) {
            log.info("Tournament {} status {} -> {}", tournamentId, tournament.getStatus(), request.tournamentStatus());
            tournament.setStatus(request.tournamentStatus());
            tournament.setUpdatedAt(now);
            tournamentRepository.save(tournament);
        }

        log.debug("Ingested results for tournament {}: {} upserted, {} skipped overrides", tournamentId, upserted, skipped);
        return new TournamentResultResponses.SnapshotIngestion(tournamentId, tournament.getStatus(), upserted, skipped);
    }

    /**
     * Feeds report unplayed rounds as {@code null}; they count as level par.
     */
    static List<Integer> normalizeRounds(List<Integer> roundToPar) {
        if (roundToPar == null) {
            return List.of();
        }
        return roundToPar.stream()
                .map(toPar -> toPar == null ? 0 : toPar)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<TournamentResultResponses.ResultDetail> getResults(UUID tournamentId) {
        if (!tournamentRepository.existsById(tournamentId)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Tournament not found: " + tournamentId);
        }
        return tournamentResultRepository.findByTournamentId(tournamentId).stream()
                .sorted(Comparator.comparing(TournamentResult::getPosition, Comparator.nullsLast(Comparator.naturalOrder())))
                .map(golfDraftResponseMapper::toResultDetail)
                .toList();
    }
}
