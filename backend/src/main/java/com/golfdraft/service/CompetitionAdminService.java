package com.golfdraft.service;

import com.golfdraft.dto.AdminRequests;
import com.golfdraft.dto.DraftResponses;
import com.golfdraft.dto.TournamentResultResponses;
import com.golfdraft.mapper.GolfDraftResponseMapper;
import com.golfdraft.model.Alternate;
import com.golfdraft.model.Competition;
import com.golfdraft.model.DraftPick;
import com.golfdraft.model.DraftStatus;
import com.golfdraft.model.Golfer;
import com.golfdraft.model.RoundToParJsonCodec;
import com.golfdraft.model.TournamentResult;
import com.golfdraft.repository.AlternateRepository;
import com.golfdraft.repository.CompetitionParticipantRepository;
import com.golfdraft.repository.CompetitionRepository;
import com.golfdraft.repository.DraftOrderRepository;
import com.golfdraft.repository.DraftPickRepository;
import com.golfdraft.repository.GolferRepository;
import com.golfdraft.repository.TournamentRepository;
import com.golfdraft.repository.TournamentResultRepository;
import com.golfdraft.repository.UserProfileRepository;
import com.golfdraft.web.CompetitionRuleException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

/**
 * Administrative corrections. The caller's admin flag is checked before anything is read for mutation.
 */
@Service
public class CompetitionAdminService {

    private static final Logger log = LoggerFactory.getLogger(CompetitionAdminService.class);

    private final CompetitionRepository competitionRepository;
    private final CompetitionParticipantRepository competitionParticipantRepository;
    private final DraftOrderRepository draftOrderRepository;
    private final DraftPickRepository draftPickRepository;
    private final AlternateRepository alternateRepository;
    private final GolferRepository golferRepository;
    private final TournamentRepository tournamentRepository;
    private final TournamentResultRepository tournamentResultRepository;
    private final UserProfileRepository userProfileRepository;
    private final CompetitionFinalizationService competitionFinalizationService;
    private final DraftService draftService;
    private final GolfDraftResponseMapper golfDraftResponseMapper;

    public CompetitionAdminService(
            CompetitionRepository competitionRepository,
            CompetitionParticipantRepository competitionParticipantRepository,
            DraftOrderRepository draftOrderRepository,
            DraftPickRepository draftPickRepository,
            AlternateRepository alternateRepository,
            GolferRepository golferRepository,
            TournamentRepository tournamentRepository,
            TournamentResultRepository tournamentResultRepository,
            UserProfileRepository userProfileRepository,
            CompetitionFinalizationService competitionFinalizationService,
            DraftService draftService,
            GolfDraftResponseMapper golfDraftResponseMapper
    ) {
        this.competitionRepository = competitionRepository;
        this.competitionParticipantRepository = competitionParticipantRepository;
        this.draftOrderRepository = draftOrderRepository;
        this.draftPickRepository = draftPickRepository;
        this.alternateRepository = alternateRepository;
        this.golferRepository = golferRepository;
        this.tournamentRepository = tournamentRepository;
        this.tournamentResultRepository = tournamentResultRepository;
        this.userProfileRepository = userProfileRepository;
        this.competitionFinalizationService = competitionFinalizationService;
        this.draftService = draftService;
        this.golfDraftResponseMapper = golfDraftResponseMapper;
    }

    @Transactional
    public boolean resetFinalization(UUID callerId, UUID competitionId) {
        requireAdmin(callerId);
        boolean reset = competitionFinalizationService.resetFinalization(competitionId);
        log.info("Admin {} reset finalization of competition {} (changed: {})", callerId, competitionId, reset);
        return reset;
    }

    /**
     * Returns the competition to NOT_STARTED. Each step tolerates the previous state already
     * being gone, so a partially applied reset can simply be run again.
     */
    @Transactional
    public void resetDraft(UUID callerId, UUID competitionId) {
        requireAdmin(callerId);
        Competition competition = lockCompetition(competitionId);

        competitionFinalizationService.resetFinalization(competitionId);
        long alternates = alternateRepository.deleteByCompetitionId(competitionId);
        long picks = draftPickRepository.deleteByCompetitionId(competitionId);
        long orderSlots = draftOrderRepository.deleteByCompetitionId(competitionId);
        draftOrderRepository.flush();

        OffsetDateTime now = OffsetDateTime.now();
        competition.setDraftStatus(DraftStatus.NOT_STARTED);
        competition.setDraftStartedAt(null);
        competition.setDraftCompletedAt(null);
        competition.setUpdatedAt(now);
        competitionRepository.save(competition);

        log.info("Admin {} reset draft of competition {}: removed {} picks, {} alternates, {} order slots",
                callerId, competitionId, picks, alternates, orderSlots);
    }

    @Transactional
    public DraftResponses.Pick swapPick(UUID callerId, UUID competitionId, UUID pickId, UUID golferId) {
        requireAdmin(callerId);
        lockCompetition(competitionId);

        DraftPick pick = draftPickRepository.findByIdAndCompetitionId(pickId, competitionId)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND,
                        "Pick not found in competition: " + pickId
                ));
        Golfer golfer = requireGolfer(golferId);
        Map<UUID, String> golferNames = Map.of(golfer.getId(), golfer.getDisplayName());
        if (pick.getGolferId().equals(golferId)) {
            return golfDraftResponseMapper.toPick(pick, golferNames);
        }

        if (draftPickRepository.existsByCompetitionIdAndGolferId(competitionId, golferId)) {
            throw CompetitionRuleException.golferAlreadyDrafted("Golfer is already drafted in this competition: " + golferId);
        }
        boolean ownersAlternate = alternateRepository.findByCompetitionIdAndUserId(competitionId, pick.getUserId())
                .map(Alternate::getGolferId)
                .filter(golferId::equals)
                .isPresent();
        if (ownersAlternate) {
            throw CompetitionRuleException.golferAlreadyDrafted("Golfer is the pick owner's alternate: " + golferId);
        }

        UUID previousGolferId = pick.getGolferId();
        pick.setGolferId(golferId);
        DraftPick saved;
        try {
            saved = draftPickRepository.saveAndFlush(pick);
        } catch (DataIntegrityViolationException ex) {
            throw CompetitionRuleException.pickConflict("Swap conflicted with a concurrent change; re-fetch the draft");
        }

        log.info("Admin {} swapped pick {} in competition {}: {} -> {}",
                callerId, pickId, competitionId, previousGolferId, golferId);
        return golfDraftResponseMapper.toPick(saved, golferNames);
    }

    @Transactional
    public DraftResponses.AlternateSelection updateAlternate(UUID callerId, UUID competitionId, UUID userId, UUID golferId) {
        requireAdmin(callerId);
        lockCompetition(competitionId);
        if (!competitionParticipantRepository.existsByCompetitionIdAndUserId(competitionId, userId)) {
            throw CompetitionRuleException.notParticipant("User is not a participant: " + userId);
        }
        Golfer golfer = requireGolfer(golferId);

        Alternate alternate = draftService.assignAlternate(competitionId, userId, golferId);
        log.info("Admin {} set alternate of user {} in competition {} to {}", callerId, userId, competitionId, golferId);
        return golfDraftResponseMapper.toAlternate(alternate, Map.of(golfer.getId(), golfer.getDisplayName()));
    }

    @Transactional
    public void removeParticipant(UUID callerId, UUID competitionId, UUID userId) {
        requireAdmin(callerId);
        Competition competition = lockCompetition(competitionId);
        if (competition.getDraftStatus() != DraftStatus.NOT_STARTED) {
            throw CompetitionRuleException.participantRemovalClosed(
                    "Participants can only be removed before the draft starts");
        }
        long removed = competitionParticipantRepository.deleteByCompetitionIdAndUserId(competitionId, userId);
        if (removed == 0) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Participant not found: " + userId);
        }
        log.info("Admin {} removed user {} from competition {}", callerId, userId, competitionId);
    }

    /**
     * Corrects a result row, creating it when the feed never delivered one. The row is marked
     * as a manual override so later feed snapshots leave it alone.
     */
    @Transactional
    public TournamentResultResponses.ResultDetail editResult(
            UUID callerId,
            UUID tournamentId,
            UUID golferId,
            AdminRequests.EditResultRequest request
    ) {
        requireAdmin(callerId);
        if (!tournamentRepository.existsById(tournamentId)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Tournament not found: " + tournamentId);
        }
        requireGolfer(golferId);

        OffsetDateTime now = OffsetDateTime.now();
        TournamentResult result = tournamentResultRepository.findByTournamentIdAndGolferId(tournamentId, golferId)
                .orElseGet(() -> {
                    TournamentResult created = new TournamentResult();
                    created.setId(UUID.randomUUID());
                    created.setTournamentId(tournamentId);
                    created.setGolferId(golferId);
                    created.setCreatedAt(now);
                    return created;
                });
        if (request.totalToPar() != null) {
            result.setTotalToPar(request.totalToPar());
        }
        if (request.madeCut() != null) {
            result.setMadeCut(request.madeCut());
        }
        if (request.withdrew() != null) {
            result.setWithdrew(request.withdrew());
        }
        if (request.position() != null) {
            result.setPosition(request.position());
        }
        if (request.totalStrokes() != null) {
            result.setTotalStrokes(request.totalStrokes());
        }
        if (request.roundToPar() != null) {
            result.setRoundToParJson(RoundToParJsonCodec.toJson(TournamentResultService.normalizeRounds(request.roundToPar())));
        }
        applyClears(request, result);
        result.setManualOverride(true);
        result.setLastUpdated(now);

        TournamentResult saved = tournamentResultRepository.save(result);
        log.info("Admin {} edited result of golfer {} in tournament {}", callerId, golferId, tournamentId);
        return golfDraftResponseMapper.toResultDetail(saved);
    }

    private static void applyClears(AdminRequests.EditResultRequest request, TournamentResult result) {
        if (request.clear() == null) {
            return;
        }
        for (AdminRequests.ResultField field : request.clear()) {
            if (valueGiven(request, field)) {
                throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Cannot both set and clear " + field);
            }
            switch (field) {
                case POSITION -> result.setPosition(null);
                case TOTAL_STROKES -> result.setTotalStrokes(null);
                case TOTAL_TO_PAR -> result.setTotalToPar(null);
                case MADE_CUT -> result.setMadeCut(null);
                case ROUND_TO_PAR -> result.setRoundToParJson(null);
            }
        }
    }

    private static boolean valueGiven(AdminRequests.EditResultRequest request, AdminRequests.ResultField field) {
        return switch (field) {
            case POSITION -> request.position() != null;
            case TOTAL_STROKES -> request.totalStrokes() != null;
            case TOTAL_TO_PAR -> request.totalToPar() != null;
            case MADE_CUT -> request.madeCut() != null;
            case ROUND_TO_PAR -> request.roundToPar() != null;
        };
    }

    public void requireAdmin(UUID callerId) {
        if (callerId == null || !userProfileRepository.existsByIdAndAdminTrue(callerId)) {
            throw CompetitionRuleException.adminRequired("Administrator access required");
        }
    }

    private Competition lockCompetition(UUID competitionId) {
        return competitionRepository.findByIdForUpdate(competitionId)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND,
                        "Competition not found: " + competitionId
                ));
    }

    private Golfer requireGolfer(UUID golferId) {
        return golferRepository.findById(golferId)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND,
                        "Golfer not found: " + golferId
                ));
    }
}
