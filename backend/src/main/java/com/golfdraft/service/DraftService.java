package com.golfdraft.service;

import com.golfdraft.config.GolfDraftProperties;
import com.golfdraft.dto.DraftResponses;
import com.golfdraft.mapper.GolfDraftResponseMapper;
import com.golfdraft.model.Alternate;
import com.golfdraft.model.Competition;
import com.golfdraft.model.CompetitionParticipant;
import com.golfdraft.model.CompetitionScore;
import com.golfdraft.model.DraftOrderEntry;
import com.golfdraft.model.DraftOrderMode;
import com.golfdraft.model.DraftPick;
import com.golfdraft.model.DraftStatus;
import com.golfdraft.model.Golfer;
import com.golfdraft.model.Tournament;
import com.golfdraft.repository.AlternateRepository;
import com.golfdraft.repository.CompetitionParticipantRepository;
import com.golfdraft.repository.CompetitionRepository;
import com.golfdraft.repository.CompetitionScoreRepository;
import com.golfdraft.repository.DraftOrderRepository;
import com.golfdraft.repository.DraftPickRepository;
import com.golfdraft.repository.GolferRepository;
import com.golfdraft.repository.TournamentRepository;
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
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Draft lifecycle for one competition. Every mutation locks the competition row first and
 * re-validates against what is stored, so concurrent submissions are applied one at a time.
 */
@Service
public class DraftService {

    private static final Logger log = LoggerFactory.getLogger(DraftService.class);

    private final CompetitionRepository competitionRepository;
    private final TournamentRepository tournamentRepository;
    private final CompetitionParticipantRepository competitionParticipantRepository;
    private final DraftOrderRepository draftOrderRepository;
    private final DraftPickRepository draftPickRepository;
    private final AlternateRepository alternateRepository;
    private final GolferRepository golferRepository;
    private final CompetitionScoreRepository competitionScoreRepository;
    private final UserProfileRepository userProfileRepository;
    private final SnakeDraftTurnResolver snakeDraftTurnResolver;
    private final DraftOrderGenerator draftOrderGenerator;
    private final GolfDraftProperties golfDraftProperties;
    private final GolfDraftResponseMapper golfDraftResponseMapper;

    public DraftService(
            CompetitionRepository competitionRepository,
            TournamentRepository tournamentRepository,
            CompetitionParticipantRepository competitionParticipantRepository,
            DraftOrderRepository draftOrderRepository,
            DraftPickRepository draftPickRepository,
            AlternateRepository alternateRepository,
            GolferRepository golferRepository,
            CompetitionScoreRepository competitionScoreRepository,
            UserProfileRepository userProfileRepository,
            SnakeDraftTurnResolver snakeDraftTurnResolver,
            DraftOrderGenerator draftOrderGenerator,
            GolfDraftProperties golfDraftProperties,
            GolfDraftResponseMapper golfDraftResponseMapper
    ) {
        this.competitionRepository = competitionRepository;
        this.tournamentRepository = tournamentRepository;
        this.competitionParticipantRepository = competitionParticipantRepository;
        this.draftOrderRepository = draftOrderRepository;
        this.draftPickRepository = draftPickRepository;
        this.alternateRepository = alternateRepository;
        this.golferRepository = golferRepository;
        this.competitionScoreRepository = competitionScoreRepository;
        this.userProfileRepository = userProfileRepository;
        this.snakeDraftTurnResolver = snakeDraftTurnResolver;
        this.draftOrderGenerator = draftOrderGenerator;
        this.golfDraftProperties = golfDraftProperties;
        this.golfDraftResponseMapper = golfDraftResponseMapper;
    }

    /**
     * Starts the draft on behalf of the competition creator or an administrator.
     *
     * @param requestedMode order mode; {@code null} falls back to the configured default
     */
    @Transactional
    public List<DraftResponses.DraftOrderSlot> startDraft(UUID competitionId, UUID callerId, DraftOrderMode requestedMode) {
        Competition competition = lockCompetition(competitionId);
        if (!competition.getCreatedBy().equals(callerId) && !userProfileRepository.existsByIdAndAdminTrue(callerId)) {
            throw CompetitionRuleException.forbidden("Only the competition creator can start the draft");
        }

        Tournament tournament = requireTournament(competition.getTournamentId());
        OffsetDateTime now = OffsetDateTime.now();
        if (tournament.hasStarted(now)) {
            throw CompetitionRuleException.tournamentStarted("Tournament has already started: " + tournament.getId());
        }

        DraftOrderMode mode = requestedMode == null
                ? golfDraftProperties.getDraft().getDefaultOrderMode()
                : requestedMode;
        return golfDraftResponseMapper.toDraftOrder(startLocked(competition, mode, now));
    }

    /**
     * Starts a scheduled draft once its time has passed. Returns {@code true} when this call started it.
     * Never fires when the tournament begins within the configured guard window.
     */
    @Transactional
    public boolean maybeAutoStartDraft(UUID competitionId) {
        OffsetDateTime now = OffsetDateTime.now();
        if (!competitionRepository.existsByIdAndDraftStatusAndDraftScheduledAtLessThanEqual(
                competitionId, DraftStatus.NOT_STARTED, now)) {
            return false;
        }

        Competition competition = lockCompetition(competitionId);
        if (!autoStartDue(competition, now)) {
            return false;
        }
        if (competitionParticipantRepository.countByCompetitionId(competitionId) < 2) {
            log.debug("Scheduled draft for competition {} waiting for participants", competitionId);
            return false;
        }

        Tournament tournament = requireTournament(competition.getTournamentId());
        OffsetDateTime guardEdge = now.plusHours(golfDraftProperties.getDraft().getAutoStartGuardHours());
        if (guardEdge.isAfter(tournament.getStartTime())) {
            log.debug("Scheduled draft for competition {} suppressed: tournament starts at {}",
                    competitionId, tournament.getStartTime());
            return false;
        }

        startLocked(competition, golfDraftProperties.getDraft().getDefaultOrderMode(), now);
        return true;
    }

    @Transactional(readOnly = true)
    public DraftResponses.CurrentTurn getCurrentTurn(UUID competitionId) {
        Competition competition = competitionRepository.findById(competitionId)
                .orElseThrow(() -> competitionNotFound(competitionId));
        List<DraftOrderEntry> order = draftOrderRepository.findByCompetitionIdOrderByPositionAsc(competitionId);
        int picksMade = (int) draftPickRepository.countByCompetitionId(competitionId);
        int totalPicks = order.isEmpty() ? 0 : snakeDraftTurnResolver.totalPicks(order.size());

        int nextPick = picksMade + 1;
        if (competition.getDraftStatus() != DraftStatus.IN_PROGRESS
                || order.isEmpty()
                || snakeDraftTurnResolver.isDraftComplete(picksMade, order.size())) {
            return new DraftResponses.CurrentTurn(
                    competitionId, competition.getDraftStatus(), null, nextPick, null, picksMade, totalPicks);
        }

        UUID userId = userAtPosition(order, snakeDraftTurnResolver.positionForPick(nextPick, order.size()));
        return new DraftResponses.CurrentTurn(
                competitionId,
                competition.getDraftStatus(),
                userId,
                nextPick,
                snakeDraftTurnResolver.roundForPick(nextPick, order.size()),
                picksMade,
                totalPicks
        );
    }

    @Transactional
    public DraftResponses.Pick makePick(UUID competitionId, UUID userId, UUID golferId) {
        OffsetDateTime now = OffsetDateTime.now();
        Competition competition = lockCompetition(competitionId);
        if (competition.getDraftStatus() != DraftStatus.IN_PROGRESS) {
            throw CompetitionRuleException.draftNotInProgress("Draft is not in progress: " + competitionId);
        }

        Tournament tournament = requireTournament(competition.getTournamentId());
        if (tournament.hasStarted(now)) {
            throw CompetitionRuleException.tournamentStarted("Tournament has already started; no more picks allowed");
        }

        List<DraftOrderEntry> order = draftOrderRepository.findByCompetitionIdOrderByPositionAsc(competitionId);
        int participantCount = order.size();
        int picksMade = (int) draftPickRepository.countByCompetitionId(competitionId);
        if (participantCount == 0 || snakeDraftTurnResolver.isDraftComplete(picksMade, participantCount)) {
            throw CompetitionRuleException.draftNotInProgress("Draft has no remaining picks: " + competitionId);
        }

        int pickNumber = picksMade + 1;
        UUID turnUserId = userAtPosition(order, snakeDraftTurnResolver.positionForPick(pickNumber, participantCount));
        if (!userId.equals(turnUserId)) {
            throw CompetitionRuleException.notYourTurn("It is not your turn to pick");
        }

        Golfer golfer = requireGolfer(golferId);
        if (draftPickRepository.existsByCompetitionIdAndGolferId(competitionId, golferId)) {
            throw CompetitionRuleException.golferAlreadyDrafted("Golfer has already been drafted: " + golferId);
        }

        DraftPick pick = new DraftPick();
        pick.setId(UUID.randomUUID());
        pick.setCompetitionId(competitionId);
        pick.setUserId(userId);
        pick.setGolferId(golferId);
        pick.setPickNumber(pickNumber);
        pick.setDraftRound(snakeDraftTurnResolver.roundForPick(pickNumber, participantCount));
        pick.setPickedAt(now);
        DraftPick savedPick;
        try {
            savedPick = draftPickRepository.saveAndFlush(pick);
        } catch (DataIntegrityViolationException ex) {
            throw CompetitionRuleException.pickConflict("Pick conflicted with a concurrent pick; re-fetch the draft");
        }

        if (pickNumber == snakeDraftTurnResolver.totalPicks(participantCount)) {
            competition.setDraftStatus(DraftStatus.COMPLETED);
            competition.setDraftCompletedAt(now);
            competition.setUpdatedAt(now);
            competitionRepository.save(competition);
            log.info("Draft completed for competition {} after {} picks", competitionId, pickNumber);
        }

        return golfDraftResponseMapper.toPick(savedPick, Map.of(golfer.getId(), golfer.getDisplayName()));
    }

    @Transactional
    public DraftResponses.AlternateSelection selectAlternate(UUID competitionId, UUID userId, UUID golferId) {
        Competition competition = lockCompetition(competitionId);
        if (!competitionParticipantRepository.existsByCompetitionIdAndUserId(competitionId, userId)) {
            throw CompetitionRuleException.notParticipant("You must be a participant to select an alternate");
        }
        if (competition.getDraftStatus() != DraftStatus.COMPLETED) {
            throw CompetitionRuleException.draftNotCompleted("Draft must be completed before selecting an alternate");
        }
        Tournament tournament = requireTournament(competition.getTournamentId());
        if (tournament.hasStarted(OffsetDateTime.now())) {
            throw CompetitionRuleException.tournamentStarted("Tournament has already started");
        }

        Golfer golfer = requireGolfer(golferId);
        Alternate alternate = assignAlternate(competitionId, userId, golferId);
        return golfDraftResponseMapper.toAlternate(alternate, Map.of(golfer.getId(), golfer.getDisplayName()));
    }

    /**
     * Upserts a participant's alternate. Callers hold the competition lock and have checked
     * participation and that the golfer exists.
     */
    @Transactional
    public Alternate assignAlternate(UUID competitionId, UUID userId, UUID golferId) {
        if (draftPickRepository.existsByCompetitionIdAndGolferId(competitionId, golferId)) {
            throw CompetitionRuleException.golferAlreadyDrafted(
                    "Golfer was already drafted in this competition: " + golferId);
        }

        Alternate alternate = alternateRepository.findByCompetitionIdAndUserId(competitionId, userId)
                .orElseGet(() -> {
                    Alternate created = new Alternate();
                    created.setId(UUID.randomUUID());
                    created.setCompetitionId(competitionId);
                    created.setUserId(userId);
                    return created;
                });
        alternate.setGolferId(golferId);
        alternate.setSelectedAt(OffsetDateTime.now());
        return alternateRepository.save(alternate);
    }

    @Transactional(readOnly = true)
    public List<DraftResponses.DraftOrderSlot> getDraftOrder(UUID competitionId) {
        requireCompetition(competitionId);
        return golfDraftResponseMapper.toDraftOrder(
                draftOrderRepository.findByCompetitionIdOrderByPositionAsc(competitionId));
    }

    @Transactional(readOnly = true)
    public List<DraftResponses.Pick> getDraftPicks(UUID competitionId) {
        requireCompetition(competitionId);
        List<DraftPick> picks = draftPickRepository.findByCompetitionIdOrderByPickNumberAsc(competitionId);
        Map<UUID, String> golferNames = golferNames(picks.stream().map(DraftPick::getGolferId).toList());
        return picks.stream()
                .map(pick -> golfDraftResponseMapper.toPick(pick, golferNames))
                .toList();
    }

    @Transactional(readOnly = true)
    public List<DraftResponses.AlternateSelection> getAlternates(UUID competitionId) {
        requireCompetition(competitionId);
        List<Alternate> alternates = alternateRepository.findByCompetitionId(competitionId);
        Map<UUID, String> golferNames = golferNames(alternates.stream().map(Alternate::getGolferId).toList());
        return alternates.stream()
                .sorted(Comparator.comparing(Alternate::getSelectedAt))
                .map(alternate -> golfDraftResponseMapper.toAlternate(alternate, golferNames))
                .toList();
    }

    private List<DraftOrderEntry> startLocked(Competition competition, DraftOrderMode mode, OffsetDateTime now) {
        if (competition.getDraftStatus() != DraftStatus.NOT_STARTED) {
            throw CompetitionRuleException.draftAlreadyStarted("Draft has already been started: " + competition.getId());
        }

        List<UUID> participantIds = competitionParticipantRepository
                .findByCompetitionIdOrderByJoinedAtAsc(competition.getId())
                .stream()
                .map(CompetitionParticipant::getUserId)
                .toList();
        if (participantIds.size() < 2) {
            throw CompetitionRuleException.insufficientParticipants("Need at least 2 participants to start the draft");
        }

        Map<UUID, Integer> priorPositions = mode == DraftOrderMode.PRIOR_STANDINGS
                ? priorFinalPositions(competition.getId(), participantIds)
                : Map.of();
        List<UUID> orderedIds = draftOrderGenerator.generate(participantIds, mode, priorPositions);

        List<DraftOrderEntry> entries = new ArrayList<>(orderedIds.size());
        for (int i = 0; i < orderedIds.size(); i++) {
            DraftOrderEntry entry = new DraftOrderEntry();
            entry.setId(UUID.randomUUID());
            entry.setCompetitionId(competition.getId());
            entry.setUserId(orderedIds.get(i));
            entry.setPosition(i + 1);
            entry.setCreatedAt(now);
            entries.add(entry);
        }
        draftOrderRepository.saveAll(entries);

        competition.setDraftStatus(DraftStatus.IN_PROGRESS);
        competition.setDraftStartedAt(now);
        competition.setDraftCompletedAt(null);
        competition.setUpdatedAt(now);
        competitionRepository.save(competition);

        log.info("Draft started for competition {} with {} participants ({} order)",
                competition.getId(), entries.size(), mode);
        return entries;
    }

    // Final positions from the most recent other finalized competition shared with any participant.
    private Map<UUID, Integer> priorFinalPositions(UUID competitionId, Collection<UUID> participantIds) {
        List<CompetitionScore> scores = competitionScoreRepository.findByUserIdIn(participantIds).stream()
                .filter(score -> !score.getCompetitionId().equals(competitionId))
                .toList();
        if (scores.isEmpty()) {
            return Map.of();
        }

        Set<UUID> competitionIds = scores.stream()
                .map(CompetitionScore::getCompetitionId)
                .collect(Collectors.toSet());
        List<Competition> competitions = competitionRepository.findByIdIn(competitionIds);
        Map<UUID, Tournament> tournaments = tournamentRepository.findByIdIn(
                        competitions.stream().map(Competition::getTournamentId).collect(Collectors.toSet()))
                .stream()
                .collect(Collectors.toMap(Tournament::getId, tournament -> tournament));

        Optional<Competition> mostRecent = competitions.stream()
                .filter(candidate -> tournaments.containsKey(candidate.getTournamentId()))
                .max(Comparator
                        .comparing((Competition candidate) -> tournaments.get(candidate.getTournamentId()).getEndDate())
                        .thenComparing(Competition::getCreatedAt));
        if (mostRecent.isEmpty()) {
            return Map.of();
        }

        UUID priorCompetitionId = mostRecent.get().getId();
        Map<UUID, Integer> positions = new LinkedHashMap<>();
        scores.stream()
                .filter(score -> score.getCompetitionId().equals(priorCompetitionId))
                .forEach(score -> positions.put(score.getUserId(), score.getFinalPosition()));
        return positions;
    }

    private static boolean autoStartDue(Competition competition, OffsetDateTime now) {
        return competition.getDraftStatus() == DraftStatus.NOT_STARTED
                && competition.getDraftScheduledAt() != null
                && !competition.getDraftScheduledAt().isAfter(now);
    }

    private static UUID userAtPosition(List<DraftOrderEntry> order, int position) {
        return order.stream()
                .filter(entry -> entry.getPosition() == position)
                .map(DraftOrderEntry::getUserId)
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("Draft order has no slot at position " + position));
    }

    private Map<UUID, String> golferNames(Collection<UUID> golferIds) {
        return golferRepository.findByIdIn(golferIds).stream()
                .collect(Collectors.toMap(Golfer::getId, Golfer::getDisplayName));
    }

    private Competition lockCompetition(UUID competitionId) {
        return competitionRepository.findByIdForUpdate(competitionId)
                .orElseThrow(() -> competitionNotFound(competitionId));
    }

    private void requireCompetition(UUID competitionId) {
        if (!competitionRepository.existsById(competitionId)) {
            throw competitionNotFound(competitionId);
        }
    }

    private Tournament requireTournament(UUID tournamentId) {
        return tournamentRepository.findById(tournamentId)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND,
                        "Tournament not found: " + tournamentId
                ));
    }

    private Golfer requireGolfer(UUID golferId) {
        return golferRepository.findById(golferId)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND,
                        "Golfer not found: " + golferId
                ));
    }

    private static ResponseStatusException competitionNotFound(UUID competitionId) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, "Competition not found: " + competitionId);
    }
}
