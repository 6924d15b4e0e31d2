package com.golfdraft.service;

import com.golfdraft.config.GolfDraftProperties;
import com.golfdraft.dto.CompetitionRequests;
import com.golfdraft.dto.CompetitionResponses;
import com.golfdraft.mapper.GolfDraftResponseMapper;
import com.golfdraft.model.Competition;
import com.golfdraft.model.CompetitionParticipant;
import com.golfdraft.model.DraftStatus;
import com.golfdraft.model.Tournament;
import com.golfdraft.model.UserProfile;
import com.golfdraft.repository.CompetitionParticipantRepository;
import com.golfdraft.repository.CompetitionRepository;
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
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
public class CompetitionService {

    private static final Logger log = LoggerFactory.getLogger(CompetitionService.class);
    private static final int MAX_INVITE_CODE_ATTEMPTS = 10;

    private final CompetitionRepository competitionRepository;
    private final CompetitionParticipantRepository competitionParticipantRepository;
    private final TournamentRepository tournamentRepository;
    private final UserProfileRepository userProfileRepository;
    private final DraftService draftService;
    private final InviteCodeGenerator inviteCodeGenerator;
    private final GolfDraftProperties golfDraftProperties;
    private final GolfDraftResponseMapper golfDraftResponseMapper;

    public CompetitionService(
            CompetitionRepository competitionRepository,
            CompetitionParticipantRepository competitionParticipantRepository,
            TournamentRepository tournamentRepository,
            UserProfileRepository userProfileRepository,
            DraftService draftService,
            InviteCodeGenerator inviteCodeGenerator,
            GolfDraftProperties golfDraftProperties,
            GolfDraftResponseMapper golfDraftResponseMapper
    ) {
        this.competitionRepository = competitionRepository;
        this.competitionParticipantRepository = competitionParticipantRepository;
        this.tournamentRepository = tournamentRepository;
        this.userProfileRepository = userProfileRepository;
        this.draftService = draftService;
        this.inviteCodeGenerator = inviteCodeGenerator;
        this.golfDraftProperties = golfDraftProperties;
        this.golfDraftResponseMapper = golfDraftResponseMapper;
    }

    /**
     * Creates an invite-only competition. The creator joins it immediately.
     */
    @Transactional
    public CompetitionResponses.CompetitionDetail createPrivateCompetition(
            UUID callerId,
            CompetitionRequests.CreateCompetitionRequest request
    ) {
        OffsetDateTime now = OffsetDateTime.now();
        Tournament tournament = requireTournament(request.tournamentId());
        if (tournament.hasStarted(now)) {
            throw CompetitionRuleException.tournamentStarted("Tournament has already started: " + tournament.getId());
        }

        Competition competition = newCompetition(tournament, request.name().trim(), callerId, now);
        competition.setPublicCompetition(false);
        competition.setInviteCode(uniqueInviteCode());
        competition.setInviteExpiresAt(now.plusHours(golfDraftProperties.getDraft().getInviteExpiryHours()));
        Competition saved = competitionRepository.save(competition);

        addParticipant(saved.getId(), callerId, now);
        log.info("Created private competition {} for tournament {}", saved.getId(), tournament.getId());
        return golfDraftResponseMapper.toCompetitionDetail(saved, 1);
    }

    /**
     * Returns the tournament's public competition, creating it on first access. The tournament
     * row lock keeps concurrent first visits from creating two.
     */
    @Transactional
    public CompetitionResponses.CompetitionDetail getOrCreatePublicCompetition(UUID callerId, UUID tournamentId) {
        Tournament tournament = tournamentRepository.findByIdForUpdate(tournamentId)
                .orElseThrow(() -> tournamentNotFound(tournamentId));

        Competition competition = competitionRepository
                .findFirstByTournamentIdAndPublicCompetitionTrueOrderByCreatedAtAsc(tournamentId)
                .orElseGet(() -> {
                    OffsetDateTime now = OffsetDateTime.now();
                    Competition created = newCompetition(tournament, tournament.getName() + " - Public", callerId, now);
                    created.setPublicCompetition(true);
                    Competition saved = competitionRepository.save(created);
                    log.info("Created public competition {} for tournament {}", saved.getId(), tournamentId);
                    return saved;
                });
        return golfDraftResponseMapper.toCompetitionDetail(
                competition,
                competitionParticipantRepository.countByCompetitionId(competition.getId())
        );
    }

    /**
     * Reads a competition, first starting its draft if the schedule says it is due.
     */
    @Transactional
    public CompetitionResponses.CompetitionDetail getCompetition(UUID competitionId) {
        draftService.maybeAutoStartDraft(competitionId);
        Competition competition = competitionRepository.findById(competitionId)
                .orElseThrow(() -> competitionNotFound(competitionId));
        return golfDraftResponseMapper.toCompetitionDetail(
                competition,
                competitionParticipantRepository.countByCompetitionId(competitionId)
        );
    }

    @Transactional(readOnly = true)
    public List<CompetitionResponses.Participant> listParticipants(UUID competitionId) {
        if (!competitionRepository.existsById(competitionId)) {
            throw competitionNotFound(competitionId);
        }
        List<CompetitionParticipant> participants =
                competitionParticipantRepository.findByCompetitionIdOrderByJoinedAtAsc(competitionId);
        Map<UUID, UserProfile> profiles = userProfileRepository
                .findByIdIn(participants.stream().map(CompetitionParticipant::getUserId).toList())
                .stream()
                .collect(Collectors.toMap(UserProfile::getId, Function.identity()));
        return participants.stream()
                .map(participant -> golfDraftResponseMapper.toParticipant(participant, profiles.get(participant.getUserId())))
                .toList();
    }

    @Transactional
    public CompetitionResponses.Participant joinCompetition(UUID competitionId, UUID callerId) {
        Competition competition = competitionRepository.findByIdForUpdate(competitionId)
                .orElseThrow(() -> competitionNotFound(competitionId));
        if (!competition.isPublicCompetition()) {
            throw CompetitionRuleException.forbidden("Private competitions are joined through their invite link");
        }
        return joinLocked(competition, callerId);
    }

    @Transactional
    public CompetitionResponses.Participant joinByInviteCode(String inviteCode, UUID callerId) {
        Competition found = competitionRepository.findByInviteCode(inviteCode)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND,
                        "Invite not found: " + inviteCode
                ));
        Competition competition = competitionRepository.findByIdForUpdate(found.getId())
                .orElseThrow(() -> competitionNotFound(found.getId()));
        if (competition.getInviteExpiresAt() != null && competition.getInviteExpiresAt().isBefore(OffsetDateTime.now())) {
            throw CompetitionRuleException.inviteExpired("Invite link has expired");
        }
        return joinLocked(competition, callerId);
    }

    private CompetitionResponses.Participant joinLocked(Competition competition, UUID callerId) {
        OffsetDateTime now = OffsetDateTime.now();
        if (competition.getDraftStatus() != DraftStatus.NOT_STARTED) {
            throw CompetitionRuleException.draftAlreadyStarted("Draft has already started; joining is closed");
        }
        Tournament tournament = requireTournament(competition.getTournamentId());
        if (tournament.hasStarted(now)) {
            throw CompetitionRuleException.tournamentStarted("Tournament has already started");
        }
        if (competitionParticipantRepository.existsByCompetitionIdAndUserId(competition.getId(), callerId)) {
            throw CompetitionRuleException.alreadyParticipant("You are already a participant in this competition");
        }

        CompetitionParticipant participant = addParticipant(competition.getId(), callerId, now);
        log.info("User {} joined competition {}", callerId, competition.getId());
        return golfDraftResponseMapper.toParticipant(
                participant,
                userProfileRepository.findById(callerId).orElse(null)
        );
    }

    private CompetitionParticipant addParticipant(UUID competitionId, UUID userId, OffsetDateTime now) {
        CompetitionParticipant participant = new CompetitionParticipant();
        participant.setId(UUID.randomUUID());
        participant.setCompetitionId(competitionId);
        participant.setUserId(userId);
        participant.setJoinedAt(now);
        try {
            return competitionParticipantRepository.saveAndFlush(participant);
        } catch (DataIntegrityViolationException ex) {
            throw CompetitionRuleException.alreadyParticipant("You are already a participant in this competition");
        }
    }

    private Competition newCompetition(Tournament tournament, String name, UUID createdBy, OffsetDateTime now) {
        Competition competition = new Competition();
        competition.setId(UUID.randomUUID());
        competition.setTournamentId(tournament.getId());
        competition.setName(name);
        competition.setCreatedBy(createdBy);
        competition.setDraftStatus(DraftStatus.NOT_STARTED);
        competition.setDraftScheduledAt(tournament.getStartTime().minusDays(golfDraftProperties.getDraft().getAutoStartLeadDays()));
        competition.setCreatedAt(now);
        competition.setUpdatedAt(now);
        return competition;
    }

    private String uniqueInviteCode() {
        for (int attempt = 0; attempt < MAX_INVITE_CODE_ATTEMPTS; attempt++) {
            String code = inviteCodeGenerator.nextCode();
            if (!competitionRepository.existsByInviteCode(code)) {
                return code;
            }
        }
        throw new IllegalStateException("Could not allocate a unique invite code");
    }

    private Tournament requireTournament(UUID tournamentId) {
        return tournamentRepository.findById(tournamentId)
                .orElseThrow(() -> tournamentNotFound(tournamentId));
    }

    private static ResponseStatusException tournamentNotFound(UUID tournamentId) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, "Tournament not found: " + tournamentId);
    }

    private static ResponseStatusException competitionNotFound(UUID competitionId) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, "Competition not found: " + competitionId);
    }
}
