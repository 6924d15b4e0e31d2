package com.golfdraft.service;

import com.golfdraft.dto.ScoringResponses;
import com.golfdraft.mapper.GolfDraftResponseMapper;
import com.golfdraft.model.Competition;
import com.golfdraft.model.CompetitionScore;
import com.golfdraft.model.Tournament;
import com.golfdraft.model.TournamentStatus;
import com.golfdraft.model.UserProfile;
import com.golfdraft.repository.CompetitionBountyRepository;
import com.golfdraft.repository.CompetitionPaymentRepository;
import com.golfdraft.repository.CompetitionRepository;
import com.golfdraft.repository.CompetitionScoreRepository;
import com.golfdraft.repository.TournamentRepository;
import com.golfdraft.repository.UserProfileRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Read side of scoring. Once the tournament is complete a leaderboard read also attempts
 * finalization; a failure there is logged and retried on the next read.
 */
@Service
public class CompetitionLeaderboardService {

    private static final Logger log = LoggerFactory.getLogger(CompetitionLeaderboardService.class);

    private final CompetitionRepository competitionRepository;
    private final TournamentRepository tournamentRepository;
    private final CompetitionScoreRepository competitionScoreRepository;
    private final CompetitionPaymentRepository competitionPaymentRepository;
    private final CompetitionBountyRepository competitionBountyRepository;
    private final UserProfileRepository userProfileRepository;
    private final CompetitionStandingsLoader competitionStandingsLoader;
    private final CompetitionFinalizationService competitionFinalizationService;
    private final GolfDraftResponseMapper golfDraftResponseMapper;

    public CompetitionLeaderboardService(
            CompetitionRepository competitionRepository,
            TournamentRepository tournamentRepository,
            CompetitionScoreRepository competitionScoreRepository,
            CompetitionPaymentRepository competitionPaymentRepository,
            CompetitionBountyRepository competitionBountyRepository,
            UserProfileRepository userProfileRepository,
            CompetitionStandingsLoader competitionStandingsLoader,
            CompetitionFinalizationService competitionFinalizationService,
            GolfDraftResponseMapper golfDraftResponseMapper
    ) {
        this.competitionRepository = competitionRepository;
        this.tournamentRepository = tournamentRepository;
        this.competitionScoreRepository = competitionScoreRepository;
        this.competitionPaymentRepository = competitionPaymentRepository;
        this.competitionBountyRepository = competitionBountyRepository;
        this.userProfileRepository = userProfileRepository;
        this.competitionStandingsLoader = competitionStandingsLoader;
        this.competitionFinalizationService = competitionFinalizationService;
        this.golfDraftResponseMapper = golfDraftResponseMapper;
    }

    // Not transactional: a failed finalization must not mark the read's transaction rollback-only.
    public ScoringResponses.Leaderboard getLeaderboard(UUID competitionId) {
        Competition competition = requireCompetition(competitionId);
        Tournament tournament = tournamentRepository.findById(competition.getTournamentId())
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND,
                        "Tournament not found: " + competition.getTournamentId()
                ));

        boolean finalized = competitionScoreRepository.existsByCompetitionId(competitionId);
        if (!finalized && tournament.getStatus() == TournamentStatus.COMPLETED) {
            try {
                FinalizationOutcome outcome = competitionFinalizationService.finalizeCompetition(competitionId);
                finalized = outcome != FinalizationOutcome.NOT_READY;
            } catch (RuntimeException ex) {
                log.warn("Finalization of competition {} failed; serving live standings", competitionId, ex);
            }
        }

        if (finalized) {
            List<CompetitionScore> scores =
                    competitionScoreRepository.findByCompetitionIdOrderByFinalPositionAsc(competitionId);
            Map<UUID, UserProfile> profiles = profiles(scores.stream().map(CompetitionScore::getUserId).toList());
            List<ScoringResponses.LeaderboardRow> rows = scores.stream()
                    .map(score -> golfDraftResponseMapper.toLeaderboardRow(score, profiles.get(score.getUserId())))
                    .toList();
            return new ScoringResponses.Leaderboard(competitionId, true, true, rows);
        }

        CompetitionStandingsLoader.Standings standings = competitionStandingsLoader.load(competition);
        Map<UUID, UserProfile> profiles = profiles(standings.leaderboard().stream().map(LeaderboardEntry::userId).toList());
        List<ScoringResponses.LeaderboardRow> rows = standings.leaderboard().stream()
                .map(entry -> golfDraftResponseMapper.toLeaderboardRow(entry, profiles.get(entry.userId())))
                .toList();
        return new ScoringResponses.Leaderboard(competitionId, false, standings.scoresAvailable(), rows);
    }

    @Transactional(readOnly = true)
    public List<ScoringResponses.Payment> getPayments(UUID competitionId) {
        requireCompetition(competitionId);
        return competitionPaymentRepository.findByCompetitionIdOrderByPaymentTypeAscAmountDesc(competitionId)
                .stream()
                .map(golfDraftResponseMapper::toPayment)
                .toList();
    }

    @Transactional(readOnly = true)
    public Optional<ScoringResponses.Bounty> getBounty(UUID competitionId) {
        requireCompetition(competitionId);
        return competitionBountyRepository.findByCompetitionId(competitionId)
                .map(golfDraftResponseMapper::toBounty);
    }

    private Map<UUID, UserProfile> profiles(Collection<UUID> userIds) {
        return userProfileRepository.findByIdIn(userIds).stream()
                .collect(Collectors.toMap(UserProfile::getId, Function.identity()));
    }

    private Competition requireCompetition(UUID competitionId) {
        return competitionRepository.findById(competitionId)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND,
                        "Competition not found: " + competitionId
                ));
    }
}
