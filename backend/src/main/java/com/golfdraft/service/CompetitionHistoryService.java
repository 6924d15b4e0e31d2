package com.golfdraft.service;

import com.golfdraft.dto.SeasonResponses;
import com.golfdraft.model.Competition;
import com.golfdraft.model.CompetitionScore;
import com.golfdraft.model.Tournament;
import com.golfdraft.repository.CompetitionParticipantRepository;
import com.golfdraft.repository.CompetitionRepository;
import com.golfdraft.repository.CompetitionScoreRepository;
import com.golfdraft.repository.TournamentRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * A user's finalized competitions, most recent tournament first.
 */
@Service
public class CompetitionHistoryService {

    static final int MAX_LIMIT = 100;

    private final CompetitionScoreRepository competitionScoreRepository;
    private final CompetitionRepository competitionRepository;
    private final CompetitionParticipantRepository competitionParticipantRepository;
    private final TournamentRepository tournamentRepository;

    public CompetitionHistoryService(
            CompetitionScoreRepository competitionScoreRepository,
            CompetitionRepository competitionRepository,
            CompetitionParticipantRepository competitionParticipantRepository,
            TournamentRepository tournamentRepository
    ) {
        this.competitionScoreRepository = competitionScoreRepository;
        this.competitionRepository = competitionRepository;
        this.competitionParticipantRepository = competitionParticipantRepository;
        this.tournamentRepository = tournamentRepository;
    }

    /**
     * @param publicFilter {@code true} for public competitions only, {@code false} for private
     *                     only, {@code null} for both
     */
    @Transactional(readOnly = true)
    public List<SeasonResponses.CompetitionHistoryItem> getHistory(UUID userId, Boolean publicFilter, int limit) {
        int boundedLimit = Math.max(1, Math.min(limit, MAX_LIMIT));

        List<CompetitionScore> scores = competitionScoreRepository.findByUserId(userId);
        if (scores.isEmpty()) {
            return List.of();
        }

        Map<UUID, Competition> competitions = competitionRepository
                .findByIdIn(scores.stream().map(CompetitionScore::getCompetitionId).toList())
                .stream()
                .collect(Collectors.toMap(Competition::getId, Function.identity()));
        Map<UUID, Tournament> tournaments = tournamentRepository
                .findByIdIn(competitions.values().stream().map(Competition::getTournamentId).toList())
                .stream()
                .collect(Collectors.toMap(Tournament::getId, Function.identity()));

        return scores.stream()
                .filter(score -> competitions.containsKey(score.getCompetitionId()))
                .filter(score -> publicFilter == null
                        || competitions.get(score.getCompetitionId()).isPublicCompetition() == publicFilter)
                .map(score -> toHistoryItem(score, competitions.get(score.getCompetitionId()), tournaments))
                .sorted(Comparator.comparing(
                        SeasonResponses.CompetitionHistoryItem::tournamentEndDate,
                        Comparator.nullsLast(Comparator.reverseOrder())))
                .limit(boundedLimit)
                .toList();
    }

    private SeasonResponses.CompetitionHistoryItem toHistoryItem(
            CompetitionScore score,
            Competition competition,
            Map<UUID, Tournament> tournaments
    ) {
        Tournament tournament = tournaments.get(competition.getTournamentId());
        return new SeasonResponses.CompetitionHistoryItem(
                competition.getId(),
                competition.getName(),
                competition.isPublicCompetition(),
                competition.getTournamentId(),
                tournament == null ? null : tournament.getName(),
                tournament == null ? null : tournament.getEndDate(),
                score.getFinalPosition(),
                score.getTeamScoreToPar(),
                (int) competitionParticipantRepository.countByCompetitionId(competition.getId()),
                score.getNetWinnings(),
                score.getNetBounties()
        );
    }
}
