package com.golfdraft.service;

import com.golfdraft.model.Alternate;
import com.golfdraft.model.Competition;
import com.golfdraft.model.CompetitionParticipant;
import com.golfdraft.model.DraftOrderEntry;
import com.golfdraft.model.DraftPick;
import com.golfdraft.model.Golfer;
import com.golfdraft.model.TournamentResult;
import com.golfdraft.repository.AlternateRepository;
import com.golfdraft.repository.CompetitionParticipantRepository;
import com.golfdraft.repository.DraftOrderRepository;
import com.golfdraft.repository.DraftPickRepository;
import com.golfdraft.repository.GolferRepository;
import com.golfdraft.repository.TournamentResultRepository;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Reads everything the live leaderboard depends on and runs the builder over it.
 */
@Component
public class CompetitionStandingsLoader {

    private final DraftOrderRepository draftOrderRepository;
    private final CompetitionParticipantRepository competitionParticipantRepository;
    private final DraftPickRepository draftPickRepository;
    private final AlternateRepository alternateRepository;
    private final TournamentResultRepository tournamentResultRepository;
    private final GolferRepository golferRepository;
    private final LeaderboardBuilder leaderboardBuilder;

    public CompetitionStandingsLoader(
            DraftOrderRepository draftOrderRepository,
            CompetitionParticipantRepository competitionParticipantRepository,
            DraftPickRepository draftPickRepository,
            AlternateRepository alternateRepository,
            TournamentResultRepository tournamentResultRepository,
            GolferRepository golferRepository,
            LeaderboardBuilder leaderboardBuilder
    ) {
        this.draftOrderRepository = draftOrderRepository;
        this.competitionParticipantRepository = competitionParticipantRepository;
        this.draftPickRepository = draftPickRepository;
        this.alternateRepository = alternateRepository;
        this.tournamentResultRepository = tournamentResultRepository;
        this.golferRepository = golferRepository;
        this.leaderboardBuilder = leaderboardBuilder;
    }

    public Standings load(Competition competition) {
        List<UUID> participantOrder = draftOrderRepository.findByCompetitionIdOrderByPositionAsc(competition.getId())
                .stream()
                .map(DraftOrderEntry::getUserId)
                .toList();
        if (participantOrder.isEmpty()) {
            participantOrder = competitionParticipantRepository
                    .findByCompetitionIdOrderByJoinedAtAsc(competition.getId())
                    .stream()
                    .map(CompetitionParticipant::getUserId)
                    .toList();
        }

        List<DraftPick> picks = draftPickRepository.findByCompetitionIdOrderByPickNumberAsc(competition.getId());

        Map<UUID, UUID> alternatesByUser = new LinkedHashMap<>();
        for (Alternate alternate : alternateRepository.findByCompetitionId(competition.getId())) {
            alternatesByUser.put(alternate.getUserId(), alternate.getGolferId());
        }

        Map<UUID, GolferResult> resultsByGolfer = new LinkedHashMap<>();
        for (TournamentResult result : tournamentResultRepository.findByTournamentId(competition.getTournamentId())) {
            resultsByGolfer.put(result.getGolferId(), GolferResult.from(result));
        }

        Set<UUID> golferIds = new HashSet<>(alternatesByUser.values());
        picks.forEach(pick -> golferIds.add(pick.getGolferId()));
        Map<UUID, String> golferNames = new LinkedHashMap<>();
        for (Golfer golfer : golferRepository.findByIdIn(golferIds)) {
            golferNames.put(golfer.getId(), golfer.getDisplayName());
        }

        List<LeaderboardEntry> leaderboard = leaderboardBuilder.build(
                participantOrder,
                picks,
                alternatesByUser,
                resultsByGolfer,
                golferNames
        );
        return new Standings(picks, resultsByGolfer, leaderboard);
    }

    public record Standings(
            List<DraftPick> picks,
            Map<UUID, GolferResult> resultsByGolfer,
            List<LeaderboardEntry> leaderboard
    ) {

        public boolean scoresAvailable() {
            return !resultsByGolfer.isEmpty();
        }
    }
}
