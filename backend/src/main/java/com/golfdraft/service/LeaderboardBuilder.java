package com.golfdraft.service;

import com.golfdraft.model.DraftPick;
import com.golfdraft.model.ScoreBreakdownItem;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Builds the competition standings from drafted picks and the current results snapshot.
 * Withdrawal penalties depend on every other resolved score, so resolution runs in two passes.
 */
@Component
public class LeaderboardBuilder {

    private static final Comparator<ScoredTeam> TEAM_ORDER = Comparator.comparingInt(ScoredTeam::teamScoreToPar);

    private final ScoreResolver scoreResolver;

    public LeaderboardBuilder(ScoreResolver scoreResolver) {
        this.scoreResolver = scoreResolver;
    }

    /**
     * @param participantOrder  participants in draft order; ties keep this order
     * @param picks             every pick of the competition
     * @param alternatesByUser  alternate golfer per participant
     * @param resultsByGolfer   normalized results keyed by golfer; empty when scores are unavailable
     * @param golferNames       display names keyed by golfer
     */
    public List<LeaderboardEntry> build(
            List<UUID> participantOrder,
            List<DraftPick> picks,
            Map<UUID, UUID> alternatesByUser,
            Map<UUID, GolferResult> resultsByGolfer,
            Map<UUID, String> golferNames
    ) {
        if (resultsByGolfer == null || resultsByGolfer.isEmpty()) {
            return List.of();
        }

        Map<UUID, List<DraftPick>> picksByUser = groupPicks(participantOrder, picks);

        Map<UUID, List<ResolvedGolferScore>> resolvedByUser = new LinkedHashMap<>();
        List<Integer> resolvedContributions = new ArrayList<>();
        for (Map.Entry<UUID, List<DraftPick>> userPicks : picksByUser.entrySet()) {
            UUID alternateGolferId = alternatesByUser.get(userPicks.getKey());
            AlternateState alternate = alternateGolferId == null
                    ? AlternateState.none()
                    : AlternateState.available(alternateGolferId, resultsByGolfer.get(alternateGolferId));

            List<ResolvedGolferScore> resolved = new ArrayList<>();
            for (DraftPick pick : userPicks.getValue()) {
                ScoreResolver.Resolution resolution =
                        scoreResolver.resolve(pick.getGolferId(), resultsByGolfer.get(pick.getGolferId()), alternate);
                alternate = resolution.alternateAfter();
                resolved.add(resolution.score());
                if (!resolution.score().penaltyPending()) {
                    resolvedContributions.add(resolution.score().scoreToPar());
                }
            }
            resolvedByUser.put(userPicks.getKey(), resolved);
        }

        int withdrawalPenalty = scoreResolver.withdrawalPenalty(resolvedContributions);

        List<ScoredTeam> teams = new ArrayList<>();
        for (Map.Entry<UUID, List<ResolvedGolferScore>> userScores : resolvedByUser.entrySet()) {
            if (userScores.getValue().size() != SnakeDraftTurnResolver.ROUNDS) {
                continue;
            }
            int teamToPar = 0;
            int teamStrokes = 0;
            List<ScoreBreakdownItem> breakdown = new ArrayList<>();
            for (ResolvedGolferScore score : userScores.getValue()) {
                boolean penalized = score.penaltyPending();
                ResolvedGolferScore counted = penalized ? score.withPenalty(withdrawalPenalty) : score;
                teamToPar += counted.scoreToPar();
                if (counted.strokes() != null) {
                    teamStrokes += counted.strokes();
                }
                breakdown.add(new ScoreBreakdownItem(
                        counted.golferId(),
                        golferNames.get(counted.golferId()),
                        counted.scoreToPar(),
                        counted.strokes(),
                        counted.usedAlternate(),
                        counted.alternateGolferId(),
                        counted.missedCut(),
                        counted.withdrew(),
                        penalized
                ));
            }
            teams.add(new ScoredTeam(userScores.getKey(), teamToPar, teamStrokes, breakdown));
        }

        teams.sort(TEAM_ORDER);

        List<LeaderboardEntry> entries = new ArrayList<>(teams.size());
        for (int i = 0; i < teams.size(); i++) {
            ScoredTeam team = teams.get(i);
            entries.add(new LeaderboardEntry(
                    team.userId(),
                    i + 1,
                    team.teamScoreToPar(),
                    team.teamScoreStrokes(),
                    team.breakdown()
            ));
        }
        return List.copyOf(entries);
    }

    private static Map<UUID, List<DraftPick>> groupPicks(List<UUID> participantOrder, List<DraftPick> picks) {
        List<DraftPick> orderedPicks = new ArrayList<>(picks);
        orderedPicks.sort(Comparator.comparingInt(DraftPick::getPickNumber));

        Set<UUID> users = new LinkedHashSet<>(participantOrder);
        orderedPicks.forEach(pick -> users.add(pick.getUserId()));

        Map<UUID, List<DraftPick>> picksByUser = new LinkedHashMap<>();
        users.forEach(userId -> picksByUser.put(userId, new ArrayList<>()));
        orderedPicks.forEach(pick -> picksByUser.get(pick.getUserId()).add(pick));
        return picksByUser;
    }

    private record ScoredTeam(
            UUID userId,
            int teamScoreToPar,
            int teamScoreStrokes,
            List<ScoreBreakdownItem> breakdown
    ) {
    }
}
