package com.golfdraft.mapper;

import com.golfdraft.dto.CompetitionResponses;
import com.golfdraft.dto.DraftResponses;
import com.golfdraft.dto.ScoringResponses;
import com.golfdraft.dto.TournamentResultResponses;
import com.golfdraft.model.Alternate;
import com.golfdraft.model.Competition;
import com.golfdraft.model.CompetitionBounty;
import com.golfdraft.model.CompetitionParticipant;
import com.golfdraft.model.CompetitionPayment;
import com.golfdraft.model.CompetitionScore;
import com.golfdraft.model.DraftOrderEntry;
import com.golfdraft.model.DraftPick;
import com.golfdraft.model.RoundToParJsonCodec;
import com.golfdraft.model.ScoreBreakdownJsonCodec;
import com.golfdraft.model.TournamentResult;
import com.golfdraft.model.UserProfile;
import com.golfdraft.service.LeaderboardEntry;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Component
public class GolfDraftResponseMapper {

    public CompetitionResponses.CompetitionDetail toCompetitionDetail(Competition competition, long participantCount) {
        return new CompetitionResponses.CompetitionDetail(
                competition.getId(),
                competition.getTournamentId(),
                competition.getName(),
                competition.getCreatedBy(),
                competition.isPublicCompetition(),
                competition.getInviteCode(),
                competition.getInviteExpiresAt(),
                competition.getDraftStatus(),
                competition.getDraftScheduledAt(),
                competition.getDraftStartedAt(),
                competition.getDraftCompletedAt(),
                (int) participantCount,
                competition.getCreatedAt(),
                competition.getUpdatedAt()
        );
    }

    public CompetitionResponses.Participant toParticipant(CompetitionParticipant participant, UserProfile profile) {
        return new CompetitionResponses.Participant(
                participant.getUserId(),
                profile == null ? null : profile.getDisplayName(),
                profile == null ? null : profile.getTeamColor(),
                participant.getJoinedAt()
        );
    }

    public List<DraftResponses.DraftOrderSlot> toDraftOrder(Collection<DraftOrderEntry> entries) {
        return entries.stream()
                .map(entry -> new DraftResponses.DraftOrderSlot(entry.getUserId(), entry.getPosition()))
                .toList();
    }

    public DraftResponses.Pick toPick(DraftPick pick, Map<UUID, String> golferNames) {
        return new DraftResponses.Pick(
                pick.getId(),
                pick.getUserId(),
                pick.getGolferId(),
                golferNames.get(pick.getGolferId()),
                pick.getDraftRound(),
                pick.getPickNumber(),
                pick.getPickedAt()
        );
    }

    public DraftResponses.AlternateSelection toAlternate(Alternate alternate, Map<UUID, String> golferNames) {
        return new DraftResponses.AlternateSelection(
                alternate.getUserId(),
                alternate.getGolferId(),
                golferNames.get(alternate.getGolferId()),
                alternate.getSelectedAt()
        );
    }

    public ScoringResponses.LeaderboardRow toLeaderboardRow(LeaderboardEntry entry, UserProfile profile) {
        return new ScoringResponses.LeaderboardRow(
                entry.userId(),
                profile == null ? null : profile.getDisplayName(),
                entry.position(),
                entry.teamScoreToPar(),
                entry.teamScoreStrokes(),
                entry.breakdown()
        );
    }

    public ScoringResponses.LeaderboardRow toLeaderboardRow(CompetitionScore score, UserProfile profile) {
        return new ScoringResponses.LeaderboardRow(
                score.getUserId(),
                profile == null ? null : profile.getDisplayName(),
                score.getFinalPosition(),
                score.getTeamScoreToPar(),
                score.getTeamScoreStrokes(),
                ScoreBreakdownJsonCodec.fromJson(score.getScoreBreakdownJson())
        );
    }

    public ScoringResponses.Payment toPayment(CompetitionPayment payment) {
        return new ScoringResponses.Payment(
                payment.getFromUserId(),
                payment.getToUserId(),
                payment.getAmount(),
                payment.getPaymentType()
        );
    }

    public ScoringResponses.Bounty toBounty(CompetitionBounty bounty) {
        return new ScoringResponses.Bounty(
                bounty.getUserId(),
                bounty.getGolferId(),
                bounty.getPickRound(),
                bounty.getBountyAmount(),
                bounty.getCreatedAt()
        );
    }

    public TournamentResultResponses.ResultDetail toResultDetail(TournamentResult result) {
        return new TournamentResultResponses.ResultDetail(
                result.getTournamentId(),
                result.getGolferId(),
                result.getPosition(),
                result.getTotalStrokes(),
                result.getTotalToPar(),
                result.getMadeCut(),
                result.isWithdrew(),
                RoundToParJsonCodec.fromJson(result.getRoundToParJson()),
                result.isManualOverride(),
                result.getLastUpdated()
        );
    }
}
