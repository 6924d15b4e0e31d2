package com.golfdraft.service;

import com.golfdraft.dto.SeasonResponses;
import com.golfdraft.model.AnnualAggregate;
import com.golfdraft.model.UserProfile;
import com.golfdraft.repository.AnnualAggregateRepository;
import com.golfdraft.repository.UserProfileRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
public class AnnualLeaderboardService {

    private static final Comparator<AnnualAggregate> STANDING_ORDER =
            Comparator.comparing(AnnualLeaderboardService::totalNet).reversed()
                    .thenComparing(Comparator.comparing(AnnualAggregate::getCompetitionsWon).reversed())
                    .thenComparing(AnnualAggregate::getUserId);

    private final AnnualAggregateRepository annualAggregateRepository;
    private final UserProfileRepository userProfileRepository;

    public AnnualLeaderboardService(
            AnnualAggregateRepository annualAggregateRepository,
            UserProfileRepository userProfileRepository
    ) {
        this.annualAggregateRepository = annualAggregateRepository;
        this.userProfileRepository = userProfileRepository;
    }

    /**
     * Season standings ordered by winnings plus bounties, best first.
     */
    @Transactional(readOnly = true)
    public List<SeasonResponses.AnnualStanding> getAnnualLeaderboard(int year) {
        List<AnnualAggregate> aggregates = new ArrayList<>(annualAggregateRepository.findByYear(year));
        aggregates.sort(STANDING_ORDER);

        Map<UUID, UserProfile> profiles = userProfileRepository
                .findByIdIn(aggregates.stream().map(AnnualAggregate::getUserId).toList())
                .stream()
                .collect(Collectors.toMap(UserProfile::getId, Function.identity()));

        List<SeasonResponses.AnnualStanding> standings = new ArrayList<>(aggregates.size());
        for (int i = 0; i < aggregates.size(); i++) {
            AnnualAggregate aggregate = aggregates.get(i);
            standings.add(toStanding(i + 1, aggregate, profiles.get(aggregate.getUserId())));
        }
        return standings;
    }

    /**
     * One user's season line. A user without finalized competitions that year gets an empty
     * line with rank 0.
     */
    @Transactional(readOnly = true)
    public SeasonResponses.AnnualStanding getAnnualStats(UUID userId, int year) {
        List<AnnualAggregate> aggregates = new ArrayList<>(annualAggregateRepository.findByYear(year));
        aggregates.sort(STANDING_ORDER);
        UserProfile profile = userProfileRepository.findById(userId).orElse(null);

        for (int i = 0; i < aggregates.size(); i++) {
            if (aggregates.get(i).getUserId().equals(userId)) {
                return toStanding(i + 1, aggregates.get(i), profile);
            }
        }

        AnnualAggregate empty = new AnnualAggregate();
        empty.setUserId(userId);
        empty.setYear(year);
        return toStanding(0, empty, profile);
    }

    private static SeasonResponses.AnnualStanding toStanding(int rank, AnnualAggregate aggregate, UserProfile profile) {
        return new SeasonResponses.AnnualStanding(
                rank,
                aggregate.getUserId(),
                profile == null ? null : profile.getDisplayName(),
                profile == null ? null : profile.getTeamColor(),
                aggregate.getYear(),
                aggregate.getTotalCompetitions(),
                aggregate.getCompetitionsWon(),
                aggregate.getTotalWinnings(),
                aggregate.getTotalBounties(),
                totalNet(aggregate)
        );
    }

    private static BigDecimal totalNet(AnnualAggregate aggregate) {
        return aggregate.getTotalWinnings().add(aggregate.getTotalBounties());
    }
}
