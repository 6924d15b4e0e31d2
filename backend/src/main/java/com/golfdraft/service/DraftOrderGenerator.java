package com.golfdraft.service;

import com.golfdraft.model.DraftOrderMode;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.UUID;

@Component
public class DraftOrderGenerator {

    private final Random random;

    @Autowired
    public DraftOrderGenerator() {
        this(new SecureRandom());
    }

    DraftOrderGenerator(Random random) {
        this.random = random;
    }

    /**
     * Returns the participants in pick order; index 0 takes position 1.
     *
     * @param priorFinalPositions final positions from the most recent shared competition;
     *                            only read in {@link DraftOrderMode#PRIOR_STANDINGS}
     */
    public List<UUID> generate(List<UUID> participantIds, DraftOrderMode mode, Map<UUID, Integer> priorFinalPositions) {
        if (participantIds == null || participantIds.size() < 2) {
            throw new IllegalArgumentException("At least 2 participants are required to build a draft order");
        }
        if (participantIds.stream().distinct().count() != participantIds.size()) {
            throw new IllegalArgumentException("Draft order participants must be distinct");
        }

        if (mode == DraftOrderMode.PRIOR_STANDINGS && priorFinalPositions != null && !priorFinalPositions.isEmpty()) {
            return priorStandingsOrder(participantIds, priorFinalPositions);
        }
        return shuffle(participantIds);
    }

    private List<UUID> shuffle(List<UUID> participantIds) {
        return List.copyOf(shuffledCopy(participantIds));
    }

    private List<UUID> shuffledCopy(List<UUID> ids) {
        List<UUID> shuffled = new ArrayList<>(ids);
        for (int i = shuffled.size() - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            Collections.swap(shuffled, i, j);
        }
        return shuffled;
    }

    // Worst finisher picks first; newcomers land in random slots among them.
    private List<UUID> priorStandingsOrder(List<UUID> participantIds, Map<UUID, Integer> priorFinalPositions) {
        List<UUID> ranked = new ArrayList<>();
        List<UUID> newcomers = new ArrayList<>();
        for (UUID participantId : participantIds) {
            if (priorFinalPositions.containsKey(participantId)) {
                ranked.add(participantId);
            } else {
                newcomers.add(participantId);
            }
        }
        if (ranked.isEmpty()) {
            return shuffle(participantIds);
        }

        ranked.sort(Comparator.comparing((UUID id) -> priorFinalPositions.get(id)).reversed());

        List<UUID> order = new ArrayList<>(ranked);
        for (UUID newcomer : shuffledCopy(newcomers)) {
            order.add(random.nextInt(order.size() + 1), newcomer);
        }
        return List.copyOf(order);
    }
}
