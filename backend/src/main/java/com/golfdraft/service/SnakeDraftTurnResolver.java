package com.golfdraft.service;

import org.springframework.stereotype.Component;

/**
 * Snake order over a fixed number of rounds: odd rounds run 1..N, even rounds run N..1.
 */
@Component
public class SnakeDraftTurnResolver {

    public static final int ROUNDS = 3;

    public int positionForPick(int pickNumber, int participantCount) {
        validate(pickNumber, participantCount);
        int round = roundForPick(pickNumber, participantCount);
        int indexInRound = (pickNumber - 1) % participantCount;
        return round % 2 == 1
                ? indexInRound + 1
                : participantCount - indexInRound;
    }

    public int roundForPick(int pickNumber, int participantCount) {
        validate(pickNumber, participantCount);
        return (pickNumber + participantCount - 1) / participantCount;
    }

    public int totalPicks(int participantCount) {
        if (participantCount < 1) {
            throw new IllegalArgumentException("participantCount must be at least 1");
        }
        return participantCount * ROUNDS;
    }

    public boolean isDraftComplete(int picksMade, int participantCount) {
        if (picksMade < 0) {
            throw new IllegalArgumentException("picksMade must not be negative");
        }
        return picksMade + 1 > totalPicks(participantCount);
    }

    private static void validate(int pickNumber, int participantCount) {
        if (participantCount < 1) {
            throw new IllegalArgumentException("participantCount must be at least 1");
        }
        if (pickNumber < 1) {
            throw new IllegalArgumentException("pickNumber must be at least 1");
        }
    }
}
