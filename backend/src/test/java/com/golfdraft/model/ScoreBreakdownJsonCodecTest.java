package com.golfdraft.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScoreBreakdownJsonCodecTest {

    @Test
    void fromJsonParsesSubstitutedAndPenalizedEntries() {
        UUID drafted = UUID.fromString("00000000-0000-0000-0000-000000000301");
        UUID alternate = UUID.fromString("00000000-0000-0000-0000-000000000302");
        UUID withdrawn = UUID.fromString("00000000-0000-0000-0000-000000000303");
        String json = """
                [
                  {"golfer_id": "%s", "golfer_name": "Drafted", "score_to_par": 1, "strokes": 281,
                   "used_alternate": true, "alternate_golfer_id": "%s", "missed_cut": false,
                   "withdrew": true, "penalized": false},
                  {"golfer_id": "%s", "golfer_name": "Withdrawn", "score_to_par": 4,
                   "used_alternate": false, "missed_cut": false, "withdrew": true, "penalized": true}
                ]
                """.formatted(drafted, alternate, withdrawn);

        List<ScoreBreakdownItem> items = ScoreBreakdownJsonCodec.fromJson(json);

        assertEquals(2, items.size());
        assertEquals(drafted, items.get(0).golferId());
        assertEquals(alternate, items.get(0).alternateGolferId());
        assertEquals(281, items.get(0).strokes());
        assertTrue(items.get(0).usedAlternate());
        assertFalse(items.get(0).penalized());
        assertEquals(4, items.get(1).scoreToPar());
        assertNull(items.get(1).strokes());
        assertNull(items.get(1).alternateGolferId());
        assertTrue(items.get(1).penalized());
    }

    @Test
    void toJsonOmitsUnknownStrokesAndAlternate() {
        ScoreBreakdownItem item = new ScoreBreakdownItem(
                UUID.fromString("00000000-0000-0000-0000-000000000304"),
                "Penalized",
                3,
                null,
                false,
                null,
                false,
                true,
                true
        );

        String json = ScoreBreakdownJsonCodec.toJson(List.of(item));

        assertFalse(json.contains("strokes"));
        assertFalse(json.contains("alternate_golfer_id"));
        assertTrue(json.contains("\"penalized\":true"));
    }

    @Test
    void fromJsonRejectsMissingScore() {
        String json = """
                [{"golfer_id": "00000000-0000-0000-0000-000000000305", "golfer_name": "No Score"}]
                """;

        assertThrows(IllegalArgumentException.class, () -> ScoreBreakdownJsonCodec.fromJson(json));
    }

    @Test
    void fromJsonRejectsInvalidGolferId() {
        String json = """
                [{"golfer_id": "not-a-uuid", "score_to_par": 0}]
                """;

        assertThrows(IllegalArgumentException.class, () -> ScoreBreakdownJsonCodec.fromJson(json));
    }
}
