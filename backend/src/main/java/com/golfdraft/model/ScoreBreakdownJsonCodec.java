package com.golfdraft.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Serializes the frozen per-golfer breakdown stored with a {@link CompetitionScore}.
 */
public final class ScoreBreakdownJsonCodec {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private static final String FIELD_GOLFER_ID = "golfer_id";
    private static final String FIELD_GOLFER_NAME = "golfer_name";
    private static final String FIELD_SCORE_TO_PAR = "score_to_par";
    private static final String FIELD_STROKES = "strokes";
    private static final String FIELD_USED_ALTERNATE = "used_alternate";
    private static final String FIELD_ALTERNATE_GOLFER_ID = "alternate_golfer_id";
    private static final String FIELD_MISSED_CUT = "missed_cut";
    private static final String FIELD_WITHDREW = "withdrew";
    private static final String FIELD_PENALIZED = "penalized";

    private ScoreBreakdownJsonCodec() {
    }

    public static String toJson(List<ScoreBreakdownItem> items) {
        if (items == null) {
            throw new IllegalArgumentException("Score breakdown is required");
        }
        ArrayNode array = JsonNodeFactory.instance.arrayNode();
        for (ScoreBreakdownItem item : items) {
            ObjectNode node = array.addObject();
            node.put(FIELD_GOLFER_ID, item.golferId().toString());
            node.put(FIELD_GOLFER_NAME, item.golferName());
            node.put(FIELD_SCORE_TO_PAR, item.scoreToPar());
            if (item.strokes() != null) {
                node.put(FIELD_STROKES, item.strokes());
            }
            node.put(FIELD_USED_ALTERNATE, item.usedAlternate());
            if (item.alternateGolferId() != null) {
                node.put(FIELD_ALTERNATE_GOLFER_ID, item.alternateGolferId().toString());
            }
            node.put(FIELD_MISSED_CUT, item.missedCut());
            node.put(FIELD_WITHDREW, item.withdrew());
            node.put(FIELD_PENALIZED, item.penalized());
        }
        return array.toString();
    }

    public static List<ScoreBreakdownItem> fromJson(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }

        JsonNode root;
        try {
            root = OBJECT_MAPPER.readTree(json);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Score breakdown column is not valid JSON", ex);
        }
        if (root == null || !root.isArray()) {
            throw new IllegalArgumentException("Score breakdown column must be a JSON array");
        }

        List<ScoreBreakdownItem> items = new ArrayList<>(root.size());
        for (JsonNode node : root) {
            items.add(new ScoreBreakdownItem(
                    requireUuid(node, FIELD_GOLFER_ID),
                    node.path(FIELD_GOLFER_NAME).asText(null),
                    requireInt(node, FIELD_SCORE_TO_PAR),
                    node.hasNonNull(FIELD_STROKES) ? node.get(FIELD_STROKES).intValue() : null,
                    node.path(FIELD_USED_ALTERNATE).asBoolean(false),
                    node.hasNonNull(FIELD_ALTERNATE_GOLFER_ID) ? requireUuid(node, FIELD_ALTERNATE_GOLFER_ID) : null,
                    node.path(FIELD_MISSED_CUT).asBoolean(false),
                    node.path(FIELD_WITHDREW).asBoolean(false),
                    node.path(FIELD_PENALIZED).asBoolean(false)
            ));
        }
        return List.copyOf(items);
    }

    private static UUID requireUuid(JsonNode node, String fieldName) {
        JsonNode valueNode = node.get(fieldName);
        if (valueNode == null || !valueNode.isTextual()) {
            throw new IllegalArgumentException("Score breakdown missing textual field '" + fieldName + "'");
        }
        try {
            return UUID.fromString(valueNode.textValue());
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Score breakdown field '" + fieldName + "' must be a valid UUID", ex);
        }
    }

    private static int requireInt(JsonNode node, String fieldName) {
        JsonNode valueNode = node.get(fieldName);
        if (valueNode == null || !valueNode.isIntegralNumber()) {
            throw new IllegalArgumentException("Score breakdown missing integer field '" + fieldName + "'");
        }
        return valueNode.intValue();
    }
}
