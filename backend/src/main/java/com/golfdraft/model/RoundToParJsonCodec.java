package com.golfdraft.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads and writes the per-round to-par column of {@link TournamentResult}.
 * Stored form is a JSON array of integers in round order, e.g. {@code [-3,1,0]}.
 */
public final class RoundToParJsonCodec {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private RoundToParJsonCodec() {
    }

    public static String toJson(List<Integer> roundToPar) {
        if (roundToPar == null || roundToPar.isEmpty()) {
            return null;
        }
        ArrayNode array = JsonNodeFactory.instance.arrayNode();
        for (Integer value : roundToPar) {
            if (value == null) {
                throw new IllegalArgumentException("Round to-par values must not be null");
            }
            array.add(value);
        }
        return array.toString();
    }

    public static List<Integer> fromJson(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }

        JsonNode root;
        try {
            root = OBJECT_MAPPER.readTree(json);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Round to-par column is not valid JSON", ex);
        }
        if (root == null || !root.isArray()) {
            throw new IllegalArgumentException("Round to-par column must be a JSON array");
        }

        List<Integer> rounds = new ArrayList<>(root.size());
        for (JsonNode node : root) {
            if (!node.isIntegralNumber()) {
                throw new IllegalArgumentException("Round to-par entries must be integers");
            }
            rounds.add(node.intValue());
        }
        return List.copyOf(rounds);
    }
}
