package io.github.chirino.tracker.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Denormalized summary of one user turn and the responses that followed it within a single write
 * batch. Materialized at write time, never updated.
 */
public record FlattenedTurn(
        String senderId,
        String turnId,
        Double timestamp,
        String userInput,
        String intentName,
        Double intentConfidence,
        List<String> actionNames,
        List<BotResponse> botResponses) {

    public FlattenedTurn {
        actionNames = Collections.unmodifiableList(new ArrayList<>(actionNames));
        botResponses = Collections.unmodifiableList(new ArrayList<>(botResponses));
    }

    public record BotResponse(String text, Object data) {}
}
