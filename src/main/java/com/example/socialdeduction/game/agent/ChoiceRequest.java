package com.example.socialdeduction.game.agent;

import java.util.List;

/**
 * One independent single-choice decision inside a concurrent gathering round.
 */
public record ChoiceRequest(String seat, Agent agent, DecisionContext context, List<String> options) {

    public ChoiceRequest {
        options = List.copyOf(options);
    }
}
