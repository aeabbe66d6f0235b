package com.example.socialdeduction.game.agent;

import com.example.socialdeduction.game.domain.Ballot;

/**
 * One independent ballot inside a concurrent voting round.
 */
public record BallotRequest(String seat, Agent agent, DecisionContext context, Ballot fallback) {
}
