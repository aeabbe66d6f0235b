package com.example.socialdeduction.game.agent;

import java.util.List;

/**
 * Everything an agent is allowed to know when deciding: its own name and role,
 * its own private facts, and the public state. {@code subject} names the player
 * or item the question is about (the nominee being voted on, the play being
 * challenged), when there is one.
 */
public record DecisionContext(
        DecisionType type,
        String self,
        String role,
        List<String> privateFacts,
        PublicState publicState,
        String subject
) {
    public DecisionContext {
        privateFacts = List.copyOf(privateFacts);
    }

    public DecisionContext withType(DecisionType newType) {
        return new DecisionContext(newType, self, role, privateFacts, publicState, subject);
    }

    public DecisionContext withSubject(String newSubject) {
        return new DecisionContext(type, self, role, privateFacts, publicState, newSubject);
    }
}
