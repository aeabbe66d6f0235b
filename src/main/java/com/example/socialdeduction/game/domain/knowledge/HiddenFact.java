package com.example.socialdeduction.game.domain.knowledge;

import com.example.socialdeduction.game.domain.GamePhase;

import java.util.Objects;

/**
 * A private fact owned by one player. {@code reliable} is engine bookkeeping for
 * poisoned or fabricated information; agents only ever see {@code text}.
 */
public record HiddenFact(String owner, int round, GamePhase phase, String text, boolean reliable) {

    public HiddenFact {
        Objects.requireNonNull(owner, "owner");
        Objects.requireNonNull(text, "text");
    }

    public static HiddenFact truth(String owner, int round, GamePhase phase, String text) {
        return new HiddenFact(owner, round, phase, text, true);
    }

    public static HiddenFact fabricated(String owner, int round, GamePhase phase, String text) {
        return new HiddenFact(owner, round, phase, text, false);
    }
}
