package com.example.socialdeduction.game.domain.vote;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Plurality result of a proposal round. {@code tally} maps each proposed name to
 * its number of proposals, in the order the names were first proposed.
 */
public record Nomination(String nominator, String nominee, Map<String, Long> tally) {

    public Nomination {
        tally = Collections.unmodifiableMap(new LinkedHashMap<>(tally));
    }
}
