package com.example.socialdeduction.game.domain.knowledge;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only private fact log, one list per owner. Facts are never removed or
 * edited; misinformation is a new (false) fact.
 */
public class HiddenKnowledgeStore {

    private final Map<String, List<HiddenFact>> factsByOwner = new HashMap<>();

    public synchronized void append(HiddenFact fact) {
        factsByOwner.computeIfAbsent(fact.owner(), owner -> new ArrayList<>()).add(fact);
    }

    public synchronized List<HiddenFact> factsOf(String owner) {
        return List.copyOf(factsByOwner.getOrDefault(owner, List.of()));
    }

    /**
     * Fact texts for building the owner's decision context, oldest first.
     */
    public synchronized List<String> textsOf(String owner) {
        return factsByOwner.getOrDefault(owner, List.of()).stream()
                .map(HiddenFact::text)
                .toList();
    }

    public synchronized int size(String owner) {
        return factsByOwner.getOrDefault(owner, List.of()).size();
    }
}
