package com.example.socialdeduction.game.agent;

import com.example.socialdeduction.game.domain.Ballot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Uniformly random seat. Used by the batch runner and as a stand-in for model
 * backed agents in tests.
 */
public class RandomAgent implements Agent {

    private final Random random;
    private final double confirmProbability;

    public RandomAgent(long seed) {
        this(seed, 0.3);
    }

    public RandomAgent(long seed, double confirmProbability) {
        this.random = new Random(seed);
        this.confirmProbability = confirmProbability;
    }

    @Override
    public synchronized String choose(DecisionContext context, List<String> options) {
        return options.get(random.nextInt(options.size()));
    }

    @Override
    public synchronized List<String> chooseMany(DecisionContext context, List<String> options,
                                                int minCount, int maxCount) {
        int count = minCount + random.nextInt(maxCount - minCount + 1);
        List<String> copy = new ArrayList<>(options);
        Collections.shuffle(copy, random);
        return List.copyOf(copy.subList(0, Math.min(count, copy.size())));
    }

    @Override
    public synchronized Ballot vote(DecisionContext context) {
        return random.nextBoolean() ? Ballot.YES : Ballot.NO;
    }

    @Override
    public synchronized boolean confirm(DecisionContext context) {
        return random.nextDouble() < confirmProbability;
    }

    @Override
    public String talk(DecisionContext context) {
        return "I am watching everyone closely.";
    }
}
