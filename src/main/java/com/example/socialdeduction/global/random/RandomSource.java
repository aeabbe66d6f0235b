package com.example.socialdeduction.global.random;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Every random choice the engine makes (shuffles, tie-breaks, fallback decisions)
 * goes through this port so a seeded source replays a game exactly.
 */
public interface RandomSource {

    /**
     * @return a value in {@code [0, bound)}
     */
    int nextInt(int bound);

    default <T> void shuffle(List<T> list) {
        for (int i = list.size() - 1; i > 0; i--) {
            Collections.swap(list, i, nextInt(i + 1));
        }
    }

    default <T> T pick(List<T> options) {
        if (options.isEmpty()) {
            throw new IllegalArgumentException("cannot pick from an empty list");
        }
        return options.get(nextInt(options.size()));
    }

    default <T> List<T> sample(List<T> options, int count) {
        List<T> copy = new ArrayList<>(options);
        shuffle(copy);
        return List.copyOf(copy.subList(0, Math.min(count, copy.size())));
    }

    static RandomSource threadLocal() {
        return bound -> ThreadLocalRandom.current().nextInt(bound);
    }

    static RandomSource seeded(long seed) {
        Random random = new Random(seed);
        return random::nextInt;
    }
}
