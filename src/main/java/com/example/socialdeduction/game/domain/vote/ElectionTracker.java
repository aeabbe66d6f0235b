package com.example.socialdeduction.game.domain.vote;

import lombok.Getter;

/**
 * Failure counter. Each failure adds exactly one; an enactment resets it. Hitting
 * the threshold reports {@code true} once and starts over from zero.
 */
@Getter
public class ElectionTracker {

    public static final int DEFAULT_THRESHOLD = 3;

    private final int threshold;
    private int count;

    public ElectionTracker(int threshold) {
        if (threshold < 1) {
            throw new IllegalArgumentException("threshold must be positive");
        }
        this.threshold = threshold;
    }

    /**
     * @return true when this failure reached the threshold and a forced
     * resolution must run now
     */
    public boolean recordFailure() {
        count++;
        if (count >= threshold) {
            count = 0;
            return true;
        }
        return false;
    }

    public void resetOnEnactment() {
        count = 0;
    }
}
