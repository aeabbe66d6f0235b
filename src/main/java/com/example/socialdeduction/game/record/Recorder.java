package com.example.socialdeduction.game.record;

/**
 * Ordered, append-only event sink. The engine calls it synchronously after each
 * mutation; an exception from {@link #record} is logged and the game goes on.
 */
@FunctionalInterface
public interface Recorder {

    void record(GameEvent event);

    static Recorder noop() {
        return event -> {
        };
    }
}
