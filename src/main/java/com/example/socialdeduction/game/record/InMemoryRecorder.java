package com.example.socialdeduction.game.record;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class InMemoryRecorder implements Recorder {

    private final List<GameEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void record(GameEvent event) {
        events.add(event);
    }

    public List<GameEvent> getEvents() {
        return List.copyOf(events);
    }

    public List<GameEvent> ofType(EventType type) {
        return events.stream()
                .filter(event -> event.type() == type)
                .toList();
    }
}
