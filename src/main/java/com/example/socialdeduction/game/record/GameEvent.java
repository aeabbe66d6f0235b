package com.example.socialdeduction.game.record;

import com.example.socialdeduction.game.domain.GamePhase;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record GameEvent(
        String gameId,
        long sequence,
        int round,
        GamePhase phase,
        EventType type,
        String message,
        Map<String, Object> data
) {
    public GameEvent {
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public Object get(String key) {
        return data.get(key);
    }
}
