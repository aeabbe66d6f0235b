package com.example.socialdeduction.game.record;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes every event as one JSON line on the {@code game.record} logger, so the
 * logging configuration decides where game trails end up.
 */
@Component
@RequiredArgsConstructor
public class Slf4jRecorder implements Recorder {

    private static final Logger RECORD_LOG = LoggerFactory.getLogger("game.record");

    private final ObjectMapper objectMapper;

    @Override
    public void record(GameEvent event) {
        if (!RECORD_LOG.isInfoEnabled()) {
            return;
        }
        try {
            RECORD_LOG.info(objectMapper.writeValueAsString(event));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot serialize event " + event.sequence(), e);
        }
    }
}
