package com.example.socialdeduction.game.service;

import com.example.socialdeduction.game.agent.Agent;
import com.example.socialdeduction.game.agent.DecisionContext;
import com.example.socialdeduction.game.agent.DecisionType;
import com.example.socialdeduction.game.domain.GamePlayer;
import com.example.socialdeduction.game.record.EventType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Public discussion. The first pass is spoken all at once; later passes go around
 * the table so each speaker sees the recent lines before talking.
 */
@Service
@Slf4j
public class TableTalkService {

    public void discuss(GameSession session, List<GamePlayer> speakers) {
        int passes = session.getProperties().tableTalkPasses();
        if (passes == 0 || speakers.isEmpty()) {
            return;
        }

        Map<String, Agent> agents = new LinkedHashMap<>();
        Map<String, DecisionContext> contexts = new LinkedHashMap<>();
        for (GamePlayer speaker : speakers) {
            agents.put(speaker.getName(), session.agentOf(speaker));
            contexts.put(speaker.getName(), session.contextFor(speaker, DecisionType.TABLE_TALK));
        }
        session.getGateway().talkAll(agents, contexts).forEach((speaker, line) -> say(session, speaker, line));

        for (int pass = 1; pass < passes; pass++) {
            for (GamePlayer speaker : speakers) {
                if (!speaker.isAlive()) {
                    continue;
                }
                String line = session.getGateway().talk(session.agentOf(speaker),
                        session.contextFor(speaker, DecisionType.TABLE_TALK));
                say(session, speaker.getName(), line);
            }
        }
    }

    private void say(GameSession session, String speaker, String line) {
        if (line.isEmpty()) {
            return;
        }
        session.addTalk(speaker, line);
        session.getRecorder().record(EventType.TABLE_TALK, speaker + ": " + line,
                Map.of("speaker", speaker, "line", line));
    }
}
