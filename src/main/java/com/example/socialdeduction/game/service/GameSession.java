package com.example.socialdeduction.game.service;

import com.example.socialdeduction.game.agent.Agent;
import com.example.socialdeduction.game.agent.AgentGateway;
import com.example.socialdeduction.game.agent.DecisionContext;
import com.example.socialdeduction.game.agent.DecisionType;
import com.example.socialdeduction.game.agent.PublicState;
import com.example.socialdeduction.game.domain.GamePlayer;
import com.example.socialdeduction.game.domain.GameState;
import com.example.socialdeduction.game.domain.Players;
import com.example.socialdeduction.game.domain.Winner;
import com.example.socialdeduction.game.domain.knowledge.HiddenFact;
import com.example.socialdeduction.game.domain.knowledge.HiddenKnowledgeStore;
import com.example.socialdeduction.game.record.EventType;
import com.example.socialdeduction.game.record.GameRecorder;
import com.example.socialdeduction.game.variant.GameVariant;
import com.example.socialdeduction.global.config.GameProperties;
import com.example.socialdeduction.global.random.RandomSource;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Everything one running game owns. Only the coordinating thread touches it.
 */
@Slf4j
@Getter
public class GameSession {

    private final GameVariant variant;
    private final GameState state;
    private final Players players;
    private final HiddenKnowledgeStore knowledge;
    private final Map<String, Agent> agents;
    private final GameRecorder recorder;
    private final AgentGateway gateway;
    private final RandomSource random;
    private final GameProperties properties;

    private final Map<Class<?>, Object> boards = new HashMap<>();
    private final List<String> talkLog = new ArrayList<>();

    @Builder
    private GameSession(GameVariant variant, GameState state, Players players, HiddenKnowledgeStore knowledge,
                        Map<String, Agent> agents, GameRecorder recorder, AgentGateway gateway,
                        RandomSource random, GameProperties properties) {
        this.variant = Objects.requireNonNull(variant, "variant");
        this.state = Objects.requireNonNull(state, "state");
        this.players = Objects.requireNonNull(players, "players");
        this.knowledge = knowledge != null ? knowledge : new HiddenKnowledgeStore();
        this.agents = Map.copyOf(agents);
        this.recorder = Objects.requireNonNull(recorder, "recorder");
        this.gateway = Objects.requireNonNull(gateway, "gateway");
        this.random = Objects.requireNonNull(random, "random");
        this.properties = properties != null ? properties : GameProperties.defaults();
    }

    public String getGameId() {
        return state.getGameId();
    }

    public Agent agentOf(String seat) {
        Agent agent = agents.get(seat);
        if (agent == null) {
            throw new IllegalStateException("no agent for seat " + seat);
        }
        return agent;
    }

    public Agent agentOf(GamePlayer player) {
        return agentOf(player.getName());
    }

    // ==================== variant boards ====================

    public <T> void putBoard(Class<T> type, T board) {
        boards.put(type, board);
    }

    public <T> T getBoard(Class<T> type) {
        Object board = boards.get(type);
        if (board == null) {
            throw new IllegalStateException("no " + type.getSimpleName() + " on game " + getGameId());
        }
        return type.cast(board);
    }

    // ==================== decision contexts ====================

    public DecisionContext contextFor(GamePlayer player, DecisionType type) {
        return contextFor(player, type, null);
    }

    public DecisionContext contextFor(GamePlayer player, DecisionType type, String subject) {
        return contextForSeat(player.getName(), player.getRole().getDisplayName(), type, subject);
    }

    /**
     * Context for a seat that is not a player, such as an arbiter.
     */
    public DecisionContext contextForSeat(String seat, String role, DecisionType type, String subject) {
        return new DecisionContext(type, seat, role, knowledge.textsOf(seat), publicState(), subject);
    }

    public PublicState publicState() {
        return new PublicState(
                variant.getKey(),
                state.getRound(),
                state.getGamePhase(),
                players.aliveNames(),
                players.deadNames(),
                variant.describeBoard(this),
                recentTalk());
    }

    // ==================== shared mutations ====================

    /**
     * Appends a private fact for {@code owner} and records it.
     */
    public void tell(String owner, String text, boolean reliable) {
        HiddenFact fact = reliable
                ? HiddenFact.truth(owner, state.getRound(), state.getGamePhase(), text)
                : HiddenFact.fabricated(owner, state.getRound(), state.getGamePhase(), text);
        knowledge.append(fact);
        recorder.fact(fact);
    }

    /**
     * @return false when the player was already dead
     */
    public boolean eliminate(GamePlayer player, String cause) {
        if (!player.eliminate()) {
            return false;
        }
        log.debug("[game] eliminated: gameId={}, player={}, cause={}", getGameId(), player.getName(), cause);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("player", player.getName());
        data.put("role", player.getRole().name());
        data.put("cause", cause);
        recorder.record(EventType.ELIMINATION, player.getName() + " died (" + cause + ")", data);
        return true;
    }

    /**
     * Day execution: elimination plus the "executed today" marker.
     */
    public boolean execute(GamePlayer player) {
        if (!eliminate(player, "executed")) {
            return false;
        }
        state.recordExecution(player.getName());
        return true;
    }

    /**
     * Caches {@code candidate} unless a winner already exists and records the
     * first declaration only.
     *
     * @return the winner that stands
     */
    public Winner declareWinner(Winner candidate) {
        if (state.isTerminal()) {
            return state.getWinner().orElseThrow();
        }
        Winner winner = state.declareWinner(candidate);
        log.info("[game] winner declared: gameId={}, winner={}, reason={}, forced={}",
                getGameId(), winner.name(), winner.reason(), winner.forced());
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("winner", winner.name());
        data.put("reason", winner.reason());
        data.put("forced", winner.forced());
        recorder.record(EventType.WINNER_DECLARED, winner.name() + " win: " + winner.reason(), data);
        return winner;
    }

    // ==================== table talk ====================

    public void addTalk(String speaker, String line) {
        talkLog.add(speaker + ": " + line);
    }

    public List<String> recentTalk() {
        int window = properties.recentTalkWindow();
        int from = Math.max(0, talkLog.size() - window);
        return List.copyOf(talkLog.subList(from, talkLog.size()));
    }
}
