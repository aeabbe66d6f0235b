package com.example.socialdeduction.game.service;

import com.example.socialdeduction.game.agent.AgentGateway;
import com.example.socialdeduction.game.domain.GamePhase;
import com.example.socialdeduction.game.domain.GamePlayer;
import com.example.socialdeduction.game.domain.GameState;
import com.example.socialdeduction.game.domain.GameStatus;
import com.example.socialdeduction.game.domain.Players;
import com.example.socialdeduction.game.domain.Winner;
import com.example.socialdeduction.game.dto.GameSetup;
import com.example.socialdeduction.game.record.EventType;
import com.example.socialdeduction.game.record.GameRecorder;
import com.example.socialdeduction.game.record.Recorder;
import com.example.socialdeduction.game.state.GamePhaseFactory;
import com.example.socialdeduction.game.state.GamePhaseState;
import com.example.socialdeduction.game.variant.GameVariant;
import com.example.socialdeduction.global.config.GameProperties;
import com.example.socialdeduction.global.random.RandomSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;

@Service
@RequiredArgsConstructor
@Slf4j
public class GameService {

    private final GameVariantRegistry variantRegistry;
    private final GameValidator gameValidator;
    private final RoleAssigner roleAssigner;
    private final PhaseResultProcessor phaseResultProcessor;
    private final WinEvaluator winEvaluator;
    private final GamePhaseFactory gamePhaseFactory;
    private final GameProperties properties;
    private final ExecutorService agentDecisionExecutor;
    private final RandomSource randomSource;
    private final Clock clock;
    private final Recorder defaultRecorder;

    // --- Game setup ---

    /**
     * Validates the setup, seats and deals the players, and runs the variant's
     * night-zero setup. Throws {@code CommonException} on a bad setup.
     */
    public GameSession createGame(GameSetup setup) {
        GameVariant variant = variantRegistry.getVariant(setup.variant());
        gameValidator.validateCreateGame(setup, variant);

        RandomSource random = setup.seed() != null ? RandomSource.seeded(setup.seed()) : randomSource;
        List<GamePlayer> seated = roleAssigner.assignRoles(variant.getRoleTable(), setup.playerNames(),
                setup.roles(), random);
        String gameId = "game_" + clock.millis() + "_" + random.nextInt(1000);

        GameState gameState = GameState.builder()
                .gameId(gameId)
                .variant(variant.getKey())
                .startedAt(Instant.now(clock))
                .build();
        GameRecorder recorder = new GameRecorder(
                setup.recorder() != null ? setup.recorder() : defaultRecorder, gameState);
        AgentGateway gateway = new AgentGateway(agentDecisionExecutor, properties.decisionTimeout(), random,
                recorder);

        GameSession session = GameSession.builder()
                .variant(variant)
                .state(gameState)
                .players(new Players(seated))
                .agents(setup.agents())
                .recorder(recorder)
                .gateway(gateway)
                .random(random)
                .properties(properties)
                .build();

        Map<String, Object> roster = new LinkedHashMap<>();
        seated.forEach(player -> roster.put(player.getName(), player.getRole().name()));
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("variant", variant.getKey());
        data.put("roles", roster);
        data.put("seed", setup.seed());
        recorder.record(EventType.GAME_STARTED, variant.getKey() + " with " + seated.size() + " players", data);

        variant.setup(session);
        log.info("[game] created: gameId={}, variant={}, players={}", gameId, variant.getKey(), seated.size());
        return session;
    }

    // --- Game loop ---

    /**
     * Runs the phase loop until a winner is cached. The round cap and the time
     * budget end the game with the variant's fallback winner.
     */
    public Winner play(GameSession session) {
        GameState state = session.getState();
        GamePhase firstPhase = session.getVariant().getPhaseCycle().firstPhase();
        Instant deadline = state.getStartedAt().plus(properties.maxGameDuration());
        state.setStatus(GameStatus.IN_PROGRESS);

        GamePhaseState current = gamePhaseFactory.getState(firstPhase);
        while (!state.isTerminal()) {
            if (current.getGamePhase() == firstPhase) {
                if (state.getRound() >= properties.maxRounds()) {
                    winEvaluator.forceFallback(session, "round cap of " + properties.maxRounds() + " reached");
                    break;
                }
                state.startRound();
            }
            if (Instant.now(clock).isAfter(deadline)) {
                winEvaluator.forceFallback(session, "time budget of " + properties.maxGameDuration() + " spent");
                break;
            }
            current.process(session);
            current.onExit(session, phaseResultProcessor);
            current = current.nextState(session);
        }
        gamePhaseFactory.getState(GamePhase.TERMINAL).process(session);

        Winner winner = state.getWinner().orElseThrow();
        log.info("[game] finished: gameId={}, winner={}, rounds={}, forced={}",
                session.getGameId(), winner.name(), state.getRound(), winner.forced());
        return winner;
    }

    public Winner run(GameSetup setup) {
        return play(createGame(setup));
    }
}
