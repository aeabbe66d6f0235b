package com.example.socialdeduction.support;

import com.example.socialdeduction.game.agent.Agent;
import com.example.socialdeduction.game.agent.RandomAgent;
import com.example.socialdeduction.game.record.InMemoryRecorder;
import com.example.socialdeduction.game.service.GameService;
import com.example.socialdeduction.game.service.GameValidator;
import com.example.socialdeduction.game.service.GameVariantRegistry;
import com.example.socialdeduction.game.service.NightActionService;
import com.example.socialdeduction.game.service.PhaseResultProcessor;
import com.example.socialdeduction.game.service.RoleAssigner;
import com.example.socialdeduction.game.service.TableTalkService;
import com.example.socialdeduction.game.service.VoteService;
import com.example.socialdeduction.game.service.WinEvaluator;
import com.example.socialdeduction.game.state.GamePhaseFactory;
import com.example.socialdeduction.game.variant.botc.BotcVariant;
import com.example.socialdeduction.game.variant.liar.LiarVariant;
import com.example.socialdeduction.game.variant.mafia.MafiaVariant;
import com.example.socialdeduction.game.variant.paranoia.ParanoiaVariant;
import com.example.socialdeduction.game.variant.secrethitler.SecretHitlerVariant;
import com.example.socialdeduction.global.config.GameProperties;
import com.example.socialdeduction.global.random.RandomSource;
import lombok.Getter;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Function;

/**
 * Wires the engine by hand, without a Spring context, around an in-memory recorder.
 */
@Getter
public class TestGames {

    private static final ExecutorService EXECUTOR = Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, "test-agent");
        thread.setDaemon(true);
        return thread;
    });

    private final GameProperties properties;
    private final InMemoryRecorder recorder = new InMemoryRecorder();
    private final VoteService voteService = new VoteService();
    private final TableTalkService tableTalkService = new TableTalkService();
    private final WinEvaluator winEvaluator = new WinEvaluator();
    private final NightActionService nightActionService = new NightActionService();
    private final GameVariantRegistry registry;
    private final GameService gameService;

    public TestGames() {
        this(properties(30, Duration.ofSeconds(10)), Clock.systemUTC());
    }

    public TestGames(GameProperties properties, Clock clock) {
        this.properties = properties;
        this.registry = new GameVariantRegistry(List.of(
                new MafiaVariant(voteService, tableTalkService),
                new BotcVariant(voteService, tableTalkService, winEvaluator),
                new SecretHitlerVariant(voteService, tableTalkService, winEvaluator),
                new ParanoiaVariant(voteService, tableTalkService, winEvaluator),
                new LiarVariant(tableTalkService)));
        registry.init();
        this.gameService = new GameService(registry, new GameValidator(), new RoleAssigner(),
                new PhaseResultProcessor(nightActionService, winEvaluator), winEvaluator, new GamePhaseFactory(),
                properties, EXECUTOR, RandomSource.seeded(7L), clock, recorder);
    }

    public static GameProperties properties(int maxRounds, Duration decisionTimeout) {
        return new GameProperties(maxRounds, Duration.ofHours(1), decisionTimeout, 4, 1, 8);
    }

    public static ExecutorService executor() {
        return EXECUTOR;
    }

    public static List<String> names(int count) {
        List<String> names = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            names.add("P" + i);
        }
        return names;
    }

    public static Map<String, Agent> agents(List<String> seats, Function<String, Agent> agentFor) {
        Map<String, Agent> agents = new LinkedHashMap<>();
        seats.forEach(seat -> agents.put(seat, agentFor.apply(seat)));
        return agents;
    }

    /**
     * Seeded random agents for the players and every extra seat.
     */
    public static Map<String, Agent> randomAgents(List<String> players, List<String> extraSeats, long seed) {
        List<String> seats = new ArrayList<>(players);
        seats.addAll(extraSeats);
        Map<String, Agent> agents = new LinkedHashMap<>();
        for (int i = 0; i < seats.size(); i++) {
            agents.put(seats.get(i), new RandomAgent(seed * 31 + i));
        }
        return agents;
    }
}
