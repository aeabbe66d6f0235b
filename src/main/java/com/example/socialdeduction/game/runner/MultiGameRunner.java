package com.example.socialdeduction.game.runner;

import com.example.socialdeduction.game.agent.Agent;
import com.example.socialdeduction.game.agent.RandomAgent;
import com.example.socialdeduction.game.domain.Winner;
import com.example.socialdeduction.game.dto.GameSetup;
import com.example.socialdeduction.game.service.GameService;
import com.example.socialdeduction.game.service.GameVariantRegistry;
import com.example.socialdeduction.game.variant.GameVariant;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Plays {@code game.runner.games} games of one variant back to back with random
 * agents and logs the tally. Enabled with {@code game.runner.enabled=true}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "game.runner", name = "enabled", havingValue = "true")
public class MultiGameRunner implements CommandLineRunner {

    private final GameService gameService;
    private final GameVariantRegistry variantRegistry;
    private final RunnerProperties properties;

    @Override
    public void run(String... args) {
        Map<String, Integer> tally = runGames();
        log.info("[runner] finished: variant={}, games={}, wins={}", properties.variant(), properties.games(), tally);
    }

    /**
     * @return winner name to number of wins, forced fallbacks included
     */
    public Map<String, Integer> runGames() {
        GameVariant variant = variantRegistry.getVariant(properties.variant());
        int playerCount = properties.players() > 0 ? properties.players() : variant.getRoleTable().getMinPlayers();
        Map<String, Integer> tally = new TreeMap<>();
        for (int game = 1; game <= properties.games(); game++) {
            log.info("[runner] starting game {}/{}: variant={}", game, properties.games(), variant.getKey());
            long seed = properties.seed() != null ? properties.seed() + game : System.nanoTime();
            GameSetup setup = setupFor(variant, playerCount, seed);
            if (properties.seed() != null) {
                setup = setup.withSeed(seed);
            }
            Winner winner = gameService.run(setup);
            tally.merge(winner.name(), 1, Integer::sum);
            log.info("[runner] game {}/{} ended: winner={}, forced={}", game, properties.games(), winner.name(),
                    winner.forced());
        }
        return tally;
    }

    static GameSetup setupFor(GameVariant variant, int playerCount, long seed) {
        List<String> names = new ArrayList<>(playerCount);
        for (int seat = 1; seat <= playerCount; seat++) {
            names.add("Player" + seat);
        }
        Map<String, Agent> agents = new LinkedHashMap<>();
        int index = 0;
        for (String name : names) {
            agents.put(name, new RandomAgent(seed * 31 + index++));
        }
        for (String seat : variant.getExtraSeats()) {
            agents.put(seat, new RandomAgent(seed * 31 + index++));
        }
        return GameSetup.of(variant.getKey(), names, agents);
    }
}
