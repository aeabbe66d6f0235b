package com.example.socialdeduction.game.runner;

import com.example.socialdeduction.game.dto.GameSetup;
import com.example.socialdeduction.game.variant.paranoia.ParanoiaVariant;
import com.example.socialdeduction.support.TestGames;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class MultiGameRunnerTest {

    private final TestGames games = new TestGames();

    @Test
    @DisplayName("every game of the batch is tallied under its winner")
    void talliesWinners() {
        // given
        MultiGameRunner runner = new MultiGameRunner(games.getGameService(), games.getRegistry(),
                new RunnerProperties(true, "mafia", 3, 0, 42L));

        // when
        Map<String, Integer> tally = runner.runGames();

        // then
        assertThat(tally.values().stream().mapToInt(Integer::intValue).sum()).isEqualTo(3);
        assertThat(tally.keySet()).isSubsetOf("Town", "Mafia");
    }

    @Test
    @DisplayName("extra seats get an agent of their own")
    void extraSeats() {
        GameSetup setup = MultiGameRunner.setupFor(games.getRegistry().getVariant(ParanoiaVariant.KEY), 4, 1L);

        assertThat(setup.playerNames()).containsExactly("Player1", "Player2", "Player3", "Player4");
        assertThat(setup.agents()).containsKeys("Player1", ParanoiaVariant.COMPUTER_SEAT);
        assertThat(setup.agents()).hasSize(5);
    }
}
