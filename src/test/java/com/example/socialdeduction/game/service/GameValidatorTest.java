package com.example.socialdeduction.game.service;

import com.example.socialdeduction.game.agent.Agent;
import com.example.socialdeduction.game.agent.RandomAgent;
import com.example.socialdeduction.game.dto.GameSetup;
import com.example.socialdeduction.game.variant.paranoia.ParanoiaVariant;
import com.example.socialdeduction.global.error.CommonException;
import com.example.socialdeduction.global.error.ErrorCode;
import com.example.socialdeduction.support.TestGames;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GameValidatorTest {

    private final TestGames games = new TestGames();
    private final GameValidator validator = new GameValidator();

    private void assertRejected(GameSetup setup, ErrorCode expected) {
        assertThatThrownBy(() -> validator.validateCreateGame(setup,
                games.getRegistry().getVariant(setup.variant())))
                .isInstanceOf(CommonException.class)
                .extracting(e -> ((CommonException) e).getErrorCode())
                .isEqualTo(expected);
    }

    @Test
    @DisplayName("too few players for the game")
    void playerCount() {
        List<String> names = TestGames.names(3);
        assertRejected(GameSetup.of("mafia", names, TestGames.randomAgents(names, List.of(), 1L)),
                ErrorCode.INVALID_PLAYER_COUNT);
    }

    @Test
    @DisplayName("duplicate or reserved names")
    void duplicateNames() {
        List<String> duplicated = List.of("P1", "P2", "P3", "P1");
        assertRejected(GameSetup.of("mafia", duplicated, TestGames.randomAgents(duplicated, List.of(), 1L)),
                ErrorCode.DUPLICATE_PLAYER_NAME);

        List<String> reserved = List.of("P1", "P2", "P3", ParanoiaVariant.COMPUTER_SEAT);
        assertRejected(GameSetup.of("paranoia", reserved, TestGames.randomAgents(reserved, List.of(), 1L)),
                ErrorCode.DUPLICATE_PLAYER_NAME);
    }

    @Test
    @DisplayName("every seat, extra seats included, needs an agent")
    void missingAgent() {
        List<String> names = TestGames.names(4);
        assertRejected(GameSetup.of("paranoia", names, TestGames.randomAgents(names, List.of(), 1L)),
                ErrorCode.MISSING_AGENT);

        Map<String, Agent> partial = Map.of("P1", new RandomAgent(1L));
        assertRejected(GameSetup.of("mafia", names, partial), ErrorCode.MISSING_AGENT);
    }

    @Test
    @DisplayName("unknown variant keys are rejected by the registry")
    void unknownVariant() {
        assertThatThrownBy(() -> games.getRegistry().getVariant("werewolf"))
                .isInstanceOf(CommonException.class)
                .extracting(e -> ((CommonException) e).getErrorCode())
                .isEqualTo(ErrorCode.UNKNOWN_VARIANT);
    }

    @Test
    @DisplayName("a complete setup passes")
    void validSetup() {
        List<String> names = TestGames.names(4);
        GameSetup setup = GameSetup.of("paranoia", names,
                TestGames.randomAgents(names, List.of(ParanoiaVariant.COMPUTER_SEAT), 1L));

        assertThatCode(() -> validator.validateCreateGame(setup, games.getRegistry().getVariant("paranoia")))
                .doesNotThrowAnyException();
    }
}
