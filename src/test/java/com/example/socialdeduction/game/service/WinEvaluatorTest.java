package com.example.socialdeduction.game.service;

import com.example.socialdeduction.game.agent.Agent;
import com.example.socialdeduction.game.domain.Role;
import com.example.socialdeduction.game.domain.Team;
import com.example.socialdeduction.game.domain.Winner;
import com.example.socialdeduction.game.dto.GameSetup;
import com.example.socialdeduction.game.record.EventType;
import com.example.socialdeduction.game.variant.mafia.MafiaRole;
import com.example.socialdeduction.support.ScriptedAgent;
import com.example.socialdeduction.support.TestGames;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class WinEvaluatorTest {

    private static final List<Role> ROLES = List.of(MafiaRole.MAFIA, MafiaRole.DOCTOR, MafiaRole.DETECTIVE,
            MafiaRole.TOWNSPERSON, MafiaRole.TOWNSPERSON);

    private TestGames games;
    private GameSession session;

    @BeforeEach
    void setUp() {
        games = new TestGames();
        Map<String, Agent> agents = TestGames.agents(TestGames.names(5), name -> ScriptedAgent.create());
        session = games.getGameService().createGame(GameSetup.of("mafia", TestGames.names(5), agents)
                .withRoles(ROLES));
    }

    @Test
    @DisplayName("no condition met, no winner")
    void noWinnerYet() {
        assertThat(games.getWinEvaluator().evaluate(session)).isEmpty();
        assertThat(session.getState().isTerminal()).isFalse();
    }

    @Test
    @DisplayName("the first winner is cached and never replaced")
    void winnerIsIdempotent() {
        // given
        session.execute(session.getPlayers().findByName("P1"));
        Optional<Winner> first = games.getWinEvaluator().evaluate(session);

        // when: conditions change after the game is decided
        session.eliminate(session.getPlayers().findByName("P2"), "test");
        session.eliminate(session.getPlayers().findByName("P3"), "test");
        session.eliminate(session.getPlayers().findByName("P4"), "test");
        Optional<Winner> second = games.getWinEvaluator().evaluate(session);
        Winner forced = games.getWinEvaluator().forceFallback(session, "late");

        // then
        assertThat(first).map(Winner::team).contains(Team.TOWN);
        assertThat(second).isEqualTo(first);
        assertThat(forced).isEqualTo(first.orElseThrow());
        assertThat(games.getRecorder().ofType(EventType.WINNER_DECLARED)).hasSize(1);
    }

    @Test
    @DisplayName("mafia win on parity")
    void mafiaParity() {
        session.eliminate(session.getPlayers().findByName("P2"), "test");
        session.eliminate(session.getPlayers().findByName("P3"), "test");
        session.eliminate(session.getPlayers().findByName("P4"), "test");

        assertThat(games.getWinEvaluator().evaluate(session)).map(Winner::team).contains(Team.MAFIA);
    }

    @Test
    @DisplayName("the fallback is marked as forced and recorded as an incident")
    void forcedFallback() {
        Winner winner = games.getWinEvaluator().forceFallback(session, "round cap");

        assertThat(winner.forced()).isTrue();
        assertThat(winner.team()).isEqualTo(Team.TOWN);
        assertThat(games.getRecorder().ofType(EventType.INCIDENT)).hasSize(1);
    }
}
