package com.example.socialdeduction.game.variant.secrethitler;

import com.example.socialdeduction.game.agent.Agent;
import com.example.socialdeduction.game.agent.DecisionType;
import com.example.socialdeduction.game.domain.Ballot;
import com.example.socialdeduction.game.domain.GamePhase;
import com.example.socialdeduction.game.domain.Role;
import com.example.socialdeduction.game.domain.Team;
import com.example.socialdeduction.game.domain.Winner;
import com.example.socialdeduction.game.dto.GameSetup;
import com.example.socialdeduction.game.record.EventType;
import com.example.socialdeduction.game.record.GameEvent;
import com.example.socialdeduction.game.service.GameSession;
import com.example.socialdeduction.support.ScriptedAgent;
import com.example.socialdeduction.support.TestGames;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SecretHitlerVariantTest {

    private static final List<Role> FIVE = List.of(ShRole.LIBERAL, ShRole.LIBERAL, ShRole.LIBERAL,
            ShRole.FASCIST, ShRole.HITLER);

    private TestGames games;
    private Map<String, ScriptedAgent> agents;

    @BeforeEach
    void setUp() {
        games = new TestGames();
        agents = new LinkedHashMap<>();
        TestGames.names(5).forEach(name -> agents.put(name, ScriptedAgent.create()));
    }

    private GameSession session() {
        return games.getGameService().createGame(
                GameSetup.of(SecretHitlerVariant.KEY, TestGames.names(5), Map.<String, Agent>copyOf(agents))
                        .withRoles(FIVE)
                        .withSeed(8L));
    }

    private SecretHitlerVariant variant() {
        return (SecretHitlerVariant) games.getRegistry().getVariant(SecretHitlerVariant.KEY);
    }

    private static void startDay(GameSession session) {
        session.getState().startRound();
        session.getState().enterPhase(GamePhase.DAY);
    }

    @Test
    @DisplayName("fascists know Hitler; in a small game Hitler knows the fascist")
    void nightZeroKnowledge() {
        GameSession session = session();

        assertThat(session.getKnowledge().textsOf("P4")).anyMatch(text -> text.contains("Hitler is P5"));
        assertThat(session.getKnowledge().textsOf("P5")).anyMatch(text -> text.contains("P4"));
        assertThat(session.getKnowledge().textsOf("P1")).isEmpty();
    }

    @Test
    @DisplayName("Hitler elected Chancellor after three fascist policies wins on the spot")
    void hitlerElectedWins() {
        // given
        agents.get("P1").choosing(DecisionType.NOMINATE_CHANCELLOR, "P5");
        agents.values().forEach(agent -> agent.voting(Ballot.YES));
        GameSession session = session();
        for (int i = 0; i < 3; i++) {
            session.getState().enactFascist();
        }
        startDay(session);

        // when
        variant().runDay(session);

        // then
        assertThat(session.getState().getWinner()).map(Winner::team).contains(Team.FASCIST);
        assertThat(games.getRecorder().ofType(EventType.GOVERNMENT_FORMED)).isEmpty();
        assertThat(games.getRecorder().ofType(EventType.VOTE_CAST))
                .extracting(event -> event.get("ballot"))
                .containsOnly("JA");
    }

    @Test
    @DisplayName("an elected government enacts one policy and keeps the deck whole")
    void electedGovernmentLegislates() {
        // given
        agents.get("P1").choosing(DecisionType.NOMINATE_CHANCELLOR, "P2");
        agents.values().forEach(agent -> agent.voting(Ballot.YES));
        GameSession session = session();
        startDay(session);

        // when
        variant().runDay(session);

        // then
        SecretHitlerBoard board = session.getBoard(SecretHitlerBoard.class);
        int enacted = session.getState().getLiberalPolicies() + session.getState().getFascistPolicies();
        assertThat(enacted).isEqualTo(1);
        assertThat(board.getDeck().drawSize() + board.getDeck().discardSize() + enacted).isEqualTo(17);
        assertThat(board.getLastElectedPresident()).isEqualTo("P1");
        assertThat(board.getLastElectedChancellor()).isEqualTo("P2");
        assertThat(session.getKnowledge().textsOf("P1")).anyMatch(text -> text.startsWith("You drew"));
    }

    @Test
    @DisplayName("three failed elections top-deck a policy, reset the tracker and lift term limits")
    void trackerTopDecks() {
        // given
        GameSession session = session();
        SecretHitlerBoard board = session.getBoard(SecretHitlerBoard.class);

        // when
        for (int day = 0; day < 3; day++) {
            startDay(session);
            variant().runDay(session);
            if (day < 2) {
                assertThat(session.getState().getElectionTracker().getCount()).isEqualTo(day + 1);
            }
        }

        // then
        assertThat(games.getRecorder().ofType(EventType.GOVERNMENT_FAILED)).hasSize(3);
        List<GameEvent> enacted = games.getRecorder().ofType(EventType.POLICY_ENACTED);
        assertThat(enacted).hasSize(1);
        assertThat(enacted.get(0).get("topDeck")).isEqualTo(true);
        assertThat(session.getState().getElectionTracker().getCount()).isZero();
        assertThat(board.getLastElectedChancellor()).isNull();
        assertThat(board.getDeck().drawSize()).isEqualTo(16);
    }

    @Test
    @DisplayName("presidents rotate through living seats")
    void presidentRotation() {
        GameSession session = session();
        SecretHitlerBoard board = session.getBoard(SecretHitlerBoard.class);
        session.eliminate(session.getPlayers().findByName("P2"), "test");

        assertThat(board.nextPresident(session.getPlayers()).getName()).isEqualTo("P1");
        assertThat(board.nextPresident(session.getPlayers()).getName()).isEqualTo("P3");

        board.setSpecialPresident("P5");
        assertThat(board.nextPresident(session.getPlayers()).getName()).isEqualTo("P5");
        assertThat(board.nextPresident(session.getPlayers()).getName()).isEqualTo("P4");
    }

    @Test
    @DisplayName("term limits bar the last chancellor, and the last president while six or fewer live")
    void termLimits() {
        GameSession session = session();
        SecretHitlerBoard board = session.getBoard(SecretHitlerBoard.class);
        board.markElected("P1", "P2");

        List<String> eligible = variant().eligibleChancellors(board, session.getPlayers(),
                session.getPlayers().findByName("P3"));

        assertThat(eligible).containsExactly("P4", "P5");
    }

    @Test
    @DisplayName("executive powers follow the board size")
    void executivePowers() {
        assertThat(ExecutivePower.forFascistPolicy(5, 3)).isEqualTo(ExecutivePower.POLICY_PEEK);
        assertThat(ExecutivePower.forFascistPolicy(5, 4)).isEqualTo(ExecutivePower.EXECUTION);
        assertThat(ExecutivePower.forFascistPolicy(7, 2)).isEqualTo(ExecutivePower.INVESTIGATE_LOYALTY);
        assertThat(ExecutivePower.forFascistPolicy(7, 3)).isEqualTo(ExecutivePower.SPECIAL_ELECTION);
        assertThat(ExecutivePower.forFascistPolicy(9, 1)).isEqualTo(ExecutivePower.INVESTIGATE_LOYALTY);
        assertThat(ExecutivePower.forFascistPolicy(6, 1)).isEqualTo(ExecutivePower.NONE);
    }
}
