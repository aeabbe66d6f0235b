package com.example.socialdeduction.game.service;

import com.example.socialdeduction.game.agent.Agent;
import com.example.socialdeduction.game.agent.DecisionType;
import com.example.socialdeduction.game.domain.GamePhase;
import com.example.socialdeduction.game.domain.Role;
import com.example.socialdeduction.game.domain.knowledge.HiddenFact;
import com.example.socialdeduction.game.dto.GameSetup;
import com.example.socialdeduction.game.record.EventType;
import com.example.socialdeduction.game.record.GameEvent;
import com.example.socialdeduction.game.variant.botc.BotcRole;
import com.example.socialdeduction.support.ScriptedAgent;
import com.example.socialdeduction.support.TestGames;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Eight-seat Clocktower table: P1 Imp, P2 Poisoner, P3 Monk, P4 Empath, P5 Butler,
 * P6 Mayor, P7 Soldier, P8 Slayer.
 */
class NightActionServiceTest {

    private static final List<Role> ROLES = List.of(BotcRole.IMP, BotcRole.POISONER, BotcRole.MONK,
            BotcRole.EMPATH, BotcRole.BUTLER, BotcRole.MAYOR, BotcRole.SOLDIER, BotcRole.SLAYER);

    private TestGames games;
    private Map<String, ScriptedAgent> agents;

    @BeforeEach
    void setUp() {
        games = new TestGames();
        agents = new LinkedHashMap<>();
        TestGames.names(8).forEach(name -> agents.put(name, ScriptedAgent.create()));
    }

    private GameSession nightTwo() {
        GameSession session = games.getGameService().createGame(
                GameSetup.of("botc", TestGames.names(8), Map.<String, Agent>copyOf(agents))
                        .withRoles(ROLES)
                        .withSeed(42L));
        session.getState().startRound();
        session.getState().enterPhase(GamePhase.NIGHT);
        session.getState().enterPhase(GamePhase.DAY);
        session.getState().startRound();
        session.getState().enterPhase(GamePhase.NIGHT);
        return session;
    }

    @Test
    @DisplayName("poisoned Monk protects nobody, so the Imp's kill lands")
    void poisonBeatsProtection() {
        // given
        agents.get("P2").choosing(DecisionType.POISON, "P3");
        agents.get("P3").choosing(DecisionType.PROTECT, "P4");
        agents.get("P1").choosing(DecisionType.KILL, "P4");
        GameSession session = nightTwo();

        // when
        NightReport report = games.getNightActionService().resolveNight(session);

        // then
        assertThat(report.deaths()).containsExactly("P4");
        assertThat(session.getPlayers().findByName("P4").isAlive()).isFalse();
    }

    @Test
    @DisplayName("a protected target survives but the attempt is on record")
    void protectionSavesTarget() {
        // given
        agents.get("P2").choosing(DecisionType.POISON, "P6");
        agents.get("P3").choosing(DecisionType.PROTECT, "P4");
        agents.get("P1").choosing(DecisionType.KILL, "P4");
        GameSession session = nightTwo();

        // when
        NightReport report = games.getNightActionService().resolveNight(session);

        // then
        assertThat(report.deaths()).isEmpty();
        assertThat(report.attemptedKills()).containsExactly("P4");
        assertThat(session.getPlayers().findByName("P4").isAlive()).isTrue();
    }

    @Test
    @DisplayName("powers resolve in priority order whatever the seat order")
    void priorityOrder() {
        // given
        agents.get("P2").choosing(DecisionType.POISON, "P5");
        agents.get("P3").choosing(DecisionType.PROTECT, "P6");
        agents.get("P1").choosing(DecisionType.KILL, "P6");
        GameSession session = nightTwo();

        // when
        games.getNightActionService().resolveNight(session);

        // then
        List<String> priorities = games.getRecorder().ofType(EventType.ACTION_TAKEN).stream()
                .map(event -> (String) event.get("priority"))
                .toList();
        assertThat(priorities).containsExactly("DISRUPTION", "PROTECTION", "PROTECTION", "ELIMINATION",
                "SENSE", "DESIGNATION");
    }

    @Test
    @DisplayName("the Soldier cannot be killed by the demon")
    void soldierSurvives() {
        agents.get("P1").choosing(DecisionType.KILL, "P7");
        agents.get("P2").choosing(DecisionType.POISON, "P6");
        GameSession session = nightTwo();

        NightReport report = games.getNightActionService().resolveNight(session);

        assertThat(report.deaths()).isEmpty();
        assertThat(session.getPlayers().findByName("P7").isAlive()).isTrue();
    }

    @Test
    @DisplayName("a poisoned Empath receives a fabricated reading")
    void poisonedEmpathIsMisinformed() {
        // given
        agents.get("P2").choosing(DecisionType.POISON, "P4");
        agents.get("P1").choosing(DecisionType.KILL, "P6");
        GameSession session = nightTwo();

        // when
        games.getNightActionService().resolveNight(session);

        // then
        List<HiddenFact> facts = session.getKnowledge().factsOf("P4");
        HiddenFact reading = facts.get(facts.size() - 1);
        assertThat(reading.reliable()).isFalse();
        assertThat(reading.text()).doesNotStartWith("Night 2: 0 ");
    }

    @Test
    @DisplayName("a poisoned Butler serves no master")
    void poisonedButlerIsFree() {
        agents.get("P2").choosing(DecisionType.POISON, "P5");
        agents.get("P5").choosing(DecisionType.CHOOSE_MASTER, "P1");
        GameSession session = nightTwo();

        games.getNightActionService().resolveNight(session);

        assertThat(session.getPlayers().findByName("P5").getMaster()).isNull();
        List<GameEvent> designations = games.getRecorder().ofType(EventType.ACTION_TAKEN).stream()
                .filter(event -> "DESIGNATION".equals(event.get("priority")))
                .toList();
        assertThat(designations).hasSize(1);
        assertThat(designations.get(0).get("success")).isEqualTo(false);
    }
}
