package com.example.socialdeduction.game.variant.liar;

import com.example.socialdeduction.game.agent.Agent;
import com.example.socialdeduction.game.agent.DecisionType;
import com.example.socialdeduction.game.domain.GamePhase;
import com.example.socialdeduction.game.domain.Team;
import com.example.socialdeduction.game.domain.Winner;
import com.example.socialdeduction.game.dto.GameSetup;
import com.example.socialdeduction.game.record.EventType;
import com.example.socialdeduction.game.record.GameEvent;
import com.example.socialdeduction.game.service.GameSession;
import com.example.socialdeduction.global.random.RandomSource;
import com.example.socialdeduction.support.ScriptedAgent;
import com.example.socialdeduction.support.TestGames;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LiarVariantTest {

    @Nested
    @DisplayName("revolver")
    class RevolverTests {

        @Test
        @DisplayName("fires exactly on the loaded chamber")
        void firesOnBulletChamber() {
            Revolver revolver = new Revolver(2);

            assertThat(revolver.pullTrigger()).isFalse();
            assertThat(revolver.pullTrigger()).isFalse();
            assertThat(revolver.pullTrigger()).isTrue();
            assertThat(revolver.getPulls()).isEqualTo(3);
        }

        @Test
        @DisplayName("rejects a bullet outside the cylinder")
        void rejectsBadChamber() {
            assertThatThrownBy(() -> new Revolver(Revolver.CHAMBERS))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("cards")
    class Cards {

        @Test
        @DisplayName("a full deck holds six of each rank and two jokers")
        void fullDeck() {
            List<Card> deck = Card.fullDeck();

            assertThat(deck).hasSize(20);
            assertThat(deck).filteredOn(card -> card == Card.JOKER).hasSize(2);
            assertThat(deck).filteredOn(card -> card == Card.KING).hasSize(6);
        }

        @Test
        @DisplayName("jokers match every target, other cards only their own rank")
        void matching() {
            assertThat(Card.JOKER.matches(Card.ACE)).isTrue();
            assertThat(Card.ACE.matches(Card.ACE)).isTrue();
            assertThat(Card.QUEEN.matches(Card.ACE)).isFalse();
        }

        @Test
        @DisplayName("playing cards removes them from the hand and discards them")
        void play() {
            // given
            LiarBoard board = new LiarBoard();
            board.deal(List.of("P1", "P2"), 5, RandomSource.seeded(3L));
            List<Card> hand = List.copyOf(board.handOf("P1"));

            // when
            List<Card> played = board.play("P1", List.of(0, 3));

            // then
            assertThat(played).containsExactly(hand.get(0), hand.get(3));
            assertThat(board.handOf("P1")).containsExactly(hand.get(1), hand.get(2), hand.get(4));
            assertThat(board.getDeck().discardSize()).isEqualTo(2);
            assertThat(board.getDeck().drawSize()).isEqualTo(10);
            assertThat(board.holdersOfCards()).isEqualTo(2);
            assertThat(Card.TARGET_RANKS).contains(board.getTargetRank());
        }
    }

    @Nested
    @DisplayName("a hand at the table")
    class Hand {

        private final TestGames games = new TestGames();

        private GameSession dayOne(Map<String, Agent> agents) {
            GameSession session = games.getGameService().createGame(
                    GameSetup.of(LiarVariant.KEY, TestGames.names(2), agents).withSeed(17L));
            session.getState().startRound();
            session.getState().enterPhase(GamePhase.DAY);
            return session;
        }

        @Test
        @DisplayName("a challenge ends the hand with one trigger pull by whoever was wrong")
        void challengeSettles() {
            // given
            Map<String, Agent> agents = new LinkedHashMap<>();
            agents.put("P1", ScriptedAgent.create());
            agents.put("P2", ScriptedAgent.create().confirming(DecisionType.CHALLENGE, true));
            GameSession session = dayOne(agents);
            LiarVariant variant = (LiarVariant) games.getRegistry().getVariant(LiarVariant.KEY);

            // when
            variant.runDay(session);

            // then
            List<GameEvent> challenges = games.getRecorder().ofType(EventType.ACTION_TAKEN).stream()
                    .filter(event -> event.data().containsKey("loser"))
                    .toList();
            assertThat(challenges).hasSize(1);
            GameEvent challenge = challenges.get(0);
            LiarBoard board = session.getBoard(LiarBoard.class);
            String loser = (String) challenge.get("loser");
            String winner = loser.equals("P1") ? "P2" : "P1";
            assertThat(challenge.get("target")).isEqualTo("P1");
            assertThat(challenge.get("forced")).isEqualTo(false);
            assertThat(loser).isEqualTo(Boolean.TRUE.equals(challenge.get("lied")) ? "P1" : "P2");
            assertThat(board.revolverOf(loser).getPulls()).isEqualTo(1);
            assertThat(board.revolverOf(winner).getPulls()).isZero();
            assertThat(board.handOf("P1")).hasSize(LiarVariant.HAND_SIZE - 1);
            assertThat(board.getStarter()).isEqualTo(session.getPlayers().findByName(loser).isAlive()
                    ? loser : winner);
        }

        @Test
        @DisplayName("a full game ends with a single gambler standing")
        void fullGame() {
            // given
            List<String> names = TestGames.names(3);
            GameSetup setup = GameSetup.of(LiarVariant.KEY, names, TestGames.randomAgents(names, List.of(), 11L))
                    .withSeed(11L);

            // when
            Winner winner = games.getGameService().run(setup);

            // then
            assertThat(winner.team()).isEqualTo(Team.SOLO);
            assertThat(names).contains(winner.name());
        }
    }
}
