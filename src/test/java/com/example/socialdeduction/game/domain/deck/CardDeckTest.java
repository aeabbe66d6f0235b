package com.example.socialdeduction.game.domain.deck;

import com.example.socialdeduction.global.random.RandomSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CardDeckTest {

    private static List<String> policies() {
        List<String> cards = new ArrayList<>(Collections.nCopies(6, "L"));
        cards.addAll(Collections.nCopies(11, "F"));
        return cards;
    }

    @Test
    @DisplayName("draw, discard and held cards always add up to the full deck")
    void cardsAreConserved() {
        // given
        CardDeck<String> deck = new CardDeck<>(policies(), RandomSource.seeded(1L));
        List<String> held = new ArrayList<>();

        // when
        for (int session = 0; session < 10; session++) {
            List<String> hand = deck.draw(3);
            deck.discard(hand.get(0));
            deck.discard(hand.get(1));
            held.add(hand.get(2));
            assertThat(deck.drawSize() + deck.discardSize() + held.size()).isEqualTo(17);
        }

        // then
        assertThat(deck.getReshuffles()).isPositive();
        assertThat(held).hasSize(10);
    }

    @Test
    @DisplayName("a short draw pile takes the discard pile back")
    void reshufflesWhenShort() {
        // given
        CardDeck<String> deck = new CardDeck<>(List.of("a", "b", "c", "d"), RandomSource.seeded(3L));
        deck.discardAll(deck.draw(3));

        // when
        List<String> drawn = deck.draw(2);

        // then
        assertThat(drawn).hasSize(2);
        assertThat(deck.getReshuffles()).isEqualTo(1);
        assertThat(deck.drawSize() + deck.discardSize()).isEqualTo(2);
    }

    @Test
    @DisplayName("drawing more than exists fails")
    void exhaustedDeck() {
        CardDeck<String> deck = new CardDeck<>(List.of("a", "b"), RandomSource.seeded(3L));
        deck.draw(1);

        assertThatThrownBy(() -> deck.draw(2)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("peek leaves the draw pile untouched")
    void peekDoesNotDraw() {
        CardDeck<String> deck = new CardDeck<>(policies(), RandomSource.seeded(5L));

        List<String> top = deck.peek(3);

        assertThat(deck.draw(3)).isEqualTo(top);
        assertThat(deck.drawSize()).isEqualTo(14);
    }
}
