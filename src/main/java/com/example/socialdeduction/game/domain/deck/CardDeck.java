package com.example.socialdeduction.game.domain.deck;

import com.example.socialdeduction.global.random.RandomSource;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Draw pile plus discard pile. Cards are drawn without replacement; when the draw
 * pile runs short the discard pile is shuffled back under it. Cards never appear
 * or vanish: draw + discard + cards held by the caller stays constant.
 */
@Slf4j
public class CardDeck<C> {

    private final List<C> drawPile;
    private final List<C> discardPile = new ArrayList<>();
    private final RandomSource random;
    private int reshuffles;

    public CardDeck(Collection<C> cards, RandomSource random) {
        this.random = Objects.requireNonNull(random, "random");
        this.drawPile = new ArrayList<>(cards);
        random.shuffle(drawPile);
    }

    public List<C> draw(int count) {
        ensureAvailable(count);
        List<C> drawn = new ArrayList<>(drawPile.subList(0, count));
        drawPile.subList(0, count).clear();
        return drawn;
    }

    /**
     * Top {@code count} cards without removing them.
     */
    public List<C> peek(int count) {
        ensureAvailable(count);
        return List.copyOf(drawPile.subList(0, count));
    }

    public void discard(C card) {
        discardPile.add(Objects.requireNonNull(card, "card"));
    }

    public void discardAll(Collection<C> cards) {
        cards.forEach(this::discard);
    }

    /**
     * Puts every discarded card back and shuffles the whole draw pile.
     */
    public void reshuffleAll() {
        drawPile.addAll(discardPile);
        discardPile.clear();
        random.shuffle(drawPile);
        reshuffles++;
    }

    public int drawSize() {
        return drawPile.size();
    }

    public int discardSize() {
        return discardPile.size();
    }

    public int getReshuffles() {
        return reshuffles;
    }

    private void ensureAvailable(int count) {
        if (drawPile.size() >= count) {
            return;
        }
        if (drawPile.size() + discardPile.size() < count) {
            throw new IllegalStateException("deck exhausted: need " + count + ", have "
                    + drawPile.size() + " + " + discardPile.size() + " discarded");
        }
        log.debug("[deck] reshuffle: draw={}, discard={}", drawPile.size(), discardPile.size());
        reshuffleAll();
    }
}
