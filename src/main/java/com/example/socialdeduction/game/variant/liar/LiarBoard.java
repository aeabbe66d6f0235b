package com.example.socialdeduction.game.variant.liar;

import com.example.socialdeduction.game.domain.deck.CardDeck;
import com.example.socialdeduction.global.random.RandomSource;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Table state of the card game: one revolver per player for the whole game, and
 * the hands, target rank and deck of the hand being played.
 */
@Getter
public class LiarBoard {

    private final Map<String, Revolver> revolvers = new LinkedHashMap<>();
    private final Map<String, List<Card>> hands = new LinkedHashMap<>();
    private CardDeck<Card> deck;
    private Card targetRank;
    private int handsPlayed;

    @Setter
    private String starter;

    public void loadRevolvers(List<String> names, RandomSource random) {
        for (String name : names) {
            revolvers.put(name, new Revolver(random.nextInt(Revolver.CHAMBERS)));
        }
    }

    public Revolver revolverOf(String name) {
        Revolver revolver = revolvers.get(name);
        if (revolver == null) {
            throw new IllegalStateException("no revolver for " + name);
        }
        return revolver;
    }

    /**
     * Fresh deck, fresh hands for {@code names}, new target rank.
     */
    public void deal(List<String> names, int handSize, RandomSource random) {
        deck = new CardDeck<>(Card.fullDeck(), random);
        hands.clear();
        for (String name : names) {
            hands.put(name, new ArrayList<>(deck.draw(handSize)));
        }
        targetRank = random.pick(Card.TARGET_RANKS);
        handsPlayed++;
    }

    public List<Card> handOf(String name) {
        return hands.getOrDefault(name, List.of());
    }

    public boolean holdsCards(String name) {
        return !handOf(name).isEmpty();
    }

    public long holdersOfCards() {
        return hands.values().stream().filter(hand -> !hand.isEmpty()).count();
    }

    /**
     * Removes the cards at the given hand positions and puts them on the discard
     * pile.
     *
     * @return the removed cards, in the order of {@code slots}
     */
    public List<Card> play(String name, List<Integer> slots) {
        List<Card> hand = hands.get(name);
        List<Card> played = new ArrayList<>(slots.size());
        for (int slot : slots) {
            played.add(hand.get(slot));
        }
        slots.stream().sorted((a, b) -> Integer.compare(b, a)).forEach(slot -> hand.remove((int) slot));
        deck.discardAll(played);
        return played;
    }
}
