package com.example.socialdeduction.game.variant.liar;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public enum Card {
    QUEEN,
    KING,
    ACE,
    JOKER;

    public static final int COPIES_PER_RANK = 6;
    public static final int JOKERS = 2;

    /**
     * Ranks a hand can be called for. Jokers match any of them.
     */
    public static final List<Card> TARGET_RANKS = List.of(QUEEN, KING, ACE);

    public boolean matches(Card target) {
        return this == JOKER || this == target;
    }

    public static List<Card> fullDeck() {
        List<Card> cards = new ArrayList<>();
        for (Card rank : TARGET_RANKS) {
            cards.addAll(Collections.nCopies(COPIES_PER_RANK, rank));
        }
        cards.addAll(Collections.nCopies(JOKERS, JOKER));
        return cards;
    }
}
