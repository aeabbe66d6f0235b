package com.example.socialdeduction.game.variant.secrethitler;

import com.example.socialdeduction.game.domain.GamePlayer;
import com.example.socialdeduction.game.domain.Players;
import com.example.socialdeduction.game.domain.deck.CardDeck;
import lombok.Getter;
import lombok.Setter;

import java.util.HashSet;
import java.util.Set;

/**
 * Policy deck, presidential rotation and term limits.
 */
@Getter
public class SecretHitlerBoard {

    private final CardDeck<Policy> deck;
    private final int boardSize;
    private final Set<String> investigated = new HashSet<>();

    // last regular president; the rotation continues after this seat
    private String rotationAnchor;
    @Setter
    private String specialPresident;

    private String lastElectedPresident;
    private String lastElectedChancellor;

    public SecretHitlerBoard(CardDeck<Policy> deck, int boardSize) {
        this.deck = deck;
        this.boardSize = boardSize;
    }

    /**
     * Next president: a pending special-election pick first, otherwise the next
     * living seat after the last regular president. A special presidency does
     * not move the rotation.
     */
    public GamePlayer nextPresident(Players players) {
        if (specialPresident != null) {
            GamePlayer special = players.findAlive(specialPresident);
            specialPresident = null;
            if (special != null) {
                return special;
            }
        }
        GamePlayer next;
        if (rotationAnchor == null) {
            next = players.findAllAlivePlayers().get(0);
        } else {
            next = players.nextAliveAfter(players.findByName(rotationAnchor));
        }
        rotationAnchor = next.getName();
        return next;
    }

    public void markElected(String president, String chancellor) {
        this.lastElectedPresident = president;
        this.lastElectedChancellor = chancellor;
    }

    /**
     * Chaos (a forced top-deck) lifts the term limits.
     */
    public void resetTermLimits() {
        this.lastElectedPresident = null;
        this.lastElectedChancellor = null;
    }
}
