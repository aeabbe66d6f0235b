package com.example.socialdeduction.game.variant.secrethitler;

/**
 * Presidential power granted by an enacted fascist policy. Depends on the board
 * size (player count at setup) and on how many fascist policies are on the board.
 */
public enum ExecutivePower {
    NONE,
    INVESTIGATE_LOYALTY,
    SPECIAL_ELECTION,
    POLICY_PEEK,
    EXECUTION;

    public static ExecutivePower forFascistPolicy(int playerCount, int fascistPolicies) {
        if (fascistPolicies == 4 || fascistPolicies == 5) {
            return EXECUTION;
        }
        if (playerCount <= 6) {
            return fascistPolicies == 3 ? POLICY_PEEK : NONE;
        }
        if (fascistPolicies == 3) {
            return SPECIAL_ELECTION;
        }
        if (fascistPolicies == 2 || (fascistPolicies == 1 && playerCount >= 9)) {
            return INVESTIGATE_LOYALTY;
        }
        return NONE;
    }
}
