package com.example.socialdeduction.game.domain;

/**
 * A seat's secret identity. Each game variant supplies its own enum; the team is
 * fixed per role and never changes during a game.
 */
public interface Role {

    String name();

    Team getTeam();

    String getDisplayName();
}
