package com.example.socialdeduction.game.strategy;

/**
 * Night resolution order. Every power of a tier resolves before any power of the
 * next tier; inside a tier, holders act in seat order.
 */
public enum NightPriority {
    DISRUPTION,     // poison
    PROTECTION,     // monk, doctor, soldier
    ELIMINATION,    // demon or mafia kill
    DEATH_TRIGGER,  // ravenkeeper
    RETROSPECTIVE,  // undertaker
    INVESTIGATION,  // detective
    SENSE,          // empath
    DESIGNATION     // butler master, mission sabotage
}
