package com.example.socialdeduction.game.variant.paranoia;

/**
 * The Computer's temper. Anything but SATISFIED makes it convict by default.
 */
public enum ComputerMood {
    SATISFIED,
    SUSPICIOUS,
    ANGRY;

    public boolean convictsByDefault() {
        return this != SATISFIED;
    }
}
