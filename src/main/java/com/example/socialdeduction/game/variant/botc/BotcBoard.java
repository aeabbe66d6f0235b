package com.example.socialdeduction.game.variant.botc;

import lombok.Getter;

/**
 * Per-game BotC state that is not on the shared game state.
 */
@Getter
public class BotcBoard {

    // day on which a full day ended without an execution
    private int quietDay;

    public void markQuietDay(int day) {
        this.quietDay = day;
    }
}
