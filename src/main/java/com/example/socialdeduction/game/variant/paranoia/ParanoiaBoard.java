package com.example.socialdeduction.game.variant.paranoia;

import lombok.Getter;
import lombok.Setter;

/**
 * The Computer's mood, the current mission and the executions it has seen since
 * its last mood change.
 */
@Getter
public class ParanoiaBoard {

    @Setter
    private ComputerMood mood = ComputerMood.SATISFIED;
    @Setter
    private String mission = "";
    private int executionsSinceMission;

    public void recordExecution() {
        executionsSinceMission++;
    }

    /**
     * Executions please the Computer; a failed mission makes it suspicious;
     * otherwise its mood drifts at random.
     */
    public ComputerMood nextMood(boolean missionSucceeded, ComputerMood drift) {
        if (executionsSinceMission > 0) {
            mood = ComputerMood.SATISFIED;
        } else if (!missionSucceeded) {
            mood = ComputerMood.SUSPICIOUS;
        } else {
            mood = drift;
        }
        executionsSinceMission = 0;
        return mood;
    }
}
