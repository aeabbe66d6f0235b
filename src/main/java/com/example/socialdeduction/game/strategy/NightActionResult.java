package com.example.socialdeduction.game.strategy;

import com.example.socialdeduction.game.domain.Role;
import lombok.Builder;
import lombok.Getter;

/**
 * Outcome of one night power.
 */
@Getter
@Builder
public class NightActionResult {
    private final Role actorRole;
    private final String actorName;
    private final String targetName;
    private final String message; // what happened, for the record only
    private final boolean success;

    public static NightActionResult noTarget(Role role, String actorName, String message) {
        return NightActionResult.builder()
                .actorRole(role)
                .actorName(actorName)
                .message(message)
                .success(false)
                .build();
    }
}
