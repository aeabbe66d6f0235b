package com.example.socialdeduction.game.service;

import com.example.socialdeduction.game.dto.GameSetup;
import com.example.socialdeduction.game.variant.GameVariant;
import com.example.socialdeduction.global.error.ErrorCode;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

@Component
public class GameValidator {

    public void validateCreateGame(GameSetup setup, GameVariant variant) {
        List<String> names = setup.playerNames();
        if (names == null || !variant.getRoleTable().supports(names.size())) {
            throw ErrorCode.INVALID_PLAYER_COUNT.commonException(variant.getKey() + " supports "
                    + variant.getRoleTable().getMinPlayers() + "-" + variant.getRoleTable().getMaxPlayers()
                    + " players, got " + (names == null ? 0 : names.size()));
        }

        Set<String> seen = new HashSet<>();
        for (String name : names) {
            if (name == null || name.isBlank() || !seen.add(name) || variant.getExtraSeats().contains(name)) {
                throw ErrorCode.DUPLICATE_PLAYER_NAME.commonException(String.valueOf(name));
            }
        }

        for (String seat : seatsOf(setup, variant)) {
            if (setup.agents() == null || setup.agents().get(seat) == null) {
                throw ErrorCode.MISSING_AGENT.commonException(seat);
            }
        }
    }

    private List<String> seatsOf(GameSetup setup, GameVariant variant) {
        return Stream.concat(setup.playerNames().stream(), variant.getExtraSeats().stream())
                .toList();
    }
}
