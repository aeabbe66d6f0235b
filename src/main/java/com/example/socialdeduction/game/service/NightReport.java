package com.example.socialdeduction.game.service;

import com.example.socialdeduction.game.strategy.NightActionResult;

import java.util.List;

/**
 * What a night produced: deaths in order, kill attempts, and every power's result.
 */
public record NightReport(int night, List<String> deaths, List<String> attemptedKills,
                          List<NightActionResult> results) {

    public NightReport {
        deaths = List.copyOf(deaths);
        attemptedKills = List.copyOf(attemptedKills);
        results = List.copyOf(results);
    }

    public static NightReport empty(int night) {
        return new NightReport(night, List.of(), List.of(), List.of());
    }
}
