package com.example.socialdeduction.global.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "game.engine")
public record GameProperties(
        @Min(1) @DefaultValue("30") int maxRounds,                // round cap before the fallback winner
        @NotNull @DefaultValue("1h") Duration maxGameDuration,    // wall-clock budget per game
        @NotNull @DefaultValue("30s") Duration decisionTimeout,   // per agent decision
        @Min(1) @DefaultValue("8") int decisionThreads,           // pool for concurrent agent calls
        @Min(0) @DefaultValue("1") int tableTalkPasses,           // talk lines per player per day
        @Min(0) @DefaultValue("8") int recentTalkWindow           // earlier lines shown to a speaker
) {

    public static GameProperties defaults() {
        return new GameProperties(30, Duration.ofHours(1), Duration.ofSeconds(30), 8, 1, 8);
    }
}
