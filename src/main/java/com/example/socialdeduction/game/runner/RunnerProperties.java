package com.example.socialdeduction.game.runner;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "game.runner")
public record RunnerProperties(
        @DefaultValue("false") boolean enabled,
        @NotBlank @DefaultValue("mafia") String variant,
        @Min(1) @DefaultValue("10") int games,
        @Min(0) @DefaultValue("0") int players,   // 0 = the variant's minimum
        Long seed                                 // base seed; game i uses seed + i
) {
}
