package com.example.socialdeduction.game.service;

import com.example.socialdeduction.game.variant.GameVariant;
import com.example.socialdeduction.global.error.ErrorCode;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Every {@link GameVariant} bean, by key.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GameVariantRegistry {

    private final List<GameVariant> variants;
    private final Map<String, GameVariant> variantMap = new TreeMap<>();

    @PostConstruct
    public void init() {
        for (GameVariant variant : variants) {
            if (variantMap.putIfAbsent(variant.getKey(), variant) != null) {
                throw new IllegalStateException("duplicate game variant key: " + variant.getKey());
            }
        }
        log.info("Registered game variants: {}", variantMap.keySet());
    }

    public GameVariant getVariant(String key) {
        GameVariant variant = variantMap.get(key);
        if (variant == null) {
            throw ErrorCode.UNKNOWN_VARIANT.commonException(key);
        }
        return variant;
    }

    public Set<String> getKeys() {
        return variantMap.keySet();
    }
}
