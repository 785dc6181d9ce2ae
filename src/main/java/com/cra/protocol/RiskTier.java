package com.cra.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum RiskTier {
    LOW("low", 1),
    MEDIUM("medium", 2),
    HIGH("high", 3),
    CRITICAL("critical", 4);

    private final String value;
    private final int level;

    RiskTier(String value, int level) {
        this.value = value;
        this.level = level;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public int level() {
        return level;
    }

    public boolean isAbove(RiskTier other) {
        return level > other.level;
    }

    public boolean isAtLeast(RiskTier other) {
        return level >= other.level;
    }

    @JsonCreator
    public static RiskTier fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown risk tier: " + raw));
    }
}
