package com.shopcraft.api.service.generation;

import java.util.Arrays;

/**
 * 대화 턴 역할 (wire 값은 소문자)
 */
public enum TurnRole {
    SYSTEM("system"),
    USER("user"),
    ASSISTANT("assistant");

    private final String value;

    TurnRole(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static TurnRole fromValue(String value) {
        return Arrays.stream(values())
                .filter(r -> r.value.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown turn role: " + value));
    }
}
