package com.wellbridge.ai.agent.state;

import java.util.Locale;

public enum EmotionalState {
    ANXIOUS,
    CONFUSED,
    ENGAGED,
    CALM;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static EmotionalState fromWireName(String value, EmotionalState fallback) {
        if (value == null) {
            return fallback;
        }
        for (EmotionalState state : values()) {
            if (state.wireName().equalsIgnoreCase(value.trim())) {
                return state;
            }
        }
        return fallback;
    }
}
