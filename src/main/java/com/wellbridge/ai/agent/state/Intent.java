package com.wellbridge.ai.agent.state;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Closed set of intents the classifier may emit.
 */
public enum Intent {
    /** New prescriptive guidance, diagnosis or prognosis. Always refused. */
    MEDICAL_ADVICE,
    NOTE_EXPLANATION,
    SCHEDULING,
    RECORD_LOOKUP,
    JARGON_EXPLAIN,
    PRE_VISIT_PREP,
    CARE_NAVIGATION,
    RECORD_COLLECTION,
    GENERAL;

    /** Intents that never need prescriptive content and may pass the confidence gate. */
    public static final Set<Intent> SAFE_SET = Set.copyOf(EnumSet.of(
            NOTE_EXPLANATION,
            CARE_NAVIGATION,
            RECORD_COLLECTION,
            RECORD_LOOKUP,
            JARGON_EXPLAIN,
            PRE_VISIT_PREP,
            SCHEDULING,
            GENERAL));

    public static boolean isSafe(Intent intent) {
        return intent != null && SAFE_SET.contains(intent);
    }

    public static Optional<Intent> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        for (Intent intent : values()) {
            if (intent.name().equalsIgnoreCase(name.trim())) {
                return Optional.of(intent);
            }
        }
        return Optional.empty();
    }
}
