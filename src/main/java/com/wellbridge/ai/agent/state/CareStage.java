package com.wellbridge.ai.agent.state;

import java.util.EnumSet;
import java.util.Set;

public enum CareStage {
    UNKNOWN("unknown"),
    PRE_VISIT("pre-visit"),
    POST_VISIT("post-visit"),
    PRE_SURGERY("pre-surgery"),
    POST_SURGERY("post-surgery"),
    TREATMENT("treatment"),
    DIAGNOSIS("diagnosis");

    /** Stages where the patient has probably just received paperwork. */
    public static final Set<CareStage> HOLDS_PAPERWORK =
            Set.copyOf(EnumSet.of(POST_VISIT, POST_SURGERY, DIAGNOSIS, TREATMENT));

    private final String wireName;

    CareStage(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static CareStage fromWireName(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        for (CareStage stage : values()) {
            if (stage.wireName.equalsIgnoreCase(value.trim())) {
                return stage;
            }
        }
        return UNKNOWN;
    }
}
