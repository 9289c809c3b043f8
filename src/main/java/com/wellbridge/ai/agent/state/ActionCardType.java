package com.wellbridge.ai.agent.state;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum ActionCardType {
    UPLOAD,
    EMAIL,
    CONFIRM,
    LINK,
    MEDICATION_REMINDER,
    APPOINTMENT_REMINDER,
    REFERRAL_FOLLOWUP;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
