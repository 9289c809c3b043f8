package com.wellbridge.ai.agent.state;

import java.time.OffsetDateTime;

public record Appointment(
        String providerName,
        String facilityName,
        OffsetDateTime appointmentDate,
        Integer durationMinutes,
        String notes
) {

    public String dateText() {
        return appointmentDate == null ? "" : appointmentDate.toLocalDate().toString();
    }

    public String providerOr(String fallback) {
        return providerName == null || providerName.isBlank() ? fallback : providerName;
    }
}
