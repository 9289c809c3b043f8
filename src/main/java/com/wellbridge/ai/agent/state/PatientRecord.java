package com.wellbridge.ai.agent.state;

import java.time.LocalDate;

public record PatientRecord(
        String id,
        String recordType,
        String providerName,
        String facilityName,
        LocalDate noteDate,
        String content
) {

    public String noteDateText() {
        return noteDate == null ? "" : noteDate.toString();
    }

    public String providerOr(String fallback) {
        return providerName == null || providerName.isBlank() ? fallback : providerName;
    }

    public String contentOrEmpty() {
        return content == null ? "" : content;
    }

    public String recordTypeLabel() {
        return recordType == null || recordType.isBlank() ? "record" : recordType.replace('_', ' ');
    }
}
