package com.wellbridge.ai.records;

import java.time.LocalDate;

/**
 * A full-text hit inside one of the patient's notes.
 */
public record NoteExcerpt(
        String recordId,
        String providerName,
        LocalDate noteDate,
        String excerpt
) {}
