package com.wellbridge.ai.agent.node;

import com.wellbridge.ai.agent.state.PatientRecord;
import java.util.List;
import java.util.stream.Collectors;

final class RecordFormatting {

    private RecordFormatting() {}

    /**
     * Notes as the model sees them, each tagged with its id so jargon entries can cite it.
     */
    static String notesText(List<PatientRecord> records, int maxContentChars) {
        return records.stream()
                .map(r -> "[NOTE_ID:" + r.id() + "] " + r.noteDateText() + " - "
                        + r.providerOr("Your care team") + " (" + r.recordTypeLabel() + "):\n"
                        + truncate(r.contentOrEmpty(), maxContentChars))
                .collect(Collectors.joining("\n\n"));
    }

    static String truncate(String text, int max) {
        return text.length() <= max ? text : text.substring(0, max);
    }
}
