package com.wellbridge.ai.agent.node;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.wellbridge.ai.agent.state.JargonCandidate;
import java.util.List;

/**
 * Structured reply of the note-reading nodes: response text plus the terms to highlight in it.
 */
record GroundedAnswer(
        @JsonAlias("summary") String response,
        @JsonProperty("jargon_entries") List<JargonCandidate> jargonEntries
) {
    GroundedAnswer {
        jargonEntries = jargonEntries == null ? List.of() : jargonEntries;
    }

    boolean hasResponse() {
        return response != null && !response.isBlank();
    }
}
