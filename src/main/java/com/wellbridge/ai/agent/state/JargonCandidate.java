package com.wellbridge.ai.agent.state;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A term a generation step wants highlighted, before it has been located in the response text.
 */
public record JargonCandidate(
        String term,
        @JsonProperty("plain_english") String plainEnglish,
        @JsonProperty("source_note_id") String sourceRecordId,
        @JsonProperty("source_sentence") String sourceSentence
) {}
