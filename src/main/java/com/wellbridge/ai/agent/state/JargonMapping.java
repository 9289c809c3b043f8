package com.wellbridge.ai.agent.state;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A highlighted span in the response text. {@code [charOffsetStart, charOffsetEnd)} indexes the
 * exact text the mapping was computed against and is invalid once that text is rewritten.
 */
public record JargonMapping(
        String term,
        @JsonProperty("plain_english") String plainEnglish,
        @JsonProperty("source_note_id") String sourceRecordId,
        @JsonProperty("source_sentence") String sourceSentence,
        @JsonProperty("char_offset_start") int charOffsetStart,
        @JsonProperty("char_offset_end") int charOffsetEnd
) {}
