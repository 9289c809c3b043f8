package com.wellbridge.ai.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.ArrayList;
import java.util.List;

/**
 * One SSE {@code data:} payload. Tokens come first, then the trailing metadata, then {@code done};
 * a failed turn produces a single {@code error} instead.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StreamEvent(
        String type,
        String content,
        Object data,
        String message
) {

    public static final String GENERIC_ERROR = "Something went wrong while answering. Please try again.";

    public static StreamEvent token(String content) {
        return new StreamEvent("token", content, null, null);
    }

    public static StreamEvent jargonMap(Object data) {
        return new StreamEvent("jargon_map", null, data, null);
    }

    public static StreamEvent actionCards(Object data) {
        return new StreamEvent("action_cards", null, data, null);
    }

    public static StreamEvent suggestedReplies(Object data) {
        return new StreamEvent("suggested_replies", null, data, null);
    }

    public static StreamEvent done() {
        return new StreamEvent("done", null, null, null);
    }

    public static StreamEvent error() {
        return new StreamEvent("error", null, null, GENERIC_ERROR);
    }

    /**
     * The full event sequence for a finished turn. Text is sent word by word, each word but the
     * last keeping its trailing space so the client can concatenate tokens.
     */
    public static List<StreamEvent> sequence(TurnResponse response) {
        List<StreamEvent> events = new ArrayList<>();
        String text = response.finalResponse() == null ? "" : response.finalResponse();
        String[] words = text.split(" ", -1);
        for (int i = 0; i < words.length; i++) {
            events.add(token(i < words.length - 1 ? words[i] + " " : words[i]));
        }
        events.add(jargonMap(response.jargonMap()));
        events.add(actionCards(response.actionCards()));
        events.add(suggestedReplies(response.suggestedReplies()));
        events.add(done());
        return events;
    }
}
