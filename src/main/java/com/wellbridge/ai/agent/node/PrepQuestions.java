package com.wellbridge.ai.agent.node;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

record PrepQuestions(
        List<String> questions,
        @JsonProperty("based_on_note_ids") List<String> basedOnNoteIds
) {
    static final int MIN_QUESTIONS = 3;
    static final int MAX_QUESTIONS = 5;

    boolean isValid() {
        return questions != null
                && questions.size() >= MIN_QUESTIONS
                && questions.size() <= MAX_QUESTIONS
                && questions.stream().noneMatch(q -> q == null || q.isBlank());
    }
}
