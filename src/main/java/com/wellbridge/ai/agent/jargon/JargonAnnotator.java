package com.wellbridge.ai.agent.jargon;

import com.wellbridge.ai.agent.state.JargonCandidate;
import com.wellbridge.ai.agent.state.JargonMapping;
import java.util.ArrayList;
import java.util.List;

/**
 * Locates jargon candidates in a response text. Each candidate is anchored at the first
 * case-insensitive occurrence of its term; candidates whose term does not occur are dropped.
 *
 * <p>The result is only valid for the exact text passed in. Callers that rewrite the text must
 * annotate again or discard the result.
 */
public final class JargonAnnotator {

    private JargonAnnotator() {}

    public static List<JargonMapping> annotate(String text, List<JargonCandidate> candidates) {
        if (text == null || text.isEmpty() || candidates == null || candidates.isEmpty()) {
            return List.of();
        }
        List<JargonMapping> mappings = new ArrayList<>();
        for (JargonCandidate candidate : candidates) {
            if (candidate == null || candidate.term() == null || candidate.term().isBlank()) {
                continue;
            }
            String term = candidate.term();
            int start = indexOfIgnoreCase(text, term);
            if (start < 0) {
                continue;
            }
            mappings.add(new JargonMapping(
                    term,
                    candidate.plainEnglish(),
                    candidate.sourceRecordId(),
                    candidate.sourceSentence(),
                    start,
                    start + term.length()));
        }
        return List.copyOf(mappings);
    }

    static int indexOfIgnoreCase(String text, String term) {
        int last = text.length() - term.length();
        for (int i = 0; i <= last; i++) {
            if (text.regionMatches(true, i, term, 0, term.length())) {
                return i;
            }
        }
        return -1;
    }
}
