package com.wellbridge.ai.guardrail;

import com.wellbridge.ai.agent.state.ChatTurn;
import com.wellbridge.ai.llm.GenerationException;
import com.wellbridge.ai.llm.GenerationProvider;
import com.wellbridge.ai.llm.GenerationRequest;
import java.util.List;

/**
 * Rewrites a response at roughly a 6th-grade level without changing its facts.
 */
public class TextSimplifier {

    static final String SIMPLIFY_SYSTEM_PROMPT = """
            Rewrite the following text at a 6th-grade reading level.
            Use shorter sentences and simpler words.
            Do not add new information.
            Do not give medical advice or recommendations.
            Preserve all facts exactly.
            """;

    private final GenerationProvider provider;

    public TextSimplifier(GenerationProvider provider) {
        this.provider = provider;
    }

    public String simplify(String text) throws GenerationException {
        return provider.complete(GenerationRequest.text(SIMPLIFY_SYSTEM_PROMPT, List.of(ChatTurn.user(text)), 0.2, 800));
    }
}
