package com.wellbridge.ai.llm;

import com.wellbridge.ai.agent.state.ChatTurn;
import java.util.List;

public record GenerationRequest(
        String systemPrompt,
        List<ChatTurn> turns,
        double temperature,
        int maxTokens,
        boolean jsonOutput
) {
    public GenerationRequest {
        turns = List.copyOf(turns);
    }

    public static GenerationRequest text(String systemPrompt, List<ChatTurn> turns, double temperature, int maxTokens) {
        return new GenerationRequest(systemPrompt, turns, temperature, maxTokens, false);
    }

    public static GenerationRequest json(String systemPrompt, List<ChatTurn> turns, double temperature, int maxTokens) {
        return new GenerationRequest(systemPrompt, turns, temperature, maxTokens, true);
    }
}
