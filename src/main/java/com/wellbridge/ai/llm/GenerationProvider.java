package com.wellbridge.ai.llm;

/**
 * The language model behind every generating node. Failure is an expected outcome: callers catch
 * {@link GenerationException} and fall back to fixed text.
 */
public interface GenerationProvider {

    String complete(GenerationRequest request) throws GenerationException;

    /**
     * Completes a JSON request and binds the payload to {@code type}.
     */
    <T> T completeStructured(GenerationRequest request, Class<T> type) throws GenerationException;
}
