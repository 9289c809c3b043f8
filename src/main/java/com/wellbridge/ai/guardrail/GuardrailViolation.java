package com.wellbridge.ai.guardrail;

/**
 * Audit entry for a response replaced by the phrase filter.
 */
public record GuardrailViolation(
        String tenantId,
        String userId,
        String sessionId,
        String truncatedRawText,
        String patternName
) {
    public static final int MAX_RAW_TEXT = 2000;

    public static GuardrailViolation of(String tenantId, String userId, String sessionId, String rawText, String patternName) {
        String truncated = rawText == null ? "" : rawText.substring(0, Math.min(rawText.length(), MAX_RAW_TEXT));
        return new GuardrailViolation(tenantId, userId, sessionId, truncated, patternName);
    }
}
