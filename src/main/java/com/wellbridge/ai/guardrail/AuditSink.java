package com.wellbridge.ai.guardrail;

/**
 * Where guardrail violations are recorded for review. Callers never let a failure here change
 * the response they already computed.
 */
public interface AuditSink {

    void append(GuardrailViolation violation);
}
