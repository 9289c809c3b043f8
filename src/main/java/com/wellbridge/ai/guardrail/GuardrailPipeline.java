package com.wellbridge.ai.guardrail;

import com.wellbridge.ai.agent.graph.AgentNode;
import com.wellbridge.ai.agent.state.JargonMapping;
import com.wellbridge.ai.agent.state.NodeOutcome;
import com.wellbridge.ai.agent.state.TurnState;
import com.wellbridge.ai.llm.GenerationException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The guardrail node. Turns {@code rawResponse} into {@code finalResponse} in two stages:
 *
 * <ol>
 *   <li>phrase filter: a match replaces the response with {@link MedicalOutputGuard#SAFE_FALLBACK},
 *       clears the jargon map and records a violation;</li>
 *   <li>readability gate: above {@link #READABILITY_THRESHOLD} the text is simplified and the jargon
 *       map cleared; otherwise text and jargon map pass through untouched.</li>
 * </ol>
 */
public class GuardrailPipeline implements AgentNode {

    private static final Logger log = LoggerFactory.getLogger(GuardrailPipeline.class);

    public static final double READABILITY_THRESHOLD = 8.0;

    private final TextSimplifier simplifier;
    private final AuditSink auditSink;
    private final Executor auditExecutor;
    private final MeterRegistry meterRegistry;
    private final Counter simplificationCounter;

    public GuardrailPipeline(TextSimplifier simplifier, AuditSink auditSink, Executor auditExecutor, MeterRegistry meterRegistry) {
        this.simplifier = simplifier;
        this.auditSink = auditSink;
        this.auditExecutor = auditExecutor;
        this.meterRegistry = meterRegistry;
        this.simplificationCounter = Counter.builder("agent.guardrail.simplifications")
                .description("Responses rewritten by the readability gate")
                .register(meterRegistry);
    }

    @Override
    public NodeOutcome execute(TurnState state) {
        String raw = state.rawResponse() == null ? "" : state.rawResponse();
        Result result = apply(raw, state.jargonMap());

        if (result.violation() != null) {
            log.warn("Guardrail violation pattern={} session={}", result.violation(), state.sessionId());
            meterRegistry.counter("agent.guardrail.violations", "pattern", result.violation()).increment();
            recordViolation(GuardrailViolation.of(
                    state.tenantId(), state.userId(), state.sessionId(), raw, result.violation()));
        }

        return NodeOutcome.builder()
                .finalResponse(result.finalResponse())
                .jargonMap(result.jargonMap())
                .build();
    }

    /**
     * Runs both stages on {@code raw}. {@code jargonMap} is returned unchanged only when the text is.
     */
    public Result apply(String raw, List<JargonMapping> jargonMap) {
        Optional<MedicalOutputGuard.NamedPattern> violation = MedicalOutputGuard.firstViolation(raw);
        if (violation.isPresent()) {
            return new Result(MedicalOutputGuard.SAFE_FALLBACK, List.of(), violation.get().name());
        }

        double grade = ReadabilityScorer.gradeLevel(raw);
        if (grade <= READABILITY_THRESHOLD) {
            return new Result(raw, jargonMap, null);
        }

        simplificationCounter.increment();
        String simplified;
        try {
            simplified = simplifier.simplify(raw);
        } catch (GenerationException e) {
            log.warn("Simplification failed grade={}, keeping original text", grade, e);
            simplified = raw;
        }

        // the rewrite is generated text too
        Optional<MedicalOutputGuard.NamedPattern> rewriteViolation = MedicalOutputGuard.firstViolation(simplified);
        if (rewriteViolation.isPresent()) {
            return new Result(MedicalOutputGuard.SAFE_FALLBACK, List.of(), rewriteViolation.get().name());
        }
        return new Result(simplified, List.of(), null);
    }

    private void recordViolation(GuardrailViolation violation) {
        try {
            CompletableFuture.runAsync(() -> auditSink.append(violation), auditExecutor)
                    .exceptionally(e -> {
                        log.warn("Audit append failed session={} pattern={}", violation.sessionId(), violation.patternName(), e);
                        return null;
                    });
        } catch (RuntimeException e) {
            log.warn("Audit dispatch failed session={} pattern={}", violation.sessionId(), violation.patternName(), e);
        }
    }

    public record Result(String finalResponse, List<JargonMapping> jargonMap, String violation) {}
}
