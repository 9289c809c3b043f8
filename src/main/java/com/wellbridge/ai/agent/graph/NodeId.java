package com.wellbridge.ai.agent.graph;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Every node the turn graph can visit.
 */
public enum NodeId {
    EMOTIONAL_ASSESSOR,
    INTENT_CLASSIFIER,
    REFUSAL,
    NOTE_EXPLAINER,
    CARE_NAVIGATOR,
    RECORD_COLLECTOR,
    CALENDAR,
    RECORD_LOOKUP,
    JARGON_EXPLAINER,
    PRE_VISIT_PREP,
    NOTE_SUMMARIZER,
    MEDICATION_INFO,
    GUARDRAIL,
    RESPONSE_ASSEMBLER;

    /** Nodes that produce a tool outcome and hand over to the tool-outcome router. */
    public static final Set<NodeId> TOOL_NODES = Set.copyOf(EnumSet.of(
            NOTE_EXPLAINER,
            CARE_NAVIGATOR,
            RECORD_COLLECTOR,
            CALENDAR,
            RECORD_LOOKUP,
            JARGON_EXPLAINER,
            PRE_VISIT_PREP,
            NOTE_SUMMARIZER,
            MEDICATION_INFO));

    public boolean isTerminal() {
        return this == REFUSAL || this == RESPONSE_ASSEMBLER;
    }

    public String metricName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
