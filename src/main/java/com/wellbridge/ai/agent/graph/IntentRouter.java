package com.wellbridge.ai.agent.graph;

import com.wellbridge.ai.agent.state.Intent;

/**
 * Picks the node that handles a classified turn.
 *
 * <p>The confidence gate runs before the intent lookup. A low-confidence turn whose intent is not in
 * {@link Intent#SAFE_SET} (including an unclassified turn) is refused by the gate; the lookup then
 * always refuses {@link Intent#MEDICAL_ADVICE}, whatever the confidence.
 */
public final class IntentRouter {

    public static final double CONFIDENCE_THRESHOLD = 0.70;

    public NodeId route(Intent intent, double confidence) {
        if (confidence < CONFIDENCE_THRESHOLD && !Intent.isSafe(intent)) {
            return NodeId.REFUSAL;
        }
        if (intent == null) {
            return NodeId.CARE_NAVIGATOR;
        }
        return switch (intent) {
            case MEDICAL_ADVICE -> NodeId.REFUSAL;
            case NOTE_EXPLANATION -> NodeId.NOTE_EXPLAINER;
            case CARE_NAVIGATION -> NodeId.CARE_NAVIGATOR;
            case RECORD_COLLECTION -> NodeId.RECORD_COLLECTOR;
            case SCHEDULING -> NodeId.CALENDAR;
            case RECORD_LOOKUP -> NodeId.RECORD_LOOKUP;
            case JARGON_EXPLAIN -> NodeId.JARGON_EXPLAINER;
            case PRE_VISIT_PREP -> NodeId.PRE_VISIT_PREP;
            case GENERAL -> NodeId.NOTE_SUMMARIZER;
        };
    }
}
