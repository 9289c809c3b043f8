package com.wellbridge.ai.agent.graph;

import com.wellbridge.ai.agent.state.TurnState;

/**
 * After a tool node: generated text goes through the guardrail, anything else straight to assembly.
 */
public final class ToolOutcomeRouter {

    public NodeId route(TurnState state) {
        return state.rawResponse() != null ? NodeId.GUARDRAIL : NodeId.RESPONSE_ASSEMBLER;
    }
}
