package com.wellbridge.ai.agent.graph;

import com.wellbridge.ai.agent.state.NodeOutcome;
import com.wellbridge.ai.agent.state.TurnState;

/**
 * One unit of work in the turn graph.
 *
 * <p>Implementations read the state they are given and return only the fields they own. They are
 * expected to catch their own downstream failures and return a safe outcome instead of throwing.
 */
@FunctionalInterface
public interface AgentNode {

    NodeOutcome execute(TurnState state);
}
