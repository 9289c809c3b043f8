package com.wellbridge.ai.agent.graph;

/**
 * A node failed in a way it did not handle itself.
 */
public class TurnExecutionException extends RuntimeException {

    private final NodeId nodeId;

    public TurnExecutionException(NodeId nodeId, Throwable cause) {
        super("Turn failed in node " + nodeId, cause);
        this.nodeId = nodeId;
    }

    public NodeId nodeId() {
        return nodeId;
    }
}
