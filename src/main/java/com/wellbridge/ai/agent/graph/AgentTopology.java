package com.wellbridge.ai.agent.graph;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The immutable turn graph: one node per {@link NodeId} plus the two routing functions.
 * Built once at startup and shared by every turn.
 */
public final class AgentTopology {

    private final Map<NodeId, AgentNode> nodes;
    private final IntentRouter intentRouter;
    private final ToolOutcomeRouter toolOutcomeRouter;

    private AgentTopology(Map<NodeId, AgentNode> nodes, IntentRouter intentRouter, ToolOutcomeRouter toolOutcomeRouter) {
        this.nodes = Collections.unmodifiableMap(new EnumMap<>(nodes));
        this.intentRouter = intentRouter;
        this.toolOutcomeRouter = toolOutcomeRouter;
    }

    public static Builder builder() {
        return new Builder();
    }

    public AgentNode node(NodeId id) {
        return nodes.get(id);
    }

    public IntentRouter intentRouter() {
        return intentRouter;
    }

    public ToolOutcomeRouter toolOutcomeRouter() {
        return toolOutcomeRouter;
    }

    public Set<NodeId> nodeIds() {
        return nodes.keySet();
    }

    public static final class Builder {

        private final EnumMap<NodeId, AgentNode> nodes = new EnumMap<>(NodeId.class);
        private IntentRouter intentRouter = new IntentRouter();
        private ToolOutcomeRouter toolOutcomeRouter = new ToolOutcomeRouter();

        private Builder() {}

        public Builder node(NodeId id, AgentNode node) {
            if (nodes.putIfAbsent(id, Objects.requireNonNull(node, "node")) != null) {
                throw new IllegalArgumentException("Node already registered: " + id);
            }
            return this;
        }

        public Builder intentRouter(IntentRouter intentRouter) {
            this.intentRouter = Objects.requireNonNull(intentRouter);
            return this;
        }

        public Builder toolOutcomeRouter(ToolOutcomeRouter toolOutcomeRouter) {
            this.toolOutcomeRouter = Objects.requireNonNull(toolOutcomeRouter);
            return this;
        }

        public AgentTopology build() {
            Set<NodeId> missing = EnumSet.allOf(NodeId.class);
            missing.removeAll(nodes.keySet());
            if (!missing.isEmpty()) {
                throw new IllegalStateException("Topology is missing nodes " + missing);
            }
            return new AgentTopology(nodes, intentRouter, toolOutcomeRouter);
        }
    }
}
