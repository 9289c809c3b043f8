package com.wellbridge.ai.agent.graph;

import com.wellbridge.ai.agent.state.NodeOutcome;
import com.wellbridge.ai.agent.state.TurnState;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives one turn through the topology. Exactly one path is taken:
 *
 * <pre>
 * emotional_assessor -> intent_classifier -> (refusal | tool node)
 * tool node -> (guardrail -> response_assembler | response_assembler)
 * </pre>
 *
 * No retries happen here; nodes degrade on their own.
 */
public class TurnExecutor {

    private static final Logger log = LoggerFactory.getLogger(TurnExecutor.class);

    private final AgentTopology topology;
    private final Map<NodeId, Timer> nodeTimers = new EnumMap<>(NodeId.class);

    public TurnExecutor(AgentTopology topology, MeterRegistry meterRegistry) {
        this.topology = topology;
        for (NodeId id : NodeId.values()) {
            nodeTimers.put(id, Timer.builder("agent.node.duration")
                    .description("Turn graph node execution duration")
                    .tag("node", id.metricName())
                    .register(meterRegistry));
        }
    }

    /**
     * @throws TurnExecutionException if a node throws instead of degrading
     */
    public TurnState runTurn(TurnState initialState) {
        List<NodeId> path = new ArrayList<>();
        TurnState state = initialState;

        state = step(NodeId.EMOTIONAL_ASSESSOR, state, path);
        state = step(NodeId.INTENT_CLASSIFIER, state, path);

        NodeId next = topology.intentRouter().route(state.intent(), state.confidence());
        log.info("Turn routed session={} intent={} confidence={} next={}",
                state.sessionId(), state.intent(), state.confidence(), next);

        state = step(next, state, path);
        if (next == NodeId.REFUSAL) {
            log.info("Turn finished session={} path={}", state.sessionId(), path);
            return state;
        }

        if (topology.toolOutcomeRouter().route(state) == NodeId.GUARDRAIL) {
            state = step(NodeId.GUARDRAIL, state, path);
        } else {
            log.info("Guardrail skipped session={} toolError={}", state.sessionId(), state.toolError());
        }
        state = step(NodeId.RESPONSE_ASSEMBLER, state, path);

        log.info("Turn finished session={} path={}", state.sessionId(), path);
        return state;
    }

    private TurnState step(NodeId id, TurnState state, List<NodeId> path) {
        path.add(id);
        AgentNode node = topology.node(id);
        long startNanos = System.nanoTime();
        try {
            NodeOutcome outcome = node.execute(state);
            return TurnState.merge(state, outcome == null ? NodeOutcome.empty() : outcome);
        } catch (RuntimeException e) {
            log.error("Node failed node={} session={}", id.metricName(), state.sessionId(), e);
            throw new TurnExecutionException(id, e);
        } finally {
            nodeTimers.get(id).record(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);
        }
    }
}
