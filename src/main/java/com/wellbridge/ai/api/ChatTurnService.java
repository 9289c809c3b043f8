package com.wellbridge.ai.api;

import com.wellbridge.ai.agent.graph.AgentTopology;
import com.wellbridge.ai.agent.graph.NodeId;
import com.wellbridge.ai.agent.graph.TurnExecutor;
import com.wellbridge.ai.agent.state.ChatTurn;
import com.wellbridge.ai.agent.state.TurnIdentity;
import com.wellbridge.ai.agent.state.TurnState;
import com.wellbridge.ai.memory.ConversationHistoryStore;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Runs one turn end to end: history in, graph, history out. History failures are logged and
 * never fail the turn; a failing node does, through {@code TurnExecutionException}.
 */
@Service
public class ChatTurnService {

    private static final Logger log = LoggerFactory.getLogger(ChatTurnService.class);

    static final String MDC_SESSION_KEY = "sessionId";

    static final List<String> REFUSAL_SUGGESTIONS = List.of(
            "I have a note from my doctor to share",
            "Tell me what my records say",
            "Help me write a question for my care team");

    private final TurnExecutor turnExecutor;
    private final AgentTopology topology;
    private final ConversationHistoryStore historyStore;
    private final int historyLimit;

    public ChatTurnService(
            TurnExecutor turnExecutor,
            AgentTopology topology,
            ConversationHistoryStore historyStore,
            @Value("${app.history.limit:10}") int historyLimit) {
        this.turnExecutor = turnExecutor;
        this.topology = topology;
        this.historyStore = historyStore;
        this.historyLimit = historyLimit;
    }

    public TurnResponse handle(TenantContext tenant, String sessionId, String message) {
        MDC.put(MDC_SESSION_KEY, sessionId);
        long start = System.currentTimeMillis();
        try {
            List<ChatTurn> history = loadHistory(tenant, sessionId);
            save(tenant, sessionId, ChatTurn.user(message));

            TurnIdentity identity = new TurnIdentity(tenant.tenantId(), tenant.userId(), tenant.role(), sessionId);
            TurnState result = turnExecutor.runTurn(TurnState.initial(identity, history, message));

            String text = result.finalResponse() == null ? "" : result.finalResponse();
            save(tenant, sessionId, ChatTurn.assistant(text));

            List<String> replies = result.suggestedReplies();
            if (replies.isEmpty() && topology.intentRouter().route(result.intent(), result.confidence()) == NodeId.REFUSAL) {
                replies = REFUSAL_SUGGESTIONS;
            }

            log.info("Turn completed intent={} historySize={} durationMs={}",
                    result.intent(), history.size(), System.currentTimeMillis() - start);
            return new TurnResponse(text, result.intent(), result.jargonMap(), result.actionCards(), replies);
        } finally {
            MDC.remove(MDC_SESSION_KEY);
        }
    }

    private List<ChatTurn> loadHistory(TenantContext tenant, String sessionId) {
        try {
            return historyStore.recent(tenant.tenantId(), sessionId, historyLimit);
        } catch (RuntimeException e) {
            log.warn("History load failed, continuing without it", e);
            return List.of();
        }
    }

    private void save(TenantContext tenant, String sessionId, ChatTurn turn) {
        try {
            historyStore.append(tenant.tenantId(), sessionId, turn);
        } catch (RuntimeException e) {
            log.warn("History save failed role={}", turn.role(), e);
        }
    }
}
