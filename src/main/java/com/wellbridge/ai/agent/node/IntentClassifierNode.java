package com.wellbridge.ai.agent.node;

import com.wellbridge.ai.agent.graph.AgentNode;
import com.wellbridge.ai.agent.state.ChatTurn;
import com.wellbridge.ai.agent.state.Intent;
import com.wellbridge.ai.agent.state.NodeOutcome;
import com.wellbridge.ai.agent.state.TurnState;
import com.wellbridge.ai.llm.GenerationException;
import com.wellbridge.ai.llm.GenerationProvider;
import com.wellbridge.ai.llm.GenerationRequest;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Classifies the inbound message, with up to three prior exchanges as context. Any failure
 * yields {@code CARE_NAVIGATION} at confidence 0.0 and never escapes the node.
 */
public class IntentClassifierNode implements AgentNode {

    private static final Logger log = LoggerFactory.getLogger(IntentClassifierNode.class);

    static final int PRIOR_MESSAGES = 6;
    static final int PRIOR_ASSISTANT_CHARS = 100;

    private final GenerationProvider provider;

    public IntentClassifierNode(GenerationProvider provider) {
        this.provider = provider;
    }

    @Override
    public NodeOutcome execute(TurnState state) {
        List<ChatTurn> turns = new ArrayList<>();
        for (ChatTurn prior : state.recentPriorMessages(PRIOR_MESSAGES)) {
            String content = prior.content() == null ? "" : prior.content();
            if (prior.isUser()) {
                turns.add(ChatTurn.user("[PRIOR] " + content));
            } else {
                turns.add(ChatTurn.assistant("[PRIOR] " + RecordFormatting.truncate(content, PRIOR_ASSISTANT_CHARS)));
            }
        }
        turns.add(ChatTurn.user("Classify this message: " + state.latestUserMessage()));

        try {
            String json = provider.complete(GenerationRequest.json(Prompts.INTENT_CLASSIFIER, turns, 0.0, 200));
            IntentResult result = IntentResultParser.parse(json);
            log.info("Intent classified session={} intent={} confidence={} reasoning={}",
                    state.sessionId(), result.intent(), result.confidence(), result.reasoning());
            return NodeOutcome.builder()
                    .classification(result.intent(), result.confidence())
                    .build();
        } catch (GenerationException | IllegalArgumentException e) {
            log.warn("Intent classification failed session={}, defaulting to care navigation", state.sessionId(), e);
            return NodeOutcome.builder()
                    .classification(Intent.CARE_NAVIGATION, 0.0)
                    .build();
        }
    }
}
