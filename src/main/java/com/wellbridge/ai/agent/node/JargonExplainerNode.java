package com.wellbridge.ai.agent.node;

import com.wellbridge.ai.agent.graph.AgentNode;
import com.wellbridge.ai.agent.state.ChatTurn;
import com.wellbridge.ai.agent.state.NodeOutcome;
import com.wellbridge.ai.agent.state.TurnState;
import com.wellbridge.ai.llm.GenerationException;
import com.wellbridge.ai.llm.GenerationProvider;
import com.wellbridge.ai.llm.GenerationRequest;
import com.wellbridge.ai.records.NoteExcerpt;
import com.wellbridge.ai.records.RecordStore;
import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class JargonExplainerNode implements AgentNode {

    private static final Logger log = LoggerFactory.getLogger(JargonExplainerNode.class);

    static final int SOURCE_LIMIT = 2;

    static final String NO_SOURCE_CONTEXT = "(This term was not found in your records.)";
    static final String SOURCE_LOOKUP_FAILED = "(Could not retrieve source context from your records.)";
    static final String FAILURE_RESPONSE = "I had trouble looking that up. Please try again.";

    private final GenerationProvider provider;
    private final RecordStore recordStore;

    public JargonExplainerNode(GenerationProvider provider, RecordStore recordStore) {
        this.provider = provider;
        this.recordStore = recordStore;
    }

    @Override
    public NodeOutcome execute(TurnState state) {
        String question = state.latestUserMessage();

        String sourceContext;
        try {
            List<NoteExcerpt> hits = recordStore.searchNotes(state.tenantId(), state.userId(), question, SOURCE_LIMIT);
            sourceContext = hits.isEmpty() ? NO_SOURCE_CONTEXT : hits.stream()
                    .map(h -> "From " + (h.providerName() == null ? "your care team" : h.providerName())
                            + " (" + (h.noteDate() == null ? "" : h.noteDate()) + "): \"" + h.excerpt() + "\"")
                    .collect(Collectors.joining("\n"));
        } catch (RuntimeException e) {
            log.warn("Source lookup failed session={}", state.sessionId(), e);
            sourceContext = SOURCE_LOOKUP_FAILED;
        }

        String prompt = "Term or question: " + question + "\n\nWhere it appears in the patient's records:\n" + sourceContext;
        try {
            String explanation = provider.complete(
                    GenerationRequest.text(Prompts.JARGON_EXPLAINER, List.of(ChatTurn.user(prompt)), 0.2, 400));
            return NodeOutcome.builder()
                    .rawResponse(explanation)
                    .jargonMap(List.of())
                    .build();
        } catch (GenerationException e) {
            log.warn("Jargon explanation failed session={}", state.sessionId(), e);
            return NodeOutcome.builder()
                    .toolError(e.getMessage())
                    .rawResponse(FAILURE_RESPONSE)
                    .build();
        }
    }
}
