package com.wellbridge.ai.agent.node;

import com.wellbridge.ai.agent.graph.AgentNode;
import com.wellbridge.ai.agent.state.ChatTurn;
import com.wellbridge.ai.agent.state.NodeOutcome;
import com.wellbridge.ai.agent.state.TurnState;
import com.wellbridge.ai.llm.GenerationException;
import com.wellbridge.ai.llm.GenerationProvider;
import com.wellbridge.ai.llm.GenerationRequest;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Label-level medication description. Part of the topology but no intent routes here yet;
 * medication questions about prescribed drugs are handled as note explanations.
 */
public class MedicationInfoNode implements AgentNode {

    private static final Logger log = LoggerFactory.getLogger(MedicationInfoNode.class);

    static final String DISCLAIMER =
            "This is general information from the drug's labeling. Your pharmacist or doctor can tell you "
                    + "how it applies to you.";

    static final String FAILURE_RESPONSE =
            "I couldn't look up that medication right now. Your pharmacist is a great resource for questions like this.";

    private final GenerationProvider provider;

    public MedicationInfoNode(GenerationProvider provider) {
        this.provider = provider;
    }

    @Override
    public NodeOutcome execute(TurnState state) {
        try {
            String description = provider.complete(GenerationRequest.text(
                    Prompts.MEDICATION_INFO,
                    List.of(ChatTurn.user("Medication question: " + state.latestUserMessage())),
                    0.1,
                    350));
            return NodeOutcome.builder()
                    .rawResponse(description.trim() + "\n\n" + DISCLAIMER)
                    .build();
        } catch (GenerationException e) {
            log.warn("Medication lookup failed session={}", state.sessionId(), e);
            return NodeOutcome.builder()
                    .toolError(e.getMessage())
                    .rawResponse(FAILURE_RESPONSE)
                    .build();
        }
    }
}
