package com.wellbridge.ai.agent.node;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.wellbridge.ai.agent.graph.AgentNode;
import com.wellbridge.ai.agent.state.CareStage;
import com.wellbridge.ai.agent.state.ChatTurn;
import com.wellbridge.ai.agent.state.EmotionalState;
import com.wellbridge.ai.agent.state.NodeOutcome;
import com.wellbridge.ai.agent.state.TurnState;
import com.wellbridge.ai.llm.GenerationException;
import com.wellbridge.ai.llm.GenerationProvider;
import com.wellbridge.ai.llm.GenerationRequest;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * First node of every turn: reads emotional state and care stage, and extracts new care facts so
 * later turns never have to ask again.
 */
public class EmotionalAssessorNode implements AgentNode {

    private static final Logger log = LoggerFactory.getLogger(EmotionalAssessorNode.class);

    record Assessment(
            @JsonProperty("emotional_state") String emotionalState,
            @JsonProperty("care_stage") String careStage,
            @JsonProperty("new_facts") List<String> newFacts
    ) {}

    private final GenerationProvider provider;

    public EmotionalAssessorNode(GenerationProvider provider) {
        this.provider = provider;
    }

    @Override
    public NodeOutcome execute(TurnState state) {
        List<ChatTurn> recent = state.messages().subList(Math.max(0, state.messages().size() - 4), state.messages().size());
        String snippet = recent.stream()
                .map(turn -> turn.role().name().toUpperCase(Locale.ROOT) + ": " + turn.content())
                .collect(Collectors.joining("\n"));

        Assessment assessment;
        try {
            assessment = provider.completeStructured(GenerationRequest.json(
                    Prompts.EMOTIONAL_ASSESSOR,
                    List.of(ChatTurn.user("Conversation so far:\n" + snippet
                            + "\n\nAssess the patient's emotional state and extract care context.")),
                    0.1,
                    300), Assessment.class);
        } catch (GenerationException e) {
            log.warn("Emotional assessment failed session={}, keeping current context", state.sessionId(), e);
            return NodeOutcome.empty();
        }

        CareStage assessedStage = CareStage.fromWireName(assessment.careStage());
        List<String> facts = assessment.newFacts() == null ? List.of() : assessment.newFacts().stream()
                .filter(f -> f != null && !f.isBlank())
                .map(String::trim)
                .collect(Collectors.toList());

        return NodeOutcome.builder()
                .emotionalState(EmotionalState.fromWireName(assessment.emotionalState(), state.emotionalState()))
                .careStage(assessedStage == CareStage.UNKNOWN ? state.careStage() : assessedStage)
                .careFacts(facts)
                .build();
    }
}
