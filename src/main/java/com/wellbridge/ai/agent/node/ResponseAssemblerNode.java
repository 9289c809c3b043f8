package com.wellbridge.ai.agent.node;

import com.wellbridge.ai.agent.graph.AgentNode;
import com.wellbridge.ai.agent.state.ActionCard;
import com.wellbridge.ai.agent.state.ChatTurn;
import com.wellbridge.ai.agent.state.Intent;
import com.wellbridge.ai.agent.state.NodeOutcome;
import com.wellbridge.ai.agent.state.TurnState;
import com.wellbridge.ai.llm.GenerationException;
import com.wellbridge.ai.llm.GenerationProvider;
import com.wellbridge.ai.llm.GenerationRequest;
import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Last node on every non-refusal path. Guarantees a final response and attaches quick replies;
 * the jargon map and action cards pass through untouched.
 */
public class ResponseAssemblerNode implements AgentNode {

    private static final Logger log = LoggerFactory.getLogger(ResponseAssemblerNode.class);

    public static final String DEFAULT_RESPONSE = "I'm sorry, I wasn't able to process that. Please try again.";

    static final int MAX_REPLIES = 3;
    static final int MAX_REPLY_CHARS = 60;

    record Suggestions(List<String> replies) {}

    private final GenerationProvider provider;

    public ResponseAssemblerNode(GenerationProvider provider) {
        this.provider = provider;
    }

    @Override
    public NodeOutcome execute(TurnState state) {
        String response = state.finalResponse() == null || state.finalResponse().isBlank()
                ? DEFAULT_RESPONSE
                : state.finalResponse();

        return NodeOutcome.builder()
                .finalResponse(response)
                .suggestedReplies(suggestions(state, response))
                .build();
    }

    private List<String> suggestions(TurnState state, String response) {
        String context = "Assistant response: " + RecordFormatting.truncate(response, 600)
                + "\nPatient's message: " + state.latestUserMessage()
                + "\nIntent: " + (state.intent() == null ? "unknown" : state.intent().name())
                + "\nCare stage: " + state.careStage().wireName()
                + "\nHas records on file: " + !state.records().isEmpty()
                + "\nAction options shown: " + state.actionCards().stream().map(ActionCard::label).collect(Collectors.joining(", "));
        try {
            Suggestions suggestions = provider.completeStructured(
                    GenerationRequest.json(Prompts.SUGGESTED_REPLIES, List.of(ChatTurn.user(context)), 0.5, 150),
                    Suggestions.class);
            List<String> replies = suggestions.replies() == null ? List.of() : suggestions.replies().stream()
                    .filter(r -> r != null && !r.isBlank() && r.length() <= MAX_REPLY_CHARS)
                    .map(String::trim)
                    .limit(MAX_REPLIES)
                    .collect(Collectors.toList());
            if (!replies.isEmpty()) {
                return replies;
            }
        } catch (GenerationException e) {
            log.warn("Suggested replies failed session={}, using fallback", state.sessionId(), e);
        }
        return state.suggestedReplies().isEmpty() ? staticReplies(state.intent()) : state.suggestedReplies();
    }

    static List<String> staticReplies(Intent intent) {
        if (intent == null) {
            return List.of("What can WellBridge help me with?", "Can you summarize my recent records?");
        }
        return switch (intent) {
            case NOTE_EXPLANATION, RECORD_LOOKUP -> List.of("What does that term mean?",
                    "Help me prepare questions for my doctor", "Summarize my other records");
            case JARGON_EXPLAIN -> List.of("Where is that in my notes?", "Explain another term");
            case PRE_VISIT_PREP -> List.of("Add another question", "When is my next appointment?");
            case SCHEDULING -> List.of("Help me prepare for this visit", "What did my last visit note say?");
            case RECORD_COLLECTION -> List.of("I uploaded it, can you explain it?", "How do I request my records?");
            default -> List.of("Can you summarize my recent records?", "Help me prepare for my next visit",
                    "What can WellBridge help me with?");
        };
    }
}
