package com.wellbridge.ai.agent.node;

import com.wellbridge.ai.agent.graph.AgentNode;
import com.wellbridge.ai.agent.state.ActionCard;
import com.wellbridge.ai.agent.state.ActionCardType;
import com.wellbridge.ai.agent.state.ChatTurn;
import com.wellbridge.ai.agent.state.NodeOutcome;
import com.wellbridge.ai.agent.state.TurnState;
import com.wellbridge.ai.llm.GenerationException;
import com.wellbridge.ai.llm.GenerationProvider;
import com.wellbridge.ai.llm.GenerationRequest;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Acknowledges information the patient has not stored yet and offers at most two ways to capture it.
 */
public class RecordCollectorNode implements AgentNode {

    private static final Logger log = LoggerFactory.getLogger(RecordCollectorNode.class);

    static final int MAX_CARDS = 2;

    private static final List<String> DOCUMENT_WORDS = List.of(
            "letter", "report", "scan", "result", "document", "pdf",
            "image", "photo", "form", "paperwork", "discharge");
    private static final List<String> VISIT_WORDS = List.of(
            "appointment", "visit", "saw", "doctor", "hospital", "clinic",
            "just came from", "just got back", "just had");
    private static final List<String> MEDICATION_WORDS = List.of(
            "prescription", "medication", "medicine", "drug", "pill",
            "started taking", "prescribed");

    static final String EMAIL_TEMPLATE =
            "Dear [Provider/Records Department],\n\n"
                    + "I am requesting a copy of my medical records, including visit notes, "
                    + "lab results, and any imaging reports from my recent visit.\n\n"
                    + "Please send records to me at [your email address].\n\n"
                    + "Thank you,\n[Your name]\nDate of Birth: [DOB]";

    static final String FALLBACK_RESPONSE =
            "I'd love to help you keep everything organized. "
                    + "You can share any documents or notes from your care team "
                    + "and I'll help you understand and remember what they say.";

    private final GenerationProvider provider;

    public RecordCollectorNode(GenerationProvider provider) {
        this.provider = provider;
    }

    static List<ActionCard> inferCards(String message) {
        String lower = message.toLowerCase(Locale.ROOT);
        List<ActionCard> cards = new ArrayList<>();

        if (containsAny(lower, DOCUMENT_WORDS) || containsAny(lower, VISIT_WORDS)) {
            cards.add(ActionCard.upload(
                    "upload_document",
                    "Upload a document",
                    "Photo, PDF, or scan. I'll help you understand it"));
        }
        if (containsAny(lower, MEDICATION_WORDS) && cards.size() < MAX_CARDS) {
            cards.add(new ActionCard(
                    "add_medication",
                    ActionCardType.LINK,
                    "Add medication to your records",
                    "I'll store it and explain what it is",
                    Map.of("href", "/records/new?type=prescription")));
        }
        if (cards.size() < MAX_CARDS) {
            cards.add(new ActionCard(
                    "request_records_email",
                    ActionCardType.EMAIL,
                    "Request records by email",
                    "I'll generate a template you can send to your provider",
                    Map.of("template", EMAIL_TEMPLATE)));
        }
        return cards;
    }

    private static boolean containsAny(String text, List<String> words) {
        return words.stream().anyMatch(text::contains);
    }

    @Override
    public NodeOutcome execute(TurnState state) {
        String message = state.latestUserMessage();
        List<ActionCard> cards = inferCards(message);

        String system = Prompts.RECORD_COLLECTOR
                + "\nCONTEXT:\nPatient emotional state: " + state.emotionalState().wireName()
                + "\nKnown facts: " + (state.careFacts().isEmpty() ? "none yet" : String.join("; ", state.careFacts()))
                + "\nAction options being shown: " + cards.stream().map(ActionCard::label).collect(Collectors.joining(", "));

        List<ChatTurn> turns = new ArrayList<>(state.recentPriorMessages(4));
        turns.add(ChatTurn.user(message));

        String response;
        try {
            response = provider.complete(GenerationRequest.text(system, turns, 0.3, 200));
        } catch (GenerationException e) {
            log.warn("Record collection generation failed session={}", state.sessionId(), e);
            response = FALLBACK_RESPONSE;
        }

        return NodeOutcome.builder()
                .rawResponse(response)
                .actionCards(cards)
                .jargonMap(List.of())
                .build();
    }
}
