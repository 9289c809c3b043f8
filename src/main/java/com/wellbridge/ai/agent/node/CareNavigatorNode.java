package com.wellbridge.ai.agent.node;

import com.wellbridge.ai.agent.graph.AgentNode;
import com.wellbridge.ai.agent.state.ActionCard;
import com.wellbridge.ai.agent.state.Appointment;
import com.wellbridge.ai.agent.state.CareStage;
import com.wellbridge.ai.agent.state.ChatTurn;
import com.wellbridge.ai.agent.state.NodeOutcome;
import com.wellbridge.ai.agent.state.PatientRecord;
import com.wellbridge.ai.agent.state.TurnState;
import com.wellbridge.ai.llm.GenerationException;
import com.wellbridge.ai.llm.GenerationProvider;
import com.wellbridge.ai.llm.GenerationRequest;
import com.wellbridge.ai.records.RecordStore;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Empathetic default node. Also receives every low-confidence safe turn and every failed
 * classification, so it must answer sensibly for any message.
 */
public class CareNavigatorNode implements AgentNode {

    private static final Logger log = LoggerFactory.getLogger(CareNavigatorNode.class);

    private static final Pattern DOCUMENT_WORDS = Pattern.compile(
            "\\b(note|notes|letter|report|discharge|summary|paperwork|document|papers|"
                    + "prescription|results?|scan|lab|form|records?)\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern POSSESSION_WORDS = Pattern.compile(
            "\\b(gave|given|got|received|have|has|here|bring|brought|upload|photo|photograph|"
                    + "picture|don'?t understand|can'?t read|summarize|explain|help me|help with)\\b",
            Pattern.CASE_INSENSITIVE);

    static final String DOCUMENT_RESPONSE =
            "Of course, I'd love to help you make sense of it.\n\n"
                    + "You can photograph or scan the note and upload it here. "
                    + "Once I have it, I'll go through everything step by step: "
                    + "what the doctor documented, what any prescriptions are for, "
                    + "any follow-up appointments, and any terms that might be confusing.\n\n"
                    + "Would you like to upload it now?";

    static final String FALLBACK_RESPONSE =
            "I'm here. What's going on? Did something happen at your appointment, "
            + "or is there something you'd like help understanding?";

    static final List<String> REPLIES_WITHOUT_RECORDS = List.of(
            "I have a note from my doctor to share",
            "What can WellBridge help me with?",
            "Tell me more about how this works");

    static final List<String> REPLIES_WITH_RECORDS = List.of(
            "What questions should I ask my doctor?",
            "Can you summarize my recent records?",
            "What should I focus on next?");

    private final GenerationProvider provider;
    private final RecordStore recordStore;

    public CareNavigatorNode(GenerationProvider provider, RecordStore recordStore) {
        this.provider = provider;
        this.recordStore = recordStore;
    }

    static boolean mentionsDocument(String message) {
        return DOCUMENT_WORDS.matcher(message).find() && POSSESSION_WORDS.matcher(message).find();
    }

    @Override
    public NodeOutcome execute(TurnState state) {
        String message = state.latestUserMessage();

        if (mentionsDocument(message)) {
            return NodeOutcome.builder()
                    .rawResponse(DOCUMENT_RESPONSE)
                    .actionCards(List.of(ActionCard.upload(
                            "upload_note",
                            "Upload your note or letter",
                            "Photograph or scan the document and I'll explain it in plain language")))
                    .jargonMap(List.of())
                    .build();
        }

        List<PatientRecord> records = state.records();
        List<Appointment> appointments = state.appointments();
        try {
            records = recordStore.findRecentRecords(state.tenantId(), state.userId(), 3);
            appointments = recordStore.findUpcomingAppointments(state.tenantId(), state.userId(), 1);
        } catch (RuntimeException e) {
            log.warn("Care context fetch failed session={}, continuing without it", state.sessionId(), e);
        }

        String system = Prompts.CARE_NAVIGATOR + "\nCURRENT CONTEXT:\n" + contextBlock(state, records, appointments);
        List<ChatTurn> turns = new ArrayList<>(state.recentPriorMessages(6));
        turns.add(ChatTurn.user(message));

        String response;
        try {
            response = provider.complete(GenerationRequest.text(system, turns, 0.4, 500));
        } catch (GenerationException e) {
            log.warn("Care navigation generation failed session={}", state.sessionId(), e);
            response = FALLBACK_RESPONSE;
        }

        List<ActionCard> cards = new ArrayList<>();
        if (records.isEmpty() && CareStage.HOLDS_PAPERWORK.contains(state.careStage())) {
            cards.add(ActionCard.upload(
                    "upload_note",
                    "Upload a note or letter",
                    "Share any paperwork from your visit and I'll help explain it"));
        }

        return NodeOutcome.builder()
                .records(records)
                .appointments(appointments)
                .rawResponse(response)
                .actionCards(cards)
                .suggestedReplies(records.isEmpty() ? REPLIES_WITHOUT_RECORDS : REPLIES_WITH_RECORDS)
                .jargonMap(List.of())
                .build();
    }

    static String contextBlock(TurnState state, List<PatientRecord> records, List<Appointment> appointments) {
        List<String> parts = new ArrayList<>();
        parts.add("Patient emotional state: " + state.emotionalState().wireName());
        parts.add("Care stage: " + state.careStage().wireName());
        if (!state.careFacts().isEmpty()) {
            parts.add("Known facts from conversation: " + String.join("; ", state.careFacts()));
        }
        if (records.isEmpty()) {
            parts.add("No records found in the patient's profile yet.");
        } else {
            StringBuilder recent = new StringBuilder("Recent records:");
            for (PatientRecord r : records.subList(0, Math.min(3, records.size()))) {
                recent.append("\n[").append(r.noteDateText()).append(", ").append(r.providerOr("unknown provider"))
                        .append("]: ").append(RecordFormatting.truncate(r.contentOrEmpty(), 200));
            }
            parts.add(recent.toString());
        }
        if (!appointments.isEmpty()) {
            Appointment next = appointments.get(0);
            parts.add("Next appointment: " + next.providerOr("unknown") + " on " + next.dateText());
        }
        return String.join("\n", parts);
    }
}
