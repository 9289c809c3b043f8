package com.wellbridge.ai.agent.node;

import com.wellbridge.ai.agent.graph.AgentNode;
import com.wellbridge.ai.agent.state.ActionCard;
import com.wellbridge.ai.agent.state.Appointment;
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
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes 3-5 information-seeking questions for the next visit. Grounded in the patient's notes,
 * or, when there are none, in what the conversation already covered.
 */
public class PreVisitPrepNode implements AgentNode {

    private static final Logger log = LoggerFactory.getLogger(PreVisitPrepNode.class);

    static final int RECORD_LIMIT = 5;
    static final int SUMMARY_MIN_CHARS = 100;
    static final int SUMMARY_MAX_CHARS = 1000;

    static final String INVITATION_RESPONSE =
            "I'd love to help you prepare for your next visit!\n\n"
                    + "I don't have any of your health records on file yet, but that's okay. "
                    + "I can still help you put together good questions.\n\n"
                    + "What health topics or concerns are you thinking about bringing up with your doctor? "
                    + "For example: a symptom you've been noticing, a diagnosis you received, "
                    + "a medication you have questions about, or anything else that's on your mind.";

    static final String RECORDS_FOOTER = "\n\n*These questions are based on your own records, not medical advice.*";
    static final String HISTORY_FOOTER =
            "\n\n*These questions are based on what you shared. Your doctor is the right person to answer them.*";

    static final String FETCH_FAILED_RESPONSE = "I had trouble retrieving your records. Please try again.";
    static final String FAILURE_RESPONSE = "I had trouble generating questions. Please try again.";

    private final GenerationProvider provider;
    private final RecordStore recordStore;

    public PreVisitPrepNode(GenerationProvider provider, RecordStore recordStore) {
        this.provider = provider;
        this.recordStore = recordStore;
    }

    @Override
    public NodeOutcome execute(TurnState state) {
        List<PatientRecord> records = state.records();
        List<Appointment> appointments = state.appointments();
        try {
            if (records.isEmpty()) {
                records = recordStore.findRecentRecords(state.tenantId(), state.userId(), RECORD_LIMIT);
            }
            if (appointments.isEmpty()) {
                appointments = recordStore.findUpcomingAppointments(state.tenantId(), state.userId(), 1);
            }
        } catch (RuntimeException e) {
            log.warn("Prep context fetch failed session={}", state.sessionId(), e);
            return NodeOutcome.builder()
                    .toolError(e.getMessage())
                    .rawResponse(FETCH_FAILED_RESPONSE)
                    .jargonMap(List.of())
                    .build();
        }

        String historyContext = records.isEmpty() ? historyContext(state.messages()) : "";
        if (records.isEmpty() && historyContext.isEmpty()) {
            return NodeOutcome.builder()
                    .records(List.of())
                    .rawResponse(INVITATION_RESPONSE)
                    .jargonMap(List.of())
                    .actionCards(List.of(ActionCard.upload(
                            "upload_records",
                            "Upload a health record",
                            "Add a visit note or lab result so I can tailor your questions to your actual care")))
                    .build();
        }

        String appointmentLine;
        String preamble;
        if (!appointments.isEmpty()) {
            Appointment next = appointments.get(0);
            String provider = next.providerOr("your doctor");
            appointmentLine = "Upcoming appointment: " + provider + " on " + next.dateText();
            preamble = "Here are questions to consider asking " + provider + " on " + next.dateText() + ":\n\n";
        } else {
            appointmentLine = "No scheduled appointment found. Questions are for the patient's next visit.";
            preamble = records.isEmpty()
                    ? "Here are some questions to consider bringing to your next visit, based on what you mentioned:\n\n"
                    : "Here are questions to bring up at your next visit:\n\n";
        }

        String material = records.isEmpty()
                ? "[From recent conversation]\n" + historyContext
                : RecordFormatting.notesText(records.subList(0, Math.min(RECORD_LIMIT, records.size())), 500);
        String prompt = appointmentLine + "\n\nRecords:\n" + material;

        try {
            PrepQuestions prep = provider.completeStructured(
                    GenerationRequest.json(Prompts.PRE_VISIT_PREP, List.of(ChatTurn.user(prompt)), 0.3, 600),
                    PrepQuestions.class);
            if (!prep.isValid()) {
                throw new GenerationException("expected 3 to 5 questions");
            }

            List<String> numbered = new ArrayList<>();
            for (int i = 0; i < prep.questions().size(); i++) {
                numbered.add((i + 1) + ". " + prep.questions().get(i).trim());
            }
            String response = preamble + String.join("\n", numbered)
                    + (records.isEmpty() ? HISTORY_FOOTER : RECORDS_FOOTER);

            return NodeOutcome.builder()
                    .records(records)
                    .appointments(appointments)
                    .rawResponse(response)
                    .jargonMap(List.of())
                    .build();
        } catch (GenerationException e) {
            log.warn("Prep question generation failed session={}", state.sessionId(), e);
            return NodeOutcome.builder()
                    .toolError(e.getMessage())
                    .rawResponse(FAILURE_RESPONSE)
                    .jargonMap(List.of())
                    .build();
        }
    }

    /**
     * The latest substantial assistant reply, or failing that the patient's own recent messages.
     */
    static String historyContext(List<ChatTurn> messages) {
        for (int i = messages.size() - 1; i >= 0; i--) {
            ChatTurn turn = messages.get(i);
            if (!turn.isUser() && turn.content() != null && turn.content().length() > SUMMARY_MIN_CHARS) {
                return RecordFormatting.truncate(turn.content(), SUMMARY_MAX_CHARS);
            }
        }

        List<String> stated = messages.subList(Math.max(0, messages.size() - 6), messages.size()).stream()
                .filter(ChatTurn::isUser)
                .map(ChatTurn::content)
                .filter(c -> c != null && c.length() > 10)
                .collect(Collectors.toList());
        if (stated.isEmpty()) {
            return "";
        }
        return "Patient-stated concerns:\n" + String.join("\n", stated.subList(Math.max(0, stated.size() - 3), stated.size()));
    }
}
