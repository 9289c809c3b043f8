package com.wellbridge.ai.agent.node;

import com.wellbridge.ai.agent.graph.AgentNode;
import com.wellbridge.ai.agent.jargon.JargonAnnotator;
import com.wellbridge.ai.agent.state.ActionCard;
import com.wellbridge.ai.agent.state.ChatTurn;
import com.wellbridge.ai.agent.state.NodeOutcome;
import com.wellbridge.ai.agent.state.PatientRecord;
import com.wellbridge.ai.agent.state.TurnState;
import com.wellbridge.ai.llm.GenerationException;
import com.wellbridge.ai.llm.GenerationProvider;
import com.wellbridge.ai.llm.GenerationRequest;
import com.wellbridge.ai.records.RecordStore;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Explains what the patient's recent notes say, in plain English, with jargon annotated.
 */
public class NoteExplainerNode implements AgentNode {

    private static final Logger log = LoggerFactory.getLogger(NoteExplainerNode.class);

    static final int RECORD_LIMIT = 5;

    static final String NO_RECORDS_RESPONSE =
            "I'd love to help you understand what your doctor said. I don't see any notes on file yet. "
                    + "If you upload your visit summary or clinical notes, I can walk you through them "
                    + "in plain language.";

    static final String FAILURE_RESPONSE =
            "I had trouble reading your notes just now. Please try again in a moment.";

    private final GenerationProvider provider;
    private final RecordStore recordStore;

    public NoteExplainerNode(GenerationProvider provider, RecordStore recordStore) {
        this.provider = provider;
        this.recordStore = recordStore;
    }

    @Override
    public NodeOutcome execute(TurnState state) {
        List<PatientRecord> records;
        try {
            records = recordStore.findRecentRecords(state.tenantId(), state.userId(), RECORD_LIMIT);
        } catch (RuntimeException e) {
            log.warn("Record fetch failed session={}", state.sessionId(), e);
            return NodeOutcome.builder()
                    .toolError(e.getMessage())
                    .rawResponse(FAILURE_RESPONSE)
                    .build();
        }

        if (records.isEmpty()) {
            return NodeOutcome.builder()
                    .records(records)
                    .rawResponse(NO_RECORDS_RESPONSE)
                    .actionCards(List.of(ActionCard.upload(
                            "upload_records",
                            "Upload your visit notes",
                            "Add a visit summary or clinical note so I can explain it")))
                    .build();
        }

        String prompt = "Patient's question: " + state.latestUserMessage()
                + "\n\nClinical notes:\n" + RecordFormatting.notesText(records, 3000);

        try {
            GroundedAnswer answer = provider.completeStructured(
                    GenerationRequest.json(Prompts.NOTE_EXPLANATION, List.of(ChatTurn.user(prompt)), 0.2, 1200),
                    GroundedAnswer.class);
            if (!answer.hasResponse()) {
                throw new GenerationException("explanation had no response text");
            }
            return NodeOutcome.builder()
                    .records(records)
                    .rawResponse(answer.response())
                    .jargonMap(JargonAnnotator.annotate(answer.response(), answer.jargonEntries()))
                    .build();
        } catch (GenerationException e) {
            log.warn("Note explanation failed session={}", state.sessionId(), e);
            return NodeOutcome.builder()
                    .records(records)
                    .toolError(e.getMessage())
                    .rawResponse(FAILURE_RESPONSE)
                    .build();
        }
    }
}
