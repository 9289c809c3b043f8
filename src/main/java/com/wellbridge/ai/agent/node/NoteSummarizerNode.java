package com.wellbridge.ai.agent.node;

import com.wellbridge.ai.agent.graph.AgentNode;
import com.wellbridge.ai.agent.jargon.JargonAnnotator;
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
 * Plain-language summary of the patient's recent notes. Handles {@code GENERAL} turns.
 */
public class NoteSummarizerNode implements AgentNode {

    private static final Logger log = LoggerFactory.getLogger(NoteSummarizerNode.class);

    static final int RECORD_LIMIT = 5;

    static final String NO_RECORDS_RESPONSE =
            "I don't see any records on file yet. You can upload documents in the Records section.";

    static final String FAILURE_RESPONSE =
            "I wasn't able to summarize your notes right now. Please try again in a moment.";

    private final GenerationProvider provider;
    private final RecordStore recordStore;

    public NoteSummarizerNode(GenerationProvider provider, RecordStore recordStore) {
        this.provider = provider;
        this.recordStore = recordStore;
    }

    @Override
    public NodeOutcome execute(TurnState state) {
        List<PatientRecord> records = state.records();
        if (records.isEmpty()) {
            try {
                records = recordStore.findRecentRecords(state.tenantId(), state.userId(), RECORD_LIMIT);
            } catch (RuntimeException e) {
                log.warn("Record fetch failed session={}", state.sessionId(), e);
                return NodeOutcome.builder()
                        .toolError(e.getMessage())
                        .rawResponse(FAILURE_RESPONSE)
                        .build();
            }
        }

        if (records.isEmpty()) {
            return NodeOutcome.builder()
                    .rawResponse(NO_RECORDS_RESPONSE)
                    .build();
        }

        String prompt = "Patient's message: " + state.latestUserMessage()
                + "\n\nNotes to summarize:\n" + RecordFormatting.notesText(records, 2000);

        try {
            GroundedAnswer answer = provider.completeStructured(
                    GenerationRequest.json(Prompts.NOTE_SUMMARIZER, List.of(ChatTurn.user(prompt)), 0.2, 1000),
                    GroundedAnswer.class);
            if (!answer.hasResponse()) {
                throw new GenerationException("summary had no text");
            }
            return NodeOutcome.builder()
                    .records(records)
                    .rawResponse(answer.response())
                    .jargonMap(JargonAnnotator.annotate(answer.response(), answer.jargonEntries()))
                    .build();
        } catch (GenerationException e) {
            log.warn("Note summary failed session={}", state.sessionId(), e);
            return NodeOutcome.builder()
                    .records(records)
                    .toolError(e.getMessage())
                    .rawResponse(FAILURE_RESPONSE)
                    .build();
        }
    }
}
