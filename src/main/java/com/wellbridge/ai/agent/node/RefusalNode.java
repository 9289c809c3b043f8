package com.wellbridge.ai.agent.node;

import com.wellbridge.ai.agent.graph.AgentNode;
import com.wellbridge.ai.agent.state.NodeOutcome;
import com.wellbridge.ai.agent.state.TurnState;
import com.wellbridge.ai.records.NoteExcerpt;
import com.wellbridge.ai.records.RecordStore;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Terminal node for advice-seeking turns. Never calls the generation provider: the reply is a
 * fixed template, optionally followed by excerpts quoted verbatim from the patient's own notes.
 * {@code rawResponse} stays null so nothing on this path is ever generated text.
 */
public class RefusalNode implements AgentNode {

    private static final Logger log = LoggerFactory.getLogger(RefusalNode.class);

    public static final String REFUSAL_TEMPLATE =
            "I'm not able to give medical advice, diagnoses, or treatment recommendations. "
                    + "For medical concerns, please contact your care team directly.\n\n"
                    + "I found these notes from your care team that may be relevant:";

    public static final String NO_RECORDS_TEMPLATE =
            "I'm not able to give medical advice, diagnoses, or treatment recommendations. "
                    + "Please contact your care team directly for medical questions.";

    static final int MAX_FACTS = 3;

    private final RecordStore recordStore;

    public RefusalNode(RecordStore recordStore) {
        this.recordStore = recordStore;
    }

    @Override
    public NodeOutcome execute(TurnState state) {
        List<String> facts = new ArrayList<>();
        try {
            for (NoteExcerpt hit : recordStore.searchNotes(state.tenantId(), state.userId(), state.latestUserMessage(), MAX_FACTS)) {
                String excerpt = hit.excerpt() == null ? "" : hit.excerpt().trim();
                if (excerpt.isEmpty()) {
                    continue;
                }
                String provider = hit.providerName() == null || hit.providerName().isBlank() ? "Your care team" : hit.providerName();
                String date = hit.noteDate() == null ? "" : hit.noteDate().toString();
                facts.add(provider + " (" + date + "): " + excerpt);
            }
        } catch (RuntimeException e) {
            log.warn("Refusal context lookup failed session={}", state.sessionId(), e);
            facts.clear();
        }

        String response = facts.isEmpty()
                ? NO_RECORDS_TEMPLATE
                : REFUSAL_TEMPLATE + "\n\n" + facts.stream().map(f -> "  • " + f).collect(Collectors.joining("\n"));

        return NodeOutcome.builder()
                .rawResponse(null)
                .finalResponse(response)
                .refusalContextFacts(facts)
                .jargonMap(List.of())
                .build();
    }
}
