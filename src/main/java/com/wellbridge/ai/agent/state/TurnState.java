package com.wellbridge.ai.agent.state;

import com.wellbridge.ai.agent.state.NodeOutcome.Classification;
import com.wellbridge.ai.agent.state.NodeOutcome.Field;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Everything one conversational turn knows. Created at graph entry, threaded through every node
 * by {@link #merge(TurnState, NodeOutcome)} and dropped after the turn is delivered.
 *
 * <p>{@code rawResponse} is the pre-guardrail text; only {@code finalResponse} ever leaves the turn.
 */
public record TurnState(
        TurnIdentity identity,
        List<ChatTurn> messages,
        Intent intent,
        double confidence,
        boolean classified,
        EmotionalState emotionalState,
        CareStage careStage,
        Set<String> careFacts,
        List<PatientRecord> records,
        List<Appointment> appointments,
        String toolError,
        String rawResponse,
        String finalResponse,
        List<JargonMapping> jargonMap,
        List<ActionCard> actionCards,
        List<String> suggestedReplies,
        List<String> refusalContextFacts
) {

    public TurnState {
        Objects.requireNonNull(identity, "identity");
        messages = List.copyOf(messages);
        careFacts = Collections.unmodifiableSet(new LinkedHashSet<>(careFacts));
        records = List.copyOf(records);
        appointments = List.copyOf(appointments);
        jargonMap = List.copyOf(jargonMap);
        actionCards = List.copyOf(actionCards);
        suggestedReplies = List.copyOf(suggestedReplies);
        refusalContextFacts = List.copyOf(refusalContextFacts);
    }

    /**
     * Entry state for a turn: prior history followed by the inbound message.
     */
    public static TurnState initial(TurnIdentity identity, List<ChatTurn> history, String message) {
        List<ChatTurn> messages = new ArrayList<>(history);
        messages.add(ChatTurn.user(message));
        return new TurnState(
                identity,
                messages,
                null,
                0.0,
                false,
                EmotionalState.CALM,
                CareStage.UNKNOWN,
                Set.of(),
                List.of(),
                List.of(),
                null,
                null,
                null,
                List.of(),
                List.of(),
                List.of(),
                List.of());
    }

    /**
     * Applies {@code outcome} on top of {@code base}. Last writer wins per field, except care facts
     * (unioned, insertion order kept) and messages (appended). Intent and confidence can be written
     * once per turn.
     */
    public static TurnState merge(TurnState base, NodeOutcome outcome) {
        if (outcome.isEmpty()) {
            return base;
        }

        Intent intent = base.intent;
        double confidence = base.confidence;
        boolean classified = base.classified;
        if (outcome.has(Field.CLASSIFICATION)) {
            if (base.classified) {
                throw new IllegalStateException("intent and confidence are already set for this turn");
            }
            Classification classification = outcome.get(Field.CLASSIFICATION);
            intent = classification.intent();
            confidence = classification.confidence();
            classified = true;
        }

        List<ChatTurn> messages = base.messages;
        if (outcome.has(Field.MESSAGES)) {
            messages = new ArrayList<>(base.messages);
            messages.addAll(outcome.get(Field.MESSAGES));
        }

        Set<String> careFacts = base.careFacts;
        if (outcome.has(Field.CARE_FACTS)) {
            careFacts = new LinkedHashSet<>(base.careFacts);
            careFacts.addAll(outcome.<List<String>>get(Field.CARE_FACTS));
        }

        return new TurnState(
                base.identity,
                messages,
                intent,
                confidence,
                classified,
                pick(outcome, Field.EMOTIONAL_STATE, base.emotionalState),
                pick(outcome, Field.CARE_STAGE, base.careStage),
                careFacts,
                pick(outcome, Field.RECORDS, base.records),
                pick(outcome, Field.APPOINTMENTS, base.appointments),
                pick(outcome, Field.TOOL_ERROR, base.toolError),
                pick(outcome, Field.RAW_RESPONSE, base.rawResponse),
                pick(outcome, Field.FINAL_RESPONSE, base.finalResponse),
                pick(outcome, Field.JARGON_MAP, base.jargonMap),
                pick(outcome, Field.ACTION_CARDS, base.actionCards),
                pick(outcome, Field.SUGGESTED_REPLIES, base.suggestedReplies),
                pick(outcome, Field.REFUSAL_CONTEXT_FACTS, base.refusalContextFacts));
    }

    private static <T> T pick(NodeOutcome outcome, Field field, T current) {
        return outcome.has(field) ? outcome.get(field) : current;
    }

    public String tenantId() {
        return identity.tenantId();
    }

    public String userId() {
        return identity.userId();
    }

    public String role() {
        return identity.role();
    }

    public String sessionId() {
        return identity.sessionId();
    }

    /** The inbound message this turn answers. */
    public String latestUserMessage() {
        if (messages.isEmpty()) {
            return "";
        }
        String content = messages.get(messages.size() - 1).content();
        return content == null ? "" : content;
    }

    /** Messages before the inbound one, oldest first. */
    public List<ChatTurn> priorMessages() {
        return messages.isEmpty() ? List.of() : messages.subList(0, messages.size() - 1);
    }

    /** The last {@code n} prior messages, oldest first. */
    public List<ChatTurn> recentPriorMessages(int n) {
        List<ChatTurn> prior = priorMessages();
        return prior.subList(Math.max(0, prior.size() - n), prior.size());
    }
}
