package com.wellbridge.ai.agent.state;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Partial update returned by one node. Only fields that were explicitly set are applied by
 * {@link TurnState#merge(TurnState, NodeOutcome)}; a field set to {@code null} clears it.
 *
 * <p>Identity fields have no setter here, so no node can ever emit one.
 */
public final class NodeOutcome {

    enum Field {
        CLASSIFICATION,
        EMOTIONAL_STATE,
        CARE_STAGE,
        CARE_FACTS,
        MESSAGES,
        RECORDS,
        APPOINTMENTS,
        TOOL_ERROR,
        RAW_RESPONSE,
        FINAL_RESPONSE,
        JARGON_MAP,
        ACTION_CARDS,
        SUGGESTED_REPLIES,
        REFUSAL_CONTEXT_FACTS
    }

    record Classification(Intent intent, double confidence) {}

    private static final NodeOutcome EMPTY = new NodeOutcome(new EnumMap<>(Field.class));

    private final Map<Field, Object> updates;

    private NodeOutcome(EnumMap<Field, Object> updates) {
        this.updates = Collections.unmodifiableMap(updates);
    }

    public static NodeOutcome empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isEmpty() {
        return updates.isEmpty();
    }

    boolean has(Field field) {
        return updates.containsKey(field);
    }

    @SuppressWarnings("unchecked")
    <T> T get(Field field) {
        return (T) updates.get(field);
    }

    public boolean setsRawResponse() {
        return has(Field.RAW_RESPONSE);
    }

    public String rawResponse() {
        return get(Field.RAW_RESPONSE);
    }

    public boolean setsFinalResponse() {
        return has(Field.FINAL_RESPONSE);
    }

    public String finalResponse() {
        return get(Field.FINAL_RESPONSE);
    }

    public boolean setsJargonMap() {
        return has(Field.JARGON_MAP);
    }

    public List<JargonMapping> jargonMap() {
        return get(Field.JARGON_MAP);
    }

    public String toolError() {
        return get(Field.TOOL_ERROR);
    }

    public List<ActionCard> actionCards() {
        return get(Field.ACTION_CARDS);
    }

    public List<String> suggestedReplies() {
        return get(Field.SUGGESTED_REPLIES);
    }

    @Override
    public String toString() {
        return "NodeOutcome" + updates.keySet();
    }

    public static final class Builder {

        private final EnumMap<Field, Object> updates = new EnumMap<>(Field.class);

        private Builder() {}

        public Builder classification(Intent intent, double confidence) {
            if (confidence < 0.0 || confidence > 1.0 || Double.isNaN(confidence)) {
                throw new IllegalArgumentException("confidence out of range: " + confidence);
            }
            updates.put(Field.CLASSIFICATION, new Classification(intent, confidence));
            return this;
        }

        public Builder emotionalState(EmotionalState emotionalState) {
            updates.put(Field.EMOTIONAL_STATE, Objects.requireNonNull(emotionalState));
            return this;
        }

        public Builder careStage(CareStage careStage) {
            updates.put(Field.CARE_STAGE, Objects.requireNonNull(careStage));
            return this;
        }

        /** Facts to union into the accumulated care context. */
        public Builder careFacts(List<String> facts) {
            updates.put(Field.CARE_FACTS, List.copyOf(facts));
            return this;
        }

        /** Messages to append to the conversation. */
        public Builder appendMessages(List<ChatTurn> messages) {
            updates.put(Field.MESSAGES, List.copyOf(messages));
            return this;
        }

        public Builder records(List<PatientRecord> records) {
            updates.put(Field.RECORDS, List.copyOf(records));
            return this;
        }

        public Builder appointments(List<Appointment> appointments) {
            updates.put(Field.APPOINTMENTS, List.copyOf(appointments));
            return this;
        }

        public Builder toolError(String toolError) {
            updates.put(Field.TOOL_ERROR, toolError);
            return this;
        }

        public Builder rawResponse(String rawResponse) {
            updates.put(Field.RAW_RESPONSE, rawResponse);
            return this;
        }

        public Builder finalResponse(String finalResponse) {
            updates.put(Field.FINAL_RESPONSE, finalResponse);
            return this;
        }

        public Builder jargonMap(List<JargonMapping> jargonMap) {
            updates.put(Field.JARGON_MAP, List.copyOf(jargonMap));
            return this;
        }

        public Builder actionCards(List<ActionCard> actionCards) {
            updates.put(Field.ACTION_CARDS, List.copyOf(actionCards));
            return this;
        }

        public Builder suggestedReplies(List<String> suggestedReplies) {
            updates.put(Field.SUGGESTED_REPLIES, List.copyOf(suggestedReplies));
            return this;
        }

        public Builder refusalContextFacts(List<String> facts) {
            updates.put(Field.REFUSAL_CONTEXT_FACTS, List.copyOf(facts));
            return this;
        }

        public NodeOutcome build() {
            return new NodeOutcome(new EnumMap<>(updates));
        }
    }
}
