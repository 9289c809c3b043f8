package com.wellbridge.ai.agent.state;

import java.util.Map;

/**
 * Interactive prompt rendered next to the response text.
 */
public record ActionCard(
        String id,
        ActionCardType type,
        String label,
        String description,
        Map<String, Object> payload
) {
    public ActionCard {
        payload = payload == null ? Map.of() : Map.copyOf(payload);
    }

    public static ActionCard upload(String id, String label, String description) {
        return new ActionCard(id, ActionCardType.UPLOAD, label, description, Map.of());
    }
}
