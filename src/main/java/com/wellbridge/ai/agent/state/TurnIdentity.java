package com.wellbridge.ai.agent.state;

import java.util.Objects;

/**
 * Who a turn belongs to. Fixed at graph entry; no node can change it.
 */
public record TurnIdentity(
        String tenantId,
        String userId,
        String role,
        String sessionId
) {
    public TurnIdentity {
        Objects.requireNonNull(tenantId, "tenantId");
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(sessionId, "sessionId");
    }
}
