package com.wellbridge.ai.api;

/**
 * Caller identity taken from the verified access token.
 */
public record TenantContext(String tenantId, String userId, String role) {}
