package com.wellbridge.ai.api;

public record ChatRequest(String sessionId, String message) {}
