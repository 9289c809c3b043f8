package com.wellbridge.ai.agent.node;

import com.wellbridge.ai.agent.state.Intent;

public record IntentResult(
        Intent intent,
        double confidence,
        String reasoning
) {}
