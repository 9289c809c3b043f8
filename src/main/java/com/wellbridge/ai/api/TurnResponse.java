package com.wellbridge.ai.api;

import com.wellbridge.ai.agent.state.ActionCard;
import com.wellbridge.ai.agent.state.Intent;
import com.wellbridge.ai.agent.state.JargonMapping;
import java.util.List;

/**
 * What a finished turn hands to the transport: only guardrail-approved text leaves the turn.
 */
public record TurnResponse(
        String finalResponse,
        Intent intent,
        List<JargonMapping> jargonMap,
        List<ActionCard> actionCards,
        List<String> suggestedReplies
) {}
