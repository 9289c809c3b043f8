package com.wellbridge.ai.memory;

import com.wellbridge.ai.agent.state.ChatTurn;
import java.util.List;

/**
 * Persisted chat history, keyed by tenant and session.
 */
public interface ConversationHistoryStore {
  /** Up to {@code limit} most recent turns, oldest first. */
  List<ChatTurn> recent(String tenantId, String sessionId, int limit);
  void append(String tenantId, String sessionId, ChatTurn turn);
}
