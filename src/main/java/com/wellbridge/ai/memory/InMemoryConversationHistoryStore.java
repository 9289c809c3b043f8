package com.wellbridge.ai.memory;

import com.wellbridge.ai.agent.state.ChatTurn;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Process-local history. Each session keeps at most {@code maxMessages} turns, and once more than
 * {@code maxSessions} sessions exist the least recently used one is dropped.
 */
public class InMemoryConversationHistoryStore implements ConversationHistoryStore {

  static final int DEFAULT_MAX_MESSAGES = 50;
  static final int DEFAULT_MAX_SESSIONS = 10_000;

  private final int maxMessages;
  private final Map<String, List<ChatTurn>> store;

  public InMemoryConversationHistoryStore() {
    this(DEFAULT_MAX_MESSAGES, DEFAULT_MAX_SESSIONS);
  }

  public InMemoryConversationHistoryStore(int maxMessages, int maxSessions) {
    if (maxMessages < 1 || maxSessions < 1) {
      throw new IllegalArgumentException("History caps must be positive");
    }
    this.maxMessages = maxMessages;
    this.store = new LinkedHashMap<>(16, 0.75f, true) {
      @Override
      protected boolean removeEldestEntry(Map.Entry<String, List<ChatTurn>> eldest) {
        return size() > maxSessions;
      }
    };
  }

  @Override
  public synchronized List<ChatTurn> recent(String tenantId, String sessionId, int limit) {
    List<ChatTurn> turns = store.get(key(tenantId, sessionId));
    if (turns == null) {
      return List.of();
    }
    return List.copyOf(turns.subList(Math.max(0, turns.size() - limit), turns.size()));
  }

  @Override
  public synchronized void append(String tenantId, String sessionId, ChatTurn turn) {
    List<ChatTurn> turns = store.computeIfAbsent(key(tenantId, sessionId), k -> new ArrayList<>());
    turns.add(turn);
    if (turns.size() > maxMessages) {
      turns.subList(0, turns.size() - maxMessages).clear();
    }
  }

  synchronized int sessionCount() {
    return store.size();
  }

  private static String key(String tenantId, String sessionId) {
    return tenantId + ":" + sessionId;
  }
}
