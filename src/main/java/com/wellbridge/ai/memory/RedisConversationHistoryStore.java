package com.wellbridge.ai.memory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wellbridge.ai.agent.state.ChatTurn;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * One Redis list per session; each element is a JSON-encoded {@link ChatTurn}. The list is trimmed
 * to the newest {@code maxMessages} entries and the key expires {@code ttl} after the last append.
 */
public class RedisConversationHistoryStore implements ConversationHistoryStore {

  private final StringRedisTemplate redis;
  private final ObjectMapper mapper;
  private final Duration ttl;
  private final String keyPrefix;
  private final int maxMessages;

  public RedisConversationHistoryStore(
      StringRedisTemplate redis,
      ObjectMapper mapper,
      Duration ttl,
      String keyPrefix,
      int maxMessages) {
    if (maxMessages < 1) {
      throw new IllegalArgumentException("maxMessages must be positive");
    }
    this.redis = redis;
    this.mapper = mapper;
    this.ttl = ttl;
    this.keyPrefix = keyPrefix;
    this.maxMessages = maxMessages;
  }

  @Override
  public List<ChatTurn> recent(String tenantId, String sessionId, int limit) {
    List<String> raw = redis.opsForList().range(key(tenantId, sessionId), -limit, -1);
    if (raw == null || raw.isEmpty()) {
      return List.of();
    }

    List<ChatTurn> turns = new ArrayList<>(raw.size());
    for (String json : raw) {
      try {
        turns.add(mapper.readValue(json, ChatTurn.class));
      } catch (Exception e) {
        throw new IllegalStateException("Failed to deserialize history for " + sessionId, e);
      }
    }
    return turns;
  }

  @Override
  public void append(String tenantId, String sessionId, ChatTurn turn) {
    String key = key(tenantId, sessionId);
    try {
      redis.opsForList().rightPush(key, mapper.writeValueAsString(turn));
      redis.opsForList().trim(key, -maxMessages, -1);
      redis.expire(key, ttl);
    } catch (Exception e) {
      throw new IllegalStateException("Failed to serialize history for " + sessionId, e);
    }
  }

  private String key(String tenantId, String sessionId) {
    return keyPrefix + tenantId + ":" + sessionId;
  }
}
