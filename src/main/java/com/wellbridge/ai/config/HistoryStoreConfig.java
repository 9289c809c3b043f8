package com.wellbridge.ai.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wellbridge.ai.memory.ConversationHistoryStore;
import com.wellbridge.ai.memory.InMemoryConversationHistoryStore;
import com.wellbridge.ai.memory.RedisConversationHistoryStore;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

@Configuration
public class HistoryStoreConfig {

  @Bean
  @ConditionalOnProperty(name = "app.history.store", havingValue = "redis")
  public ConversationHistoryStore redisHistoryStore(
      StringRedisTemplate redisTemplate,
      ObjectMapper mapper,
      @Value("${app.history.redis-ttl:PT24H}") Duration ttl,
      @Value("${app.history.redis-key-prefix:history:}") String keyPrefix,
      @Value("${app.history.max-stored:50}") int maxStored) {
    return new RedisConversationHistoryStore(redisTemplate, mapper, ttl, keyPrefix, maxStored);
  }

  @Bean
  @ConditionalOnMissingBean(ConversationHistoryStore.class)
  public ConversationHistoryStore inMemoryHistoryStore(
      @Value("${app.history.max-stored:50}") int maxStored,
      @Value("${app.history.max-sessions:10000}") int maxSessions) {
    return new InMemoryConversationHistoryStore(maxStored, maxSessions);
  }
}
