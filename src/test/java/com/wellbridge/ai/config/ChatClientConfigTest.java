package com.wellbridge.ai.config;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.springframework.ai.ollama.api.OllamaChatOptions;

public class ChatClientConfigTest {

  @Test
  void optionsCarryModelTuning() {
    OllamaChatOptions options = ChatClientConfig.options("llama3.2:3b", 0.0, 2048, "5m");

    assertEquals("llama3.2:3b", options.getModel());
    assertEquals(0.0, options.getTemperature());
    assertEquals(2048, options.getNumCtx());
    assertEquals("5m", options.getKeepAlive());
  }

  @Test
  void blankModelIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> ChatClientConfig.options(" ", 0.3, 8192, "5m"));
  }

  @Test
  void tinyContextWindowIsRejected() {
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
        () -> ChatClientConfig.options("mistral:7b-instruct", 0.3, 128, "5m"));
    assertTrue(e.getMessage().contains("mistral:7b-instruct"));
  }
}
