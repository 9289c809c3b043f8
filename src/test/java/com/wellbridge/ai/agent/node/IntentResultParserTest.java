package com.wellbridge.ai.agent.node;

import static org.junit.jupiter.api.Assertions.*;

import com.wellbridge.ai.agent.state.Intent;
import org.junit.jupiter.api.Test;

public class IntentResultParserTest {

  @Test
  void validClassification() {
    String json = """
      {
        "intent": "RECORD_LOOKUP",
        "confidence": 0.82,
        "reasoning": "asks what the records say"
      }
    """;

    IntentResult result = IntentResultParser.parse(json);
    assertEquals(Intent.RECORD_LOOKUP, result.intent());
    assertEquals(0.82, result.confidence());
    assertEquals("asks what the records say", result.reasoning());
  }

  @Test
  void reasoningIsOptional() {
    IntentResult result = IntentResultParser.parse("{\"intent\": \"GENERAL\", \"confidence\": 1}");

    assertEquals(Intent.GENERAL, result.intent());
    assertNull(result.reasoning());
  }

  @Test
  void unknownIntentIsInvalid() {
    String json = """
      {"intent": "DIAGNOSIS", "confidence": 0.9}
    """;

    Exception ex = assertThrows(IllegalArgumentException.class, () -> IntentResultParser.parse(json));
    assertTrue(ex.getMessage().contains("Invalid classifier JSON"));
  }

  @Test
  void confidenceOutOfRangeIsInvalid() {
    assertThrows(IllegalArgumentException.class,
        () -> IntentResultParser.parse("{\"intent\": \"GENERAL\", \"confidence\": 1.2}"));
    assertThrows(IllegalArgumentException.class,
        () -> IntentResultParser.parse("{\"intent\": \"GENERAL\", \"confidence\": \"high\"}"));
    assertThrows(IllegalArgumentException.class,
        () -> IntentResultParser.parse("{\"intent\": \"GENERAL\"}"));
  }

  @Test
  void extraFieldsAreInvalid() {
    assertThrows(IllegalArgumentException.class,
        () -> IntentResultParser.parse("{\"intent\": \"GENERAL\", \"confidence\": 0.9, \"answer\": \"hi\"}"));
  }

  @Test
  void malformedJsonIsInvalid() {
    assertThrows(IllegalArgumentException.class, () -> IntentResultParser.parse("GENERAL, 0.9"));
    assertThrows(IllegalArgumentException.class, () -> IntentResultParser.parse("[]"));
  }
}
