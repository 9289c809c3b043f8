package com.wellbridge.ai.guardrail;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

public class MedicalOutputGuardTest {

  @Test
  void matchesAreCaseInsensitive() {
    assertEquals("I_recommend", MedicalOutputGuard.firstViolation("i RECOMMEND rest").orElseThrow().name());
    assertEquals("you_likely_have", MedicalOutputGuard.firstViolation("you probably have a cold").orElseThrow().name());
  }

  @Test
  void firstPatternInOrderIsReported() {
    assertEquals("I_diagnose",
        MedicalOutputGuard.firstViolation("I recommend rest because I diagnose a sprain.").orElseThrow().name());
  }

  @Test
  void documentedFactsDoNotMatch() {
    assertTrue(MedicalOutputGuard.firstViolation(
        "Dr. Smith noted that you take metformin 500 mg twice a day.").isEmpty());
    assertTrue(MedicalOutputGuard.firstViolation("").isEmpty());
    assertTrue(MedicalOutputGuard.firstViolation(null).isEmpty());
  }

  @Test
  void thirteenNamedPatterns() {
    assertEquals(13, MedicalOutputGuard.PATTERNS.size());
  }
}
