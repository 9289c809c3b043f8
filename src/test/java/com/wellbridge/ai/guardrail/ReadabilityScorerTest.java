package com.wellbridge.ai.guardrail;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

public class ReadabilityScorerTest {

  @Test
  void emptyTextScoresZero() {
    assertEquals(0.0, ReadabilityScorer.gradeLevel(""));
    assertEquals(0.0, ReadabilityScorer.gradeLevel("   "));
    assertEquals(0.0, ReadabilityScorer.gradeLevel(null));
  }

  @Test
  void longerSentencesScoreHigher() {
    double shortSentences = ReadabilityScorer.gradeLevel("The cat sat. The dog ran. The sun set.");
    double oneLongSentence = ReadabilityScorer.gradeLevel("The cat sat and the dog ran and the sun set.");

    assertTrue(oneLongSentence >= shortSentences);
  }

  @Test
  void moreSyllablesScoreHigher() {
    double simple = ReadabilityScorer.gradeLevel("The cat sat on the mat today.");
    double complex = ReadabilityScorer.gradeLevel("The veterinarian evaluated the animal extensively.");

    assertTrue(complex > simple);
  }

  @Test
  void simpleTextIsBelowThreshold() {
    assertTrue(ReadabilityScorer.gradeLevel("Your note says you had a checkup. It went well.")
        <= GuardrailPipeline.READABILITY_THRESHOLD);
  }

  @Test
  void syllableHeuristic() {
    assertEquals(1, ReadabilityScorer.countSyllables("cat"));
    assertEquals(1, ReadabilityScorer.countSyllables("the"));
    assertEquals(2, ReadabilityScorer.countSyllables("doctor"));
    assertEquals(1, ReadabilityScorer.countSyllables("smoke"));
    assertEquals(3, ReadabilityScorer.countSyllables("medicine"));
    assertEquals(1, ReadabilityScorer.countSyllables("\"cat,\""));
    assertEquals(0, ReadabilityScorer.countSyllables("..."));
  }
}
