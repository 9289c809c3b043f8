package com.wellbridge.ai.agent.node;

import static org.junit.jupiter.api.Assertions.*;

import com.wellbridge.ai.agent.state.NodeOutcome;
import com.wellbridge.ai.records.NoteExcerpt;
import com.wellbridge.ai.support.FakeRecordStore;
import com.wellbridge.ai.support.ScriptedGenerationProvider;
import com.wellbridge.ai.support.TurnStates;
import java.time.LocalDate;
import org.junit.jupiter.api.Test;

public class JargonExplainerNodeTest {

  @Test
  void quotesWhereTheTermAppears() {
    FakeRecordStore store = new FakeRecordStore()
        .excerpt(new NoteExcerpt("n1", "Dr. Lee", LocalDate.of(2025, 3, 1), "Lesion appears benign."));
    ScriptedGenerationProvider provider = new ScriptedGenerationProvider()
        .reply("Benign means not cancer. Dr. Lee used it about the lesion.");

    NodeOutcome outcome = new JargonExplainerNode(provider, store).execute(TurnStates.of("what does benign mean?"));

    assertEquals("Benign means not cancer. Dr. Lee used it about the lesion.", outcome.rawResponse());
    assertTrue(outcome.jargonMap().isEmpty());
    String prompt = provider.requests().get(0).turns().get(0).content();
    assertTrue(prompt.contains("From Dr. Lee (2025-03-01): \"Lesion appears benign.\""));
    assertFalse(provider.requests().get(0).jsonOutput());
  }

  @Test
  void missingOrFailedSourceStillExplains() {
    ScriptedGenerationProvider provider = new ScriptedGenerationProvider().reply("one").reply("two");

    new JargonExplainerNode(provider, new FakeRecordStore()).execute(TurnStates.of("what is an MRI?"));
    new JargonExplainerNode(provider, new FakeRecordStore().failing()).execute(TurnStates.of("what is an MRI?"));

    assertTrue(provider.requests().get(0).turns().get(0).content().contains(JargonExplainerNode.NO_SOURCE_CONTEXT));
    assertTrue(provider.requests().get(1).turns().get(0).content().contains(JargonExplainerNode.SOURCE_LOOKUP_FAILED));
  }

  @Test
  void generationFailure() {
    NodeOutcome outcome = new JargonExplainerNode(new ScriptedGenerationProvider().fail(), new FakeRecordStore())
        .execute(TurnStates.of("what is stenosis?"));

    assertEquals(JargonExplainerNode.FAILURE_RESPONSE, outcome.rawResponse());
    assertNotNull(outcome.toolError());
  }
}
