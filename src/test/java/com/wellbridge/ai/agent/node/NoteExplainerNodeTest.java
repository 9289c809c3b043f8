package com.wellbridge.ai.agent.node;

import static org.junit.jupiter.api.Assertions.*;

import com.wellbridge.ai.agent.state.ActionCardType;
import com.wellbridge.ai.agent.state.JargonMapping;
import com.wellbridge.ai.agent.state.TurnState;
import com.wellbridge.ai.support.FakeRecordStore;
import com.wellbridge.ai.support.ScriptedGenerationProvider;
import com.wellbridge.ai.support.TurnStates;
import org.junit.jupiter.api.Test;

public class NoteExplainerNodeTest {

  private static TurnState run(ScriptedGenerationProvider provider, FakeRecordStore store) {
    TurnState state = TurnStates.of("What did Dr. Lee mean in my last note?");
    return TurnState.merge(state, new NoteExplainerNode(provider, store).execute(state));
  }

  @Test
  void noRecordsOffersUploadWithoutGenerating() {
    ScriptedGenerationProvider provider = new ScriptedGenerationProvider();

    TurnState after = run(provider, new FakeRecordStore());

    assertEquals(NoteExplainerNode.NO_RECORDS_RESPONSE, after.rawResponse());
    assertEquals(1, after.actionCards().size());
    assertEquals("upload_records", after.actionCards().get(0).id());
    assertEquals(ActionCardType.UPLOAD, after.actionCards().get(0).type());
    assertEquals(0, provider.callCount());
  }

  @Test
  void explanationIsAnnotatedAgainstItsOwnText() {
    FakeRecordStore store = new FakeRecordStore()
        .record(TurnStates.note("n1", "Dr. Lee", "Mild hypertension. Continue lisinopril."));
    ScriptedGenerationProvider provider = new ScriptedGenerationProvider().reply("""
        {"response": "Dr. Lee noted mild hypertension, which means slightly high blood pressure.",
         "jargon_entries": [
           {"term": "Hypertension", "plain_english": "high blood pressure",
            "source_note_id": "n1", "source_sentence": "Mild hypertension."},
           {"term": "bradycardia", "plain_english": "slow heart rate"}
         ]}
        """);

    TurnState after = run(provider, store);

    assertTrue(after.rawResponse().startsWith("Dr. Lee noted mild hypertension"));
    assertEquals(1, after.jargonMap().size());
    JargonMapping mapping = after.jargonMap().get(0);
    assertEquals("hypertension",
        after.rawResponse().substring(mapping.charOffsetStart(), mapping.charOffsetEnd()));
    assertEquals("n1", mapping.sourceRecordId());
    assertEquals(1, after.records().size());

    String prompt = provider.requests().get(0).turns().get(0).content();
    assertTrue(prompt.contains("[NOTE_ID:n1]"));
    assertTrue(prompt.contains("What did Dr. Lee mean"));
  }

  @Test
  void generationFailureSetsToolError() {
    FakeRecordStore store = new FakeRecordStore().record(TurnStates.note("n1", "Dr. Lee", "Stable."));

    TurnState after = run(new ScriptedGenerationProvider().fail(), store);

    assertEquals(NoteExplainerNode.FAILURE_RESPONSE, after.rawResponse());
    assertNotNull(after.toolError());
  }

  @Test
  void blankExplanationCountsAsFailure() {
    FakeRecordStore store = new FakeRecordStore().record(TurnStates.note("n1", "Dr. Lee", "Stable."));

    TurnState after = run(new ScriptedGenerationProvider().reply("{\"response\": \"  \"}"), store);

    assertEquals(NoteExplainerNode.FAILURE_RESPONSE, after.rawResponse());
    assertNotNull(after.toolError());
  }

  @Test
  void storeFailureSetsToolError() {
    TurnState after = run(new ScriptedGenerationProvider(), new FakeRecordStore().failing());

    assertEquals(NoteExplainerNode.FAILURE_RESPONSE, after.rawResponse());
    assertNotNull(after.toolError());
  }
}
