package com.wellbridge.ai.agent.node;

import static org.junit.jupiter.api.Assertions.*;

import com.wellbridge.ai.agent.state.NodeOutcome;
import com.wellbridge.ai.agent.state.TurnState;
import com.wellbridge.ai.records.NoteExcerpt;
import com.wellbridge.ai.support.FakeRecordStore;
import com.wellbridge.ai.support.TurnStates;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;

public class RefusalNodeTest {

  private static TurnState stateWithRawText() {
    return TurnStates.with(TurnStates.of("Should I double my dose?"),
        NodeOutcome.builder().rawResponse("leftover text").build());
  }

  @Test
  void noRecordsGivesFixedTemplateAndNullRawResponse() {
    TurnState state = stateWithRawText();

    TurnState after = TurnState.merge(state, new RefusalNode(new FakeRecordStore()).execute(state));

    assertNull(after.rawResponse());
    assertEquals(RefusalNode.NO_RECORDS_TEMPLATE, after.finalResponse());
    assertTrue(after.refusalContextFacts().isEmpty());
    assertTrue(after.jargonMap().isEmpty());
  }

  @Test
  void quotesNoteExcerptsVerbatim() {
    FakeRecordStore store = new FakeRecordStore()
        .excerpt(new NoteExcerpt("n1", "Dr. Lee", LocalDate.of(2025, 2, 1), "Continue lisinopril 10 mg daily."))
        .excerpt(new NoteExcerpt("n2", null, LocalDate.of(2025, 1, 5), "Follow up in 3 months."));
    TurnState state = stateWithRawText();

    TurnState after = TurnState.merge(state, new RefusalNode(store).execute(state));

    assertNull(after.rawResponse());
    assertEquals(List.of(
        "Dr. Lee (2025-02-01): Continue lisinopril 10 mg daily.",
        "Your care team (2025-01-05): Follow up in 3 months."), after.refusalContextFacts());
    assertEquals(RefusalNode.REFUSAL_TEMPLATE + "\n\n"
        + "  • Dr. Lee (2025-02-01): Continue lisinopril 10 mg daily.\n"
        + "  • Your care team (2025-01-05): Follow up in 3 months.", after.finalResponse());
  }

  @Test
  void blankExcerptsAreSkipped() {
    FakeRecordStore store = new FakeRecordStore()
        .excerpt(new NoteExcerpt("n1", "Dr. Lee", LocalDate.of(2025, 2, 1), "   "));

    NodeOutcome outcome = new RefusalNode(store).execute(TurnStates.of("is this normal for me?"));

    assertEquals(RefusalNode.NO_RECORDS_TEMPLATE, outcome.finalResponse());
  }

  @Test
  void storeFailureFallsBackToNoRecordsTemplate() {
    NodeOutcome outcome = new RefusalNode(new FakeRecordStore().failing()).execute(TurnStates.of("do I have cancer?"));

    assertTrue(outcome.setsRawResponse());
    assertNull(outcome.rawResponse());
    assertEquals(RefusalNode.NO_RECORDS_TEMPLATE, outcome.finalResponse());
  }

  @Test
  void searchIsScopedToTurnIdentity() {
    FakeRecordStore store = new FakeRecordStore();

    new RefusalNode(store).execute(TurnStates.of("will I be okay?"));

    assertEquals(List.of("tenant-a/user-1"), store.queriedUsers());
  }
}
