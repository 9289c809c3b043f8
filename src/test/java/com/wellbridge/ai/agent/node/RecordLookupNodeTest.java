package com.wellbridge.ai.agent.node;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.wellbridge.ai.agent.state.PatientRecord;
import com.wellbridge.ai.agent.state.TurnState;
import com.wellbridge.ai.records.RecordRetriever;
import com.wellbridge.ai.support.FakeRecordStore;
import com.wellbridge.ai.support.ScriptedGenerationProvider;
import com.wellbridge.ai.support.TurnStates;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.ai.document.Document;
import org.springframework.ai.vectorstore.SearchRequest;
import org.springframework.ai.vectorstore.VectorStore;

public class RecordLookupNodeTest {

  private static final String ANSWER = "{\"response\": \"Your cholesterol was 190 in March.\", \"jargon_entries\": []}";

  private VectorStore vectorStore;
  private RecordRetriever retriever;
  private FakeRecordStore store;

  @BeforeEach
  void setUp() {
    vectorStore = mock(VectorStore.class);
    retriever = new RecordRetriever(vectorStore, 0.35, 8, new SimpleMeterRegistry());
    store = new FakeRecordStore()
        .record(TurnStates.note("n1", "Dr. Lee", "Knee looks good after physical therapy."))
        .record(TurnStates.note("n2", "Dr. Kim", "Total cholesterol 190, LDL 110."))
        .record(TurnStates.note("n3", "Dr. Ortiz", "Flu shot given."));
  }

  private TurnState run(ScriptedGenerationProvider provider, String message) {
    TurnState state = TurnStates.of(message);
    return TurnState.merge(state, new RecordLookupNode(provider, store, retriever).execute(state));
  }

  @Test
  void semanticHitsSelectRecords() {
    when(vectorStore.similaritySearch(any(SearchRequest.class)))
        .thenReturn(List.of(new Document("cholesterol panel", Map.of("recordId", "n2")),
            new Document("someone else's note", Map.of("recordId", "other-user"))));
    ScriptedGenerationProvider provider = new ScriptedGenerationProvider().reply(ANSWER);

    TurnState after = run(provider, "What was my cholesterol?");

    assertEquals("Your cholesterol was 190 in March.", after.rawResponse());
    assertEquals(List.of("n2"), after.records().stream().map(PatientRecord::id).toList());
    String prompt = provider.requests().get(0).turns().get(0).content();
    assertTrue(prompt.contains("via semantic similarity (1 of 3 total)"));
    assertFalse(prompt.contains("[NOTE_ID:n1]"));
  }

  @Test
  void vectorFailureFallsBackToKeywords() {
    when(vectorStore.similaritySearch(any(SearchRequest.class))).thenThrow(new IllegalStateException("pgvector down"));
    ScriptedGenerationProvider provider = new ScriptedGenerationProvider().reply(ANSWER);

    TurnState after = run(provider, "What was my cholesterol?");

    assertEquals("n2", after.records().get(0).id());
    assertNull(after.toolError());
    assertTrue(provider.requests().get(0).turns().get(0).content().contains("via keyword matching"));
  }

  @Test
  void generationFailureListsRecordsOnFile() {
    when(vectorStore.similaritySearch(any(SearchRequest.class))).thenReturn(List.of());

    TurnState after = run(new ScriptedGenerationProvider().fail(), "What was my cholesterol?");

    assertNotNull(after.toolError());
    assertTrue(after.rawResponse().startsWith("I found 3 record(s)"));
    assertTrue(after.rawResponse().contains("• 2025-03-14 - clinical note from Dr. Kim"));
    assertEquals(3, after.records().size());
  }

  @Test
  void noRecordsOffersUpload() {
    store = new FakeRecordStore();

    TurnState after = run(new ScriptedGenerationProvider(), "What was my cholesterol?");

    assertEquals(RecordLookupNode.NO_RECORDS_RESPONSE, after.rawResponse());
    assertEquals("upload_records", after.actionCards().get(0).id());
  }

  @Test
  void storeFailure() {
    store = new FakeRecordStore().failing();

    TurnState after = run(new ScriptedGenerationProvider(), "What was my cholesterol?");

    assertEquals(RecordLookupNode.FETCH_FAILED_RESPONSE, after.rawResponse());
    assertNotNull(after.toolError());
  }

  @Test
  void keywordsSkipStopWordsAndShortWords() {
    assertEquals(List.of("cholesterol", "knee"),
        RecordLookupNode.keywords("Can you tell me about my cholesterol and my knee?"));
  }

  @Test
  void keywordRankingPrefersHitsThenRecency() {
    List<PatientRecord> records = List.of(
        TurnStates.note("a", "Dr. Lee", "Flu shot."),
        TurnStates.note("b", "Dr. Kim", "Knee swelling, ordered knee MRI."),
        TurnStates.note("c", "Dr. Ortiz", "Knee brace fitted."));

    List<PatientRecord> ranked = RecordLookupNode.keywordRanked("anything about my knee", records);

    assertEquals(List.of("b", "c", "a"), ranked.stream().map(PatientRecord::id).toList());
  }

  @Test
  void keywordRankingFallsBackToMostRecent() {
    List<PatientRecord> records = List.of(
        TurnStates.note("a", "Dr. Lee", "Flu shot."),
        TurnStates.note("b", "Dr. Kim", "Ear check."));

    assertEquals(records, RecordLookupNode.keywordRanked("what about vision", records));
  }
}
