package com.wellbridge.ai.agent.node;

import static org.junit.jupiter.api.Assertions.*;

import com.wellbridge.ai.agent.state.ActionCard;
import com.wellbridge.ai.agent.state.ActionCardType;
import com.wellbridge.ai.agent.state.NodeOutcome;
import com.wellbridge.ai.support.ScriptedGenerationProvider;
import com.wellbridge.ai.support.TurnStates;
import java.util.List;
import org.junit.jupiter.api.Test;

public class RecordCollectorNodeTest {

  private static List<String> ids(List<ActionCard> cards) {
    return cards.stream().map(ActionCard::id).toList();
  }

  @Test
  void visitWithPrescriptionFillsBothSlots() {
    List<ActionCard> cards = RecordCollectorNode.inferCards("I just got back from the doctor with a new prescription");

    assertEquals(List.of("upload_document", "add_medication"), ids(cards));
    assertEquals(ActionCardType.LINK, cards.get(1).type());
    assertEquals("/records/new?type=prescription", cards.get(1).payload().get("href"));
  }

  @Test
  void documentAloneAddsEmailTemplate() {
    List<ActionCard> cards = RecordCollectorNode.inferCards("I have my lab result letter");

    assertEquals(List.of("upload_document", "request_records_email"), ids(cards));
    assertEquals(RecordCollectorNode.EMAIL_TEMPLATE, cards.get(1).payload().get("template"));
  }

  @Test
  void medicationAloneAddsEmailTemplate() {
    assertEquals(List.of("add_medication", "request_records_email"),
        ids(RecordCollectorNode.inferCards("I started taking a new pill")));
  }

  @Test
  void nothingRecognizedStillOffersEmail() {
    assertEquals(List.of("request_records_email"), ids(RecordCollectorNode.inferCards("Can you keep track of things?")));
  }

  @Test
  void generationFailureKeepsCards() {
    ScriptedGenerationProvider provider = new ScriptedGenerationProvider().fail();

    NodeOutcome outcome = new RecordCollectorNode(provider)
        .execute(TurnStates.of("My doctor prescribed a new medication"));

    assertEquals(RecordCollectorNode.FALLBACK_RESPONSE, outcome.rawResponse());
    assertEquals(2, outcome.actionCards().size());
    assertTrue(provider.requests().get(0).systemPrompt()
        .contains("Action options being shown: Upload a document, Add medication to your records"));
  }

  @Test
  void usesGeneratedAcknowledgement() {
    NodeOutcome outcome = new RecordCollectorNode(new ScriptedGenerationProvider().reply("Got it, thanks for sharing."))
        .execute(TurnStates.of("I have a new inhaler"));

    assertEquals("Got it, thanks for sharing.", outcome.rawResponse());
  }
}
