package com.wellbridge.ai.api;

import static org.junit.jupiter.api.Assertions.*;

import com.wellbridge.ai.agent.graph.AgentNode;
import com.wellbridge.ai.agent.graph.AgentTopology;
import com.wellbridge.ai.agent.graph.NodeId;
import com.wellbridge.ai.agent.graph.TurnExecutionException;
import com.wellbridge.ai.agent.graph.TurnExecutor;
import com.wellbridge.ai.agent.node.RefusalNode;
import com.wellbridge.ai.agent.node.ResponseAssemblerNode;
import com.wellbridge.ai.agent.state.ChatTurn;
import com.wellbridge.ai.agent.state.Intent;
import com.wellbridge.ai.agent.state.NodeOutcome;
import com.wellbridge.ai.memory.ConversationHistoryStore;
import com.wellbridge.ai.memory.InMemoryConversationHistoryStore;
import com.wellbridge.ai.support.FakeRecordStore;
import com.wellbridge.ai.support.ScriptedGenerationProvider;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

public class ChatTurnServiceTest {

  private static final TenantContext TENANT = new TenantContext("tenant-a", "user-1", "patient");

  private final List<Integer> messageCounts = new ArrayList<>();

  private AgentTopology topology(Intent intent, double confidence, AgentNode careNavigator) {
    Map<NodeId, AgentNode> nodes = new EnumMap<>(NodeId.class);
    nodes.put(NodeId.EMOTIONAL_ASSESSOR, state -> {
      messageCounts.add(state.messages().size());
      return NodeOutcome.empty();
    });
    nodes.put(NodeId.INTENT_CLASSIFIER, state -> NodeOutcome.builder().classification(intent, confidence).build());
    nodes.put(NodeId.REFUSAL, new RefusalNode(new FakeRecordStore()));
    nodes.put(NodeId.CARE_NAVIGATOR, careNavigator);
    nodes.put(NodeId.GUARDRAIL, state -> NodeOutcome.builder().finalResponse(state.rawResponse()).build());
    nodes.put(NodeId.RESPONSE_ASSEMBLER, new ResponseAssemblerNode(new ScriptedGenerationProvider()));

    AgentTopology.Builder builder = AgentTopology.builder();
    for (NodeId id : NodeId.values()) {
      builder.node(id, nodes.getOrDefault(id, state -> fail("unexpected node " + id)));
    }
    return builder.build();
  }

  private ChatTurnService service(AgentTopology topology, ConversationHistoryStore history) {
    return new ChatTurnService(new TurnExecutor(topology, new SimpleMeterRegistry()), topology, history, 10);
  }

  @Test
  void bothSidesOfTheTurnArePersisted() {
    InMemoryConversationHistoryStore history = new InMemoryConversationHistoryStore();
    ChatTurnService service = service(topology(Intent.CARE_NAVIGATION, 0.9,
        state -> NodeOutcome.builder().rawResponse("Hi! How can I help?").build()), history);

    TurnResponse first = service.handle(TENANT, "s1", "hello");
    service.handle(TENANT, "s1", "thanks");

    assertEquals("Hi! How can I help?", first.finalResponse());
    assertEquals(Intent.CARE_NAVIGATION, first.intent());
    assertEquals(List.of(
        "Can you summarize my recent records?",
        "Help me prepare for my next visit",
        "What can WellBridge help me with?"), first.suggestedReplies());
    assertEquals(List.of(1, 3), messageCounts);
    assertEquals(List.of(
        ChatTurn.user("hello"), ChatTurn.assistant("Hi! How can I help?"),
        ChatTurn.user("thanks"), ChatTurn.assistant("Hi! How can I help?")), history.recent("tenant-a", "s1", 10));
  }

  @Test
  void refusalGetsFixedSuggestions() {
    ChatTurnService service = service(topology(Intent.MEDICAL_ADVICE, 0.95, state -> fail("not routed")),
        new InMemoryConversationHistoryStore());

    TurnResponse response = service.handle(TENANT, "s1", "Should I double my insulin?");

    assertEquals(RefusalNode.NO_RECORDS_TEMPLATE, response.finalResponse());
    assertEquals(ChatTurnService.REFUSAL_SUGGESTIONS, response.suggestedReplies());
    assertTrue(response.jargonMap().isEmpty());
  }

  @Test
  void historyOutageDoesNotFailTheTurn() {
    ConversationHistoryStore broken = new ConversationHistoryStore() {
      @Override
      public List<ChatTurn> recent(String tenantId, String sessionId, int limit) {
        throw new IllegalStateException("redis down");
      }

      @Override
      public void append(String tenantId, String sessionId, ChatTurn turn) {
        throw new IllegalStateException("redis down");
      }
    };
    ChatTurnService service = service(topology(Intent.CARE_NAVIGATION, 0.9,
        state -> NodeOutcome.builder().rawResponse("I'm here.").build()), broken);

    assertEquals("I'm here.", service.handle(TENANT, "s1", "hi").finalResponse());
  }

  @Test
  void failingNodeFailsTheTurnAfterUserMessageIsSaved() {
    InMemoryConversationHistoryStore history = new InMemoryConversationHistoryStore();
    ChatTurnService service = service(topology(Intent.CARE_NAVIGATION, 0.9, state -> {
      throw new IllegalStateException("bug");
    }), history);

    assertThrows(TurnExecutionException.class, () -> service.handle(TENANT, "s1", "hi"));
    assertEquals(List.of(ChatTurn.user("hi")), history.recent("tenant-a", "s1", 10));
  }
}
