package com.wellbridge.ai.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wellbridge.ai.agent.graph.AgentTopology;
import com.wellbridge.ai.agent.graph.NodeId;
import com.wellbridge.ai.agent.graph.TurnExecutor;
import com.wellbridge.ai.agent.node.CalendarNode;
import com.wellbridge.ai.agent.node.CareNavigatorNode;
import com.wellbridge.ai.agent.node.EmotionalAssessorNode;
import com.wellbridge.ai.agent.node.IntentClassifierNode;
import com.wellbridge.ai.agent.node.JargonExplainerNode;
import com.wellbridge.ai.agent.node.MedicationInfoNode;
import com.wellbridge.ai.agent.node.NoteExplainerNode;
import com.wellbridge.ai.agent.node.NoteSummarizerNode;
import com.wellbridge.ai.agent.node.PreVisitPrepNode;
import com.wellbridge.ai.agent.node.RecordCollectorNode;
import com.wellbridge.ai.agent.node.RecordLookupNode;
import com.wellbridge.ai.agent.node.RefusalNode;
import com.wellbridge.ai.agent.node.ResponseAssemblerNode;
import com.wellbridge.ai.guardrail.AuditSink;
import com.wellbridge.ai.guardrail.GuardrailPipeline;
import com.wellbridge.ai.guardrail.JdbcAuditSink;
import com.wellbridge.ai.guardrail.TextSimplifier;
import com.wellbridge.ai.llm.ChatClientGenerationProvider;
import com.wellbridge.ai.llm.GenerationProvider;
import com.wellbridge.ai.records.JdbcRecordStore;
import com.wellbridge.ai.records.RecordRetriever;
import com.wellbridge.ai.records.RecordStore;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.vectorstore.VectorStore;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

/**
 * Wires the turn graph. Nodes are plain objects; only their collaborators are beans.
 */
@Configuration
public class AgentGraphConfig {

    @Bean(name = "generationCallExecutor", destroyMethod = "shutdownNow")
    public ExecutorService generationCallExecutor(
            @Value("${app.generation.max-concurrent:32}") int maxConcurrent,
            @Value("${app.generation.queue-capacity:64}") int queueCapacity) {
        return boundedPool("generation-", maxConcurrent, queueCapacity);
    }

    @Bean(name = "auditExecutor", destroyMethod = "shutdown")
    public ExecutorService auditExecutor(@Value("${app.audit.queue-capacity:1000}") int queueCapacity) {
        return boundedPool("audit-", 1, queueCapacity);
    }

    @Bean(name = "turnWorkerPool", destroyMethod = "shutdown")
    public ExecutorService turnWorkerPool(
            @Value("${app.turn.workers:16}") int workers,
            @Value("${app.turn.queue-capacity:64}") int queueCapacity) {
        return boundedPool("turn-", workers, queueCapacity);
    }

    /**
     * Fixed-size pool over a bounded queue. Work beyond {@code queueCapacity} is rejected with
     * {@link java.util.concurrent.RejectedExecutionException} rather than queued.
     */
    static ThreadPoolExecutor boundedPool(String threadNamePrefix, int threads, int queueCapacity) {
        if (threads < 1 || queueCapacity < 1) {
            throw new IllegalArgumentException(
                    "Pool " + threadNamePrefix + " needs positive threads and queue capacity");
        }
        return new ThreadPoolExecutor(
                threads,
                threads,
                0L,
                TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(queueCapacity),
                new CustomizableThreadFactory(threadNamePrefix),
                new ThreadPoolExecutor.AbortPolicy());
    }

    @Bean(name = "classifierGenerationProvider")
    public GenerationProvider classifierGenerationProvider(
            @Qualifier("classifierChatClient") ChatClient chatClient,
            @Qualifier("generationCallExecutor") ExecutorService callExecutor,
            @Value("${app.generation.timeout:PT20S}") Duration timeout,
            ObjectMapper mapper,
            MeterRegistry meterRegistry) {
        return new ChatClientGenerationProvider(chatClient, callExecutor, timeout, mapper, meterRegistry);
    }

    @Bean(name = "answerGenerationProvider")
    public GenerationProvider answerGenerationProvider(
            @Qualifier("answerChatClient") ChatClient chatClient,
            @Qualifier("generationCallExecutor") ExecutorService callExecutor,
            @Value("${app.generation.timeout:PT20S}") Duration timeout,
            ObjectMapper mapper,
            MeterRegistry meterRegistry) {
        return new ChatClientGenerationProvider(chatClient, callExecutor, timeout, mapper, meterRegistry);
    }

    @Bean
    public RecordStore recordStore(JdbcTemplate jdbcTemplate) {
        return new JdbcRecordStore(jdbcTemplate);
    }

    @Bean
    public RecordRetriever recordRetriever(
            VectorStore vectorStore,
            @Value("${app.records.vector-search.threshold:0.35}") double threshold,
            @Value("${app.records.vector-search.top-k:8}") int topK,
            MeterRegistry meterRegistry) {
        return new RecordRetriever(vectorStore, threshold, topK, meterRegistry);
    }

    @Bean
    public AuditSink auditSink(JdbcTemplate jdbcTemplate) {
        return new JdbcAuditSink(jdbcTemplate);
    }

    @Bean
    public AgentTopology agentTopology(
            @Qualifier("classifierGenerationProvider") GenerationProvider classifier,
            @Qualifier("answerGenerationProvider") GenerationProvider answer,
            @Qualifier("auditExecutor") ExecutorService auditExecutor,
            RecordStore recordStore,
            RecordRetriever recordRetriever,
            AuditSink auditSink,
            MeterRegistry meterRegistry) {
        return AgentTopology.builder()
                .node(NodeId.EMOTIONAL_ASSESSOR, new EmotionalAssessorNode(classifier))
                .node(NodeId.INTENT_CLASSIFIER, new IntentClassifierNode(classifier))
                .node(NodeId.REFUSAL, new RefusalNode(recordStore))
                .node(NodeId.NOTE_EXPLAINER, new NoteExplainerNode(answer, recordStore))
                .node(NodeId.CARE_NAVIGATOR, new CareNavigatorNode(answer, recordStore))
                .node(NodeId.RECORD_COLLECTOR, new RecordCollectorNode(answer))
                .node(NodeId.CALENDAR, new CalendarNode(recordStore))
                .node(NodeId.RECORD_LOOKUP, new RecordLookupNode(answer, recordStore, recordRetriever))
                .node(NodeId.JARGON_EXPLAINER, new JargonExplainerNode(answer, recordStore))
                .node(NodeId.PRE_VISIT_PREP, new PreVisitPrepNode(answer, recordStore))
                .node(NodeId.NOTE_SUMMARIZER, new NoteSummarizerNode(answer, recordStore))
                .node(NodeId.MEDICATION_INFO, new MedicationInfoNode(answer))
                .node(NodeId.GUARDRAIL, new GuardrailPipeline(
                        new TextSimplifier(answer), auditSink, auditExecutor, meterRegistry))
                .node(NodeId.RESPONSE_ASSEMBLER, new ResponseAssemblerNode(classifier))
                .build();
    }

    @Bean
    public TurnExecutor turnExecutor(AgentTopology agentTopology, MeterRegistry meterRegistry) {
        return new TurnExecutor(agentTopology, meterRegistry);
    }
}
