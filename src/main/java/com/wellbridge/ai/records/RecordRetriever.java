package com.wellbridge.ai.records;

import com.wellbridge.ai.agent.state.PatientRecord;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.ai.document.Document;
import org.springframework.ai.vectorstore.SearchRequest;
import org.springframework.ai.vectorstore.VectorStore;
import org.springframework.ai.vectorstore.filter.FilterExpressionBuilder;

/**
 * Semantic lookup over record embeddings. Documents carry {@code recordId}, {@code tenantId} and
 * {@code userId} metadata; hits are resolved against the caller's own record list so nothing
 * outside it can be returned.
 */
public class RecordRetriever {

    private final VectorStore vectorStore;
    private final double similarityThreshold;
    private final int topK;
    private final Counter searchCounter;

    public RecordRetriever(VectorStore vectorStore, double similarityThreshold, int topK, MeterRegistry meterRegistry) {
        this.vectorStore = vectorStore;
        this.similarityThreshold = similarityThreshold;
        this.topK = topK;
        this.searchCounter = Counter.builder("agent.records.vector.searches")
                .description("Number of record similarity searches")
                .register(meterRegistry);
    }

    public List<PatientRecord> similarRecords(String tenantId, String userId, String query, List<PatientRecord> candidates) {
        FilterExpressionBuilder b = new FilterExpressionBuilder();
        List<Document> docs = vectorStore.similaritySearch(
                SearchRequest.builder()
                        .query(query)
                        .topK(topK)
                        .similarityThreshold(similarityThreshold)
                        .filterExpression(b.and(b.eq("tenantId", tenantId), b.eq("userId", userId)).build())
                        .build());
        searchCounter.increment();

        Map<String, PatientRecord> byId = new LinkedHashMap<>();
        for (PatientRecord record : candidates) {
            byId.put(record.id(), record);
        }

        Map<String, PatientRecord> hits = new LinkedHashMap<>();
        for (Document doc : docs) {
            Object recordId = doc.getMetadata().get("recordId");
            if (recordId == null) {
                continue;
            }
            PatientRecord record = byId.get(recordId.toString());
            if (record != null) {
                hits.putIfAbsent(record.id(), record);
            }
        }
        return List.copyOf(hits.values());
    }
}
