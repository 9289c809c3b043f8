package com.wellbridge.ai.agent.node;

import com.wellbridge.ai.agent.graph.AgentNode;
import com.wellbridge.ai.agent.jargon.JargonAnnotator;
import com.wellbridge.ai.agent.state.ActionCard;
import com.wellbridge.ai.agent.state.ChatTurn;
import com.wellbridge.ai.agent.state.NodeOutcome;
import com.wellbridge.ai.agent.state.PatientRecord;
import com.wellbridge.ai.agent.state.TurnState;
import com.wellbridge.ai.llm.GenerationException;
import com.wellbridge.ai.llm.GenerationProvider;
import com.wellbridge.ai.llm.GenerationRequest;
import com.wellbridge.ai.records.RecordRetriever;
import com.wellbridge.ai.records.RecordStore;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Answers "what do my records say about X". Relevant records come from semantic search; when
 * that is unavailable or finds nothing, from keyword scoring over the recent records.
 */
public class RecordLookupNode implements AgentNode {

    private static final Logger log = LoggerFactory.getLogger(RecordLookupNode.class);

    static final int INDEX_LIMIT = 20;
    static final int KEYWORD_TOP = 8;
    static final int RECENT_FALLBACK = 5;
    static final int LISTING_LIMIT = 10;

    private static final Pattern WORD = Pattern.compile("[a-zA-Z]+");

    private static final Set<String> STOP_WORDS = Set.of(
            "can", "you", "look", "at", "my", "recent", "records", "show", "me",
            "what", "did", "does", "the", "a", "an", "and", "or", "is", "are",
            "was", "were", "have", "has", "do", "in", "on", "of", "to", "for",
            "with", "about", "from", "tell", "see", "find", "get", "i", "please",
            "any", "all", "some", "last", "latest", "most", "also", "would", "like",
            "know", "let", "check", "says", "said", "information", "that", "this",
            "there", "here", "just", "been", "they", "them", "when", "where", "how");

    static final String NO_RECORDS_RESPONSE =
            "I don't have any records on file for you yet, so I can't look anything up.\n\n"
                    + "If you have paperwork from a visit, like a discharge summary, clinic letter, "
                    + "lab printout, or prescription, you can upload it here and I'll go through it with you.";

    static final String FETCH_FAILED_RESPONSE = "I had trouble retrieving your records. Please try again.";

    private final GenerationProvider provider;
    private final RecordStore recordStore;
    private final RecordRetriever retriever;

    public RecordLookupNode(GenerationProvider provider, RecordStore recordStore, RecordRetriever retriever) {
        this.provider = provider;
        this.recordStore = recordStore;
        this.retriever = retriever;
    }

    @Override
    public NodeOutcome execute(TurnState state) {
        String question = state.latestUserMessage();

        List<PatientRecord> allRecords;
        try {
            allRecords = recordStore.findRecentRecords(state.tenantId(), state.userId(), INDEX_LIMIT);
        } catch (RuntimeException e) {
            log.warn("Record index fetch failed session={}", state.sessionId(), e);
            return NodeOutcome.builder()
                    .records(List.of())
                    .toolError(e.getMessage())
                    .rawResponse(FETCH_FAILED_RESPONSE)
                    .jargonMap(List.of())
                    .build();
        }

        if (allRecords.isEmpty()) {
            return NodeOutcome.builder()
                    .records(List.of())
                    .rawResponse(NO_RECORDS_RESPONSE)
                    .jargonMap(List.of())
                    .actionCards(List.of(ActionCard.upload(
                            "upload_records",
                            "Upload a document",
                            "Add a discharge summary, clinic letter, or lab result")))
                    .build();
        }

        List<PatientRecord> relevant = List.of();
        boolean semantic = false;
        try {
            relevant = retriever.similarRecords(state.tenantId(), state.userId(), question, allRecords);
            semantic = !relevant.isEmpty();
        } catch (RuntimeException e) {
            log.warn("Vector search failed session={}, falling back to keywords", state.sessionId(), e);
        }
        if (relevant.isEmpty()) {
            relevant = keywordRanked(question, allRecords);
        }

        String index = allRecords.stream()
                .limit(LISTING_LIMIT)
                .map(r -> r.noteDateText() + " (" + r.providerOr("?") + ")")
                .collect(Collectors.joining(", "));
        String prompt = "Patient question: " + question
                + "\n\nAll records on file (newest first): " + index
                + "\n\nRecords selected for this query via " + (semantic ? "semantic similarity" : "keyword matching")
                + " (" + relevant.size() + " of " + allRecords.size() + " total):\n\n"
                + RecordFormatting.notesText(relevant, 2000);

        try {
            GroundedAnswer answer = provider.completeStructured(
                    GenerationRequest.json(Prompts.RECORD_LOOKUP, List.of(ChatTurn.user(prompt)), 0.2, 1200),
                    GroundedAnswer.class);
            if (!answer.hasResponse()) {
                throw new GenerationException("lookup answer had no response text");
            }
            return NodeOutcome.builder()
                    .records(relevant)
                    .rawResponse(answer.response())
                    .jargonMap(JargonAnnotator.annotate(answer.response(), answer.jargonEntries()))
                    .actionCards(List.of())
                    .build();
        } catch (GenerationException e) {
            log.warn("Record lookup generation failed session={}", state.sessionId(), e);
            List<PatientRecord> listed = allRecords.subList(0, Math.min(LISTING_LIMIT, allRecords.size()));
            return NodeOutcome.builder()
                    .records(listed)
                    .toolError(e.getMessage())
                    .rawResponse(listing(allRecords.size(), listed))
                    .jargonMap(List.of())
                    .build();
        }
    }

    static List<String> keywords(String message) {
        List<String> words = new ArrayList<>();
        Matcher m = WORD.matcher(message.toLowerCase(Locale.ROOT));
        while (m.find()) {
            String word = m.group();
            if (word.length() > 3 && !STOP_WORDS.contains(word)) {
                words.add(word);
            }
        }
        return words;
    }

    static int score(PatientRecord record, List<String> keywords) {
        String haystack = record.contentOrEmpty().toLowerCase(Locale.ROOT) + " "
                + (record.providerName() == null ? "" : record.providerName().toLowerCase(Locale.ROOT));
        int hits = 0;
        for (String keyword : keywords) {
            if (haystack.contains(keyword)) {
                hits++;
            }
        }
        return hits;
    }

    /**
     * Top records by keyword hits (ties keep recency order), or the most recent few when no
     * keyword matches anything.
     */
    static List<PatientRecord> keywordRanked(String message, List<PatientRecord> records) {
        List<String> keywords = keywords(message);
        List<PatientRecord> top = records.stream()
                .sorted(Comparator.comparingInt((PatientRecord r) -> score(r, keywords)).reversed())
                .limit(KEYWORD_TOP)
                .collect(Collectors.toList());
        boolean matched = !keywords.isEmpty() && top.stream().anyMatch(r -> score(r, keywords) > 0);
        return matched ? top : records.subList(0, Math.min(RECENT_FALLBACK, records.size()));
    }

    static String listing(int total, List<PatientRecord> listed) {
        String lines = listed.stream()
                .map(r -> "• " + r.noteDateText() + " - " + r.recordTypeLabel() + " from " + r.providerOr("Unknown"))
                .collect(Collectors.joining("\n"));
        return "I found " + total + " record(s) but had trouble reading them in detail right now. "
                + "Here's what's on file:\n\n" + lines
                + "\n\nCould you tell me more specifically what you'd like to know?";
    }
}
