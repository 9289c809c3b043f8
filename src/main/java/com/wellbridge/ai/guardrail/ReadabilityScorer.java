package com.wellbridge.ai.guardrail;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Flesch-Kincaid grade level:
 * {@code 0.39 * (words / sentences) + 11.8 * (syllables / words) - 15.59}, floored at 0.
 */
public final class ReadabilityScorer {

    private static final Pattern SENTENCE_BREAK = Pattern.compile("[.!?]+");
    private static final Pattern WORD = Pattern.compile("\\b[a-zA-Z']+\\b");
    private static final Pattern VOWEL_GROUP = Pattern.compile("[aeiou]+");
    private static final String EDGE_PUNCTUATION = ".,!?;:\"'()";

    private ReadabilityScorer() {}

    public static double gradeLevel(String text) {
        if (text == null || text.isBlank()) {
            return 0.0;
        }

        int sentences = 0;
        for (String sentence : SENTENCE_BREAK.split(text)) {
            if (!sentence.isBlank()) {
                sentences++;
            }
        }
        if (sentences == 0) {
            return 0.0;
        }

        int words = 0;
        int syllables = 0;
        Matcher matcher = WORD.matcher(text);
        while (matcher.find()) {
            words++;
            syllables += countSyllables(matcher.group());
        }
        if (words == 0) {
            return 0.0;
        }

        double grade = 0.39 * ((double) words / sentences)
                + 11.8 * ((double) syllables / words)
                - 15.59;
        return Math.round(Math.max(0.0, grade) * 100.0) / 100.0;
    }

    /**
     * Heuristic syllable count, good enough for grade scoring. Never less than one for a real word.
     */
    public static int countSyllables(String rawWord) {
        String word = strip(rawWord.toLowerCase(Locale.ROOT));
        if (word.isEmpty()) {
            return 0;
        }
        if (word.length() <= 3) {
            return 1;
        }

        if (word.endsWith("e") && word.length() > 4) {
            word = word.substring(0, word.length() - 1);
        }

        int count = 0;
        Matcher groups = VOWEL_GROUP.matcher(word);
        while (groups.find()) {
            count++;
        }

        if (word.endsWith("le") && word.length() > 2 && "aeiou".indexOf(word.charAt(word.length() - 3)) < 0) {
            count++;
        }
        if (word.endsWith("ed") && count > 1) {
            count--;
        }
        return Math.max(1, count);
    }

    private static String strip(String word) {
        int start = 0;
        int end = word.length();
        while (start < end && EDGE_PUNCTUATION.indexOf(word.charAt(start)) >= 0) {
            start++;
        }
        while (end > start && EDGE_PUNCTUATION.indexOf(word.charAt(end - 1)) >= 0) {
            end--;
        }
        return word.substring(start, end);
    }
}
