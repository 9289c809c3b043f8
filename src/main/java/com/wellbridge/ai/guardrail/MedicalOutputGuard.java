package com.wellbridge.ai.guardrail;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Stage one of the guardrail: a fixed, ordered list of named patterns for prescriptive,
 * diagnostic, dosage and emergency-directive phrasing. Any match replaces the whole response.
 *
 * <p>Patterns are evaluated in order and the first match is the one reported to the audit log.
 */
public final class MedicalOutputGuard {

    public static final String SAFE_FALLBACK =
            "I wasn't able to generate a safe response for that request. "
                    + "Please contact your care team directly for medical guidance.\n\n"
                    + "You can reach me for factual questions about your own documented records.";

    public record NamedPattern(String name, Pattern pattern) {}

    public static final List<NamedPattern> PATTERNS = List.of(
            named("I_diagnose", "\\bI diagnose\\b"),
            named("I_recommend", "\\bI recommend\\b"),
            named("I_suggest", "\\bI suggest\\b"),
            named("try_this_instead", "\\btry this instead\\b"),
            named("prescriptive_should", "\\byou (should|must|need to) (take|stop|start|avoid|use)\\b"),
            named("diagnostic_this_indicates", "\\bThis (indicates|suggests|means) you have\\b"),
            named("you_likely_have", "\\bYou (likely|probably|definitely) have\\b"),
            named("your_condition_is", "\\bYour condition is\\b"),
            named("prescribe", "\\bI (would|will|can) prescribe\\b"),
            named("you_are_developing", "\\byou are (likely|probably) (developing|experiencing)\\b"),
            named("dietary_advice", "\\b(cut out|stop eating|avoid eating)\\b"),
            named("dosage_recommendation", "\\btake (\\d+\\s*)?(mg|milligram|tablet|pill|dose)\\b"),
            named("emergency_directive", "\\bseek (immediate|emergency|urgent) (medical )?(help|care|attention)\\b"));

    private MedicalOutputGuard() {}

    /**
     * @return the first pattern that matches {@code text}, if any
     */
    public static Optional<NamedPattern> firstViolation(String text) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }
        for (NamedPattern candidate : PATTERNS) {
            if (candidate.pattern().matcher(text).find()) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private static NamedPattern named(String name, String regex) {
        return new NamedPattern(name, Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
    }
}
