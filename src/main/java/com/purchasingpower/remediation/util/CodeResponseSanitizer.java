package com.purchasingpower.remediation.util;

import java.util.ArrayList;
import java.util.List;

/**
 * Strips chat decoration from a model answer so only code is left for the scanner.
 *
 * <p>Markdown fence lines are dropped. Outside fences, lines opening with a typical
 * explanation phrase ("Here", "This", "Note:"...) are dropped too. If nothing is left the
 * stripped original is returned, so a terse answer is never turned into an empty one.
 */
public final class CodeResponseSanitizer {

    private static final String FENCE = "```";
    private static final List<String> EXPLANATION_PREFIXES =
            List.of("Here", "This", "The", "Note:", "Remember:", "Example:");

    private CodeResponseSanitizer() {
    }

    public static String clean(String response) {
        if (response == null) {
            return "";
        }

        List<String> kept = new ArrayList<>();
        boolean inCodeBlock = false;
        for (String line : response.split("\n", -1)) {
            String trimmed = line.strip();
            if (trimmed.startsWith(FENCE)) {
                inCodeBlock = !inCodeBlock;
                continue;
            }
            if (inCodeBlock || !isExplanation(trimmed)) {
                kept.add(line);
            }
        }

        String cleaned = String.join("\n", kept).strip();
        return cleaned.isEmpty() ? response.strip() : cleaned;
    }

    private static boolean isExplanation(String trimmedLine) {
        return EXPLANATION_PREFIXES.stream().anyMatch(trimmedLine::startsWith);
    }
}
