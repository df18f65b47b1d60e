package org.example.simplifier.service.gateway;

import java.util.Arrays;

/**
 * Closed set of rewrite intensities accepted at job submission.
 */
public enum RewriteLevel {
    LIGHT(1, "light", " - Light",
            "Level: LIGHT. Keep the author's style and all of the content. Only clarify: prefer shorter "
                    + "sentences and explain difficult terms in parentheses when needed."),
    MODERATE(2, "moderate", " - Moderate",
            "Level: MODERATE. Keep all content and examples, but simplify the wording and sentence order "
                    + "for maximum clarity, without summarizing."),
    AGGRESSIVE(3, "aggressive", " - Aggressive",
            "Level: AGGRESSIVE. Keep all content and details, but firmly simplify vocabulary and sentence "
                    + "structure, without summarizing; preserve every name, date and number.");

    private final int value;
    private final String label;
    private final String titleSuffix;
    private final String instructions;

    RewriteLevel(int value, String label, String titleSuffix, String instructions) {
        this.value = value;
        this.label = label;
        this.titleSuffix = titleSuffix;
        this.instructions = instructions;
    }

    public static RewriteLevel fromValue(int value) {
        return Arrays.stream(values())
                .filter(level -> level.value == value)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "Simplification level must be 1, 2 or 3, got " + value));
    }

    public int value() {
        return value;
    }

    public String label() {
        return label;
    }

    public String titleSuffix() {
        return titleSuffix;
    }

    public String instructions() {
        return instructions;
    }
}
