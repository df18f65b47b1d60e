package org.example.simplifier.service.gateway;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cheap heuristics that catch degenerate backend output: too short, too repetitive, or looping.
 */
public class OutputValidator {

    private static final Pattern TOKEN = Pattern.compile("\\w+", Pattern.UNICODE_CHARACTER_CLASS);

    private final double minUniqueRatio;
    private final int ngramSize;
    private final int maxNgramRepeats;

    public OutputValidator(double minUniqueRatio, int ngramSize, int maxNgramRepeats) {
        this.minUniqueRatio = minUniqueRatio;
        this.ngramSize = Math.max(1, ngramSize);
        this.maxNgramRepeats = Math.max(2, maxNgramRepeats);
    }

    public static OutputValidator defaults() {
        return new OutputValidator(0.25, 6, 5);
    }

    /**
     * @return a short description of why the output is rejected, or empty when it is acceptable
     */
    public Optional<String> findProblem(String output, int minChars) {
        if (output == null || output.length() < minChars) {
            return Optional.of("output shorter than " + minChars + " chars");
        }
        List<String> tokens = tokenize(output);
        if (tokens.isEmpty()) {
            return Optional.of("no word tokens");
        }
        double uniqueRatio = (double) new HashSet<>(tokens).size() / tokens.size();
        if (uniqueRatio < minUniqueRatio) {
            return Optional.of(String.format(Locale.ROOT, "unique token ratio %.2f below %.2f",
                    uniqueRatio, minUniqueRatio));
        }
        Map<String, Integer> counts = new HashMap<>();
        for (int i = 0; i + ngramSize <= tokens.size(); i++) {
            String gram = String.join(" ", tokens.subList(i, i + ngramSize));
            int count = counts.merge(gram, 1, Integer::sum);
            if (count >= maxNgramRepeats) {
                return Optional.of(ngramSize + "-gram repeated " + count + " times");
            }
        }
        return Optional.empty();
    }

    private static List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        Matcher matcher = TOKEN.matcher(text.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            tokens.add(matcher.group());
        }
        return tokens;
    }
}
