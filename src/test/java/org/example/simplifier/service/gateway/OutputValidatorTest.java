package org.example.simplifier.service.gateway;

import org.junit.jupiter.api.Test;

import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OutputValidatorTest {

    private static final String VARIED = "The old harbour town woke slowly under a grey sky. Fishermen checked "
            + "their nets while children ran along the stone wall, shouting at the gulls. Near the market, a baker "
            + "opened his shutters and the smell of warm bread drifted over the square. Nobody noticed the stranger "
            + "who stepped off the morning ferry carrying a small leather case.";

    private final OutputValidator validator = OutputValidator.defaults();

    @Test
    void findProblem_variedProse_isAccepted() {
        assertTrue(VARIED.length() >= 300);
        assertTrue(validator.findProblem(VARIED, 200).isEmpty());
    }

    @Test
    void findProblem_repeatedPhrase_isRejected() {
        String loop = IntStream.range(0, 50)
                .mapToObj(i -> "the cat sat on the mat")
                .collect(Collectors.joining(" "));

        assertTrue(validator.findProblem(loop, 200).isPresent());
    }

    @Test
    void findProblem_sixGramRepeatedFiveTimes_isRejectedEvenWithVariedVocabulary() {
        StringBuilder text = new StringBuilder();
        for (int i = 0; i < 5; i++) {
            for (int j = 0; j < 40; j++) {
                text.append("word").append(i * 40 + j).append(' ');
            }
            text.append("alpha beta gamma delta epsilon zeta ");
        }

        String problem = validator.findProblem(text.toString(), 200).orElse("");

        assertTrue(problem.contains("6-gram repeated 5 times"), problem);
    }

    @Test
    void findProblem_sixGramRepeatedFourTimes_isAccepted() {
        StringBuilder text = new StringBuilder();
        for (int i = 0; i < 4; i++) {
            for (int j = 0; j < 40; j++) {
                text.append("word").append(i * 40 + j).append(' ');
            }
            text.append("alpha beta gamma delta epsilon zeta ");
        }

        assertTrue(validator.findProblem(text.toString(), 200).isEmpty());
    }

    @Test
    void findProblem_belowMinimumLength_isRejected() {
        assertEquals("output shorter than 500 chars", validator.findProblem(VARIED, 500).orElseThrow());
        assertTrue(validator.findProblem(null, 1).isPresent());
    }

    @Test
    void findProblem_punctuationOnly_hasNoTokens() {
        assertEquals("no word tokens", validator.findProblem("... --- !!! ???", 5).orElseThrow());
    }
}
