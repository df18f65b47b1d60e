package org.example.simplifier.service.gateway;

import org.example.simplifier.service.llm.LlmOptions;
import org.example.simplifier.service.llm.LlmProvider;
import org.example.simplifier.service.llm.LlmProviderException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LlmRewriteGatewayTest {

    private static final String WINDOW = "It was the best of times, it was the worst of times, it was the age of wisdom, "
            + "it was the age of foolishness, it was the epoch of belief, it was the epoch of incredulity, it was "
            + "the season of Light, it was the season of Darkness, it was the spring of hope.";

    private static final String GOOD_REWRITE = "Times were very good and very bad at once. People were wise and "
            + "foolish, and they believed and doubted in equal measure. Some seasons felt bright, others dark, yet "
            + "spring still brought hope to everyone who waited for better days ahead.";

    @Mock
    private LlmProvider provider;

    private LlmRewriteGateway gateway;

    @BeforeEach
    void setUp() {
        LlmOptions options = LlmOptions.full(0.3, 0.9, 400);
        gateway = new LlmRewriteGateway(provider, OutputValidator.defaults(),
                new LlmRewriteGateway.Options(3, 0L, 200, 50, 0.5, 100, options, options.withMaxTokens(600)));
    }

    @Test
    void backendNameAndAvailability_comeFromProvider() {
        when(provider.getProviderName()).thenReturn("ollama");
        when(provider.isAvailable()).thenReturn(false);

        assertEquals("ollama", gateway.backendName());
        assertFalse(gateway.isAvailable());
    }

    @Test
    void rewrite_validOutput_succeedsOnFirstAttempt() {
        when(provider.generate(anyString(), any())).thenReturn(GOOD_REWRITE);

        GatewayOutcome outcome = gateway.rewrite(WINDOW, "book", "chapter", "tail", RewriteLevel.MODERATE);

        assertTrue(outcome.isSuccess());
        assertEquals(GOOD_REWRITE, outcome.text());
        assertEquals(1, outcome.attempts());
    }

    @Test
    void rewrite_alwaysDegenerate_failsAfterExactlyThreeCalls() {
        when(provider.generate(anyString(), any())).thenReturn("no no no no no no no no no no no no");

        GatewayOutcome outcome = gateway.rewrite(WINDOW, "", "", "", RewriteLevel.LIGHT);

        assertFalse(outcome.isSuccess());
        assertEquals(FailureKind.INVALID_OUTPUT, outcome.failureKind());
        assertEquals(3, outcome.attempts());
        verify(provider, times(3)).generate(anyString(), any());
        assertThrows(IllegalStateException.class, outcome::text);
    }

    @Test
    void rewrite_degenerateThenValid_retriesOnce() {
        when(provider.generate(anyString(), any())).thenReturn("short", GOOD_REWRITE);

        GatewayOutcome outcome = gateway.rewrite(WINDOW, "", "", "", RewriteLevel.AGGRESSIVE);

        assertTrue(outcome.isSuccess());
        assertEquals(2, outcome.attempts());
        verify(provider, times(2)).generate(anyString(), any());
    }

    @Test
    void rewrite_shortWindow_usesHalfItsLengthAsFloor() {
        String window = "The dog barked at the moon all night long.";
        when(provider.generate(anyString(), any())).thenReturn("The dog barked all night.");

        GatewayOutcome outcome = gateway.rewrite(window, "", "", "", RewriteLevel.LIGHT);

        assertTrue(outcome.isSuccess());
    }

    @Test
    void rewrite_timeout_isClassifiedAndRetried() {
        when(provider.generate(anyString(), any())).thenThrow(
                new LlmProviderException("Failed to generate", new RuntimeException(new TimeoutException("90s"))));

        GatewayOutcome outcome = gateway.rewrite(WINDOW, "", "", "", RewriteLevel.LIGHT);

        assertEquals(FailureKind.TIMEOUT, outcome.failureKind());
        verify(provider, times(3)).generate(anyString(), any());
    }

    @Test
    void classify_mapsProviderFailures() {
        assertEquals(FailureKind.RATE_LIMITED,
                LlmRewriteGateway.classify(new LlmProviderException("slow down", null, 429)));
        assertEquals(FailureKind.BACKEND_ERROR,
                LlmRewriteGateway.classify(new LlmProviderException("boom", null, 500)));
        assertEquals(FailureKind.TIMEOUT,
                LlmRewriteGateway.classify(new IllegalStateException(new TimeoutException())));
    }

    @Test
    void rewrite_promptCarriesContextAndLevel() {
        when(provider.generate(anyString(), any())).thenReturn(GOOD_REWRITE);
        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);

        gateway.rewrite(WINDOW, "BOOK-SUMMARY", "CHAPTER-SUMMARY", "PREVIOUS-TAIL", RewriteLevel.AGGRESSIVE);

        verify(provider).generate(prompt.capture(), any());
        assertTrue(prompt.getValue().contains("BOOK-SUMMARY"));
        assertTrue(prompt.getValue().contains("CHAPTER-SUMMARY"));
        assertTrue(prompt.getValue().contains("PREVIOUS-TAIL"));
        assertTrue(prompt.getValue().contains(RewriteLevel.AGGRESSIVE.instructions()));
        assertTrue(prompt.getValue().contains(WINDOW));
    }

    @Test
    void summarize_tooShort_failsWithoutRetry() {
        when(provider.generate(anyString(), any())).thenReturn("Too short.");

        GatewayOutcome outcome = gateway.summarize(WINDOW, SummaryScope.CHAPTER);

        assertEquals(FailureKind.INVALID_OUTPUT, outcome.failureKind());
        verify(provider, times(1)).generate(anyString(), any());
    }

    @Test
    void summarize_backendError_isReportedAsFailure() {
        when(provider.generate(anyString(), any())).thenThrow(new LlmProviderException("down", null, 503));

        GatewayOutcome outcome = gateway.summarize(WINDOW, SummaryScope.BOOK);

        assertEquals(FailureKind.BACKEND_ERROR, outcome.failureKind());
    }

    @Test
    void smoothTransitions_outputBelowHalfTheChapter_isRejected() {
        String chapter = GOOD_REWRITE + "\n\n" + GOOD_REWRITE + "\n\n" + GOOD_REWRITE;
        when(provider.generate(anyString(), any())).thenReturn(GOOD_REWRITE);

        GatewayOutcome outcome = gateway.smoothTransitions(chapter);

        assertEquals(FailureKind.INVALID_OUTPUT, outcome.failureKind());
        verify(provider, times(3)).generate(anyString(), any());
    }
}
