package org.example.simplifier.service.gateway;

import org.example.simplifier.config.RewriteProperties;
import org.example.simplifier.service.llm.LlmOptions;
import org.example.simplifier.service.llm.LlmProvider;
import org.example.simplifier.service.llm.LlmProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * {@link RewriteGateway} backed by a single {@link LlmProvider}.
 * Builds the prompts, validates every answer and retries with a fixed backoff.
 */
@Service
public class LlmRewriteGateway implements RewriteGateway {

    private static final Logger log = LoggerFactory.getLogger(LlmRewriteGateway.class);

    public record Options(
            int attempts,
            long backoffMillis,
            int minChars,
            int summaryMinChars,
            double transitionMinRatio,
            int transitionMinChars,
            LlmOptions rewriteOptions,
            LlmOptions summaryOptions
    ) {
        static Options from(RewriteProperties properties) {
            RewriteProperties.Generation generation = properties.getGeneration();
            int rewriteTokens = properties.isFastMode()
                    ? generation.getFastMaxTokens()
                    : generation.getQualityMaxTokens();
            LlmOptions rewrite = LlmOptions.full(generation.getTemperature(), generation.getTopP(), rewriteTokens);
            return new Options(
                    Math.max(1, properties.getRetry().getAttempts()),
                    Math.max(0L, properties.getRetry().getBackoffMillis()),
                    properties.getValidation().getMinChars(),
                    properties.getSummary().getMinChars(),
                    properties.getValidation().getTransitionMinRatio(),
                    properties.getValidation().getTransitionMinChars(),
                    rewrite,
                    rewrite.withMaxTokens(generation.getSummaryMaxTokens())
            );
        }
    }

    private final LlmProvider provider;
    private final OutputValidator validator;
    private final Options options;

    @Autowired
    public LlmRewriteGateway(LlmProvider rewriteLlmProvider, RewriteProperties properties) {
        this(rewriteLlmProvider,
                new OutputValidator(
                        properties.getValidation().getMinUniqueRatio(),
                        properties.getValidation().getNgramSize(),
                        properties.getValidation().getMaxNgramRepeats()),
                Options.from(properties));
    }

    public LlmRewriteGateway(LlmProvider provider, OutputValidator validator, Options options) {
        this.provider = provider;
        this.validator = validator;
        this.options = options;
    }

    @Override
    public GatewayOutcome rewrite(String windowText, String globalSummary, String chapterSummary,
                                  String memoryTail, RewriteLevel level) {
        String prompt = buildRewritePrompt(windowText, globalSummary, chapterSummary, memoryTail, level);
        int minChars = Math.min(options.minChars(), Math.max(1, windowText.length() / 2));
        return generateValidated("rewrite", prompt, options.rewriteOptions(), minChars, options.attempts());
    }

    @Override
    public GatewayOutcome summarize(String text, SummaryScope scope) {
        String prompt = buildSummaryPrompt(text, scope);
        try {
            String output = provider.generate(prompt, options.summaryOptions());
            if (output == null || output.length() < options.summaryMinChars()) {
                return GatewayOutcome.failure(FailureKind.INVALID_OUTPUT,
                        "summary shorter than " + options.summaryMinChars() + " chars");
            }
            return GatewayOutcome.success(output);
        } catch (RuntimeException e) {
            log.warn("Summary of {} failed: {}", scope.description(), e.getMessage());
            return GatewayOutcome.failure(classify(e), e.getMessage());
        }
    }

    @Override
    public GatewayOutcome smoothTransitions(String chapterText) {
        String prompt = buildTransitionPrompt(chapterText);
        int minChars = Math.max(options.transitionMinChars(),
                (int) (chapterText.length() * options.transitionMinRatio()));
        return generateValidated("transitions", prompt, options.rewriteOptions(), minChars, options.attempts());
    }

    @Override
    public String backendName() {
        return provider.getProviderName();
    }

    @Override
    public boolean isAvailable() {
        return provider.isAvailable();
    }

    private GatewayOutcome generateValidated(String operation, String prompt, LlmOptions llmOptions,
                                             int minChars, int attempts) {
        GatewayOutcome last = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            last = attemptOnce(() -> provider.generate(prompt, llmOptions), minChars, attempt);
            if (last.isSuccess()) {
                return last;
            }
            log.warn("{} attempt {}/{} rejected ({}): {}",
                    operation, attempt, attempts, last.failureKind(), last.detail());
            if (attempt < attempts && !backoff()) {
                break;
            }
        }
        return last;
    }

    private GatewayOutcome attemptOnce(Supplier<String> call, int minChars, int attempt) {
        try {
            String output = call.get();
            Optional<String> problem = validator.findProblem(output, minChars);
            if (problem.isPresent()) {
                return GatewayOutcome.failure(FailureKind.INVALID_OUTPUT, problem.get(), attempt);
            }
            return GatewayOutcome.success(output, attempt);
        } catch (RuntimeException e) {
            return GatewayOutcome.failure(classify(e), e.getMessage(), attempt);
        }
    }

    private boolean backoff() {
        if (options.backoffMillis() <= 0) {
            return true;
        }
        try {
            Thread.sleep(options.backoffMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    static FailureKind classify(Throwable error) {
        if (error instanceof LlmProviderException providerError && providerError.isRateLimited()) {
            return FailureKind.RATE_LIMITED;
        }
        for (Throwable cause = error; cause != null; cause = cause.getCause()) {
            if (cause instanceof TimeoutException) {
                return FailureKind.TIMEOUT;
            }
        }
        return FailureKind.BACKEND_ERROR;
    }

    String buildRewritePrompt(String windowText, String globalSummary, String chapterSummary,
                              String memoryTail, RewriteLevel level) {
        return String.format("""
            You are an editorial assistant specialized in rewriting WITHOUT SUMMARIZING.
            Follow the instructions carefully. Preserve every fact, name, date, example and the logical structure.

            %s

            RULES:
            1) Do NOT summarize; keep a length similar to the original.
            2) Preserve paragraphs; do not add or remove breaks unnecessarily.
            3) Adjust sentences for clarity without deleting content.
            4) Stay consistent with what has already been rewritten (previous memory).

            GLOBAL CONTEXT (book summary):
            %s

            CHAPTER CONTEXT (summary):
            %s

            PREVIOUS MEMORY (end of the last rewritten passage):
            %s

            TEXT TO REWRITE (keep content and length; only simplify the language):
            %s

            Rewritten text:""",
                level.instructions(),
                nullToEmpty(globalSummary),
                nullToEmpty(chapterSummary),
                nullToEmpty(memoryTail),
                windowText);
    }

    String buildSummaryPrompt(String text, SummaryScope scope) {
        return String.format("""
            You are an editorial assistant. Write an OBJECTIVE, NON-EVALUATIVE summary covering every key idea.
            Do not invent facts. At most 15 lines. Plain language.

            Summary scope: %s

            Text:
            %s

            Summary:""", scope.description(), text);
    }

    String buildTransitionPrompt(String chapterText) {
        return String.format("""
            Revise the text below ONLY to smooth the transitions between paragraphs and sentences,
            without removing content, without summarizing and without introducing new ideas.
            Keep the same information and the same paragraphs.

            Text:
            %s

            Revised text:""", chapterText);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
