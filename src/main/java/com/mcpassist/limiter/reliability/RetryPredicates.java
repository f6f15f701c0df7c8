package com.mcpassist.limiter.reliability;

import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;

import com.mcpassist.limiter.ResilienceException;

/**
 * Retry predicates for tool invocations.
 */
public final class RetryPredicates {
    public static final String DOC_TOOL = "go-doc";

    private static final List<String> TRANSIENT_PATTERNS = List.of(
            "timeout",
            "timed out",
            "deadline exceeded",
            "temporary",
            "connection",
            "network",
            "try again",
            "resource temporarily unavailable",
            "broken pipe");

    private static final List<String> DOC_TOOL_PATTERNS = List.of(
            "command not found",
            "exit status",
            "no such file");

    private RetryPredicates() {}

    /**
     * Retries every error except the outcomes of the resilience components themselves
     * (cancellation, rate limit, open circuit) and interrupts.
     */
    public static Predicate<Throwable> defaults() {
        return error -> !(error instanceof ResilienceException) && !(error instanceof InterruptedException);
    }

    /**
     * Retries only errors whose message chain mentions a transient condition. The
     * documentation tool also retries failures of its external command.
     */
    public static Predicate<Throwable> transientOnly(String tool) {
        boolean docTool = DOC_TOOL.equals(tool);
        return error -> {
            if (error instanceof ResilienceException || error instanceof InterruptedException) {
                return false;
            }
            String text = describe(error);
            if (matchesAny(text, TRANSIENT_PATTERNS)) {
                return true;
            }
            return docTool && matchesAny(text, DOC_TOOL_PATTERNS);
        };
    }

    private static boolean matchesAny(String text, List<String> patterns) {
        for (String pattern : patterns) {
            if (text.contains(pattern)) {
                return true;
            }
        }
        return false;
    }

    private static String describe(Throwable error) {
        StringBuilder text = new StringBuilder();
        for (Throwable t = error; t != null; t = t.getCause() == t ? null : t.getCause()) {
            text.append(t.getClass().getSimpleName()).append(": ").append(t.getMessage()).append('\n');
        }
        return text.toString().toLowerCase(Locale.ROOT);
    }
}
