package io.github.hide212131.langchain4j.atelier.runtime.provider;

/**
 * Told about each retry before the backoff delay starts.
 */
@FunctionalInterface
public interface RetryListener {

    void onRetry(int attempt, int maxAttempts, String reason);

    static RetryListener none() {
        return (attempt, maxAttempts, reason) -> { };
    }
}
