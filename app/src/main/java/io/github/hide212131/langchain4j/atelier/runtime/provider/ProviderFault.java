package io.github.hide212131.langchain4j.atelier.runtime.provider;

/**
 * Closed set of failure categories every backend failure is mapped into.
 */
public enum ProviderFault {
    RATE_LIMITED("Rate limit reached"),
    OVERLOADED("Service temporarily overloaded"),
    SERVER_ERROR("Service temporarily overloaded"),
    FATAL("Request rejected");

    private final String retryReason;

    ProviderFault(String retryReason) {
        this.retryReason = retryReason;
    }

    public boolean isRetryable() {
        return this != FATAL;
    }

    /** Text handed to retry listeners. */
    public String retryReason() {
        return retryReason;
    }
}
