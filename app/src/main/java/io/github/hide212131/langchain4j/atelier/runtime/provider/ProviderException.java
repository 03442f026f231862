package io.github.hide212131.langchain4j.atelier.runtime.provider;

import io.github.hide212131.langchain4j.atelier.runtime.model.ProviderType;
import java.util.Objects;

/**
 * Raised by a {@link ProviderGateway} when a call fails for good: a fatal fault, exhausted retries, or a
 * stream that broke after output was already delivered.
 */
public class ProviderException extends RuntimeException {

    private final ProviderType provider;
    private final ProviderFault fault;
    private final int attempts;
    private final boolean midStream;

    public ProviderException(
            ProviderType provider, ProviderFault fault, int attempts, boolean midStream, String message, Throwable cause) {
        super(message, cause);
        this.provider = Objects.requireNonNull(provider, "provider");
        this.fault = Objects.requireNonNull(fault, "fault");
        this.attempts = attempts;
        this.midStream = midStream;
    }

    public ProviderType provider() {
        return provider;
    }

    public ProviderFault fault() {
        return fault;
    }

    public int attempts() {
        return attempts;
    }

    public boolean midStream() {
        return midStream;
    }
}
