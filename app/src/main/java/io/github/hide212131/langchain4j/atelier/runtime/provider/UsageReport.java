package io.github.hide212131.langchain4j.atelier.runtime.provider;

import io.github.hide212131.langchain4j.atelier.runtime.usage.UsageMeter;

/**
 * Token counts of one call. {@code estimated} is set when the backend did not report usage.
 */
public record UsageReport(int inputTokens, int outputTokens, boolean estimated) {

    public UsageReport {
        if (inputTokens < 0 || outputTokens < 0) {
            throw new IllegalArgumentException("token counts must not be negative");
        }
    }

    public static UsageReport reported(int inputTokens, int outputTokens) {
        return new UsageReport(inputTokens, outputTokens, false);
    }

    public static UsageReport estimate(GenerationRequest request, String content) {
        return new UsageReport(
                UsageMeter.estimateTokens(request.systemPrompt() + request.userPrompt()),
                UsageMeter.estimateTokens(content),
                true);
    }

    public int totalTokens() {
        return inputTokens + outputTokens;
    }
}
