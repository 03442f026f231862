package io.github.hide212131.langchain4j.atelier.runtime.provider;

/**
 * Full text of a streamed response together with its usage.
 */
public record StreamingResult(String content, UsageReport usage) {}
