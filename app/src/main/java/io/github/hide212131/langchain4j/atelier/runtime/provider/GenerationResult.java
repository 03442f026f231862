package io.github.hide212131.langchain4j.atelier.runtime.provider;

public record GenerationResult(String content, String model, UsageReport usage) {}
