package io.github.hide212131.langchain4j.atelier.infra.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thin wrapper around SLF4J shared by the engine. Each component logs under its own category.
 */
public final class WorkflowLogger {

    private final Logger logger;

    public WorkflowLogger() {
        this(WorkflowLogger.class);
    }

    public WorkflowLogger(Class<?> owner) {
        this.logger = LoggerFactory.getLogger(owner);
    }

    public void info(String message, Object... args) {
        logger.info(message, args);
    }

    public void debug(String message, Object... args) {
        logger.debug(message, args);
    }

    public void warn(String message, Object... args) {
        logger.warn(message, args);
    }

    public void error(String message, Object... args) {
        logger.error(message, args);
    }

    public boolean isDebugEnabled() {
        return logger.isDebugEnabled();
    }

    /**
     * Masks a secret so only its last four characters remain visible.
     */
    public static String mask(String secret) {
        if (secret == null || secret.isBlank()) {
            return "(not set)";
        }
        String trimmed = secret.trim();
        if (trimmed.length() <= 4) {
            return "****";
        }
        return "****" + trimmed.substring(trimmed.length() - 4);
    }
}
