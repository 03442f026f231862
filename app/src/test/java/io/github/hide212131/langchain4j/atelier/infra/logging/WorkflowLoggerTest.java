package io.github.hide212131.langchain4j.atelier.infra.logging;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class WorkflowLoggerTest {

    @Test
    void maskKeepsOnlyTheLastFourCharacters() {
        assertThat(WorkflowLogger.mask("sk-live-abcdef1234")).isEqualTo("****1234");
        assertThat(WorkflowLogger.mask(" abcd ")).isEqualTo("****");
        assertThat(WorkflowLogger.mask("")).isEqualTo("(not set)");
        assertThat(WorkflowLogger.mask(null)).isEqualTo("(not set)");
    }

    @Test
    void loggingDelegatesToSlf4j() {
        WorkflowLogger logger = new WorkflowLogger(WorkflowLoggerTest.class);

        logger.info("plain message");
        logger.debug("value {}", 42);
        logger.warn("two {} {}", "a", "b");

        assertThat(logger.isDebugEnabled()).isFalse();
    }
}
