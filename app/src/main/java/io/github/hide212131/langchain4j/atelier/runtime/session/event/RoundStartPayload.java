package io.github.hide212131.langchain4j.atelier.runtime.session.event;

import com.fasterxml.jackson.annotation.JsonProperty;

/** {@code finalPass} is null for regular rounds and true for the closing Writer pass. */
public record RoundStartPayload(int round, int maxRounds, @JsonProperty("is_final_pass") Boolean finalPass)
        implements SessionEventPayload {

    @Override
    public SessionEventType type() {
        return SessionEventType.ROUND_START;
    }
}
