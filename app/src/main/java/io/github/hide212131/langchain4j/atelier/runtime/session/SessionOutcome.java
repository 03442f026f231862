package io.github.hide212131.langchain4j.atelier.runtime.session;

import io.github.hide212131.langchain4j.atelier.runtime.model.ExchangeTurn;
import io.github.hide212131.langchain4j.atelier.runtime.model.SessionStatus;
import java.util.List;
import java.util.Optional;

/**
 * What a finished session leaves behind.
 *
 * @param remainingBalance the user's balance after settlement, null when nothing was deducted
 * @param creditShortfall credits the ledger could not cover, 0 when settlement succeeded or was skipped
 */
public record SessionOutcome(
        String sessionId,
        SessionStatus status,
        String reason,
        int roundsCompleted,
        List<ExchangeTurn> turns,
        int creditsUsed,
        String finalDocument,
        Integer remainingBalance,
        int creditShortfall) {

    public SessionOutcome {
        turns = turns == null ? List.of() : List.copyOf(turns);
        finalDocument = finalDocument == null ? "" : finalDocument;
    }

    public Optional<Integer> optionalRemainingBalance() {
        return Optional.ofNullable(remainingBalance);
    }

    public boolean settledInFull() {
        return creditShortfall == 0;
    }
}
