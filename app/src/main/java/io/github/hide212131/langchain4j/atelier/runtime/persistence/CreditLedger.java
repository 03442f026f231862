package io.github.hide212131.langchain4j.atelier.runtime.persistence;

/**
 * Per-user credit balances.
 */
public interface CreditLedger {

    int getBalance(String userId);

    /**
     * Removes {@code amount} credits and returns the new balance.
     *
     * @throws InsufficientCreditsException when the balance is lower than {@code amount}
     */
    int deduct(String userId, int amount, String sessionId, String description);
}
