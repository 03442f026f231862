package io.github.hide212131.langchain4j.atelier.runtime.persistence;

/**
 * A deduction asked for more credits than the balance holds.
 */
public class InsufficientCreditsException extends RuntimeException {

    private final int balance;
    private final int requested;

    public InsufficientCreditsException(String userId, int balance, int requested) {
        super("Insufficient credits for " + userId + ": balance " + balance + ", requested " + requested);
        this.balance = balance;
        this.requested = requested;
    }

    public int balance() {
        return balance;
    }

    public int requested() {
        return requested;
    }

    public int shortfall() {
        return requested - balance;
    }
}
