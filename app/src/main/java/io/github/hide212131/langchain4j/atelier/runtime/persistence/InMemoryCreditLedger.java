package io.github.hide212131.langchain4j.atelier.runtime.persistence;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link CreditLedger}. Unknown users hold zero credits.
 */
public final class InMemoryCreditLedger implements CreditLedger {

    private final Map<String, Integer> balances = new ConcurrentHashMap<>();
    private final List<Deduction> deductions = new ArrayList<>();

    public InMemoryCreditLedger grant(String userId, int credits) {
        if (credits < 0) {
            throw new IllegalArgumentException("credits must not be negative");
        }
        balances.merge(userId, credits, Integer::sum);
        return this;
    }

    @Override
    public int getBalance(String userId) {
        return balances.getOrDefault(userId, 0);
    }

    @Override
    public synchronized int deduct(String userId, int amount, String sessionId, String description) {
        if (amount < 0) {
            throw new IllegalArgumentException("amount must not be negative");
        }
        int balance = getBalance(userId);
        if (balance < amount) {
            throw new InsufficientCreditsException(userId, balance, amount);
        }
        int remaining = balance - amount;
        balances.put(userId, remaining);
        deductions.add(new Deduction(userId, amount, sessionId, description));
        return remaining;
    }

    public synchronized List<Deduction> deductions() {
        return List.copyOf(deductions);
    }

    public record Deduction(String userId, int amount, String sessionId, String description) {}
}
