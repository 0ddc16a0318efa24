package com.paymentsengine.accounts;

import com.paymentsengine.common.Money;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Balances of a single client, plus the two indices needed to validate disputes:
 * amounts of accepted deposits by transaction id, and the transaction ids currently under dispute.
 *
 * The mutators below perform no validation. Callers (the rules) check every
 * precondition first, so a rejected transaction never leaves a partial update behind.
 */
@Getter
@ToString(exclude = {"deposits", "activeDisputes"})
public class ClientAccount {

    private final int clientId;

    private Money available = Money.ZERO;

    private Money held = Money.ZERO;

    private boolean frozen;

    @Getter(AccessLevel.NONE)
    private final Map<Long, Money> deposits = new HashMap<>();

    @Getter(AccessLevel.NONE)
    private final Set<Long> activeDisputes = new HashSet<>();

    public ClientAccount(int clientId) {
        this.clientId = clientId;
    }

    /**
     * Get the total balance (available + held).
     */
    public Money total() {
        return available.add(held);
    }

    public Optional<Money> depositAmount(long transactionId) {
        return Optional.ofNullable(deposits.get(transactionId));
    }

    public boolean isDisputed(long transactionId) {
        return activeDisputes.contains(transactionId);
    }

    public Set<Long> getActiveDisputes() {
        return Collections.unmodifiableSet(activeDisputes);
    }

    /**
     * Add funds to the available balance and remember the deposit so it can be disputed later.
     */
    public void credit(long transactionId, Money amount) {
        available = available.add(amount);
        deposits.put(transactionId, amount);
    }

    public void debit(Money amount) {
        available = available.subtract(amount);
    }

    /**
     * Move a disputed deposit's amount from available to held.
     */
    public void hold(long transactionId, Money amount) {
        available = available.subtract(amount);
        held = held.add(amount);
        activeDisputes.add(transactionId);
    }

    /**
     * Return a held amount to available and close the dispute.
     */
    public void release(long transactionId, Money amount) {
        held = held.subtract(amount);
        available = available.add(amount);
        activeDisputes.remove(transactionId);
    }

    /**
     * Remove a held amount from the account for good, close the dispute and lock the account.
     */
    public void chargeBack(long transactionId, Money amount) {
        held = held.subtract(amount);
        activeDisputes.remove(transactionId);
        frozen = true;
    }
}
