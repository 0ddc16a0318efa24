package com.paymentsengine.ledger;

import com.paymentsengine.accounts.ClientAccount;
import com.paymentsengine.rules.RuleViolation;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * In-memory state of one run: every client account seen so far, keyed by client id,
 * plus counters of applied and declined transactions.
 *
 * Lives for a single run and is never persisted.
 */
public class Ledger {

    private final Map<Integer, ClientAccount> accounts = new TreeMap<>();

    private final Map<RuleViolation, Long> declines = new EnumMap<>(RuleViolation.class);

    private long applied;

    /**
     * Get the account of a client, opening an empty one on first use.
     */
    public ClientAccount accountFor(int clientId) {
        return accounts.computeIfAbsent(clientId, ClientAccount::new);
    }

    public Optional<ClientAccount> findAccount(int clientId) {
        return Optional.ofNullable(accounts.get(clientId));
    }

    /**
     * All accounts, ordered by client id.
     */
    public Collection<ClientAccount> getAccounts() {
        return Collections.unmodifiableCollection(accounts.values());
    }

    public int size() {
        return accounts.size();
    }

    void recordApplied() {
        applied++;
    }

    void recordDeclined(RuleViolation violation) {
        declines.merge(violation, 1L, Long::sum);
    }

    public long getAppliedCount() {
        return applied;
    }

    public long getDeclinedCount() {
        return declines.values().stream().mapToLong(Long::longValue).sum();
    }

    public Map<RuleViolation, Long> getDeclinesByViolation() {
        return Collections.unmodifiableMap(declines);
    }
}
