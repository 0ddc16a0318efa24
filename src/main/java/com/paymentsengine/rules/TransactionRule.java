package com.paymentsengine.rules;

import com.paymentsengine.accounts.ClientAccount;
import com.paymentsengine.transactions.Transaction;
import com.paymentsengine.transactions.TransactionType;

/**
 * Interface for the per-kind transaction rules.
 *
 * Each rule handles exactly one {@link TransactionType}. It checks its own
 * preconditions and, only when all of them hold, mutates the account.
 * The client-id and frozen-account guards are run by {@link RulesEngine}
 * before a rule is invoked.
 */
public interface TransactionRule {

    /**
     * The transaction type this rule handles.
     */
    TransactionType getTransactionType();

    /**
     * Apply the transaction to the account.
     *
     * @param account the account owned by the transaction's client
     * @param transaction a transaction of {@link #getTransactionType()}
     * @return approval, or the violation that left the account untouched
     */
    RuleResult apply(ClientAccount account, Transaction transaction);

    /**
     * Get the name of this rule.
     */
    String getRuleName();
}
