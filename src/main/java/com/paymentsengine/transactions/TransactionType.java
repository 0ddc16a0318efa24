package com.paymentsengine.transactions;

import com.paymentsengine.common.exception.InvalidTransactionException;

import java.util.Locale;

/**
 * Kinds of client transactions.
 *
 * Deposits and withdrawals carry their own amount. Disputes, resolves and
 * chargebacks carry none: they act on the amount of the earlier deposit
 * with the same transaction id.
 */
public enum TransactionType {
    /**
     * Credit to the client's available funds.
     */
    DEPOSIT,

    /**
     * Debit from the client's available funds.
     */
    WITHDRAWAL,

    /**
     * Claim against a prior deposit. Moves its amount from available to held.
     */
    DISPUTE,

    /**
     * Ends a dispute in the client's favour. Moves the held amount back to available.
     */
    RESOLVE,

    /**
     * Ends a dispute against the client. Removes the held amount and locks the account.
     */
    CHARGEBACK;

    public boolean requiresAmount() {
        return this == DEPOSIT || this == WITHDRAWAL;
    }

    /**
     * Parse the code used in input files, e.g. {@code "deposit"} or {@code " Chargeback "}.
     */
    public static TransactionType fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new InvalidTransactionException("Transaction type is missing");
        }
        try {
            return valueOf(code.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidTransactionException("Unknown transaction type: " + code.trim(), e);
        }
    }

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
