package com.paymentsengine.rules;

import lombok.Value;

/**
 * Result of applying a transaction to an account.
 */
@Value
public class RuleResult {
    boolean approved;
    RuleViolation violation;
    String reason;

    public static RuleResult approve() {
        return new RuleResult(true, null, null);
    }

    public static RuleResult decline(RuleViolation violation, String reason) {
        return new RuleResult(false, violation, reason);
    }

    public static RuleResult mismatchedAccount(int expectedClientId, int actualClientId) {
        return decline(RuleViolation.MISMATCHED_ACCOUNT,
            String.format("Account mismatch: account belongs to client %d, transaction names client %d",
                expectedClientId, actualClientId));
    }

    public static RuleResult accountFrozen(int clientId) {
        return decline(RuleViolation.ACCOUNT_FROZEN,
            String.format("Account of client %d is frozen", clientId));
    }

    public static RuleResult missingAmount(long transactionId) {
        return decline(RuleViolation.MISSING_AMOUNT,
            String.format("Transaction %d has no amount", transactionId));
    }

    public static RuleResult depositNotFound(long transactionId) {
        return decline(RuleViolation.DEPOSIT_NOT_FOUND,
            String.format("Deposit not found: %d", transactionId));
    }

    public static RuleResult transactionNotDisputed(long transactionId) {
        return decline(RuleViolation.TRANSACTION_NOT_DISPUTED,
            String.format("Transaction not being disputed: %d", transactionId));
    }
}
