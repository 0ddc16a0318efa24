package com.paymentsengine.rules;

/**
 * Reasons a transaction can be rejected.
 */
public enum RuleViolation {
    /**
     * The transaction names a different client than the account it was routed to.
     */
    MISMATCHED_ACCOUNT,

    /**
     * The account was locked by an earlier chargeback.
     */
    ACCOUNT_FROZEN,

    /**
     * A deposit or withdrawal without an amount.
     */
    MISSING_AMOUNT,

    /**
     * A withdrawal larger than the available balance.
     */
    INSUFFICIENT_FUNDS,

    /**
     * A dispute, resolve or chargeback referencing no accepted deposit.
     */
    DEPOSIT_NOT_FOUND,

    /**
     * A resolve or chargeback for a deposit that is not under dispute.
     */
    TRANSACTION_NOT_DISPUTED,

    /**
     * A deposit reusing the id of a deposit already accepted on the account.
     */
    DUPLICATE_TRANSACTION,

    /**
     * A dispute for a deposit that is already under dispute.
     */
    ALREADY_DISPUTED
}
