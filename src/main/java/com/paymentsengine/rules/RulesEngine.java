package com.paymentsengine.rules;

import com.paymentsengine.accounts.ClientAccount;
import com.paymentsengine.transactions.Transaction;
import com.paymentsengine.transactions.TransactionType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Rules engine that applies a transaction to the account it belongs to.
 *
 * The client-id and frozen-account guards run once, before dispatch. The
 * transaction is then handed to the single rule registered for its type.
 */
@Service
@Slf4j
public class RulesEngine {

    private final Map<TransactionType, TransactionRule> rules = new EnumMap<>(TransactionType.class);

    public RulesEngine(List<TransactionRule> rules) {
        for (TransactionRule rule : rules) {
            TransactionRule previous = this.rules.put(rule.getTransactionType(), rule);
            if (previous != null) {
                throw new IllegalStateException(String.format("Rules %s and %s both handle %s",
                    previous.getRuleName(), rule.getRuleName(), rule.getTransactionType()));
            }
        }
        for (TransactionType type : TransactionType.values()) {
            if (!this.rules.containsKey(type)) {
                throw new IllegalStateException("No rule registered for transaction type " + type);
            }
        }
    }

    /**
     * Apply a transaction to an account.
     *
     * @param account the account the transaction was routed to
     * @param transaction the transaction to apply
     * @return the result; on decline the account is unchanged
     */
    public RuleResult process(ClientAccount account, Transaction transaction) {
        RuleResult guard = checkPreconditions(account, transaction);
        if (!guard.isApproved()) {
            return guard;
        }

        TransactionRule rule = rules.get(transaction.getType());
        RuleResult result = rule.apply(account, transaction);

        if (result.isApproved()) {
            log.debug("Rule {} applied tx {} to client {}",
                rule.getRuleName(), transaction.getTransactionId(), account.getClientId());
        } else {
            log.debug("Rule {} declined tx {}: {}",
                rule.getRuleName(), transaction.getTransactionId(), result.getReason());
        }
        return result;
    }

    private RuleResult checkPreconditions(ClientAccount account, Transaction transaction) {
        if (account.getClientId() != transaction.getClientId()) {
            return RuleResult.mismatchedAccount(account.getClientId(), transaction.getClientId());
        }
        if (account.isFrozen()) {
            return RuleResult.accountFrozen(account.getClientId());
        }
        return RuleResult.approve();
    }
}
