package com.paymentsengine.rules;

import com.paymentsengine.accounts.ClientAccount;
import com.paymentsengine.common.Money;
import com.paymentsengine.transactions.Transaction;
import com.paymentsengine.transactions.TransactionType;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Puts a prior deposit under dispute, moving its amount from available to held.
 *
 * The available balance is allowed to go negative here: the disputed funds
 * may already have been withdrawn. A deposit whose earlier dispute was resolved
 * can be disputed again.
 */
@Component
public class DisputeRule implements TransactionRule {

    @Override
    public TransactionType getTransactionType() {
        return TransactionType.DISPUTE;
    }

    @Override
    public RuleResult apply(ClientAccount account, Transaction transaction) {
        long transactionId = transaction.getTransactionId();

        Optional<Money> deposited = account.depositAmount(transactionId);
        if (deposited.isEmpty()) {
            return RuleResult.depositNotFound(transactionId);
        }

        if (account.isDisputed(transactionId)) {
            return RuleResult.decline(RuleViolation.ALREADY_DISPUTED,
                String.format("Transaction already being disputed: %d", transactionId));
        }

        account.hold(transactionId, deposited.get());
        return RuleResult.approve();
    }

    @Override
    public String getRuleName() {
        return "Dispute";
    }
}
