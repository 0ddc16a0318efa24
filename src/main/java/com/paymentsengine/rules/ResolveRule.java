package com.paymentsengine.rules;

import com.paymentsengine.accounts.ClientAccount;
import com.paymentsengine.common.Money;
import com.paymentsengine.transactions.Transaction;
import com.paymentsengine.transactions.TransactionType;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Closes a dispute in the client's favour, returning the held amount to available.
 */
@Component
public class ResolveRule implements TransactionRule {

    @Override
    public TransactionType getTransactionType() {
        return TransactionType.RESOLVE;
    }

    @Override
    public RuleResult apply(ClientAccount account, Transaction transaction) {
        long transactionId = transaction.getTransactionId();

        Optional<Money> deposited = account.depositAmount(transactionId);
        if (deposited.isEmpty()) {
            return RuleResult.depositNotFound(transactionId);
        }
        if (!account.isDisputed(transactionId)) {
            return RuleResult.transactionNotDisputed(transactionId);
        }

        account.release(transactionId, deposited.get());
        return RuleResult.approve();
    }

    @Override
    public String getRuleName() {
        return "Resolve";
    }
}
