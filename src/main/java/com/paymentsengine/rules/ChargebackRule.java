package com.paymentsengine.rules;

import com.paymentsengine.accounts.ClientAccount;
import com.paymentsengine.common.Money;
import com.paymentsengine.transactions.Transaction;
import com.paymentsengine.transactions.TransactionType;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Closes a dispute against the client.
 *
 * Unlike a resolve, a chargeback is irreversible: the held amount leaves the
 * account and the account is frozen, so every later transaction is rejected.
 */
@Component
public class ChargebackRule implements TransactionRule {

    @Override
    public TransactionType getTransactionType() {
        return TransactionType.CHARGEBACK;
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

        account.chargeBack(transactionId, deposited.get());
        return RuleResult.approve();
    }

    @Override
    public String getRuleName() {
        return "Chargeback";
    }
}
