package com.paymentsengine.rules;

import com.paymentsengine.accounts.ClientAccount;
import com.paymentsengine.common.Money;
import com.paymentsengine.transactions.Transaction;
import com.paymentsengine.transactions.TransactionType;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Credits the deposited amount to the available balance and records it
 * so that it can be disputed later.
 */
@Component
public class DepositRule implements TransactionRule {

    private final boolean rejectDuplicateDeposits;

    public DepositRule(@Value("${payments-engine.rules.reject-duplicate-deposits:true}")
                       boolean rejectDuplicateDeposits) {
        this.rejectDuplicateDeposits = rejectDuplicateDeposits;
    }

    @Override
    public TransactionType getTransactionType() {
        return TransactionType.DEPOSIT;
    }

    @Override
    public RuleResult apply(ClientAccount account, Transaction transaction) {
        Optional<Money> amount = transaction.getAmount();
        if (amount.isEmpty()) {
            return RuleResult.missingAmount(transaction.getTransactionId());
        }

        // Otherwise last write wins on the deposit index
        if (rejectDuplicateDeposits && account.depositAmount(transaction.getTransactionId()).isPresent()) {
            return RuleResult.decline(RuleViolation.DUPLICATE_TRANSACTION,
                String.format("Deposit %d already recorded for client %d",
                    transaction.getTransactionId(), account.getClientId()));
        }

        account.credit(transaction.getTransactionId(), amount.get());
        return RuleResult.approve();
    }

    @Override
    public String getRuleName() {
        return "Deposit";
    }
}
