package com.paymentsengine.rules;

import com.paymentsengine.accounts.ClientAccount;
import com.paymentsengine.common.Money;
import com.paymentsengine.transactions.Transaction;
import com.paymentsengine.transactions.TransactionType;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Debits the withdrawn amount from the available balance.
 * Held funds can never be withdrawn.
 */
@Component
public class WithdrawalRule implements TransactionRule {

    @Override
    public TransactionType getTransactionType() {
        return TransactionType.WITHDRAWAL;
    }

    @Override
    public RuleResult apply(ClientAccount account, Transaction transaction) {
        Optional<Money> amount = transaction.getAmount();
        if (amount.isEmpty()) {
            return RuleResult.missingAmount(transaction.getTransactionId());
        }

        if (account.getAvailable().isLessThan(amount.get())) {
            return RuleResult.decline(RuleViolation.INSUFFICIENT_FUNDS,
                String.format("Insufficient funds for client %d. Required: %s, Available: %s",
                    account.getClientId(), amount.get(), account.getAvailable()));
        }

        account.debit(amount.get());
        return RuleResult.approve();
    }

    @Override
    public String getRuleName() {
        return "Withdrawal";
    }
}
