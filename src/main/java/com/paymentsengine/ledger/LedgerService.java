package com.paymentsengine.ledger;

import com.paymentsengine.accounts.ClientAccount;
import com.paymentsengine.rules.RuleResult;
import com.paymentsengine.rules.RulesEngine;
import com.paymentsengine.transactions.Transaction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.stream.Stream;

/**
 * Service that folds a stream of transactions into client accounts.
 *
 * Transactions are applied strictly in the order received. A declined
 * transaction is logged and counted, and processing carries on with the next one.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerService {

    private final RulesEngine rulesEngine;

    /**
     * Apply every transaction of the stream to a fresh ledger.
     */
    public Ledger process(Stream<Transaction> transactions) {
        Ledger ledger = new Ledger();
        transactions.forEachOrdered(transaction -> apply(ledger, transaction));

        log.info("Processed {} transactions: {} applied, {} declined, {} accounts",
            ledger.getAppliedCount() + ledger.getDeclinedCount(),
            ledger.getAppliedCount(), ledger.getDeclinedCount(), ledger.size());
        if (ledger.getDeclinedCount() > 0) {
            log.info("Declines by reason: {}", ledger.getDeclinesByViolation());
        }
        return ledger;
    }

    /**
     * Apply a single transaction to the account of the client it names.
     */
    public RuleResult apply(Ledger ledger, Transaction transaction) {
        ClientAccount account = ledger.accountFor(transaction.getClientId());
        RuleResult result = rulesEngine.process(account, transaction);

        if (result.isApproved()) {
            ledger.recordApplied();
        } else {
            ledger.recordDeclined(result.getViolation());
            log.warn("Declined {} tx={} client={}: {} ({})",
                transaction.getType().code(), transaction.getTransactionId(), transaction.getClientId(),
                result.getViolation(), result.getReason());
        }
        return result;
    }
}
