package com.paymentsengine.ledger;

import com.paymentsengine.accounts.ClientAccount;
import com.paymentsengine.common.Money;
import com.paymentsengine.rules.ChargebackRule;
import com.paymentsengine.rules.DepositRule;
import com.paymentsengine.rules.DisputeRule;
import com.paymentsengine.rules.ResolveRule;
import com.paymentsengine.rules.RuleResult;
import com.paymentsengine.rules.RuleViolation;
import com.paymentsengine.rules.RulesEngine;
import com.paymentsengine.rules.WithdrawalRule;
import com.paymentsengine.transactions.Transaction;
import com.paymentsengine.transactions.TransactionType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for folding transaction streams into accounts.
 */
class LedgerServiceTest {

    private LedgerService ledgerService;

    @BeforeEach
    void setUp() {
        RulesEngine rulesEngine = new RulesEngine(List.of(
            new DepositRule(true), new WithdrawalRule(), new DisputeRule(),
            new ResolveRule(), new ChargebackRule()));
        ledgerService = new LedgerService(rulesEngine);
    }

    private static Transaction deposit(int client, long tx, String amount) {
        return Transaction.of(TransactionType.DEPOSIT, client, tx, Money.of(amount));
    }

    private static Transaction withdrawal(int client, long tx, String amount) {
        return Transaction.of(TransactionType.WITHDRAWAL, client, tx, Money.of(amount));
    }

    private static Transaction reference(TransactionType type, int client, long tx) {
        return Transaction.of(type, client, tx);
    }

    @Test
    void testDisputeThenChargebackScenario() {
        Ledger ledger = new Ledger();

        ledgerService.apply(ledger, deposit(1, 1, "100.0"));
        ledgerService.apply(ledger, reference(TransactionType.DISPUTE, 1, 1));

        ClientAccount account = ledger.findAccount(1).orElseThrow();
        assertEquals(Money.ZERO, account.getAvailable());
        assertEquals(Money.of("100"), account.getHeld());
        assertEquals(Money.of("100"), account.total());

        ledgerService.apply(ledger, reference(TransactionType.CHARGEBACK, 1, 1));

        assertEquals(Money.ZERO, account.getAvailable());
        assertEquals(Money.ZERO, account.getHeld());
        assertEquals(Money.ZERO, account.total());
        assertTrue(account.isFrozen());
    }

    @Test
    void testTransactionsAfterChargebackAreDeclined() {
        Ledger ledger = ledgerService.process(Stream.of(
            deposit(1, 1, "100"),
            deposit(1, 2, "20"),
            reference(TransactionType.DISPUTE, 1, 1),
            reference(TransactionType.CHARGEBACK, 1, 1)));

        RuleResult result = ledgerService.apply(ledger, withdrawal(1, 3, "5"));

        assertEquals(RuleViolation.ACCOUNT_FROZEN, result.getViolation());
        ClientAccount account = ledger.findAccount(1).orElseThrow();
        assertEquals(Money.of("20"), account.getAvailable());
        assertEquals(Money.of("20"), account.total());
    }

    @Test
    void testInsufficientFundsScenario() {
        Ledger ledger = new Ledger();
        ledgerService.apply(ledger, deposit(2, 2, "50.0"));

        RuleResult result = ledgerService.apply(ledger, withdrawal(2, 3, "70.0"));

        assertEquals(RuleViolation.INSUFFICIENT_FUNDS, result.getViolation());
        ClientAccount account = ledger.findAccount(2).orElseThrow();
        assertEquals(Money.of("50"), account.getAvailable());
        assertEquals(Money.ZERO, account.getHeld());
        assertEquals(Money.of("50"), account.total());
        assertFalse(account.isFrozen());
    }

    @Test
    void testDisputeWithoutDepositScenario() {
        Ledger ledger = new Ledger();

        RuleResult result = ledgerService.apply(ledger, reference(TransactionType.DISPUTE, 3, 99));

        assertEquals(RuleViolation.DEPOSIT_NOT_FOUND, result.getViolation());
        assertEquals("Deposit not found: 99", result.getReason());
        ClientAccount account = ledger.findAccount(3).orElseThrow();
        assertEquals(Money.ZERO, account.total());
        assertFalse(account.isFrozen());
    }

    @Test
    void testDisputeResolveRoundTripRestoresBalances() {
        Ledger ledger = ledgerService.process(Stream.of(
            deposit(1, 1, "10.5"),
            deposit(1, 2, "4.25"),
            withdrawal(1, 3, "1.75")));
        ClientAccount account = ledger.findAccount(1).orElseThrow();
        Money available = account.getAvailable();
        Money held = account.getHeld();
        Money total = account.total();

        ledgerService.apply(ledger, reference(TransactionType.DISPUTE, 1, 2));
        assertEquals(total, account.total());
        ledgerService.apply(ledger, reference(TransactionType.RESOLVE, 1, 2));

        assertEquals(available, account.getAvailable());
        assertEquals(held, account.getHeld());
        assertEquals(total, account.total());
    }

    @Test
    void testDepositsOnlySumToAvailable() {
        List<Transaction> deposits = IntStream.rangeClosed(1, 500)
            .mapToObj(i -> deposit(4, i, "0.0" + (i % 10) + "01"))
            .collect(Collectors.toList());
        Money expected = deposits.stream()
            .map(tx -> tx.getAmount().orElseThrow())
            .reduce(Money.ZERO, Money::add);

        Ledger ledger = ledgerService.process(deposits.stream());

        ClientAccount account = ledger.findAccount(4).orElseThrow();
        assertEquals(expected, account.getAvailable());
        assertEquals(Money.ZERO, account.getHeld());
        assertEquals(500, ledger.getAppliedCount());
        assertEquals(0, ledger.getDeclinedCount());
    }

    @Test
    void testDisputeReferencesOwnClientDepositsOnly() {
        Ledger ledger = ledgerService.process(Stream.of(
            deposit(1, 1, "10"),
            reference(TransactionType.DISPUTE, 2, 1)));

        assertEquals(Money.ZERO, ledger.findAccount(1).orElseThrow().getHeld());
        assertEquals(Money.ZERO, ledger.findAccount(2).orElseThrow().getHeld());
        assertEquals(1L, ledger.getDeclinesByViolation().get(RuleViolation.DEPOSIT_NOT_FOUND));
    }

    @Test
    void testFailuresDoNotStopProcessing() {
        Ledger ledger = ledgerService.process(Stream.of(
            withdrawal(1, 1, "5"),
            reference(TransactionType.RESOLVE, 1, 7),
            deposit(1, 2, "3"),
            deposit(2, 3, "1"),
            deposit(1, 2, "3")));

        assertEquals(2, ledger.getAppliedCount());
        assertEquals(3, ledger.getDeclinedCount());
        assertEquals(1L, ledger.getDeclinesByViolation().get(RuleViolation.INSUFFICIENT_FUNDS));
        assertEquals(1L, ledger.getDeclinesByViolation().get(RuleViolation.DEPOSIT_NOT_FOUND));
        assertEquals(1L, ledger.getDeclinesByViolation().get(RuleViolation.DUPLICATE_TRANSACTION));
        assertEquals(Money.of("3"), ledger.findAccount(1).orElseThrow().getAvailable());
        assertEquals(Money.of("1"), ledger.findAccount(2).orElseThrow().getAvailable());
    }

    @Test
    void testAccountsAreOrderedByClientId() {
        Ledger ledger = ledgerService.process(Stream.of(
            deposit(30, 1, "1"),
            deposit(2, 2, "1"),
            deposit(65535, 3, "1"),
            deposit(0, 4, "1")));

        List<Integer> clients = ledger.getAccounts().stream()
            .map(ClientAccount::getClientId)
            .collect(Collectors.toList());
        assertEquals(List.of(0, 2, 30, 65535), clients);
    }
}
