package com.paymentsengine;

import com.paymentsengine.ledger.LedgerService;
import com.paymentsengine.rules.RulesEngine;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.io.PrintStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Boots the application against the scenario file and checks the wiring.
 */
@SpringBootTest(args = "src/test/resources/transactions/scenarios.csv")
@ActiveProfiles("test")
class PaymentsEngineApplicationTests {

    @Autowired
    private ProcessTransactionsCommand command;

    @Autowired
    private RulesEngine rulesEngine;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private PrintStream accountOutput;

    @Test
    void testContextRunsCommand() {
        assertNotNull(rulesEngine);
        assertNotNull(ledgerService);
        assertEquals(0, command.getExitCode());
    }

    @Test
    void testSnapshotGoesToStdout() {
        assertSame(System.out, accountOutput);
    }
}
