package com.paymentsengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Payments Engine.
 *
 * Payments Engine reads a CSV file of deposits, withdrawals, disputes, resolves
 * and chargebacks, applies them in order to per-client accounts and prints the
 * final balances as CSV on stdout. Diagnostics are logged to stderr.
 *
 * Usage: {@code java -jar payments-engine.jar transactions.csv > accounts.csv}
 */
@SpringBootApplication
public class PaymentsEngineApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(PaymentsEngineApplication.class, args)));
    }
}
