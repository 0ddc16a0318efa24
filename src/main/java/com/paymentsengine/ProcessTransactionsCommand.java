package com.paymentsengine;

import com.paymentsengine.common.exception.InputSourceException;
import com.paymentsengine.csv.AccountCsvWriter;
import com.paymentsengine.csv.TransactionCsvReader;
import com.paymentsengine.ledger.Ledger;
import com.paymentsengine.ledger.LedgerService;
import com.paymentsengine.transactions.Transaction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

/**
 * Command surface: takes one positional argument naming the input CSV file,
 * processes it and writes the account snapshot to stdout.
 *
 * Exit codes: 0 on success, 1 when the input cannot be read or the output
 * cannot be written, 2 on bad usage. The snapshot goes to the {@code PrintStream}
 * bean, which is stdout outside tests.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ProcessTransactionsCommand implements ApplicationRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_IO_ERROR = 1;
    static final int EXIT_USAGE = 2;

    private final TransactionCsvReader transactionReader;
    private final LedgerService ledgerService;
    private final AccountCsvWriter accountWriter;
    private final PrintStream out;

    private int exitCode = EXIT_OK;

    @Override
    public void run(ApplicationArguments args) {
        List<String> positional = args.getNonOptionArgs();
        if (positional.size() != 1) {
            log.error("Usage: payments-engine <transactions.csv>");
            exitCode = EXIT_USAGE;
            return;
        }
        exitCode = process(Path.of(positional.get(0)));
    }

    int process(Path input) {
        Ledger ledger;
        try (Stream<Transaction> transactions = transactionReader.read(input)) {
            ledger = ledgerService.process(transactions);
        } catch (InputSourceException e) {
            log.error(e.getMessage(), e.getCause());
            return EXIT_IO_ERROR;
        }

        Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8);
        try {
            accountWriter.write(ledger.getAccounts(), writer);
        } catch (IOException e) {
            log.error("Failed to write account balances", e);
            return EXIT_IO_ERROR;
        }
        return EXIT_OK;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
