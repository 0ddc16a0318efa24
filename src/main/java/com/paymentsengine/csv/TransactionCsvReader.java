package com.paymentsengine.csv;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.paymentsengine.common.Money;
import com.paymentsengine.common.exception.InputSourceException;
import com.paymentsengine.common.exception.InvalidTransactionException;
import com.paymentsengine.transactions.Transaction;
import com.paymentsengine.transactions.TransactionType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Reads transactions from CSV with the columns {@code type, client, tx, amount}.
 *
 * Records are streamed one at a time. Surrounding whitespace is trimmed and
 * type names are case-insensitive. A record that cannot be coerced into a
 * {@link Transaction} is logged and skipped; only an unreadable source is fatal.
 */
@Component
@Slf4j
public class TransactionCsvReader {

    private final CsvMapper csvMapper = CsvMapper.builder()
        .enable(CsvParser.Feature.TRIM_SPACES)
        .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
        .enable(CsvParser.Feature.ALLOW_TRAILING_COMMA)
        .enable(CsvParser.Feature.IGNORE_TRAILING_UNMAPPABLE)
        .build();

    // Positional columns, so header spelling and spacing do not matter
    private final CsvSchema schema = csvMapper.schemaFor(TransactionRecord.class)
        .withSkipFirstDataRow(true);

    /**
     * Open a CSV file. The returned stream must be closed by the caller.
     *
     * @throws InputSourceException if the file does not exist or cannot be opened
     */
    public Stream<Transaction> read(Path path) {
        String source = path.toString();
        if (!Files.exists(path)) {
            throw new InputSourceException(source, "file does not exist");
        }
        if (!Files.isRegularFile(path)) {
            throw new InputSourceException(source, "not a regular file");
        }
        try {
            return read(Files.newBufferedReader(path, StandardCharsets.UTF_8), source);
        } catch (IOException e) {
            throw new InputSourceException(source, e.getMessage(), e);
        }
    }

    /**
     * Read CSV from an open reader. Closing the returned stream closes the reader.
     */
    public Stream<Transaction> read(Reader reader, String source) {
        MappingIterator<TransactionRecord> records = openRecords(reader, source);

        Iterator<Optional<Transaction>> transactions = new Iterator<>() {
            private long recordNumber;
            private long lastFailureOffset = -1;

            @Override
            public boolean hasNext() {
                while (true) {
                    try {
                        return records.hasNextValue();
                    } catch (JsonProcessingException e) {
                        // The iterator resyncs to the next row on the following call
                        skipMalformed(e);
                    } catch (IOException e) {
                        throw new InputSourceException(source, e.getMessage(), e);
                    }
                }
            }

            @Override
            public Optional<Transaction> next() {
                try {
                    TransactionRecord record = records.nextValue();
                    recordNumber++;
                    return toTransaction(record, recordNumber, source);
                } catch (JsonProcessingException e) {
                    skipMalformed(e);
                    return Optional.empty();
                } catch (IOException e) {
                    throw new InputSourceException(source, e.getMessage(), e);
                }
            }

            private void skipMalformed(JsonProcessingException e) {
                long offset = records.getCurrentLocation().getCharOffset();
                if (offset == lastFailureOffset) {
                    throw new InputSourceException(source, "cannot recover from " + e.getOriginalMessage(), e);
                }
                lastFailureOffset = offset;
                recordNumber++;
                log.warn("Skipping record {} of {}: {}", recordNumber, source, e.getOriginalMessage());
            }
        };

        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(transactions, Spliterator.ORDERED | Spliterator.NONNULL),
                false)
            .flatMap(Optional::stream)
            .onClose(() -> close(records, source));
    }

    private MappingIterator<TransactionRecord> openRecords(Reader reader, String source) {
        try {
            return csvMapper.readerFor(TransactionRecord.class)
                .with(schema)
                .readValues(reader);
        } catch (IOException e) {
            throw new InputSourceException(source, e.getMessage(), e);
        }
    }

    private Optional<Transaction> toTransaction(TransactionRecord record, long recordNumber, String source) {
        try {
            TransactionType type = TransactionType.fromCode(record.getType());
            Transaction transaction = Transaction.builder()
                .type(type)
                .clientId(parseClientId(record.getClient()))
                .transactionId(parseTransactionId(record.getTx()))
                .amount(type.requiresAmount() ? parseAmount(record.getAmount()) : null)
                .build();
            return Optional.of(transaction);
        } catch (InvalidTransactionException e) {
            log.warn("Skipping record {} of {}: {}", recordNumber, source, e.getMessage());
            return Optional.empty();
        }
    }

    private static int parseClientId(String value) {
        if (value == null || value.isEmpty()) {
            throw new InvalidTransactionException("Client id is missing");
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new InvalidTransactionException("Invalid client id: " + value, e);
        }
    }

    private static long parseTransactionId(String value) {
        if (value == null || value.isEmpty()) {
            throw new InvalidTransactionException("Transaction id is missing");
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new InvalidTransactionException("Invalid transaction id: " + value, e);
        }
    }

    /**
     * A blank amount maps to null; the rules decline deposits and withdrawals without one.
     */
    private static Money parseAmount(String value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        Money amount;
        try {
            amount = Money.of(value);
        } catch (NumberFormatException e) {
            throw new InvalidTransactionException("Invalid amount: " + value, e);
        } catch (ArithmeticException e) {
            throw new InvalidTransactionException("Amount out of range: " + value, e);
        }
        if (amount.isNegative()) {
            throw new InvalidTransactionException("Negative amount: " + value);
        }
        return amount;
    }

    private static void close(MappingIterator<TransactionRecord> records, String source) {
        try {
            records.close();
        } catch (IOException e) {
            throw new InputSourceException(source, "failed to close: " + e.getMessage(), e);
        }
    }
}
