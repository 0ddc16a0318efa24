package com.paymentsengine.csv;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.paymentsengine.accounts.ClientAccount;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.util.Collection;

/**
 * Writes the final account snapshot as CSV with the columns
 * {@code client, available, held, total, locked}.
 *
 * The target writer is flushed but left open, so stdout can be passed in.
 */
@Component
public class AccountCsvWriter {

    private final CsvMapper csvMapper = CsvMapper.builder()
        .disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
        .build();

    private final ObjectWriter rowWriter = csvMapper.writerFor(AccountRow.class)
        .with(csvMapper.schemaFor(AccountRow.class).withHeader());

    public void write(Collection<ClientAccount> accounts, Writer target) throws IOException {
        try (SequenceWriter rows = rowWriter.writeValues(target)) {
            for (ClientAccount account : accounts) {
                rows.write(AccountRow.from(account));
            }
        }
        target.flush();
    }
}
