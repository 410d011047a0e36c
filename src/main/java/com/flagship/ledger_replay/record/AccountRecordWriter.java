package com.flagship.ledger_replay.record;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.flagship.ledger_replay.ledger.Account;
import com.flagship.ledger_replay.replay.ReplayErrorCode;
import com.flagship.ledger_replay.replay.ReplayException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Writes final account states as CSV with a header row.
 */
@Component
public class AccountRecordWriter {

    private final CsvMapper csvMapper;
    private final CsvSchema schema;
    private final boolean sortByClient;

    public AccountRecordWriter(CsvMapper csvMapper,
                               @Value("${replay.output.sort-by-client:true}") boolean sortByClient) {
        this.csvMapper = csvMapper;
        this.schema = csvMapper.schemaFor(AccountRecord.class).withHeader();
        this.sortByClient = sortByClient;
    }

    /**
     * Writes one row per account. The target is flushed but not closed.
     *
     * @return number of rows written
     * @throws ReplayException OUTPUT_FAILED if the target cannot be written
     */
    public int write(Collection<Account> accounts, Writer target) {
        Stream<Account> ordered = sortByClient
                ? accounts.stream().sorted(Comparator.comparingInt(Account::getClientId))
                : accounts.stream();
        List<AccountRecord> records = ordered.map(AccountRecord::from).toList();

        try (SequenceWriter rows = csvMapper.writer(schema).writeValues(target)) {
            rows.writeAll(records);
            rows.flush();
        } catch (IOException e) {
            throw new ReplayException(ReplayErrorCode.OUTPUT_FAILED,
                    String.format("Failed to write account records: %s", e.getMessage()), e);
        }
        return records.size();
    }
}
