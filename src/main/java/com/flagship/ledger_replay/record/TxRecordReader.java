package com.flagship.ledger_replay.record;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.flagship.ledger_replay.replay.ReplayErrorCode;
import com.flagship.ledger_replay.replay.ReplayException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Opens a CSV transaction log for sequential reading.
 *
 * Columns are bound by the header row, so their order in the file does not matter.
 */
@Component
@RequiredArgsConstructor
public class TxRecordReader {

    private static final CsvSchema SCHEMA = CsvSchema.emptySchema().withHeader();

    private final CsvMapper csvMapper;

    /**
     * The caller owns the returned iterator and must close it.
     *
     * @throws ReplayException INPUT_UNREADABLE if the file cannot be opened
     */
    public MappingIterator<TxRecord> open(Path input) {
        if (!Files.isRegularFile(input) || !Files.isReadable(input)) {
            throw new ReplayException(ReplayErrorCode.INPUT_UNREADABLE,
                    String.format("Cannot read input file %s", input));
        }
        try {
            Reader reader = Files.newBufferedReader(input, StandardCharsets.UTF_8);
            return open(reader);
        } catch (IOException e) {
            throw new ReplayException(ReplayErrorCode.INPUT_UNREADABLE,
                    String.format("Cannot read input file %s: %s", input, e.getMessage()), e);
        }
    }

    public MappingIterator<TxRecord> open(Reader reader) throws IOException {
        return csvMapper.readerFor(TxRecord.class)
                .with(SCHEMA)
                .readValues(reader);
    }
}
