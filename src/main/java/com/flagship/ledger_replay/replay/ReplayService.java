package com.flagship.ledger_replay.replay;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.flagship.ledger_replay.ledger.Ledger;
import com.flagship.ledger_replay.ledger.TransactionException;
import com.flagship.ledger_replay.ledger.Tx;
import com.flagship.ledger_replay.observability.ReplayMetrics;
import com.flagship.ledger_replay.record.AccountRecordWriter;
import com.flagship.ledger_replay.record.TxRecord;
import com.flagship.ledger_replay.record.TxRecordReader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Writer;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Replays a transaction log against a fresh ledger and writes the final accounts.
 *
 * This service:
 * 1. Reads rows in file order
 * 2. Converts each row into a typed transaction
 * 3. Applies it to the ledger
 * 4. Writes one output row per account once the log is exhausted
 *
 * A row that cannot be converted (missing or bad amount) or that the ledger
 * rejects is logged as a warning and skipped. Anything that makes the log
 * itself unusable (unreadable file, malformed row, unknown type) aborts the run
 * with a fatal {@link ReplayException}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReplayService {

    static final String RECORD_MDC_KEY = "record";

    private final TxRecordReader recordReader;
    private final AccountRecordWriter recordWriter;
    private final ReplayMetrics replayMetrics;

    public ReplaySummary replay(Path input, Writer output) {
        long startTime = System.currentTimeMillis();
        log.info("Replaying transactions from {}", input);

        try (MappingIterator<TxRecord> records = recordReader.open(input)) {
            ReplaySummary summary = replay(records, output);
            long duration = System.currentTimeMillis() - startTime;
            replayMetrics.recordReplayDuration(Duration.ofMillis(duration));
            log.info("Replay finished: records={}, applied={}, warnings={}, accounts={}, duration={}ms",
                    summary.getRecordsRead(), summary.getTransactionsApplied(),
                    summary.getWarnings(), summary.getAccountsWritten(), duration);
            return summary;
        } catch (IOException e) {
            throw new ReplayException(ReplayErrorCode.INPUT_UNREADABLE,
                    String.format("Failed to close input %s: %s", input, e.getMessage()), e);
        }
    }

    /**
     * Replays already opened records. The iterator is not closed here.
     */
    public ReplaySummary replay(MappingIterator<TxRecord> records, Writer output) {
        Ledger ledger = new Ledger();
        int position = 0;
        int applied = 0;
        int warnings = 0;

        while (hasNext(records, position + 1)) {
            position++;
            TxRecord record = next(records, position);
            MDC.put(RECORD_MDC_KEY, String.valueOf(position));
            try {
                if (apply(ledger, record, position)) {
                    applied++;
                } else {
                    warnings++;
                }
            } finally {
                MDC.remove(RECORD_MDC_KEY);
            }
        }

        int written = recordWriter.write(ledger.getAccounts(), output);
        return new ReplaySummary(position, applied, warnings, written);
    }

    /**
     * @return true if the transaction was applied, false if it was skipped with a warning
     */
    private boolean apply(Ledger ledger, TxRecord record, int position) {
        Tx tx;
        try {
            tx = record.toTx();
        } catch (ReplayException e) {
            if (e.isFatal()) {
                throw new ReplayException(e.getErrorCode(),
                        String.format("Record %d: %s", position, e.getMessage()), e);
            }
            replayMetrics.recordRejected(e.getErrorCode());
            log.warn("Transaction {} failed: {}", position, e.getMessage());
            return false;
        }

        try {
            ledger.process(tx);
            replayMetrics.recordApplied(tx.getType());
            return true;
        } catch (TransactionException e) {
            replayMetrics.recordFailed(tx.getType(), e.getError());
            log.warn("Transaction {} failed: {}", position, e.getMessage());
            return false;
        }
    }

    private boolean hasNext(MappingIterator<TxRecord> records, int position) {
        try {
            return records.hasNextValue();
        } catch (IOException e) {
            throw readFailure(e, position);
        }
    }

    private TxRecord next(MappingIterator<TxRecord> records, int position) {
        try {
            return records.nextValue();
        } catch (IOException e) {
            throw readFailure(e, position);
        }
    }

    private ReplayException readFailure(IOException e, int position) {
        if (e instanceof JsonProcessingException) {
            return new ReplayException(ReplayErrorCode.MALFORMED_RECORD,
                    String.format("Record %d: %s", position, ((JsonProcessingException) e).getOriginalMessage()), e);
        }
        return new ReplayException(ReplayErrorCode.INPUT_UNREADABLE,
                String.format("Failed to read record %d: %s", position, e.getMessage()), e);
    }
}
