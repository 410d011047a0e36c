package com.flagship.ledger_replay.record;

import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.flagship.ledger_replay.config.CsvConfig;
import com.flagship.ledger_replay.ledger.Ledger;
import com.flagship.ledger_replay.ledger.Money;
import com.flagship.ledger_replay.ledger.TransactionException;
import com.flagship.ledger_replay.ledger.Tx;
import com.flagship.ledger_replay.replay.ReplayErrorCode;
import com.flagship.ledger_replay.replay.ReplayException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AccountRecordWriterTest {

    private final CsvMapper csvMapper = new CsvConfig().csvMapper();

    private Ledger ledger;

    @BeforeEach
    void setUp() throws TransactionException {
        ledger = new Ledger();
        ledger.process(Tx.deposit(3, 1, Money.ofScaled(15_000)));
        ledger.process(Tx.deposit(1, 2, Money.ofScaled(20_000)));
        ledger.process(Tx.dispute(1, 2));
        ledger.process(Tx.chargeback(1, 2));
    }

    @Test
    @DisplayName("Writes a header and one row per account, sorted by client")
    void testWriteSorted() {
        AccountRecordWriter writer = new AccountRecordWriter(csvMapper, true);
        StringWriter out = new StringWriter();

        int written = writer.write(ledger.getAccounts(), out);

        assertEquals(2, written);
        List<String> lines = out.toString().lines().toList();
        assertEquals(List.of(
            "client,available,held,total,locked",
            "1,0.0000,0.0000,0.0000,true",
            "3,1.5000,0.0000,1.5000,false"
        ), lines);
    }

    @Test
    @DisplayName("Unsorted output still contains every account")
    void testWriteUnsorted() {
        AccountRecordWriter writer = new AccountRecordWriter(csvMapper, false);
        StringWriter out = new StringWriter();

        writer.write(ledger.getAccounts(), out);

        List<String> lines = out.toString().lines().toList();
        assertEquals("client,available,held,total,locked", lines.get(0));
        assertEquals(3, lines.size());
        assertTrue(lines.contains("1,0.0000,0.0000,0.0000,true"));
        assertTrue(lines.contains("3,1.5000,0.0000,1.5000,false"));
    }

    @Test
    @DisplayName("Account record renders negative available balances")
    void testNegativeAvailable() throws TransactionException {
        ledger.process(Tx.withdrawal(3, 5, Money.ofScaled(10_000)));
        ledger.process(Tx.dispute(3, 1));

        AccountRecord record = AccountRecord.from(ledger.findAccount(3).orElseThrow());

        assertEquals(new AccountRecord(3, "-1.0000", "1.5000", "0.5000", false), record);
    }

    @Test
    @DisplayName("The target stream is left open")
    void testTargetNotClosed() {
        AccountRecordWriter writer = new AccountRecordWriter(csvMapper, true);
        ClosingTrackingWriter out = new ClosingTrackingWriter();

        writer.write(ledger.getAccounts(), out);

        assertFalse(out.closed);
        assertTrue(out.buffer.toString().startsWith("client,"));
    }

    @Test
    @DisplayName("Write failure is a fatal OUTPUT_FAILED")
    void testWriteFailure() {
        AccountRecordWriter writer = new AccountRecordWriter(csvMapper, true);
        Writer broken = new Writer() {
            @Override
            public void write(char[] cbuf, int off, int len) throws IOException {
                throw new IOException("disk full");
            }

            @Override
            public void flush() throws IOException {
                throw new IOException("disk full");
            }

            @Override
            public void close() {
            }
        };

        ReplayException e = assertThrows(ReplayException.class,
            () -> writer.write(ledger.getAccounts(), broken));

        assertEquals(ReplayErrorCode.OUTPUT_FAILED, e.getErrorCode());
        assertTrue(e.isFatal());
    }

    private static class ClosingTrackingWriter extends Writer {
        private final StringBuilder buffer = new StringBuilder();
        private boolean closed;

        @Override
        public void write(char[] cbuf, int off, int len) {
            buffer.append(cbuf, off, len);
        }

        @Override
        public void flush() {
        }

        @Override
        public void close() {
            closed = true;
        }
    }
}
