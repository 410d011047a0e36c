package com.flagship.ledger_replay.observability;

import com.flagship.ledger_replay.ledger.TxError;
import com.flagship.ledger_replay.ledger.TxType;
import com.flagship.ledger_replay.replay.ReplayErrorCode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for replay runs.
 *
 * Metrics exposed:
 * - replay.transactions.applied: transactions accepted by the ledger, by type
 * - replay.transactions.failed: transactions rejected by the ledger, by type and error
 * - replay.records.rejected: rows that could not be turned into a transaction, by reason
 * - replay.duration: wall time of a whole replay
 */
@Component
public class ReplayMetrics {

    private final MeterRegistry registry;
    private final Timer replayTimer;

    public ReplayMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.replayTimer = Timer.builder("replay.duration")
                .description("Time taken to replay a transaction log")
                .register(registry);
    }

    public void recordApplied(TxType type) {
        registry.counter("replay.transactions.applied", "type", type.getCode()).increment();
    }

    public void recordFailed(TxType type, TxError error) {
        Counter.builder("replay.transactions.failed")
                .tag("type", type.getCode())
                .tag("error", error.name().toLowerCase())
                .register(registry)
                .increment();
    }

    public void recordRejected(ReplayErrorCode reason) {
        registry.counter("replay.records.rejected", "reason", reason.name().toLowerCase()).increment();
    }

    public void recordReplayDuration(Duration duration) {
        replayTimer.record(duration);
    }

    public double appliedCount(TxType type) {
        Counter counter = registry.find("replay.transactions.applied").tag("type", type.getCode()).counter();
        return counter != null ? counter.count() : 0;
    }

    public double failedCount(TxError error) {
        return registry.find("replay.transactions.failed")
                .tag("error", error.name().toLowerCase())
                .counters()
                .stream()
                .mapToDouble(Counter::count)
                .sum();
    }
}
