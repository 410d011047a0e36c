package com.flagship.ledger_replay.replay;

import lombok.Value;

/**
 * Outcome of a completed replay.
 */
@Value
public class ReplaySummary {
    int recordsRead;
    int transactionsApplied;
    int warnings;
    int accountsWritten;
}
