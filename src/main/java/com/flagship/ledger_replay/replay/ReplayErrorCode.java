package com.flagship.ledger_replay.replay;

/**
 * Failures raised around the ledger: reading, converting and writing records,
 * and command-line usage.
 *
 * Non-fatal codes concern a single record; the record is skipped with a warning.
 * Fatal codes abort the whole run with the given exit code.
 */
public enum ReplayErrorCode {

    // --- per record ---
    MISSING_AMOUNT("Amount missing in transaction CSV", false, 0),
    INVALID_AMOUNT("Amount is not a valid decimal in range", false, 0),

    // --- whole run ---
    USAGE("Command line usage error", true, 2),
    INPUT_UNREADABLE("Input could not be read", true, 1),
    MALFORMED_RECORD("Malformed transaction record", true, 1),
    OUTPUT_FAILED("Account output could not be written", true, 1);

    private final String defaultMessage;
    private final boolean fatal;
    private final int exitCode;

    ReplayErrorCode(String defaultMessage, boolean fatal, int exitCode) {
        this.defaultMessage = defaultMessage;
        this.fatal = fatal;
        this.exitCode = exitCode;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }

    public boolean isFatal() {
        return fatal;
    }

    public int getExitCode() {
        return exitCode;
    }
}
