package com.flagship.ledger_replay.replay;

public class ReplayException extends RuntimeException {

    private final ReplayErrorCode errorCode;

    public ReplayException(ReplayErrorCode errorCode) {
        super(errorCode.getDefaultMessage());
        this.errorCode = errorCode;
    }

    public ReplayException(ReplayErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ReplayException(ReplayErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ReplayErrorCode getErrorCode() {
        return errorCode;
    }

    public boolean isFatal() {
        return errorCode.isFatal();
    }
}
