package com.sidr.error;

import lombok.Getter;

/**
 * Exception thrown by store reading and report generation.
 */
@Getter
public class SidrException extends Exception {
    private final ErrorType errorType;

    public SidrException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public SidrException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    /**
     * Record-level errors skip a single record; everything else aborts a table or a store.
     */
    public boolean isRecordLocal() {
        switch (errorType) {
            case TRUNCATED_RECORD:
            case DANGLING_LONG_VALUE:
            case UNSUPPORTED_COMPRESSION:
            case TYPE_MISMATCH:
                return true;
            default:
                return false;
        }
    }

    @Override
    public String toString() {
        return String.format("SidrException{type=%s, message='%s'}", errorType, getMessage());
    }
}
