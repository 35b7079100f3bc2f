package com.sidr.error;

/**
 * Types of errors that can occur while reading a Windows Search store.
 */
public enum ErrorType {
    OUT_OF_RANGE,
    CORRUPT_PAGE,
    CATALOG_CORRUPT,
    UNSUPPORTED_VERSION,
    INVALID_SIGNATURE,
    CORRUPT_BTREE,
    TRUNCATED_RECORD,
    DANGLING_LONG_VALUE,
    UNSUPPORTED_COMPRESSION,
    TYPE_MISMATCH,
    DATABASE_ERROR,
    IO_ERROR
}
