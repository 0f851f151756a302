package com.docsearch.dto;

/**
 * Outcome kinds reported by every engine operation.
 */
public enum Status {
    OK,
    VALIDATION_ERROR,
    NOT_FOUND,
    TIMEOUT,
    INTEGRITY_ERROR,
    BACKEND_UNAVAILABLE
}
