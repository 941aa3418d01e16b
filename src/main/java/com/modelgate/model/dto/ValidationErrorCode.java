package com.modelgate.model.dto;

/**
 * Reasons a credential validation can fail.
 */
public enum ValidationErrorCode {
    MISSING_AUTH,
    INVALID_FORMAT,
    EMPTY_KEY,
    INVALID_KEY,
    EXPIRED_KEY,
    RATE_LIMITED,
    CONFIG_ERROR,
    SERVER_ERROR;

    public boolean isServerSide() {
        return this == CONFIG_ERROR || this == SERVER_ERROR;
    }
}
