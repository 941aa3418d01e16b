package com.modelgate.model.dto;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Why a sync trigger did not run the syncer.
 */
public enum SkipReason {
    DATA_FRESH("data_fresh"),
    SYNC_IN_PROGRESS("sync_in_progress");

    private final String value;

    SkipReason(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
