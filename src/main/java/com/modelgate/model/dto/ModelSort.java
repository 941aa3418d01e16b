package com.modelgate.model.dto;

import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Comparator;
import java.util.function.ToLongFunction;

/**
 * Orderings for the catalog endpoints. All sort descending and break ties by context length.
 */
public enum ModelSort {
    CONTEXT_LENGTH("contextLength", model -> orZero(model.getContextLength())),
    MAX_OUTPUT("maxOutput", model -> orZero(model.getMaxCompletionTokens())),
    CAPABLE("capable", model -> model.getSupportedParameters() == null ? 0 : model.getSupportedParameters().size()),
    NEWEST("newest", model -> model.getCreatedAt() == null ? 0 : model.getCreatedAt().toEpochSecond(ZoneOffset.UTC));

    public static final ModelSort DEFAULT = CONTEXT_LENGTH;

    private final String value;
    private final ToLongFunction<ModelResponse> key;

    ModelSort(String value, ToLongFunction<ModelResponse> key) {
        this.value = value;
        this.key = key;
    }

    public Comparator<ModelResponse> comparator() {
        Comparator<ModelResponse> primary = Comparator.comparingLong(key).reversed();
        return primary.thenComparing(Comparator.comparingLong((ModelResponse model) -> orZero(model.getContextLength())).reversed());
    }

    /**
     * Unknown or absent names fall back to {@link #DEFAULT}.
     */
    public static ModelSort parse(String value) {
        return Arrays.stream(values())
                .filter(sort -> sort.value.equals(value))
                .findFirst()
                .orElse(DEFAULT);
    }

    private static long orZero(Integer value) {
        return value == null ? 0 : value;
    }
}
