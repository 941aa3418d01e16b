package com.modelgate.model.dto;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Capability filters accepted by the catalog endpoints. A model must satisfy every requested use case.
 */
public enum UseCase {
    CHAT("chat", model -> "text->text".equals(model.getModality()) || contains(model.getOutputModalities(), "text")),
    VISION("vision", model -> contains(model.getInputModalities(), "image")),
    TOOLS("tools", model -> contains(model.getSupportedParameters(), "tools")),
    LONG_CONTEXT("longContext", model -> model.getContextLength() != null && model.getContextLength() >= 100_000),
    REASONING("reasoning", model -> contains(model.getSupportedParameters(), "reasoning")
            || contains(model.getSupportedParameters(), "include_reasoning"));

    private final String value;
    private final Predicate<ModelResponse> matcher;

    UseCase(String value, Predicate<ModelResponse> matcher) {
        this.value = value;
        this.matcher = matcher;
    }

    public boolean matches(ModelResponse model) {
        return matcher.test(model);
    }

    public static Optional<UseCase> fromValue(String value) {
        return Arrays.stream(values())
                .filter(useCase -> useCase.value.equals(value))
                .findFirst();
    }

    /**
     * Parses a comma-separated list. Unknown names are dropped.
     */
    public static Set<UseCase> parseList(String csv) {
        Set<UseCase> useCases = EnumSet.noneOf(UseCase.class);
        if (csv == null || csv.isBlank()) {
            return useCases;
        }
        for (String part : csv.split(",")) {
            fromValue(part.trim()).ifPresent(useCases::add);
        }
        return useCases;
    }

    private static boolean contains(List<String> values, String value) {
        return values != null && values.contains(value);
    }
}
