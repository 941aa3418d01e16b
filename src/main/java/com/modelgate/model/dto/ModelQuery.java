package com.modelgate.model.dto;

import lombok.Builder;
import lombok.Value;

import java.util.EnumSet;
import java.util.Set;

/**
 * Filter, ordering and truncation for a catalog read. Null {@code topN} or {@code limit} means no cap.
 */
@Value
@Builder
public class ModelQuery {

    @Builder.Default
    Set<UseCase> useCases = EnumSet.noneOf(UseCase.class);

    @Builder.Default
    ModelSort sort = ModelSort.DEFAULT;

    Integer topN;
    Integer limit;

    public static ModelQuery of(String useCase, String sort, Integer topN, Integer limit) {
        return ModelQuery.builder()
                .useCases(UseCase.parseList(useCase))
                .sort(ModelSort.parse(sort))
                .topN(topN)
                .limit(limit)
                .build();
    }

    public static ModelQuery unfiltered() {
        return ModelQuery.builder().build();
    }
}
