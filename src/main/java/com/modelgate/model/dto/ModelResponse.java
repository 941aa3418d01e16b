package com.modelgate.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Public view of an active catalog entry.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ModelResponse {
    private String id;
    private String name;
    private String description;
    private Integer contextLength;
    private Integer maxCompletionTokens;
    private String modality;
    private List<String> inputModalities;
    private List<String> outputModalities;
    private List<String> supportedParameters;
    private Boolean isModerated;
    private LocalDateTime createdAt;
}
