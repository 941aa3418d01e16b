package com.modelgate.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One model as published by the upstream listing.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class UpstreamModel {

    private String id;
    private String name;
    private String description;
    private Pricing pricing;

    @JsonProperty("context_length")
    private Integer contextLength;

    private Architecture architecture;

    @JsonProperty("top_provider")
    private TopProvider topProvider;

    @JsonProperty("supported_parameters")
    private List<String> supportedParameters;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Pricing {
        private String prompt;
        private String completion;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Architecture {
        private String modality;

        @JsonProperty("input_modalities")
        private List<String> inputModalities;

        @JsonProperty("output_modalities")
        private List<String> outputModalities;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TopProvider {
        @JsonProperty("max_completion_tokens")
        private Integer maxCompletionTokens;

        @JsonProperty("is_moderated")
        private Boolean moderated;
    }
}
