package com.modelgate.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Response DTO for the full model listing.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelsResponse {
    private List<ModelResponse> models;
    private LocalDateTime lastUpdated;
    private int count;
}
