package com.modelgate.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response DTO for the lightweight id-only listing.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelIdsResponse {
    private List<String> ids;
    private int count;
}
