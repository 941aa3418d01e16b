package com.modelgate.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of a credential lookup. Unknown and disabled keys are both {@code found = false}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KeyLookup {

    private boolean found;
    private String principalId;
    private String keyId;
    private boolean expired;

    public static KeyLookup notFound() {
        return KeyLookup.builder().found(false).build();
    }

    public boolean isUsable() {
        return found && !expired;
    }
}
