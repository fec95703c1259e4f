package com.chemfetch.sds.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * @param productId product to parse
 * @param force     re-parse even when metadata exists
 * @param delayMs   optional delay before the run, in milliseconds
 */
public record TriggerRequest(
        @NotNull Long productId,
        Boolean force,
        @PositiveOrZero Long delayMs
) {

    public boolean forceOrDefault() {
        return Boolean.TRUE.equals(force);
    }
}
