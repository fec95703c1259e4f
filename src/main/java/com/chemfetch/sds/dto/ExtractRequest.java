package com.chemfetch.sds.dto;

import jakarta.validation.constraints.NotNull;

/**
 * @param productId product to parse
 * @param sdsUrl    optional document to store on the product first
 * @param force     re-parse even when metadata exists
 */
public record ExtractRequest(
        @NotNull Long productId,
        String sdsUrl,
        Boolean force
) {

    public boolean forceOrDefault() {
        return Boolean.TRUE.equals(force);
    }
}
