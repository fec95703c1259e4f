package com.chemfetch.sds.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Request payload for SDS resolution.
 *
 * @param name      product name; must not be blank
 * @param size      optional pack size, e.g. {@code 500mL}
 * @param productId optional product to attach the resolved URL to; a parse
 *                  is then scheduled for it
 */
public record ResolveRequest(
        @NotBlank String name,
        String size,
        Long productId
) {}
