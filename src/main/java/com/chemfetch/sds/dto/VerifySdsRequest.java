package com.chemfetch.sds.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * @param url     candidate document URL
 * @param name    product name it should belong to
 * @param trusted URL was entered by hand rather than discovered; absent means {@code false}
 */
public record VerifySdsRequest(
        @NotBlank String url,
        @NotBlank String name,
        Boolean trusted
) {

    public boolean trustedOrDefault() {
        return Boolean.TRUE.equals(trusted);
    }
}
