package com.chemfetch.sds.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Snake-case payload shared with remote document-processing services.
 *
 * @param productId product the record is for
 * @param pdfUrl    document to parse
 */
public record ParseSdsRequest(
        @JsonProperty("product_id") @NotNull Long productId,
        @JsonProperty("pdf_url") @NotBlank String pdfUrl
) {}
