package com.chemfetch.sds.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

/**
 * @param barcode scanned EAN/UPC code, digits only
 */
public record BarcodeRequest(
        @NotBlank @Pattern(regexp = "\\s*\\d{6,14}\\s*") String barcode
) {}
