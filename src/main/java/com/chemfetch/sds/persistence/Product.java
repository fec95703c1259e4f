package com.chemfetch.sds.persistence;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A catalogue product. Owned by the persistence collaborator; discovery only
 * fills in a better name, size or SDS URL.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Product {

    private long id;

    private String barcode;

    private String name;

    private String size;

    private String sdsUrl;

    public boolean hasSdsUrl() {
        return sdsUrl != null && !sdsUrl.isBlank();
    }
}
