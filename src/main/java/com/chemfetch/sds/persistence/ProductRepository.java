package com.chemfetch.sds.persistence;

import java.util.List;
import java.util.Optional;

/**
 * Product store. Products are never deleted.
 */
public interface ProductRepository {

    Optional<Product> findById(long id);

    Optional<Product> findByBarcode(String barcode);

    /**
     * Inserts or replaces the product with the same id.
     *
     * @param product product to store
     * @return the stored product
     */
    Product save(Product product);

    /**
     * @return products whose SDS URL is set and not blank
     */
    List<Product> findAllWithSdsUrl();
}
