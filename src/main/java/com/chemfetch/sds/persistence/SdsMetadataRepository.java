package com.chemfetch.sds.persistence;

import java.util.Optional;

/**
 * SDS metadata store, one row per product id.
 */
public interface SdsMetadataRepository {

    Optional<SdsMetadata> findByProductId(long productId);

    boolean existsByProductId(long productId);

    /**
     * Inserts the row or overwrites the existing row of the same product.
     *
     * @param metadata row to store
     * @return the stored row
     */
    SdsMetadata upsert(SdsMetadata metadata);

    long count();
}
