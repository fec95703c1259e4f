package com.chemfetch.sds.persistence;

/**
 * Denormalised inventory rows that mirror a product's hazard columns.
 */
public interface InventoryRepository {

    /**
     * @param productId product whose inventory rows are updated
     * @param fields    new hazard columns
     */
    void updateHazardFields(long productId, InventoryHazardFields fields);
}
