package com.chemfetch.sds.persistence.memory;

import com.chemfetch.sds.persistence.InventoryHazardFields;
import com.chemfetch.sds.persistence.InventoryRepository;
import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Default {@link InventoryRepository}: keeps the latest hazard columns per
 * product.
 */
@Repository
public class InMemoryInventoryRepository implements InventoryRepository {

    private final Map<Long, InventoryHazardFields> rows = new ConcurrentHashMap<>();

    @Override
    public void updateHazardFields(final long productId, final InventoryHazardFields fields) {
        rows.put(productId, fields);
    }

    /**
     * @param productId product id
     * @return the last hazard columns written for the product
     */
    public Optional<InventoryHazardFields> hazardFields(final long productId) {
        return Optional.ofNullable(rows.get(productId));
    }
}
