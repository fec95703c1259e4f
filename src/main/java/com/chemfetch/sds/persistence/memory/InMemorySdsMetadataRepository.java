package com.chemfetch.sds.persistence.memory;

import com.chemfetch.sds.persistence.SdsMetadata;
import com.chemfetch.sds.persistence.SdsMetadataRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Default {@link SdsMetadataRepository}; last write wins.
 */
@Slf4j
@Repository
public class InMemorySdsMetadataRepository implements SdsMetadataRepository {

    private final Map<Long, SdsMetadata> rows = new ConcurrentHashMap<>();

    @Override
    public Optional<SdsMetadata> findByProductId(final long productId) {
        return Optional.ofNullable(rows.get(productId)).map(m -> m.toBuilder().build());
    }

    @Override
    public boolean existsByProductId(final long productId) {
        return rows.containsKey(productId);
    }

    @Override
    public SdsMetadata upsert(final SdsMetadata metadata) {
        Objects.requireNonNull(metadata, "metadata");
        SdsMetadata previous = rows.put(metadata.getProductId(), metadata.toBuilder().build());
        log.debug("{} SDS metadata for product {}", previous == null ? "Inserted" : "Replaced", metadata.getProductId());
        return metadata;
    }

    @Override
    public long count() {
        return rows.size();
    }
}
