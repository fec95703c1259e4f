package com.chemfetch.sds.persistence.memory;

import com.chemfetch.sds.persistence.Product;
import com.chemfetch.sds.persistence.ProductRepository;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Default {@link ProductRepository}. Stores copies so callers cannot mutate
 * stored state.
 */
@Repository
public class InMemoryProductRepository implements ProductRepository {

    private final Map<Long, Product> products = new ConcurrentHashMap<>();

    @Override
    public Optional<Product> findById(final long id) {
        return Optional.ofNullable(products.get(id)).map(p -> p.toBuilder().build());
    }

    @Override
    public Optional<Product> findByBarcode(final String barcode) {
        return products.values().stream()
                .filter(p -> Objects.equals(p.getBarcode(), barcode))
                .findFirst()
                .map(p -> p.toBuilder().build());
    }

    @Override
    public Product save(final Product product) {
        Objects.requireNonNull(product, "product");
        products.put(product.getId(), product.toBuilder().build());
        return product;
    }

    @Override
    public List<Product> findAllWithSdsUrl() {
        return products.values().stream()
                .filter(Product::hasSdsUrl)
                .sorted(Comparator.comparingLong(Product::getId))
                .map(p -> p.toBuilder().build())
                .toList();
    }
}
