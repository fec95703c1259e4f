package com.chemfetch.sds.coordinator;

/**
 * Thrown when an operation names a product id the store does not know.
 */
public class ProductNotFoundException extends RuntimeException {

    private final long productId;

    public ProductNotFoundException(final long productId) {
        super("Product not found: " + productId);
        this.productId = productId;
    }

    public long getProductId() {
        return productId;
    }
}
