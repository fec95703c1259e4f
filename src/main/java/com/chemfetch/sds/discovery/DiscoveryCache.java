package com.chemfetch.sds.discovery;

import com.chemfetch.sds.config.SearchProperties;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;

/**
 * Short-lived memo of discovery results, one instance per application
 * context. Resolutions are keyed by {@code name|size} and kept even when no
 * document was found; barcode lookups by the code itself.
 */
@Component
public class DiscoveryCache {

    private final Cache<String, ResolutionResult> resolutions;

    private final Cache<String, ProductInfo> barcodes;

    @Autowired
    public DiscoveryCache(final SearchProperties props) {
        this(props, Ticker.systemTicker());
    }

    public DiscoveryCache(final SearchProperties props, final Ticker ticker) {
        this.resolutions = Caffeine.newBuilder()
                .maximumSize(props.getCacheMaximumSize())
                .expireAfterWrite(props.getResolutionCacheTtl())
                .ticker(ticker)
                .build();
        this.barcodes = Caffeine.newBuilder()
                .maximumSize(props.getCacheMaximumSize())
                .expireAfterWrite(props.getBarcodeCacheTtl())
                .ticker(ticker)
                .build();
    }

    public Optional<ResolutionResult> resolution(final String name, final String size) {
        return Optional.ofNullable(resolutions.getIfPresent(resolutionKey(name, size)));
    }

    public void putResolution(final String name, final String size, final ResolutionResult result) {
        resolutions.put(resolutionKey(name, size), result);
    }

    public Optional<ProductInfo> barcode(final String barcode) {
        return Optional.ofNullable(barcodes.getIfPresent(QueryVariants.clean(barcode)));
    }

    public void putBarcode(final String barcode, final ProductInfo info) {
        barcodes.put(QueryVariants.clean(barcode), info);
    }

    public void invalidateAll() {
        resolutions.invalidateAll();
        barcodes.invalidateAll();
    }

    private static String resolutionKey(final String name, final String size) {
        return (QueryVariants.clean(name) + "|" + QueryVariants.clean(size)).toLowerCase(Locale.ROOT);
    }
}
