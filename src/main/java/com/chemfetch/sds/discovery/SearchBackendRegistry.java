package com.chemfetch.sds.discovery;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Registry that wires all search backends in fallback order.
 * Inject this where the ordered chain is needed.
 */
@Component
@Slf4j
public class SearchBackendRegistry {

    private final List<SearchBackend> ordered;

    @Autowired
    public SearchBackendRegistry(final List<SearchBackend> backends) {
        this.ordered = backends.stream()
                .sorted(Comparator.comparingInt(SearchBackend::order))
                .toList();
        log.info("Registered search backends: {}", ordered.stream()
                .map(b -> b.name() + (b.isAvailable() ? "" : " (unavailable)"))
                .collect(Collectors.joining(", ")));
    }

    /**
     * @return available backends, lowest order first
     */
    public List<SearchBackend> chain() {
        return ordered.stream().filter(SearchBackend::isAvailable).toList();
    }
}
