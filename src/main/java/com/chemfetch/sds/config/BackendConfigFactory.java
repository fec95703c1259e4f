package com.chemfetch.sds.config;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Factory component producing {@link BackendCfg} instances for a search
 * backend identifier. It delegates to {@link SearchProperties} to look up
 * the section defined under <code>search.backends</code>.
 *
 * <p>Usage:</p>
 * <pre>{@code
 * BackendCfg bing = configFactory.forBackend("bing");
 * }</pre>
 */
@Component
@RequiredArgsConstructor
public class BackendConfigFactory {

    private final SearchProperties searchProps;

    /**
     * Retrieves the {@link BackendCfg} for the specified backend ID.
     *
     * @param id the backend identifier (must match a key under
     *           <code>search.backends.{id}</code> in application.yml)
     * @return the corresponding {@link BackendCfg} instance
     * @throws IllegalArgumentException if no configuration section is found
     */
    public BackendCfg forBackend(final String id) {
        return Optional.ofNullable(searchProps.forName(id))
                .orElseThrow(() -> new IllegalArgumentException(
                        "No <search.backends." + id + "> section found in application.yml"));
    }
}
