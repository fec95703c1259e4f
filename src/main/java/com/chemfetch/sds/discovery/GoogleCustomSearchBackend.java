package com.chemfetch.sds.discovery;

import com.chemfetch.sds.config.BackendCfg;
import com.chemfetch.sds.config.BackendConfigFactory;
import com.chemfetch.sds.link.LinkResolver;
import com.fasterxml.jackson.databind.JsonNode;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * <h2>GoogleCustomSearchBackend</h2>
 *
 * <p>Primary backend: the Custom Search JSON API
 * ({@code GET /customsearch/v1?key=..&cx=..&q=..}). It needs both an API key
 * and a programmable engine id; without them the backend reports itself as
 * unavailable and discovery starts with the next one.</p>
 *
 * <p>Each call is wrapped in the {@code searchBackend} Resilience4j retry.</p>
 */
@Slf4j
@Component
public class GoogleCustomSearchBackend implements SearchBackend {

    public static final String NAME = "google";

    /** The API never returns more than ten items per request. */
    private static final int MAX_NUM = 10;

    private final BackendCfg cfg;

    private final WebClient client;

    private final Retry retry;

    private final LinkResolver linkResolver;

    public GoogleCustomSearchBackend(final BackendConfigFactory factory,
                                     final WebClient.Builder builder,
                                     final Retry searchRetry,
                                     final LinkResolver linkResolver) {
        this.cfg = factory.forBackend(NAME);
        this.client = builder.clone()
                .baseUrl(StringUtils.defaultString(cfg.getBaseUrl()))
                .build();
        this.retry = searchRetry;
        this.linkResolver = linkResolver;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public int order() {
        return cfg.getOrder();
    }

    @Override
    public boolean isAvailable() {
        return cfg.isEnabled()
                && StringUtils.isNoneBlank(cfg.getBaseUrl(), cfg.getApiKey(), cfg.getEngineId());
    }

    @Override
    public List<SearchHit> search(final String query, final int limit) {
        JsonNode root;
        try {
            root = Retry.decorateSupplier(retry, () -> fetch(query, Math.min(limit, MAX_NUM))).get();
        } catch (RuntimeException ex) {
            throw new SearchBackendException(NAME, query, ex);
        }
        if (root == null) {
            return List.of();
        }

        List<SearchHit> hits = new ArrayList<>();
        for (JsonNode item : root.path("items")) {
            String link = linkResolver.resolve(item.path("link").asText(""));
            if (StringUtils.isBlank(link)
                    || linkResolver.isSearchEngineHosted(link)
                    || linkResolver.isPlaceholder(link)) {
                continue;
            }
            hits.add(new SearchHit(link, item.path("title").asText("")));
            if (hits.size() >= limit) {
                break;
            }
        }
        log.debug("google returned {} links for \"{}\"", hits.size(), query);
        return hits;
    }

    private JsonNode fetch(final String query, final int num) {
        return client.get()
                .uri(ub -> ub.path(StringUtils.defaultIfBlank(cfg.getSearchPath(), "/customsearch/v1"))
                        .queryParam("key", "{key}")
                        .queryParam("cx", "{cx}")
                        .queryParam("q", "{q}")
                        .queryParam("num", num)
                        .queryParam("gl", "au")
                        .queryParam("hl", "en")
                        .queryParam("lr", "lang_en")
                        .queryParam("safe", "off")
                        .build(Map.of("key", cfg.getApiKey(), "cx", cfg.getEngineId(), "q", query)))
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .block(cfg.getTimeout());
    }
}
