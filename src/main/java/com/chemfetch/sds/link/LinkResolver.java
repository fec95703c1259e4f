package com.chemfetch.sds.link;

import com.chemfetch.sds.config.SearchProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.util.MultiValueMap;
import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * <h2>LinkResolver</h2>
 *
 * <p>Turns raw search-result hrefs into direct target URLs.</p>
 *
 * <ul>
 *   <li>Unwraps redirector links (Bing {@code u=}, DuckDuckGo {@code uddg=},
 *       Google {@code /url?q=}).</li>
 *   <li>Decodes percent-encoded targets, then Bing's {@code a1}-prefixed
 *       base64 form.</li>
 *   <li>Rejects targets on placeholder hosts.</li>
 * </ul>
 *
 * <p>None of the methods throw. Unresolvable input is returned unchanged and
 * resolving an already resolved URL is a no-op.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LinkResolver {

    private final SearchProperties searchProps;

    /* ------------------------------------------------------------------ */
    /* redirect unwrapping                                                 */
    /* ------------------------------------------------------------------ */

    /**
     * Returns the direct target of a redirect-wrapped URL, or {@code raw}
     * itself when no usable wrapping is detected.
     *
     * @param raw the href as scraped or returned by a search API
     * @return the decoded absolute target, or the input unchanged
     */
    public String resolve(@Nullable final String raw) {
        if (StringUtils.isBlank(raw)) {
            return raw;
        }
        try {
            UriComponents uri = UriComponentsBuilder.fromUriString(raw.trim()).build();
            String host = StringUtils.defaultString(uri.getHost()).toLowerCase(Locale.ROOT);
            String param = redirectParameter(host, StringUtils.defaultString(uri.getPath()));
            if (param == null) {
                return raw;
            }
            String encoded = firstParam(uri.getQueryParams(), param);
            if (StringUtils.isBlank(encoded)) {
                return raw;
            }
            Optional<String> target = decodeTarget(encoded);
            if (target.isEmpty()) {
                log.debug("Redirect target not decodable in {}", raw);
                return raw;
            }
            if (isPlaceholder(target.get())) {
                log.debug("Rejected placeholder target {} (from {})", target.get(), raw);
                return raw;
            }
            return target.get();
        } catch (RuntimeException ex) {
            log.debug("Unparseable link {}: {}", raw, ex.toString());
            return raw;
        }
    }

    /**
     * Makes a page href absolute and unwraps it.
     *
     * @param href the href attribute, possibly relative or protocol-relative
     * @param base the URL of the page the href was found on; may be {@code null}
     * @return an absolute http(s) URL, or empty for script, mail or malformed links
     */
    public Optional<String> normalise(@Nullable final String href, @Nullable final String base) {
        if (StringUtils.isBlank(href)) {
            return Optional.empty();
        }
        String candidate = href.trim();
        String lower = candidate.toLowerCase(Locale.ROOT);
        if (lower.startsWith("javascript:") || lower.startsWith("mailto:")
                || lower.startsWith("tel:") || lower.startsWith("#")) {
            return Optional.empty();
        }
        if (candidate.startsWith("//")) {
            candidate = "https:" + candidate;
        }
        try {
            if (!isHttp(candidate)) {
                if (base == null) {
                    return Optional.empty();
                }
                candidate = URI.create(base).resolve(candidate.replace(" ", "%20")).toString();
            }
        } catch (IllegalArgumentException ex) {
            log.debug("Cannot resolve {} against {}: {}", href, base, ex.getMessage());
            return Optional.empty();
        }
        String resolved = resolve(candidate);
        return isHttp(resolved) ? Optional.of(resolved) : Optional.empty();
    }

    /**
     * Key used to deduplicate candidates: lower-case scheme and host, no
     * fragment, no trailing slash, no {@code www.} prefix.
     *
     * @param url an absolute URL
     * @return the dedup key, or the trimmed input when it cannot be parsed
     */
    public String dedupeKey(final String url) {
        try {
            URI u = URI.create(url.trim());
            String host = StringUtils.defaultString(u.getHost()).toLowerCase(Locale.ROOT);
            host = StringUtils.removeStart(host, "www.");
            String path = StringUtils.defaultString(u.getRawPath());
            path = StringUtils.removeEnd(path, "/");
            String query = u.getRawQuery() == null ? "" : "?" + u.getRawQuery();
            return host + path + query;
        } catch (IllegalArgumentException ex) {
            return url.trim();
        }
    }

    /**
     * @param url an absolute URL
     * @return whether the host is a search engine (its results are never the document)
     */
    public boolean isSearchEngineHosted(final String url) {
        return hostMatches(url, searchProps.getSearchEngineHosts());
    }

    /**
     * @param url an absolute URL
     * @return whether the host is a configured placeholder / test host
     */
    public boolean isPlaceholder(final String url) {
        return hostMatches(url, searchProps.getPlaceholderHosts());
    }

    /**
     * @param url    an absolute URL
     * @param needles host fragments such as {@code "ebay."} or {@code "chemwatch.net"}
     * @return whether the URL host contains any of the fragments
     */
    public static boolean hostMatches(final String url, final List<String> needles) {
        String host = hostOf(url);
        if (host.isEmpty()) {
            return false;
        }
        return needles.stream()
                .map(n -> n.toLowerCase(Locale.ROOT))
                .anyMatch(host::contains);
    }

    /**
     * @param url any string
     * @return the lower-case host, or an empty string
     */
    public static String hostOf(final String url) {
        if (url == null) {
            return "";
        }
        try {
            return StringUtils.defaultString(URI.create(url.trim()).getHost()).toLowerCase(Locale.ROOT);
        } catch (IllegalArgumentException ex) {
            return "";
        }
    }

    /* ------------------------------------------------------------------ */
    /* private helpers                                                     */
    /* ------------------------------------------------------------------ */

    @Nullable
    private static String redirectParameter(final String host, final String path) {
        if (host.endsWith("bing.com")) {
            return "u";
        }
        if (host.endsWith("duckduckgo.com") && path.startsWith("/l")) {
            return "uddg";
        }
        if (host.matches("(www\\.)?google\\.[a-z.]+") && "/url".equals(path)) {
            return "q";
        }
        return null;
    }

    @Nullable
    private static String firstParam(final MultiValueMap<String, String> params, final String name) {
        String value = params.getFirst(name);
        if (value == null && "q".equals(name)) {
            value = params.getFirst("url");
        }
        return value;
    }

    private static Optional<String> decodeTarget(final String encoded) {
        String percent = percentDecode(encoded);
        if (isHttp(percent)) {
            return Optional.of(percent);
        }
        if (isProbablyA1Base64(percent)) {
            Optional<String> b64 = base64Decode(percent.substring(2));
            if (b64.isPresent() && isHttp(b64.get())) {
                return b64;
            }
        }
        return Optional.empty();
    }

    private static String percentDecode(final String value) {
        String current = value;
        // double-wrapped targets are common in tracking links
        for (int i = 0; i < 2 && current.contains("%"); i++) {
            try {
                current = URLDecoder.decode(current, StandardCharsets.UTF_8);
            } catch (IllegalArgumentException ex) {
                break;
            }
        }
        return current;
    }

    static boolean isProbablyA1Base64(final String value) {
        return value.length() > 2
                && Character.isLetter(value.charAt(0))
                && Character.isDigit(value.charAt(1));
    }

    private static Optional<String> base64Decode(final String payload) {
        String normalised = payload.replace('-', '+').replace('_', '/');
        int pad = (4 - normalised.length() % 4) % 4;
        normalised = normalised + "=".repeat(pad);
        try {
            return Optional.of(new String(Base64.getDecoder().decode(normalised), StandardCharsets.UTF_8));
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
    }

    private static boolean isHttp(@Nullable final String value) {
        if (value == null) {
            return false;
        }
        String lower = value.toLowerCase(Locale.ROOT);
        return lower.startsWith("http://") || lower.startsWith("https://");
    }
}
