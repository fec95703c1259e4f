package com.chemfetch.sds.discovery;

import com.chemfetch.sds.classify.DocumentFetcher;
import com.chemfetch.sds.config.SearchProperties;
import com.chemfetch.sds.link.LinkResolver;
import com.chemfetch.sds.persistence.Product;
import com.chemfetch.sds.persistence.ProductRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * <h2>BarcodeLookupService</h2>
 *
 * <p>Identifies a product from its barcode by reading the pages that web
 * search returns for the code:</p>
 * <ul>
 *   <li>name from {@code og:title}, {@code meta[name=title]}, {@code h1} or
 *       {@code title}, else from the URL slug,</li>
 *   <li>size from the name, else the size closest to the barcode in the page
 *       text,</li>
 *   <li>the first SDS-looking link on the page.</li>
 * </ul>
 * <p>Site-search pages are skipped, at most
 * {@code search.barcode-pages-limit} pages are read and consecutive fetches
 * are spaced by {@code search.politeness-delay}.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BarcodeLookupService {

    static final Pattern SIZE_PATTERN = Pattern.compile(
            "\\b(\\d+(?:[.,]\\d+)?)\\s*(fl\\.?\\s*oz|ml|mL|litres?|liters?|ltr|l|kg|g|oz|pack|pk|tablets?)\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern TITLE_SUFFIX = Pattern.compile("\\s+\\|\\s+.*$");

    private static final int MAX_NAME_LENGTH = 150;

    private final CandidateDiscoveryEngine discovery;

    private final SiteSearchExpander expander;

    private final DocumentFetcher fetcher;

    private final LinkResolver linkResolver;

    private final DiscoveryCache cache;

    private final SearchProperties searchProps;

    private final ProductRepository products;

    /**
     * @param barcode scanned code
     * @return what the web knows about the product; {@link ProductInfo#empty()}
     *         when no page named it
     */
    public ProductInfo lookup(final String barcode) {
        String code = QueryVariants.clean(barcode);
        if (code.isEmpty()) {
            throw new IllegalArgumentException("barcode must not be blank");
        }
        Optional<ProductInfo> cached = cache.barcode(code);
        if (cached.isPresent()) {
            return cached.get();
        }

        List<CandidateLink> pages = discovery.discoverByBarcode(code).stream()
                .filter(c -> !expander.isLikelySiteSearch(c.url()))
                .limit(searchProps.getBarcodePagesLimit())
                .toList();

        ProductInfo found = ProductInfo.empty();
        for (int i = 0; i < pages.size(); i++) {
            if (i > 0 && !pause()) {
                break;
            }
            Optional<ProductInfo> info = scrape(pages.get(i).url(), code);
            if (info.isPresent() && info.get().hasName()) {
                found = info.get();
                break;
            }
        }
        log.info("Barcode {} identified as \"{}\" {} from {}", code, found.name(), found.size(), found.url());
        cache.putBarcode(code, found);
        return found;
    }

    /**
     * Looks the barcode up and fills the gaps (name, size, SDS URL) of a
     * stored product carrying the same barcode. Known values are kept.
     *
     * @param barcode scanned code
     * @return the lookup result
     */
    public ProductInfo lookupAndRecord(final String barcode) {
        ProductInfo info = lookup(barcode);
        if (!info.hasName() && info.sdsUrl() == null) {
            return info;
        }
        products.findByBarcode(QueryVariants.clean(barcode)).ifPresent(p -> {
            Product updated = p.toBuilder()
                    .name(StringUtils.defaultIfBlank(p.getName(), info.name()))
                    .size(StringUtils.defaultIfBlank(p.getSize(), info.size()))
                    .sdsUrl(StringUtils.defaultIfBlank(p.getSdsUrl(), info.sdsUrl()))
                    .build();
            if (!updated.equals(p)) {
                products.save(updated);
                log.info("Product {} updated from barcode lookup", p.getId());
            }
        });
        return info;
    }

    /* ------------------------------------------------------------------ */

    Optional<ProductInfo> scrape(final String url, final String barcode) {
        Document doc;
        try {
            doc = fetcher.fetchHtml(url);
        } catch (IOException ex) {
            log.warn("Product page {} unreadable: {}", url, ex.getMessage());
            return Optional.empty();
        }
        String name = productName(doc, url);
        String size = findSize(name, null).orElseGet(() -> findSize(doc.text(), barcode).orElse(""));
        String sdsUrl = sdsLink(doc).orElse(null);
        return Optional.of(new ProductInfo(url, name, size, sdsUrl));
    }

    static String productName(final Document doc, final String url) {
        String name = firstNonBlank(
                doc.select("meta[property=og:title]").attr("content"),
                doc.select("meta[name=title]").attr("content"),
                Optional.ofNullable(doc.selectFirst("h1")).map(Element::text).orElse(""),
                doc.title());
        if (StringUtils.isBlank(name)) {
            name = slugName(url);
        }
        name = TITLE_SUFFIX.matcher(QueryVariants.clean(name)).replaceFirst("");
        return StringUtils.abbreviate(name, MAX_NAME_LENGTH);
    }

    /**
     * @param text    text to search
     * @param barcode when given, the size nearest to it wins
     * @return a size such as {@code "500 mL"}
     */
    static Optional<String> findSize(final String text, final String barcode) {
        if (StringUtils.isBlank(text)) {
            return Optional.empty();
        }
        int anchor = barcode == null ? -1 : text.indexOf(barcode);
        Matcher m = SIZE_PATTERN.matcher(text);
        String best = null;
        int bestDistance = Integer.MAX_VALUE;
        while (m.find()) {
            String size = m.group(1) + " " + m.group(2);
            if (anchor < 0) {
                return Optional.of(size);
            }
            int distance = Math.abs(m.start() - anchor);
            if (distance < bestDistance) {
                best = size;
                bestDistance = distance;
            }
        }
        return Optional.ofNullable(best);
    }

    private Optional<String> sdsLink(final Document doc) {
        for (Element a : doc.select("a[href]")) {
            Optional<String> url = linkResolver.normalise(a.attr("href"), doc.location());
            if (url.isPresent() && SdsLinks.isLikelySds(url.get(), a.text())) {
                return url;
            }
        }
        return Optional.empty();
    }

    private static String slugName(final String url) {
        try {
            String path = StringUtils.defaultString(URI.create(url).getPath());
            String slug = StringUtils.substringAfterLast(StringUtils.removeEnd(path, "/"), "/");
            slug = slug.replaceFirst("\\.[a-z]{2,5}$", "").replaceAll("[-_+]+", " ").strip();
            return slug.matches("\\d*") ? "" : slug;
        } catch (IllegalArgumentException ex) {
            return "";
        }
    }

    private static String firstNonBlank(final String... values) {
        for (String v : values) {
            if (StringUtils.isNotBlank(v)) {
                return v;
            }
        }
        return "";
    }

    /** @return {@code false} when interrupted */
    private boolean pause() {
        try {
            Thread.sleep(searchProps.getPolitenessDelay().toMillis());
            return true;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("Barcode lookup interrupted");
            return false;
        }
    }
}
