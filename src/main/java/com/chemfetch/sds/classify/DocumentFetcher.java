package com.chemfetch.sds.classify;

import com.chemfetch.sds.config.HttpProperties;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * <h2>DocumentFetcher</h2>
 *
 * <p>Polite, bounded HTTP access for everything that is not a JSON API:
 * search-result pages, product pages, PDF probes and PDF downloads.</p>
 *
 * <ul>
 *   <li>Browser user agent and {@code Accept-Language} on every request.</li>
 *   <li>Redirects are walked by hand, at most
 *       {@link HttpProperties#getMaxRedirects()} hops, so the final URL is
 *       always known.</li>
 *   <li>Bodies are read up to a byte limit; sniffing reads truncate, downloads
 *       fail with {@link DocumentTooLargeException}.</li>
 * </ul>
 */
@Slf4j
@Component
public class DocumentFetcher {

    private static final String ACCEPT_HTML = "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8";

    private static final String ACCEPT_PDF = "application/pdf,application/octet-stream;q=0.9,*/*;q=0.5";

    private static final int MAX_HTML_BYTES = 5 * 1024 * 1024;

    private static final int BUFFER_SIZE = 8192;

    private final HttpClient http;

    private final HttpProperties props;

    public DocumentFetcher(@Qualifier("scraperHttpClient") final HttpClient http,
                           final HttpProperties props) {
        this.http = http;
        this.props = props;
    }

    /**
     * Lightweight header probe.
     *
     * @param url absolute URL
     * @return the final response, body empty
     * @throws IOException on network failure, timeout or too many redirects
     */
    public FetchResult head(final String url) throws IOException {
        return exchange(url, "HEAD", Map.of(HttpHeaders.ACCEPT, ACCEPT_PDF),
                props.getProbeTimeout(), 0, false);
    }

    /**
     * Bounded GET that reads only the leading bytes of the body.
     *
     * @param url absolute URL
     * @return the final response with at most {@link HttpProperties#getSniffBytes()} body bytes
     * @throws IOException on network failure, timeout or too many redirects
     */
    public FetchResult sniff(final String url) throws IOException {
        int bytes = props.getSniffBytes();
        return exchange(url, "GET",
                Map.of(HttpHeaders.ACCEPT, ACCEPT_PDF, HttpHeaders.RANGE, "bytes=0-" + (bytes - 1)),
                props.getProbeTimeout(), bytes, false);
    }

    /**
     * Full download of a document.
     *
     * @param url absolute URL
     * @return the final response with the complete body
     * @throws IOException on network failure, timeout, non-2xx status or when the
     *                     body exceeds {@link HttpProperties#getMaxDownloadBytes()}
     */
    public FetchResult download(final String url) throws IOException {
        FetchResult rs = exchange(url, "GET", Map.of(HttpHeaders.ACCEPT, ACCEPT_PDF),
                props.getDownloadTimeout(), props.getMaxDownloadBytes(), true);
        if (!rs.isSuccess()) {
            throw new IOException("HTTP " + rs.status() + " for " + rs.finalUrl());
        }
        log.debug("Downloaded {} bytes from {}", rs.body().length, rs.finalUrl());
        return rs;
    }

    /**
     * Download and parse an HTML page in one call.
     *
     * @param url absolute URL
     * @return the parsed page; its base URI is the final URL
     * @throws IOException on network failure, timeout or non-2xx status
     */
    public Document fetchHtml(final String url) throws IOException {
        FetchResult rs = exchange(url, "GET", Map.of(HttpHeaders.ACCEPT, ACCEPT_HTML),
                props.getPageTimeout(), MAX_HTML_BYTES, false);
        if (!rs.isSuccess()) {
            throw new IOException("HTTP " + rs.status() + " for " + rs.finalUrl());
        }
        return Jsoup.parse(rs.text(), rs.finalUrl());
    }

    /* ------------------------------------------------------------------ */
    /* HTTP helpers                                                        */
    /* ------------------------------------------------------------------ */

    private FetchResult exchange(final String url,
                                 final String method,
                                 final Map<String, String> headers,
                                 final Duration timeout,
                                 final long maxBytes,
                                 final boolean failWhenTooLarge) throws IOException {
        URI current = toUri(url);
        for (int hop = 0; ; hop++) {
            HttpRequest.Builder rb = HttpRequest.newBuilder(current)
                    .timeout(timeout)
                    .header(HttpHeaders.USER_AGENT, props.getUserAgent())
                    .header(HttpHeaders.ACCEPT_LANGUAGE, props.getAcceptLanguage())
                    .method(method, HttpRequest.BodyPublishers.noBody());
            headers.forEach(rb::header);

            HttpResponse<InputStream> rsp = send(rb.build());
            int code = rsp.statusCode();
            String location = rsp.headers().firstValue(HttpHeaders.LOCATION).orElse(null);

            if (isRedirect(code) && location != null) {
                rsp.body().close();
                if (hop >= props.getMaxRedirects()) {
                    throw new TooManyRedirectsException(url, props.getMaxRedirects());
                }
                URI next = current.resolve(location.trim().replace(" ", "%20"));
                log.debug("{} {} -> {} ({})", method, current, next, code);
                current = next;
                continue;
            }

            String contentType = rsp.headers().firstValue(HttpHeaders.CONTENT_TYPE).orElse(null);
            byte[] body;
            try (InputStream in = rsp.body()) {
                body = maxBytes > 0 ? readBounded(in, maxBytes, failWhenTooLarge, current) : new byte[0];
            }
            return new FetchResult(code, current.toString(), contentType, body);
        }
    }

    private HttpResponse<InputStream> send(final HttpRequest request) throws IOException {
        try {
            return http.send(request, HttpResponse.BodyHandlers.ofInputStream());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            InterruptedIOException io = new InterruptedIOException("Interrupted: " + request.uri());
            io.initCause(ex);
            throw io;
        }
    }

    private static byte[] readBounded(final InputStream in,
                                      final long maxBytes,
                                      final boolean failWhenTooLarge,
                                      final URI source) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] buf = new byte[BUFFER_SIZE];
        long total = 0;
        int n;
        while ((n = in.read(buf)) != -1) {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedIOException("Interrupted while reading " + source);
            }
            long room = maxBytes - total;
            if (n > room) {
                if (failWhenTooLarge) {
                    throw new DocumentTooLargeException(source.toString(), maxBytes);
                }
                out.write(buf, 0, (int) room);
                break;
            }
            out.write(buf, 0, n);
            total += n;
        }
        return out.toByteArray();
    }

    private static boolean isRedirect(final int code) {
        return code == 301 || code == 302 || code == 303 || code == 307 || code == 308;
    }

    private static URI toUri(final String url) throws IOException {
        try {
            return URI.create(url.trim().replace(" ", "%20"));
        } catch (IllegalArgumentException ex) {
            throw new IOException("Malformed URL " + url, ex);
        }
    }

    /** Raised when a redirect chain is longer than allowed. */
    public static class TooManyRedirectsException extends IOException {
        public TooManyRedirectsException(final String url, final int max) {
            super("More than " + max + " redirects for " + url);
        }
    }

    /** Raised when a download exceeds the configured size limit. */
    public static class DocumentTooLargeException extends IOException {
        public DocumentTooLargeException(final String url, final long max) {
            super("Document larger than " + max + " bytes: " + url);
        }
    }
}
