package com.chemfetch.sds.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Outbound HTTP settings shared by page scraping, PDF probing and downloads,
 * bound from the <code>scraper.http</code> prefix.
 */
@Component
@ConfigurationProperties(prefix = "scraper.http")
@Getter
@Setter
public class HttpProperties {

    private String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) "
            + "AppleWebKit/537.36 (KHTML, like Gecko) "
            + "Chrome/125.0.0.0 Safari/537.36";

    private String acceptLanguage = "en-AU,en;q=0.9";

    /** Connect timeout of the shared clients. */
    private Duration connectTimeout = Duration.ofSeconds(5);

    /** Timeout for HTML page requests. */
    private Duration pageTimeout = Duration.ofSeconds(8);

    /** Timeout for one classification probe (HEAD or sniffing GET). */
    private Duration probeTimeout = Duration.ofSeconds(10);

    /** Timeout for a full document download. */
    private Duration downloadTimeout = Duration.ofSeconds(30);

    /** Redirect hops followed before giving up. */
    private int maxRedirects = 3;

    /** Bytes read by the sniffing GET. */
    private int sniffBytes = 1024;

    /** Largest document accepted for download. */
    private long maxDownloadBytes = 50L * 1024 * 1024;
}
