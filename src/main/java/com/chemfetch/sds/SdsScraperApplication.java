package com.chemfetch.sds;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * The main entry point for the SDS Scraper application.
 *
 * <p>This Spring Boot application exposes RESTful endpoints for:
 * <ul>
 *   <li>Resolving a Safety Data Sheet URL from a product name and size,</li>
 *   <li>Looking up product details from a scanned barcode,</li>
 *   <li>Triggering, batching and querying automatic SDS parsing,</li>
 *   <li>The document-processing boundary (verify, parse, health).</li>
 * </ul>
 * It wires together the web-search backends, the PDF probe and download
 * helpers, the layered text and field extractors and the auto-parse
 * coordinator.</p>
 *
 * <p>Usage:
 * <pre>{@code
 *   mvn spring-boot:run
 *
 *   java -jar target/sds-scraper.jar
 * }</pre>
 *
 * <p>Once started, the application listens on the configured port (default
 * 8080) and serves requests under <code>/api/sds/</code> and
 * <code>/capability/</code>.</p>
 */
@SpringBootApplication
public class SdsScraperApplication {

    /**
     * Bootstrap method to launch the Spring Boot application.
     *
     * @param args command-line arguments (ignored)
     */
    public static void main(final String[] args) {
        SpringApplication.run(SdsScraperApplication.class, args);
    }
}
