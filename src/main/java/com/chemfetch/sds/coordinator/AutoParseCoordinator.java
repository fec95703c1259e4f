package com.chemfetch.sds.coordinator;

import com.chemfetch.sds.capability.CapabilityHealth;
import com.chemfetch.sds.capability.ExtractionCapability;
import com.chemfetch.sds.capability.ExtractionUnavailableException;
import com.chemfetch.sds.capability.ParseOutcome;
import com.chemfetch.sds.capability.VerificationOutcome;
import com.chemfetch.sds.config.AutoParseProperties;
import com.chemfetch.sds.persistence.InventoryHazardFields;
import com.chemfetch.sds.persistence.InventoryRepository;
import com.chemfetch.sds.persistence.Product;
import com.chemfetch.sds.persistence.ProductRepository;
import com.chemfetch.sds.persistence.SdsMetadata;
import com.chemfetch.sds.persistence.SdsMetadataRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.Exceptions;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * <h2>AutoParseCoordinator</h2>
 *
 * <p>Decides when a product's SDS is parsed and guarantees that every run
 * ends in a stored record:</p>
 *
 * <pre>
 * no_sds_url ──(url attached)──▶ pending_parse ──▶ parsed
 *                                      └──────────▶ parse_failed_basic
 * </pre>
 *
 * <p>A run checks capability health, parses and upserts the record, then
 * mirrors the hazard columns onto the inventory. An unhealthy capability,
 * a parse error or the run deadline ({@code auto-parse.run-timeout}) all
 * produce placeholder metadata instead.</p>
 *
 * <p>Every run owns a write-once {@link CompletableFuture}: the completion
 * and the deadline race to complete it, only the winner's record is
 * persisted, and it is persisted exactly once. Runs execute on
 * {@link Schedulers#boundedElastic()}.</p>
 */
@Slf4j
@Service
public class AutoParseCoordinator {

    static final String PLACEHOLDER_NOTE = "Basic metadata created - extraction unavailable";

    private final ProductRepository products;

    private final SdsMetadataRepository metadata;

    private final InventoryRepository inventory;

    private final ExtractionCapability capability;

    private final AutoParseProperties props;

    private final ObjectMapper mapper;

    private final Clock clock;

    private final Scheduler scheduler = Schedulers.boundedElastic();

    /** Persisted result of the latest run per product, while it is in flight. */
    private final Map<Long, CompletableFuture<SdsMetadata>> inFlight = new ConcurrentHashMap<>();

    public AutoParseCoordinator(final ProductRepository products,
                                final SdsMetadataRepository metadata,
                                final InventoryRepository inventory,
                                final ExtractionCapability capability,
                                final AutoParseProperties props,
                                @Qualifier("scraperObjectMapper") final ObjectMapper mapper,
                                final Clock clock) {
        this.products = products;
        this.metadata = metadata;
        this.inventory = inventory;
        this.capability = capability;
        this.props = props;
        this.mapper = mapper;
        this.clock = clock;
    }

    /* ------------------------------------------------------------------ */
    /* public API                                                          */
    /* ------------------------------------------------------------------ */

    /**
     * @param productId product to parse
     * @param force     re-parse even when metadata exists
     * @param delay     wait before the run starts; {@code null} for the configured default
     * @return whether a run was scheduled
     * @throws ProductNotFoundException when the product does not exist
     */
    public TriggerResult trigger(final long productId, final boolean force, final Duration delay) {
        Product product = product(productId);
        if (!product.hasSdsUrl()) {
            log.debug("Product {} has no SDS URL, nothing to parse", productId);
            return new TriggerResult(false, ParseStatus.NO_SDS_URL, "no_sds_url");
        }
        if (!force && metadata.existsByProductId(productId)) {
            log.debug("Product {} already parsed, trigger ignored", productId);
            return new TriggerResult(false, status(productId), "already_parsed");
        }
        schedule(product, delay == null ? props.getDefaultDelay() : delay);
        return new TriggerResult(true, ParseStatus.PENDING_PARSE, "scheduled");
    }

    /**
     * @param productId product id
     * @return the product's parse status
     * @throws ProductNotFoundException when the product does not exist
     */
    public ParseStatus status(final long productId) {
        Product product = product(productId);
        if (inFlight.containsKey(productId)) {
            return ParseStatus.PENDING_PARSE;
        }
        return metadata.findByProductId(productId)
                .map(m -> m.isPlaceholder() ? ParseStatus.PARSE_FAILED_BASIC : ParseStatus.PARSED)
                .orElse(product.hasSdsUrl() ? ParseStatus.PENDING_PARSE : ParseStatus.NO_SDS_URL);
    }

    /**
     * Stores the SDS URL (when given), runs a parse and waits for its
     * terminal state. Without {@code force} an existing record is returned
     * as is. A new URL is checked on the trusted verification path first
     * and is not stored when it is rejected.
     *
     * @param productId product to parse
     * @param sdsUrl    document to attach first, may be {@code null}
     * @param force     re-parse even when metadata exists
     * @return the stored record, or the reason there is none
     * @throws ProductNotFoundException when the product does not exist
     */
    public ExtractResult extract(final long productId, final String sdsUrl, final boolean force) {
        Product product = product(productId);
        if (sdsUrl != null && !sdsUrl.isBlank() && !Objects.equals(product.getSdsUrl(), sdsUrl)) {
            Optional<String> rejection = rejectSuppliedUrl(product, sdsUrl);
            if (rejection.isPresent()) {
                return new ExtractResult(false, null, rejection.get());
            }
            product = attachSdsUrl(productId, sdsUrl);
        }
        if (!product.hasSdsUrl()) {
            return new ExtractResult(false, null, "Product has no SDS URL");
        }
        if (!force) {
            SdsMetadata existing = metadata.findByProductId(productId).orElse(null);
            if (existing != null) {
                return result(existing);
            }
        }

        CompletableFuture<SdsMetadata> run = schedule(product, Duration.ZERO);
        try {
            return result(run.get(props.getRunTimeout().plusSeconds(5).toMillis(), TimeUnit.MILLISECONDS));
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return new ExtractResult(false, null, "interrupted");
        } catch (ExecutionException | TimeoutException ex) {
            log.warn("Extraction of product {} did not finish: {}", productId, ex.toString());
            return new ExtractResult(false, null, ex.toString());
        }
    }

    /**
     * @param productId product to update
     * @param sdsUrl    document URL
     * @return the updated product
     * @throws ProductNotFoundException when the product does not exist
     */
    public Product attachSdsUrl(final long productId, final String sdsUrl) {
        Product product = product(productId);
        if (Objects.equals(product.getSdsUrl(), sdsUrl)) {
            return product;
        }
        Product updated = product.toBuilder().sdsUrl(sdsUrl).build();
        products.save(updated);
        log.info("Product {} SDS URL set to {}", productId, sdsUrl);
        return updated;
    }

    /**
     * Parses, one after another, every product with an SDS URL and no
     * metadata. Returns immediately.
     *
     * @return number of products queued
     */
    public int runBatch() {
        List<Product> pending = products.findAllWithSdsUrl().stream()
                .filter(p -> !metadata.existsByProductId(p.getId()))
                .toList();
        log.info("Batch parse queued {} products", pending.size());

        Flux.fromIterable(pending)
                .index()
                .concatMap(t -> Mono.delay(t.getT1() == 0 ? Duration.ZERO : props.getBatchDelay(), scheduler)
                        .then(Mono.fromFuture(() -> schedule(t.getT2(), Duration.ZERO)))
                        .onErrorResume(err -> {
                            log.warn("Batch item {} failed, continuing: {}", t.getT2().getId(),
                                    reason(Exceptions.unwrap(err)));
                            return Mono.empty();
                        }))
                .subscribe(
                        m -> log.debug("Batch item {} done", m.getProductId()),
                        err -> log.error("Batch parse stopped: {}", err.toString()),
                        () -> log.info("Batch parse finished ({} products)", pending.size()));
        return pending.size();
    }

    /**
     * @return counts over products with an SDS URL
     */
    public BatchStats batchStats() {
        List<Product> withSds = products.findAllWithSdsUrl();
        long total = withSds.size();
        long parsed = withSds.stream().filter(p -> metadata.existsByProductId(p.getId())).count();
        double rate = total == 0 ? 0.0 : Math.round(1000.0 * parsed / total) / 10.0;
        return new BatchStats(total, parsed, total - parsed, rate);
    }

    /* ------------------------------------------------------------------ */
    /* run                                                                 */
    /* ------------------------------------------------------------------ */

    /**
     * @return completes with the persisted record once the run is terminal and no longer in flight
     */
    private CompletableFuture<SdsMetadata> schedule(final Product product, final Duration delay) {
        long productId = product.getId();
        CompletableFuture<SdsMetadata> outcome = new CompletableFuture<>();
        CompletableFuture<SdsMetadata> persisted = outcome.thenApply(record -> persist(product, record));
        inFlight.put(productId, persisted);
        CompletableFuture<SdsMetadata> settled =
                persisted.whenComplete((m, err) -> inFlight.remove(productId, persisted));

        log.info("Parse of product {} scheduled in {}", productId, delay);
        Mono.delay(delay, scheduler)
                .flatMap(tick -> Mono.fromCallable(() -> parse(product))
                        .subscribeOn(scheduler)
                        .timeout(props.getRunTimeout(), scheduler))
                .subscribe(
                        outcome::complete,
                        err -> outcome.complete(placeholder(product, SdsMetadata.EXTRACTION_UNAVAILABLE,
                                reason(err))));
        return settled;
    }

    /** Health check then parse; never throws. */
    private SdsMetadata parse(final Product product) {
        try {
            CapabilityHealth health = checkHealth();
            log.debug("Capability healthy (ocr={}), parsing product {}", health.ocr(), product.getId());
            ParseOutcome outcome = capability.parse(product.getId(), product.getSdsUrl());
            if (outcome.succeeded()) {
                return outcome.metadata();
            }
            return placeholder(product, SdsMetadata.NO_TEXT_EXTRACTED, outcome.failureReason());
        } catch (ExtractionUnavailableException ex) {
            log.warn("Extraction unavailable for product {}: {}", product.getId(), ex.getMessage());
            return placeholder(product, SdsMetadata.EXTRACTION_UNAVAILABLE, ex.getMessage());
        } catch (RuntimeException ex) {
            log.warn("Parse of product {} failed: {}", product.getId(), ex.toString());
            return placeholder(product, SdsMetadata.EXTRACTION_UNAVAILABLE, ex.toString());
        }
    }

    private CapabilityHealth checkHealth() throws ExtractionUnavailableException {
        try {
            CapabilityHealth health = Mono.fromCallable(capability::health)
                    .subscribeOn(scheduler)
                    .timeout(props.getHealthTimeout())
                    .block();
            if (health == null || !health.isOk()) {
                throw new ExtractionUnavailableException("capability unhealthy");
            }
            return health;
        } catch (RuntimeException ex) {
            Throwable cause = Exceptions.unwrap(ex);
            if (cause instanceof ExtractionUnavailableException) {
                throw (ExtractionUnavailableException) cause;
            }
            throw new ExtractionUnavailableException("health check failed: " + reason(cause), cause);
        }
    }

    /**
     * Runs once per run, on the thread that won the race. A full record that
     * cannot be stored is replaced by a placeholder; a failing inventory
     * update leaves the stored record in place.
     */
    private SdsMetadata persist(final Product product, final SdsMetadata record) {
        SdsMetadata stored = record;
        try {
            metadata.upsert(record);
        } catch (RuntimeException ex) {
            if (record.isPlaceholder()) {
                log.error("Basic metadata for product {} could not be stored: {}", product.getId(), ex.toString());
                throw ex;
            }
            log.warn("Metadata for product {} could not be stored, writing basic metadata: {}",
                    product.getId(), ex.toString());
            stored = placeholder(product, SdsMetadata.EXTRACTION_UNAVAILABLE, "store failed: " + reason(ex));
            metadata.upsert(stored);
        }
        try {
            inventory.updateHazardFields(stored.getProductId(), InventoryHazardFields.from(stored));
        } catch (RuntimeException ex) {
            log.warn("Inventory hazard fields for product {} not updated: {}", product.getId(), ex.toString());
        }
        log.info("Product {} -> {}", stored.getProductId(),
                stored.isPlaceholder() ? ParseStatus.PARSE_FAILED_BASIC.key() : ParseStatus.PARSED.key());
        return stored;
    }

    SdsMetadata placeholder(final Product product, final String provenance, final String reason) {
        ObjectNode raw = mapper.createObjectNode();
        raw.put("note", PLACEHOLDER_NOTE);
        raw.put(SdsMetadata.PROVENANCE, provenance);
        raw.put("fallback_reason", reason);
        raw.put("sds_url", product.getSdsUrl());
        raw.put("created_at", Instant.now(clock).toString());
        return SdsMetadata.builder()
                .productId(product.getId())
                .description(product.getName())
                .rawJson(raw)
                .build();
    }

    /* ------------------------------------------------------------------ */
    /* helpers                                                             */
    /* ------------------------------------------------------------------ */

    /** Empty when the directly supplied document may be used. */
    private Optional<String> rejectSuppliedUrl(final Product product, final String sdsUrl) {
        try {
            VerificationOutcome check = capability.verify(sdsUrl, product.getName(), true);
            if (check.verified()) {
                return Optional.empty();
            }
            log.info("Supplied SDS {} rejected for product {}: {}", sdsUrl, product.getId(), check.reason());
            return Optional.of("SDS not verified: " + check.reason());
        } catch (ExtractionUnavailableException ex) {
            // the run itself records the outage as basic metadata
            log.warn("Supplied SDS {} for product {} not verified: {}", sdsUrl, product.getId(), ex.getMessage());
            return Optional.empty();
        }
    }

    private Product product(final long productId) {
        return products.findById(productId).orElseThrow(() -> new ProductNotFoundException(productId));
    }

    private static ExtractResult result(final SdsMetadata record) {
        if (record.isPlaceholder()) {
            return new ExtractResult(false, record, record.getRawJson().path("fallback_reason").asText(null));
        }
        return new ExtractResult(true, record, null);
    }

    private static String reason(final Throwable err) {
        if (err instanceof TimeoutException) {
            return "timed out";
        }
        return err.getMessage() == null ? err.getClass().getSimpleName() : err.getMessage();
    }
}
