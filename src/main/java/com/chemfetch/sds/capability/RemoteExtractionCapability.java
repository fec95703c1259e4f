package com.chemfetch.sds.capability;

import com.chemfetch.sds.config.ExtractionProperties;
import com.chemfetch.sds.extraction.field.DateNormalizer;
import com.chemfetch.sds.extraction.field.FieldValidators;
import com.chemfetch.sds.persistence.SdsMetadata;
import com.fasterxml.jackson.databind.JsonNode;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.codec.CodecException;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;
import java.util.function.Supplier;

/**
 * <h2>RemoteExtractionCapability</h2>
 *
 * <p>Calls a document-processing service over HTTP:</p>
 * <ul>
 *   <li>{@code GET  /health} → {@code {status, ocr}}</li>
 *   <li>{@code POST /verify-sds} {@code {url, name, trusted}} → {@code {verified, reason, text}}</li>
 *   <li>{@code POST /parse-sds} {@code {product_id, pdf_url}} → persisted record shape,
 *       or 422 with {@code {error}}</li>
 * </ul>
 *
 * <p>Each call blocks for at most its configured timeout and runs inside the
 * {@code extractionCapability} circuit breaker. Transport errors, timeouts
 * and an open breaker all surface as {@link ExtractionUnavailableException}.</p>
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "extraction.capability", name = "mode", havingValue = "remote")
public class RemoteExtractionCapability implements ExtractionCapability {

    /** Status of a parse that reached the document but read no text; the body carries the error. */
    private static final int UNPROCESSABLE = 422;

    private final WebClient client;

    private final CircuitBreaker breaker;

    private final ExtractionProperties.Capability cfg;

    private final DateNormalizer dateNormalizer;

    public RemoteExtractionCapability(final WebClient.Builder builder,
                                      final CircuitBreaker capabilityCircuitBreaker,
                                      final ExtractionProperties props,
                                      final DateNormalizer dateNormalizer) {
        this.cfg = props.getCapability();
        this.client = builder.clone().baseUrl(cfg.getBaseUrl()).build();
        this.breaker = capabilityCircuitBreaker;
        this.dateNormalizer = dateNormalizer;
        log.info("Remote extraction capability at {}", cfg.getBaseUrl());
    }

    @Override
    public CapabilityHealth health() throws ExtractionUnavailableException {
        JsonNode body = call("health", cfg.getHealthTimeout(), () -> client.get()
                .uri("/health")
                .retrieve()
                .bodyToMono(JsonNode.class));
        CapabilityHealth health = new CapabilityHealth(body.path("status").asText("unknown"),
                body.path("ocr").asBoolean(false));
        if (!health.isOk()) {
            throw new ExtractionUnavailableException("capability reports status " + health.status());
        }
        return health;
    }

    @Override
    public VerificationOutcome verify(final String url, final String name, final boolean trusted)
            throws ExtractionUnavailableException {
        JsonNode body = call("verify-sds", cfg.getVerifyTimeout(), () -> client.post()
                .uri("/verify-sds")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("url", url, "name", name, "trusted", trusted))
                .retrieve()
                .bodyToMono(JsonNode.class));
        return new VerificationOutcome(body.path("verified").asBoolean(false),
                body.path("reason").asText(""),
                body.path("text").asText(""));
    }

    @Override
    public ParseOutcome parse(final long productId, final String pdfUrl) throws ExtractionUnavailableException {
        JsonNode body = call("parse-sds", cfg.getParseTimeout(), () -> client.post()
                .uri("/parse-sds")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("product_id", productId, "pdf_url", pdfUrl))
                .retrieve()
                .onStatus(status -> status.value() == UNPROCESSABLE, response -> Mono.empty())
                .bodyToMono(JsonNode.class));

        if (body.hasNonNull("error")) {
            return ParseOutcome.failed(body.path("error").asText());
        }
        return ParseOutcome.parsed(toMetadata(productId, body));
    }

    /* ------------------------------------------------------------------ */

    private SdsMetadata toMetadata(final long productId, final JsonNode body) {
        return SdsMetadata.builder()
                .productId(productId)
                .vendor(text(body, "vendor"))
                .issueDate(dateNormalizer.toIso(text(body, "issue_date")).orElse(null))
                .hazardousSubstance(bool(body, "hazardous_substance"))
                .dangerousGood(bool(body, "dangerous_good"))
                .dangerousGoodsClass(FieldValidators.dangerousGoodsClass(text(body, "dangerous_goods_class"))
                        .filter(c -> !FieldValidators.isNotApplicable(c))
                        .orElse(null))
                .packingGroup(FieldValidators.packingGroup(text(body, "packing_group")).orElse(null))
                .subsidiaryRisks(text(body, "subsidiary_risks"))
                .description(text(body, "description"))
                .rawJson(body.has("raw_json") ? body.get("raw_json") : body)
                .build();
    }

    private JsonNode call(final String operation,
                          final Duration timeout,
                          final Supplier<Mono<JsonNode>> request)
            throws ExtractionUnavailableException {
        try {
            JsonNode body = breaker.executeSupplier(() -> request.get().block(timeout));
            if (body == null) {
                throw new ExtractionUnavailableException(operation + " returned no body");
            }
            return body;
        } catch (CallNotPermittedException ex) {
            throw new ExtractionUnavailableException("circuit breaker open for " + operation, ex);
        } catch (WebClientException | CodecException | IllegalStateException ex) {
            log.warn("Capability call {} failed: {}", operation, ex.getMessage());
            throw new ExtractionUnavailableException(operation + " failed: " + ex.getMessage(), ex);
        }
    }

    private static String text(final JsonNode node, final String field) {
        JsonNode v = node.get(field);
        return v == null || v.isNull() || v.asText().isBlank() ? null : v.asText();
    }

    private static Boolean bool(final JsonNode node, final String field) {
        JsonNode v = node.get(field);
        return v == null || v.isNull() ? null : v.asBoolean();
    }
}
