package com.chemfetch.sds.controller;

import com.chemfetch.sds.coordinator.AutoParseCoordinator;
import com.chemfetch.sds.coordinator.BatchStats;
import com.chemfetch.sds.coordinator.ExtractResult;
import com.chemfetch.sds.coordinator.TriggerResult;
import com.chemfetch.sds.discovery.BarcodeLookupService;
import com.chemfetch.sds.discovery.ProductInfo;
import com.chemfetch.sds.discovery.ResolutionResult;
import com.chemfetch.sds.discovery.SdsResolver;
import com.chemfetch.sds.dto.BarcodeRequest;
import com.chemfetch.sds.dto.BatchResponse;
import com.chemfetch.sds.dto.ExtractRequest;
import com.chemfetch.sds.dto.ResolveRequest;
import com.chemfetch.sds.dto.StatusResponse;
import com.chemfetch.sds.dto.TriggerRequest;
import com.chemfetch.sds.dto.TriggerResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;

/**
 * REST controller for SDS discovery and parsing.
 * <p>
 * Endpoints under <code>/api/sds</code>:
 * </p>
 * <ul>
 *   <li><code>POST /resolve</code>: find the SDS of a product by name and size</li>
 *   <li><code>POST /barcode</code>: identify a product from its barcode</li>
 *   <li><code>POST /extract</code>: parse a product's SDS and wait for the result</li>
 *   <li><code>POST /trigger</code>: schedule a background parse</li>
 *   <li><code>GET  /status/{productId}</code>: parse state of a product</li>
 *   <li><code>POST /batch</code>, <code>GET /batch/status</code>: parse every unparsed product</li>
 * </ul>
 *
 * <h3>Example Request</h3>
 * <pre>{@code
 * POST /api/sds/resolve
 * Content-Type: application/json
 *
 * { "name": "Whiteboard Cleaner", "size": "500mL" }
 * }</pre>
 *
 * <h3>Example Response</h3>
 * <pre>{@code
 * {
 *   "sdsUrl": "https://example-supplier.com.au/sds/whiteboard-cleaner.pdf",
 *   "verified": true,
 *   "candidateLinksTried": [ "..." ]
 * }
 * }</pre>
 */
@Slf4j
@RestController
@RequestMapping(path = "/api/sds", produces = MediaType.APPLICATION_JSON_VALUE)
@RequiredArgsConstructor
public class SdsController {

    private final SdsResolver resolver;

    private final BarcodeLookupService barcodeLookup;

    private final AutoParseCoordinator coordinator;

    /**
     * Resolves the SDS URL of a product. When a product id is given and a
     * document was found, the URL is stored and a parse is scheduled.
     *
     * @param request name, optional size and product id
     * @return the resolution
     */
    @PostMapping(path = "/resolve", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResolutionResult resolve(@RequestBody @Validated final ResolveRequest request) {
        ResolutionResult result = resolver.resolve(request.name(), request.size());
        if (request.productId() != null && result.found()) {
            coordinator.attachSdsUrl(request.productId(), result.sdsUrl());
            TriggerResult trigger = coordinator.trigger(request.productId(), false, null);
            log.debug("Auto-parse after resolve of product {}: {}", request.productId(), trigger.message());
        }
        return result;
    }

    @PostMapping(path = "/barcode", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ProductInfo barcode(@RequestBody @Validated final BarcodeRequest request) {
        return barcodeLookup.lookupAndRecord(request.barcode());
    }

    @PostMapping(path = "/extract", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ExtractResult extract(@RequestBody @Validated final ExtractRequest request) {
        return coordinator.extract(request.productId(), request.sdsUrl(), request.forceOrDefault());
    }

    @PostMapping(path = "/trigger", consumes = MediaType.APPLICATION_JSON_VALUE)
    public TriggerResponse trigger(@RequestBody @Validated final TriggerRequest request) {
        Duration delay = request.delayMs() == null ? null : Duration.ofMillis(request.delayMs());
        TriggerResult result = coordinator.trigger(request.productId(), request.forceOrDefault(), delay);
        return new TriggerResponse(result.scheduled(), result.message(), result.status());
    }

    @GetMapping("/status/{productId}")
    public StatusResponse status(@PathVariable final long productId) {
        return StatusResponse.of(productId, coordinator.status(productId));
    }

    @PostMapping("/batch")
    public BatchResponse batch() {
        return new BatchResponse(true, coordinator.runBatch());
    }

    @GetMapping("/batch/status")
    public BatchStats batchStatus() {
        return coordinator.batchStats();
    }
}
