package com.chemfetch.sds.controller;

import com.chemfetch.sds.capability.CapabilityHealth;
import com.chemfetch.sds.capability.ExtractionCapability;
import com.chemfetch.sds.capability.ExtractionUnavailableException;
import com.chemfetch.sds.capability.ParseOutcome;
import com.chemfetch.sds.capability.VerificationOutcome;
import com.chemfetch.sds.dto.ParseSdsRequest;
import com.chemfetch.sds.dto.VerifySdsRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Exposes the {@link ExtractionCapability} over HTTP under
 * <code>/capability</code>, in the shape {@code RemoteExtractionCapability}
 * consumes, so one deployment can serve another.
 */
@RestController
@RequestMapping(path = "/capability", produces = MediaType.APPLICATION_JSON_VALUE)
@RequiredArgsConstructor
public class CapabilityController {

    private final ExtractionCapability capability;

    @GetMapping("/health")
    public CapabilityHealth health() throws ExtractionUnavailableException {
        return capability.health();
    }

    @PostMapping(path = "/verify-sds", consumes = MediaType.APPLICATION_JSON_VALUE)
    public VerificationOutcome verify(@RequestBody @Validated final VerifySdsRequest request)
            throws ExtractionUnavailableException {
        return capability.verify(request.url(), request.name(), request.trustedOrDefault());
    }

    /**
     * @param request product id and document URL
     * @return the record in its persisted shape, or {@code {"error": ...}}
     *         with status 422 when the document yielded no text
     * @throws ExtractionUnavailableException when a remote capability is unreachable
     */
    @PostMapping(path = "/parse-sds", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> parse(@RequestBody @Validated final ParseSdsRequest request)
            throws ExtractionUnavailableException {
        ParseOutcome outcome = capability.parse(request.productId(), request.pdfUrl());
        if (outcome.succeeded()) {
            return ResponseEntity.ok(outcome.metadata());
        }
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(Map.of("error", outcome.failureReason()));
    }
}
