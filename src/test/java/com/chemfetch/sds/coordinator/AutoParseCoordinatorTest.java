package com.chemfetch.sds.coordinator;

import com.chemfetch.sds.capability.CapabilityHealth;
import com.chemfetch.sds.capability.ExtractionCapability;
import com.chemfetch.sds.capability.ExtractionUnavailableException;
import com.chemfetch.sds.capability.ParseOutcome;
import com.chemfetch.sds.capability.VerificationOutcome;
import com.chemfetch.sds.config.AutoParseProperties;
import com.chemfetch.sds.config.JacksonScraperConfig;
import com.chemfetch.sds.persistence.InventoryHazardFields;
import com.chemfetch.sds.persistence.Product;
import com.chemfetch.sds.persistence.SdsMetadata;
import com.chemfetch.sds.persistence.memory.InMemoryInventoryRepository;
import com.chemfetch.sds.persistence.memory.InMemoryProductRepository;
import com.chemfetch.sds.persistence.memory.InMemorySdsMetadataRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class AutoParseCoordinatorTest {

    private static final String PDF = "https://acme.example.org/sds/whiteboard-cleaner.pdf";

    private final ObjectMapper mapper = new JacksonScraperConfig().scraperObjectMapper();

    private InMemoryProductRepository products;

    private InMemorySdsMetadataRepository metadata;

    private InMemoryInventoryRepository inventory;

    private ExtractionCapability capability;

    private AutoParseProperties props;

    private AutoParseCoordinator coordinator;

    @BeforeEach
    void setUp() throws Exception {
        products = new InMemoryProductRepository();
        metadata = spy(new InMemorySdsMetadataRepository());
        inventory = new InMemoryInventoryRepository();
        capability = mock(ExtractionCapability.class);
        when(capability.health()).thenReturn(CapabilityHealth.ok(false));

        props = new AutoParseProperties();
        props.setHealthTimeout(Duration.ofMillis(500));
        props.setRunTimeout(Duration.ofSeconds(2));
        props.setBatchDelay(Duration.ofMillis(10));

        coordinator = new AutoParseCoordinator(products, metadata, inventory, capability, props, mapper,
                Clock.fixed(Instant.parse("2025-06-30T00:00:00Z"), ZoneOffset.UTC));

        products.save(Product.builder().id(1L).name("Whiteboard Cleaner").sdsUrl(PDF).build());
        products.save(Product.builder().id(2L).name("Glass Cleaner").build());
    }

    @Test
    void triggerWithoutSdsUrlSchedulesNothing() {
        TriggerResult result = coordinator.trigger(2L, false, null);

        assertThat(result.scheduled()).isFalse();
        assertThat(result.message()).isEqualTo("no_sds_url");
        assertThat(result.status()).isEqualTo(ParseStatus.NO_SDS_URL);
        verifyNoInteractions(capability);
    }

    @Test
    void triggerOnParsedProductWithoutForceIsIgnored() {
        metadata.upsert(full(1L));
        clearInvocations(metadata);

        TriggerResult result = coordinator.trigger(1L, false, Duration.ZERO);

        assertThat(result.scheduled()).isFalse();
        assertThat(result.message()).isEqualTo("already_parsed");
        assertThat(result.status()).isEqualTo(ParseStatus.PARSED);
        verifyNoInteractions(capability);
        verify(metadata, times(0)).upsert(any());
    }

    @Test
    void triggerRunsInBackgroundAndStoresRecord() throws Exception {
        when(capability.parse(1L, PDF)).thenReturn(ParseOutcome.parsed(full(1L)));

        TriggerResult result = coordinator.trigger(1L, false, Duration.ofMillis(20));

        assertThat(result.scheduled()).isTrue();
        assertThat(result.message()).isEqualTo("scheduled");
        verify(metadata, timeout(3000)).upsert(any());
        awaitInventory(1L);
        assertThat(inventory.hazardFields(1L)).hasValueSatisfying(f -> {
            assertThat(f.sdsAvailable()).isTrue();
            assertThat(f.dangerousGoodsClass()).isEqualTo("3");
        });
    }

    @Test
    void forcedExtractReparsesAndUpsertsOnce() throws Exception {
        metadata.upsert(SdsMetadata.builder().productId(1L).vendor("Old Vendor").build());
        clearInvocations(metadata);
        when(capability.parse(1L, PDF)).thenReturn(ParseOutcome.parsed(full(1L)));

        ExtractResult result = coordinator.extract(1L, null, true);

        assertThat(result.success()).isTrue();
        assertThat(result.metadata().getVendor()).isEqualTo("Acme Chemicals Pty Ltd");
        verify(capability, times(1)).parse(1L, PDF);
        verify(metadata, times(1)).upsert(any());
        assertThat(coordinator.status(1L)).isEqualTo(ParseStatus.PARSED);
    }

    @Test
    void extractWithoutForceReturnsStoredRecord() throws Exception {
        metadata.upsert(full(1L));

        ExtractResult result = coordinator.extract(1L, null, false);

        assertThat(result.success()).isTrue();
        verify(capability, times(0)).parse(anyLong(), anyString());
    }

    @Test
    void extractAttachesNewSdsUrlFirst() throws Exception {
        String url = "https://glass.example.org/glass-cleaner-sds.pdf";
        when(capability.verify(url, "Glass Cleaner", true)).thenReturn(new VerificationOutcome(true, "trusted source", ""));
        when(capability.parse(2L, url)).thenReturn(ParseOutcome.parsed(full(2L)));

        ExtractResult result = coordinator.extract(2L, url, false);

        assertThat(result.success()).isTrue();
        assertThat(products.findById(2L)).hasValueSatisfying(p -> assertThat(p.getSdsUrl()).isEqualTo(url));
        verify(capability).verify(url, "Glass Cleaner", true);
    }

    @Test
    void rejectedSuppliedUrlIsNotStored() throws Exception {
        String url = "https://shop.example.org/brochure.pdf";
        when(capability.verify(url, "Glass Cleaner", true))
                .thenReturn(new VerificationOutcome(false, "no safety-document vocabulary", ""));

        ExtractResult result = coordinator.extract(2L, url, false);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("SDS not verified: no safety-document vocabulary");
        assertThat(products.findById(2L).orElseThrow().getSdsUrl()).isNull();
        verify(capability, times(0)).parse(anyLong(), anyString());
        assertThat(metadata.findByProductId(2L)).isEmpty();
    }

    @Test
    void suppliedUrlIsKeptWhenVerificationIsUnavailable() throws Exception {
        String url = "https://glass.example.org/4411.pdf";
        when(capability.verify(url, "Glass Cleaner", true)).thenThrow(new ExtractionUnavailableException("connection refused"));
        when(capability.parse(2L, url)).thenReturn(ParseOutcome.parsed(full(2L)));

        ExtractResult result = coordinator.extract(2L, url, false);

        assertThat(result.success()).isTrue();
        assertThat(products.findById(2L).orElseThrow().getSdsUrl()).isEqualTo(url);
    }

    @Test
    void storedUrlIsNotVerifiedAgain() throws Exception {
        when(capability.parse(1L, PDF)).thenReturn(ParseOutcome.parsed(full(1L)));

        ExtractResult result = coordinator.extract(1L, PDF, false);

        assertThat(result.success()).isTrue();
        verify(capability, times(0)).verify(anyString(), anyString(), anyBoolean());
    }

    @Test
    void unhealthyCapabilityWritesPlaceholder() throws Exception {
        when(capability.health()).thenThrow(new ExtractionUnavailableException("connection refused"));

        ExtractResult result = coordinator.extract(1L, null, false);

        assertThat(result.success()).isFalse();
        SdsMetadata stored = metadata.findByProductId(1L).orElseThrow();
        assertPlaceholder(stored, SdsMetadata.EXTRACTION_UNAVAILABLE);
        assertThat(stored.getRawJson().path("fallback_reason").asText()).contains("connection refused");
        assertThat(coordinator.status(1L)).isEqualTo(ParseStatus.PARSE_FAILED_BASIC);
        assertThat(coordinator.status(1L).state()).isEqualTo("unavailable");
        verify(capability, times(0)).parse(anyLong(), anyString());
        assertThat(inventory.hazardFields(1L)).hasValue(
                new InventoryHazardFields(true, null, null, null, null, null, null));
    }

    @Test
    void unreadableDocumentWritesNoTextPlaceholder() throws Exception {
        when(capability.parse(1L, PDF)).thenReturn(ParseOutcome.failed("no text could be extracted"));

        ExtractResult result = coordinator.extract(1L, null, false);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("no text could be extracted");
        assertPlaceholder(result.metadata(), SdsMetadata.NO_TEXT_EXTRACTED);
    }

    @Test
    void slowParseTimesOutToPlaceholderAndLateResultIsDropped() throws Exception {
        props.setRunTimeout(Duration.ofMillis(200));
        CountDownLatch release = new CountDownLatch(1);
        when(capability.parse(eq(1L), anyString())).thenAnswer(inv -> {
            release.await(2, TimeUnit.SECONDS);
            return ParseOutcome.parsed(full(1L));
        });

        ExtractResult result = coordinator.extract(1L, null, false);
        release.countDown();

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("timed out");
        assertPlaceholder(result.metadata(), SdsMetadata.EXTRACTION_UNAVAILABLE);

        TimeUnit.MILLISECONDS.sleep(300);
        verify(metadata, times(1)).upsert(any());
        assertThat(metadata.findByProductId(1L).orElseThrow().isPlaceholder()).isTrue();
    }

    @Test
    void runBatchParsesOnlyProductsWithoutMetadata() throws Exception {
        products.save(Product.builder().id(3L).name("Degreaser").sdsUrl("https://x.example.org/d.pdf").build());
        products.save(Product.builder().id(4L).name("Bleach").sdsUrl("https://x.example.org/b.pdf").build());
        metadata.upsert(full(4L));
        clearInvocations(metadata);
        when(capability.parse(anyLong(), anyString()))
                .thenAnswer(inv -> ParseOutcome.parsed(full(inv.<Long>getArgument(0))));

        int queued = coordinator.runBatch();

        assertThat(queued).isEqualTo(2);
        verify(metadata, timeout(3000).times(2)).upsert(any());
        verify(capability, times(0)).parse(eq(4L), anyString());
        awaitInventory(1L, 3L);
        assertThat(coordinator.batchStats()).isEqualTo(new BatchStats(3, 3, 0, 100.0));
    }

    @Test
    void batchContinuesAfterAProductCannotBeStored() throws Exception {
        products.save(Product.builder().id(3L).name("Degreaser").sdsUrl("https://x.example.org/d.pdf").build());
        products.save(Product.builder().id(5L).name("Bleach").sdsUrl("https://x.example.org/b.pdf").build());
        doThrow(new IllegalStateException("db hiccup"))
                .when(metadata).upsert(argThat((SdsMetadata m) -> m.getProductId() == 1L));
        when(capability.parse(anyLong(), anyString()))
                .thenAnswer(inv -> ParseOutcome.parsed(full(inv.<Long>getArgument(0))));

        int queued = coordinator.runBatch();

        assertThat(queued).isEqualTo(3);
        awaitInventory(3L, 5L);
        assertThat(metadata.findByProductId(3L)).hasValueSatisfying(m -> assertThat(m.isPlaceholder()).isFalse());
        assertThat(metadata.findByProductId(5L)).hasValueSatisfying(m -> assertThat(m.isPlaceholder()).isFalse());
        assertThat(metadata.findByProductId(1L)).isEmpty();
    }

    @Test
    void recordThatCannotBeStoredFallsBackToPlaceholder() throws Exception {
        doThrow(new IllegalStateException("db hiccup"))
                .when(metadata).upsert(argThat((SdsMetadata m) -> m.getVendor() != null));
        when(capability.parse(1L, PDF)).thenReturn(ParseOutcome.parsed(full(1L)));

        ExtractResult result = coordinator.extract(1L, null, false);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("store failed: db hiccup");
        assertPlaceholder(metadata.findByProductId(1L).orElseThrow(), SdsMetadata.EXTRACTION_UNAVAILABLE);
        assertThat(coordinator.status(1L)).isEqualTo(ParseStatus.PARSE_FAILED_BASIC);
    }

    @Test
    void batchStatsCountsProductsWithSdsUrl() {
        products.save(Product.builder().id(3L).name("Degreaser").sdsUrl("https://x.example.org/d.pdf").build());
        products.save(Product.builder().id(4L).name("Bleach").sdsUrl("https://x.example.org/b.pdf").build());
        metadata.upsert(full(3L));

        BatchStats stats = coordinator.batchStats();

        assertThat(stats.totalWithSds()).isEqualTo(3);
        assertThat(stats.totalWithMetadata()).isEqualTo(1);
        assertThat(stats.pending()).isEqualTo(2);
        assertThat(stats.processingRate()).isEqualTo(33.3);
    }

    @Test
    void unknownProductIsRejected() {
        assertThatThrownBy(() -> coordinator.trigger(99L, false, null))
                .isInstanceOf(ProductNotFoundException.class);
    }

    /** Hazard fields are mirrored right after the upsert; wait for the run thread to get there. */
    private void awaitInventory(final long... productIds) throws InterruptedException {
        for (int i = 0; i < 300; i++) {
            boolean all = true;
            for (long id : productIds) {
                all &= inventory.hazardFields(id).isPresent();
            }
            if (all) {
                return;
            }
            TimeUnit.MILLISECONDS.sleep(10);
        }
    }

    private static void assertPlaceholder(final SdsMetadata record, final String provenance) {
        assertThat(record.isPlaceholder()).isTrue();
        assertThat(record.getRawJson().path(SdsMetadata.PROVENANCE).asText()).isEqualTo(provenance);
        assertThat(record.getRawJson().path("note").asText()).isEqualTo(AutoParseCoordinator.PLACEHOLDER_NOTE);
        assertThat(record.getVendor()).isNull();
        assertThat(record.getIssueDate()).isNull();
        assertThat(record.getHazardousSubstance()).isNull();
        assertThat(record.getDangerousGood()).isNull();
        assertThat(record.getDangerousGoodsClass()).isNull();
        assertThat(record.getPackingGroup()).isNull();
        assertThat(record.getSubsidiaryRisks()).isNull();
    }

    private SdsMetadata full(final long productId) {
        return SdsMetadata.builder()
                .productId(productId)
                .vendor("Acme Chemicals Pty Ltd")
                .issueDate("2024-03-15")
                .hazardousSubstance(true)
                .dangerousGood(true)
                .dangerousGoodsClass("3")
                .packingGroup("II")
                .description("Whiteboard Cleaner")
                .rawJson(mapper.createObjectNode().put("sds_url", PDF))
                .build();
    }
}
