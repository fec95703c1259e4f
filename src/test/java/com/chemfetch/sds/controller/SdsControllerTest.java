package com.chemfetch.sds.controller;

import com.chemfetch.sds.coordinator.AutoParseCoordinator;
import com.chemfetch.sds.coordinator.BatchStats;
import com.chemfetch.sds.coordinator.ExtractResult;
import com.chemfetch.sds.coordinator.ParseStatus;
import com.chemfetch.sds.coordinator.ProductNotFoundException;
import com.chemfetch.sds.coordinator.TriggerResult;
import com.chemfetch.sds.discovery.BarcodeLookupService;
import com.chemfetch.sds.discovery.ProductInfo;
import com.chemfetch.sds.discovery.ResolutionResult;
import com.chemfetch.sds.discovery.SdsResolver;
import com.chemfetch.sds.persistence.SdsMetadata;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = {
        "extraction.ocr.enabled=false",
        "search.backends.google.api-key="
})
@AutoConfigureMockMvc
class SdsControllerTest {

    private static final String SHEET = "https://acme.example.org/sds/whiteboard-cleaner.pdf";

    @Autowired
    MockMvc mvc;

    @MockBean
    SdsResolver resolver;

    @MockBean
    BarcodeLookupService barcodeLookup;

    @MockBean
    AutoParseCoordinator coordinator;

    @Test
    void resolveAttachesUrlAndTriggersParse() throws Exception {
        when(resolver.resolve("Whiteboard Cleaner", "500 mL"))
                .thenReturn(new ResolutionResult(SHEET, true, List.of(SHEET)));
        when(coordinator.trigger(7L, false, null))
                .thenReturn(new TriggerResult(true, ParseStatus.PENDING_PARSE, "scheduled"));

        mvc.perform(post("/api/sds/resolve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Whiteboard Cleaner\",\"size\":\"500 mL\",\"productId\":7}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sdsUrl").value(SHEET))
                .andExpect(jsonPath("$.verified").value(true))
                .andExpect(jsonPath("$.candidateLinksTried[0]").value(SHEET));

        verify(coordinator).attachSdsUrl(7L, SHEET);
        verify(coordinator).trigger(7L, false, null);
    }

    @Test
    void resolveWithoutMatchTouchesNoProduct() throws Exception {
        when(resolver.resolve("Mystery Fluid", null)).thenReturn(ResolutionResult.notFound(List.of()));

        mvc.perform(post("/api/sds/resolve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Mystery Fluid\",\"productId\":7}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sdsUrl").doesNotExist());

        verify(coordinator, never()).attachSdsUrl(anyLong(), any());
    }

    @Test
    void resolveRequiresName() throws Exception {
        mvc.perform(post("/api/sds/resolve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"size\":\"1 L\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid request fields: name"));
    }

    @Test
    void barcodeLookup() throws Exception {
        when(barcodeLookup.lookupAndRecord("9300000000012")).thenReturn(
                new ProductInfo("https://shop.example.org/p/1", "Whiteboard Cleaner", "500 mL", null));

        mvc.perform(post("/api/sds/barcode")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"barcode\":\"9300000000012\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("Whiteboard Cleaner"))
                .andExpect(jsonPath("$.size").value("500 mL"));
    }

    @Test
    void extractReturnsStoredRecordInSnakeCase() throws Exception {
        SdsMetadata md = SdsMetadata.builder()
                .productId(7L)
                .vendor("Acme Chemicals Pty Ltd")
                .dangerousGoodsClass("3")
                .packingGroup("II")
                .build();
        when(coordinator.extract(7L, SHEET, true)).thenReturn(new ExtractResult(true, md, null));

        mvc.perform(post("/api/sds/extract")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"productId\":7,\"sdsUrl\":\"" + SHEET + "\",\"force\":true}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.metadata.dangerous_goods_class").value("3"))
                .andExpect(jsonPath("$.metadata.packing_group").value("II"))
                .andExpect(jsonPath("$.metadata.placeholder").doesNotExist());
    }

    @Test
    void triggerPassesDelay() throws Exception {
        when(coordinator.trigger(eq(7L), eq(false), eq(Duration.ofMillis(250))))
                .thenReturn(new TriggerResult(true, ParseStatus.PENDING_PARSE, "scheduled"));

        mvc.perform(post("/api/sds/trigger")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"productId\":7,\"delayMs\":250}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.message").value("scheduled"))
                .andExpect(jsonPath("$.status").value("pending_parse"));
    }

    @Test
    void triggerRejectsNegativeDelay() throws Exception {
        mvc.perform(post("/api/sds/trigger")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"productId\":7,\"delayMs\":-1}"))
                .andExpect(status().isBadRequest());

        verify(coordinator, never()).trigger(anyLong(), anyBoolean(), any());
    }

    @Test
    void statusOfUnknownProductIs404() throws Exception {
        when(coordinator.status(99L)).thenThrow(new ProductNotFoundException(99L));

        mvc.perform(get("/api/sds/status/99"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").exists());
    }

    @Test
    void statusShowsCoarseState() throws Exception {
        when(coordinator.status(7L)).thenReturn(ParseStatus.PARSE_FAILED_BASIC);

        mvc.perform(get("/api/sds/status/7"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("parse_failed_basic"))
                .andExpect(jsonPath("$.state").value("unavailable"));
    }

    @Test
    void batchEndpoints() throws Exception {
        when(coordinator.runBatch()).thenReturn(3);
        when(coordinator.batchStats()).thenReturn(new BatchStats(10, 7, 3, 70.0));

        mvc.perform(post("/api/sds/batch"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.pendingCount").value(3));
        mvc.perform(get("/api/sds/batch/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalWithSds").value(10))
                .andExpect(jsonPath("$.processingRate").value(70.0));
    }
}
