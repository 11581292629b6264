package com.apflow.invoice.orchestrator.api;

import com.apflow.invoice.canonical.ExtractedField;
import com.apflow.invoice.canonical.ExtractedInvoice;
import com.apflow.invoice.orchestrator.InProcessTools;
import com.apflow.invoice.orchestrator.TestInvoices;
import com.apflow.invoice.orchestrator.client.ToolTransport;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * HTTP surface of the orchestrator, wired to in-process reference tools in mock mode.
 */
@SpringBootTest(properties = {
    "pipeline.mock.mode=true",
    "pipeline.retry.initial-backoff-ms=10"
})
@AutoConfigureMockMvc
public class PipelineRunControllerTest {

    @TestConfiguration
    static class InProcessToolsConfig {
        @Bean
        @Primary
        public ToolTransport inProcessToolTransport() {
            return new InProcessTools();
        }
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private String json(ExtractedInvoice invoice) throws Exception {
        return objectMapper.writeValueAsString(invoice);
    }

    @Test
    public void testSubmitAndWaitProceeds() throws Exception {
        mockMvc.perform(post("/api/invoice-runs").param("wait", "true")
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(TestInvoices.technoVision("api-proceed", "FV-API-001"))))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.runId").value("api-proceed"))
            .andExpect(jsonPath("$.state").value("COMPLETED"))
            .andExpect(jsonPath("$.finalOutcome").value("PROCEED"))
            .andExpect(jsonPath("$.createdRecordId", startsWith("ERP-INV-")));

        mockMvc.perform(get("/api/invoice-runs/api-proceed"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.state").value("COMPLETED"));
    }

    @Test
    public void testRejectedRunIsNotified() throws Exception {
        ExtractedInvoice invoice = TestInvoices.technoVision("api-reject", "FV-API-002").toBuilder()
            .purchaseOrderRef(ExtractedField.of("PO-2025-999", 0.95))
            .taxId(ExtractedField.of("FR00000000000", 0.95))
            .build();

        mockMvc.perform(post("/api/invoice-runs").param("wait", "true")
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(invoice)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.finalOutcome").value("REJECT"))
            .andExpect(jsonPath("$.report.type").value("REJECTION"));

        mockMvc.perform(get("/api/notifications").param("runId", "api-reject"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].outcome").value("REJECT"));
    }

    @Test
    public void testSubmitIsAccepted() throws Exception {
        mockMvc.perform(post("/api/invoice-runs")
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(TestInvoices.technoVision("api-async", "FV-API-003"))))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.runId").value("api-async"))
            .andExpect(jsonPath("$.attempt").value(1));
    }

    @Test
    public void testMalformedBodyIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/invoice-runs")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"supplierName\": "))
            .andExpect(status().isBadRequest());
    }

    @Test
    public void testUnknownRunIsNotFound() throws Exception {
        mockMvc.perform(get("/api/invoice-runs/no-such-run"))
            .andExpect(status().isNotFound());
        mockMvc.perform(post("/api/invoice-runs/no-such-run/cancel"))
            .andExpect(status().isNotFound());
    }

    @Test
    public void testCompletedRunCannotBeCancelled() throws Exception {
        mockMvc.perform(post("/api/invoice-runs").param("wait", "true")
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(TestInvoices.technoVision("api-done", "FV-API-004"))))
            .andExpect(status().isOk());

        mockMvc.perform(post("/api/invoice-runs/api-done/cancel"))
            .andExpect(status().isConflict());
        mockMvc.perform(get("/api/invoice-runs/api-done/attempts"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].state").value("COMPLETED"));
    }
}
