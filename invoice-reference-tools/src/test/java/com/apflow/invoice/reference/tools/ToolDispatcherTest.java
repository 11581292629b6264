package com.apflow.invoice.reference.tools;

import com.apflow.invoice.reference.data.ReferenceDataStore;
import com.apflow.invoice.reference.ledger.IdempotencyRegistry;
import com.apflow.invoice.reference.ledger.InvoiceLedgerService;
import com.apflow.invoice.tools.ToolNames;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ToolDispatcherTest {

    private ToolDispatcher dispatcher;

    @BeforeEach
    public void setUp() {
        ReferenceDataStore store = new ReferenceDataStore();
        dispatcher = new ToolDispatcher(
            new ReferenceToolService(store, new InvoiceLedgerService(store, new IdempotencyRegistry())));
    }

    @Test
    public void testDispatchesCheckAndRendersJson() {
        String json = dispatcher.dispatch(ToolNames.VALIDATE_PURCHASE_ORDER, "{\"reference\":\"PO-2025-005\"}");

        assertTrue(json.contains("\"status\":\"MISMATCH\""));
        assertTrue(json.contains("status is 'closed'"));
    }

    @Test
    public void testCreateRecordRoundTrip() {
        String request = "{\"idempotencyKey\":\"invoice-run:r1\",\"invoice\":{"
            + "\"invoiceNumber\":\"FV-100\",\"supplierName\":\"LogiServ Europe SA\","
            + "\"taxId\":\"FR31456789012\",\"purchaseOrderRef\":\"PO-2025-003\","
            + "\"invoiceDate\":\"2025-02-20\",\"totalAmount\":3600.00}}";

        String created = dispatcher.dispatch(ToolNames.CREATE_INVOICE_RECORD, request);
        String replayed = dispatcher.dispatch(ToolNames.CREATE_INVOICE_RECORD, request);

        assertTrue(created.contains("\"status\":\"CREATED\""));
        assertTrue(replayed.contains("\"status\":\"DUPLICATE\""));
    }

    @Test
    public void testUnknownTool() {
        assertThrows(UnknownToolException.class, () -> dispatcher.dispatch("drop_tables", "{}"));
    }

    @Test
    public void testMissingArgumentIsRejected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> dispatcher.dispatch(ToolNames.VALIDATE_TAX_ID, "{\"supplierName\":\"TechnoVision SAS\"}"));
        assertEquals("Missing required argument: taxId", e.getMessage());
    }

    @Test
    public void testUnknownArgumentIsRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> dispatcher.dispatch(ToolNames.VALIDATE_NATIONAL_ID, "{\"nationalId\":\"1\",\"extra\":true}"));
    }

    @Test
    public void testMalformedJsonIsRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> dispatcher.dispatch(ToolNames.LOOKUP_SUPPLIER, "{\"name\":"));
    }
}
