package com.example.reportflow.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

@DisplayName("InvoiceRecord")
class InvoiceRecordTest {

    @Nested
    @DisplayName("fromMap")
    class FromMap {

        @Test
        @DisplayName("reads canonical field names")
        void readsCanonicalFields() {
            InvoiceRecord record = InvoiceRecord.fromMap(Map.of(
                    "id", "r1",
                    "invoice_number", "INV-1",
                    "counterparty", "Acme",
                    "invoice_date", "2025-01-01",
                    "due_date", "2025-01-31",
                    "total_amount", 1000,
                    "paid_amount", "250.50",
                    "tax_amount", 180
            ));

            assertEquals("r1", record.id());
            assertEquals("INV-1", record.invoiceNumber());
            assertEquals("Acme", record.counterparty());
            assertEquals(LocalDate.of(2025, 1, 1), record.invoiceDate());
            assertEquals(LocalDate.of(2025, 1, 31), record.dueDate());
            assertEquals(0, new BigDecimal("1000").compareTo(record.totalAmount()));
            assertEquals(0, new BigDecimal("250.50").compareTo(record.paidAmount()));
            assertEquals(0, new BigDecimal("180").compareTo(record.taxAmount()));
            assertThat(record.extensions()).isEmpty();
        }

        @Test
        @DisplayName("accepts alternative field names")
        void acceptsAliases() {
            InvoiceRecord record = InvoiceRecord.fromMap(Map.of(
                    "document_number", "D-7",
                    "vendor_name", "Globex",
                    "document_date", "2024-12-01",
                    "grand_total", 500,
                    "received_amount", 100,
                    "tax_total", 90
            ));

            assertEquals("D-7", record.invoiceNumber());
            assertEquals("Globex", record.counterparty());
            assertEquals(LocalDate.of(2024, 12, 1), record.invoiceDate());
            assertEquals(0, new BigDecimal("500").compareTo(record.totalAmount()));
            assertEquals(0, new BigDecimal("100").compareTo(record.paidAmount()));
            assertEquals(0, new BigDecimal("90").compareTo(record.taxAmount()));
        }

        @Test
        @DisplayName("keeps unknown keys as extensions")
        void keepsUnknownKeys() {
            InvoiceRecord record = InvoiceRecord.fromMap(Map.of("total", 10, "currency", "INR", "branch", "North"));

            assertThat(record.extensions()).containsEntry("currency", "INR").containsEntry("branch", "North");
            assertEquals("INR", record.field("currency"));
        }

        @Test
        @DisplayName("keeps an unparseable date as raw value and leaves the typed field empty")
        void keepsUnparseableDate() {
            InvoiceRecord record = InvoiceRecord.fromMap(Map.of("invoice_date", "not a date"));

            assertNull(record.invoiceDate());
            assertEquals("not a date", record.extensions().get("invoice_date"));
        }

        @Test
        @DisplayName("falls back to the next date name when the first one cannot be parsed")
        void fallsBackToNextDateAlias() {
            InvoiceRecord record = InvoiceRecord.fromMap(Map.of("invoice_date", "not a date", "document_date", "2025-01-15"));

            assertEquals(LocalDate.of(2025, 1, 15), record.invoiceDate());
            assertEquals("not a date", record.extensions().get("invoice_date"));
            assertThat(record.extensions()).doesNotContainKey("document_date");
        }

        @Test
        @DisplayName("reads outstanding_amount when outstanding is absent")
        void readsOutstandingAlias() {
            InvoiceRecord record = InvoiceRecord.fromMap(Map.of("outstanding_amount", 42));

            assertEquals(0, new BigDecimal("42").compareTo(record.outstanding()));
        }
    }

    @Nested
    @DisplayName("field and toMap")
    class FieldAccess {

        @Test
        @DisplayName("resolves aliases to typed values")
        void resolvesAliases() {
            InvoiceRecord record = InvoiceRecord.builder().totalAmount(new BigDecimal("12.50")).counterparty("Acme").build();

            assertEquals(new BigDecimal("12.50"), record.field("grand_total"));
            assertEquals("Acme", record.field("vendor_name"));
            assertNull(record.field("missing"));
            assertNull(record.field(null));
        }

        @Test
        @DisplayName("emits canonical keys with outstanding mirrored and labels for enums")
        void emitsCanonicalKeys() {
            Map<String, Object> source = new LinkedHashMap<>();
            source.put("invoice_number", "INV-9");
            source.put("note", "urgent");
            InvoiceRecord record = InvoiceRecord.fromMap(source).toBuilder()
                    .outstanding(new BigDecimal("5.00"))
                    .agingBucket(AgingBucket.OVER_90)
                    .slaSeverity(SlaSeverity.HIGH)
                    .build();

            Map<String, Object> map = record.toMap();

            assertEquals("INV-9", map.get("invoice_number"));
            assertEquals(new BigDecimal("5.00"), map.get("outstanding"));
            assertEquals(new BigDecimal("5.00"), map.get("outstanding_amount"));
            assertEquals("90+", map.get("aging_bucket"));
            assertEquals("High", map.get("sla_severity"));
            assertEquals("urgent", map.get("note"));
            assertThat(map).doesNotContainKey("due_date");
        }
    }
}
