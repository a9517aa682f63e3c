package com.example.reportflow.model;

import com.fasterxml.jackson.annotation.JsonValue;

import lombok.Builder;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One invoice-like entity flowing between nodes.
 * <p>
 * Well-known fields are typed so calculation nodes can rely on them; every other key of the
 * source data is kept in {@link #extensions()} and emitted unchanged. Instances are immutable:
 * nodes derive new records with {@link #toBuilder()}.
 * </p>
 */
@Builder(toBuilder = true)
public record InvoiceRecord(
        String id,
        String invoiceNumber,
        String counterparty,
        LocalDate invoiceDate,
        LocalDate dueDate,
        BigDecimal totalAmount,
        BigDecimal paidAmount,
        BigDecimal taxAmount,
        BigDecimal outstanding,
        BigDecimal grossAmount,
        String status,
        Integer agingDays,
        AgingBucket agingBucket,
        Integer overdueDays,
        LocalDate slaDeadline,
        Boolean slaBreach,
        Integer breachDays,
        SlaSeverity slaSeverity,
        Map<String, Object> extensions
) {

    public static final String ID = "id";
    public static final String INVOICE_NUMBER = "invoice_number";
    public static final String COUNTERPARTY = "counterparty";
    public static final String INVOICE_DATE = "invoice_date";
    public static final String DUE_DATE = "due_date";
    public static final String TOTAL_AMOUNT = "total_amount";
    public static final String PAID_AMOUNT = "paid_amount";
    public static final String TAX_AMOUNT = "tax_amount";
    public static final String OUTSTANDING = "outstanding";
    public static final String OUTSTANDING_AMOUNT = "outstanding_amount";
    public static final String GROSS_AMOUNT = "gross_amount";
    public static final String STATUS = "status";
    public static final String AGING_DAYS = "aging_days";
    public static final String AGING_BUCKET = "aging_bucket";
    public static final String OVERDUE_DAYS = "overdue_days";
    public static final String SLA_DEADLINE = "sla_deadline";
    public static final String SLA_BREACH = "sla_breach";
    public static final String BREACH_DAYS = "breach_days";
    public static final String SLA_SEVERITY = "sla_severity";

    private static final List<String> INVOICE_NUMBER_KEYS = List.of(INVOICE_NUMBER, "document_number");
    private static final List<String> COUNTERPARTY_KEYS = List.of(COUNTERPARTY, "vendor_name", "vendor_id", "customer_name", "customer_id");
    private static final List<String> INVOICE_DATE_KEYS = List.of(INVOICE_DATE, "document_date", "date");
    private static final List<String> TOTAL_KEYS = List.of(TOTAL_AMOUNT, "inr_amount", "grand_total", "total");
    private static final List<String> PAID_KEYS = List.of(PAID_AMOUNT, "received_amount", "paid");
    private static final List<String> TAX_KEYS = List.of(TAX_AMOUNT, "tax_total", "tax");

    /** Alternative source field names mapped to the canonical field they populate. */
    private static final Map<String, String> FIELD_ALIASES = aliases();

    public InvoiceRecord {
        extensions = extensions == null || extensions.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(extensions));
    }

    /**
     * Builds a record from an open key/value map, reading the well-known fields under any of
     * their accepted names. A date that cannot be parsed is skipped in favour of the next
     * accepted name and its raw value is kept under its original key.
     */
    public static InvoiceRecord fromMap(Map<String, ?> source) {
        Map<String, Object> rest = new LinkedHashMap<>(source);
        InvoiceRecordBuilder builder = builder()
                .id(text(rest.remove(ID)))
                .invoiceNumber(text(takeFirst(rest, INVOICE_NUMBER_KEYS)))
                .counterparty(text(takeFirst(rest, COUNTERPARTY_KEYS)))
                .invoiceDate(takeDate(rest, INVOICE_DATE_KEYS))
                .dueDate(takeDate(rest, List.of(DUE_DATE)))
                .totalAmount(Amounts.toDecimal(takeFirst(rest, TOTAL_KEYS)))
                .paidAmount(Amounts.toDecimal(takeFirst(rest, PAID_KEYS)))
                .taxAmount(Amounts.toDecimal(takeFirst(rest, TAX_KEYS)))
                .status(text(rest.remove(STATUS)));
        Object outstanding = rest.remove(OUTSTANDING);
        Object outstandingAmount = rest.remove(OUTSTANDING_AMOUNT);
        builder.outstanding(Amounts.toDecimal(outstanding != null ? outstanding : outstandingAmount));
        builder.grossAmount(Amounts.toDecimal(rest.remove(GROSS_AMOUNT)));
        return builder.extensions(rest).build();
    }

    /**
     * Value of a field by name: canonical names and their aliases resolve to the typed value,
     * anything else is looked up in the extensions.
     */
    public Object field(String name) {
        if (name == null) {
            return null;
        }
        String canonical = FIELD_ALIASES.getOrDefault(name, name);
        if (!canonical.equals(name) && extensions.containsKey(name)) {
            return extensions.get(name);
        }
        Object known = knownField(canonical);
        if (known != null) {
            return known;
        }
        return extensions.get(name);
    }

    /**
     * Flat view with canonical field names; {@code outstanding_amount} mirrors {@code outstanding}.
     */
    @JsonValue
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        putIfPresent(map, ID, id);
        putIfPresent(map, INVOICE_NUMBER, invoiceNumber);
        putIfPresent(map, COUNTERPARTY, counterparty);
        putIfPresent(map, INVOICE_DATE, invoiceDate);
        putIfPresent(map, DUE_DATE, dueDate);
        putIfPresent(map, TOTAL_AMOUNT, totalAmount);
        putIfPresent(map, PAID_AMOUNT, paidAmount);
        putIfPresent(map, TAX_AMOUNT, taxAmount);
        putIfPresent(map, OUTSTANDING, outstanding);
        putIfPresent(map, OUTSTANDING_AMOUNT, outstanding);
        putIfPresent(map, GROSS_AMOUNT, grossAmount);
        putIfPresent(map, STATUS, status);
        putIfPresent(map, AGING_DAYS, agingDays);
        putIfPresent(map, AGING_BUCKET, agingBucket != null ? agingBucket.label() : null);
        putIfPresent(map, OVERDUE_DAYS, overdueDays);
        putIfPresent(map, SLA_DEADLINE, slaDeadline);
        putIfPresent(map, SLA_BREACH, slaBreach);
        putIfPresent(map, BREACH_DAYS, breachDays);
        putIfPresent(map, SLA_SEVERITY, slaSeverity != null ? slaSeverity.label() : null);
        extensions.forEach(map::putIfAbsent);
        return map;
    }

    private Object knownField(String canonical) {
        return switch (canonical) {
            case ID -> id;
            case INVOICE_NUMBER -> invoiceNumber;
            case COUNTERPARTY -> counterparty;
            case INVOICE_DATE -> invoiceDate;
            case DUE_DATE -> dueDate;
            case TOTAL_AMOUNT -> totalAmount;
            case PAID_AMOUNT -> paidAmount;
            case TAX_AMOUNT -> taxAmount;
            case OUTSTANDING, OUTSTANDING_AMOUNT -> outstanding;
            case GROSS_AMOUNT -> grossAmount;
            case STATUS -> status;
            case AGING_DAYS -> agingDays;
            case AGING_BUCKET -> agingBucket != null ? agingBucket.label() : null;
            case OVERDUE_DAYS -> overdueDays;
            case SLA_DEADLINE -> slaDeadline;
            case SLA_BREACH -> slaBreach;
            case BREACH_DAYS -> breachDays;
            case SLA_SEVERITY -> slaSeverity != null ? slaSeverity.label() : null;
            default -> null;
        };
    }

    private static Map<String, String> aliases() {
        Map<String, String> aliases = new LinkedHashMap<>();
        INVOICE_NUMBER_KEYS.forEach(key -> aliases.put(key, INVOICE_NUMBER));
        COUNTERPARTY_KEYS.forEach(key -> aliases.put(key, COUNTERPARTY));
        INVOICE_DATE_KEYS.forEach(key -> aliases.put(key, INVOICE_DATE));
        TOTAL_KEYS.forEach(key -> aliases.put(key, TOTAL_AMOUNT));
        PAID_KEYS.forEach(key -> aliases.put(key, PAID_AMOUNT));
        TAX_KEYS.forEach(key -> aliases.put(key, TAX_AMOUNT));
        return Map.copyOf(aliases);
    }

    private static Object takeFirst(Map<String, Object> source, List<String> keys) {
        for (String key : keys) {
            Object value = source.get(key);
            if (value != null && !value.toString().isBlank()) {
                source.remove(key);
                return value;
            }
        }
        return null;
    }

    private static LocalDate takeDate(Map<String, Object> source, List<String> keys) {
        for (String key : keys) {
            Object value = source.get(key);
            if (value == null || value.toString().isBlank()) {
                continue;
            }
            LocalDate parsed = DateValues.parse(value).orElse(null);
            if (parsed != null) {
                source.remove(key);
                return parsed;
            }
        }
        return null;
    }

    private static String text(Object value) {
        if (value == null) {
            return null;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }

    private static void putIfPresent(Map<String, Object> map, String key, Object value) {
        if (value != null) {
            map.put(key, value);
        }
    }
}
