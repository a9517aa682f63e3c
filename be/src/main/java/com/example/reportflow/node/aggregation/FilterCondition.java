package com.example.reportflow.node.aggregation;

import com.example.reportflow.model.FieldValues;
import com.example.reportflow.model.InvoiceRecord;

import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One {@code {field, operator, value}} condition of a {@link FilterNode}.
 */
public record FilterCondition(String field, Operator operator, Object value) {

    public FilterCondition {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(operator, "operator");
    }

    /**
     * Parses a condition object; throws {@link IllegalArgumentException} when a part is missing
     * or the operator is not supported.
     */
    public static FilterCondition fromMap(Map<String, Object> source) {
        Object field = source.get("field");
        if (field == null || field.toString().isBlank()) {
            throw new IllegalArgumentException("Filter condition is missing 'field': " + source);
        }
        Object operator = source.get("operator");
        if (operator == null) {
            throw new IllegalArgumentException("Filter condition is missing 'operator': " + source);
        }
        return new FilterCondition(field.toString(), Operator.fromSymbol(operator.toString()), source.get("value"));
    }

    public boolean matches(InvoiceRecord record) {
        Object actual = record.field(field);
        if (actual == null) {
            return false;
        }
        if (operator == Operator.IN) {
            if (!(value instanceof Collection<?> options)) {
                throw new IllegalArgumentException("Operator 'in' needs a list value for field '" + field + "'");
            }
            return options.stream().anyMatch(option -> compare(actual, option).map(c -> c == 0).orElse(false));
        }
        return compare(actual, value).map(operator::accepts).orElse(false);
    }

    private static Optional<Integer> compare(Object actual, Object expected) {
        return FieldValues.compareWithOperand(actual, expected);
    }

    public enum Operator {
        EQ("="),
        NE("!="),
        GT(">"),
        LT("<"),
        GE(">="),
        LE("<="),
        IN("in");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public static Operator fromSymbol(String symbol) {
            String normalized = symbol.trim().toLowerCase();
            if ("==".equals(normalized)) {
                return EQ;
            }
            for (Operator operator : values()) {
                if (operator.symbol.equals(normalized)) {
                    return operator;
                }
            }
            throw new IllegalArgumentException("Unsupported filter operator: " + symbol);
        }

        boolean accepts(int comparison) {
            return switch (this) {
                case EQ -> comparison == 0;
                case NE -> comparison != 0;
                case GT -> comparison > 0;
                case LT -> comparison < 0;
                case GE -> comparison >= 0;
                case LE -> comparison <= 0;
                case IN -> throw new IllegalStateException("'in' is not a comparison");
            };
        }
    }
}
