package com.example.reportflow.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Day-range classification of invoice age, in display order.
 */
public enum AgingBucket {

    CURRENT("0-30"),
    DAYS_31_60("31-60"),
    DAYS_61_90("61-90"),
    OVER_90("90+"),
    UNKNOWN("Unknown");

    private final String label;

    AgingBucket(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Closed intervals evaluated in order; the first match wins.
     */
    public static AgingBucket forDays(long agingDays) {
        if (agingDays <= 30) {
            return CURRENT;
        }
        if (agingDays <= 60) {
            return DAYS_31_60;
        }
        if (agingDays <= 90) {
            return DAYS_61_90;
        }
        return OVER_90;
    }

    /**
     * Display position of a bucket label; labels that are not buckets sort after all buckets.
     */
    public static int displayRank(String label) {
        for (AgingBucket bucket : values()) {
            if (bucket.label.equals(label)) {
                return bucket.ordinal();
            }
        }
        return values().length;
    }
}
