package com.example.reportflow.executor;

import com.example.reportflow.model.FanInInput;
import com.example.reportflow.model.RecordSet;

import java.util.Collection;
import java.util.Map;

/**
 * Size of a node payload for the trace: number of records where there are records, entry count
 * for other collections and maps, 1 for any other value, 0 for none.
 */
final class PayloadSizes {

    private PayloadSizes() {
    }

    static int sizeOf(Object payload) {
        if (payload == null) {
            return 0;
        }
        if (payload instanceof RecordSet recordSet) {
            return recordSet.records().size();
        }
        if (payload instanceof FanInInput fanIn) {
            return fanIn.outputsBySource().values().stream().mapToInt(PayloadSizes::sizeOf).sum();
        }
        if (payload instanceof Collection<?> items) {
            return items.size();
        }
        if (payload instanceof Map<?, ?> map) {
            Object records = map.containsKey("records") ? map.get("records") : map.get("invoices");
            if (records instanceof Collection<?> items) {
                return items.size();
            }
            return map.size();
        }
        return 1;
    }
}
