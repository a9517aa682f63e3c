package com.example.reportflow.model;

import java.util.List;

public record DuplicateReport(List<DuplicateCandidate> exact, List<DuplicateCandidate> fuzzy) {

    public DuplicateReport {
        exact = exact != null ? List.copyOf(exact) : List.of();
        fuzzy = fuzzy != null ? List.copyOf(fuzzy) : List.of();
    }
}
