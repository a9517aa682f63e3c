package com.example.reportflow.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RunStatus {
    SUCCESS,
    ERROR;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
