package com.example.tenderintel;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Urgency {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW;

    @JsonValue
    public String getKey() {
        return name().toLowerCase(Locale.ROOT);
    }
}
