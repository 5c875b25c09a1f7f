package com.example.tenderintel;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Товарные группы закупки, которые распознаются по ключевым словам в тексте тендера.
 */
public enum MaterialCategory {
    PIPING("piping"),
    VALVES("valves"),
    FLANGES("flanges"),
    FITTINGS("fittings"),
    BOLTS("bolts"),
    GASKETS("gaskets"),
    FINNED_TUBES("finned_tubes");

    private final String key;

    MaterialCategory(String key) {
        this.key = key;
    }

    @JsonValue
    public String getKey() {
        return key;
    }
}
