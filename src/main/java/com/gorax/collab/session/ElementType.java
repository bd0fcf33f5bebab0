package com.gorax.collab.session;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum ElementType {
    NODE("node"),
    EDGE("edge");

    private final String wireName;

    ElementType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static Optional<ElementType> fromWire(String value) {
        return Arrays.stream(values())
            .filter(t -> t.wireName.equals(value))
            .findFirst();
    }
}
