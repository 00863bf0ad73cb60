package com.example.matrixgame.game.domain.state;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum NarrationMode {
    INITIATOR_ONLY("initiator_only"),
    OPEN("open");

    private final String id;

    NarrationMode(String id) {
        this.id = id;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    @JsonCreator
    public static NarrationMode from(String value) {
        if (value == null) {
            return null;
        }
        // older games stored "collaborative" for the open mode
        if ("collaborative".equalsIgnoreCase(value)) {
            return OPEN;
        }
        for (NarrationMode mode : values()) {
            if (mode.id.equalsIgnoreCase(value) || mode.name().equalsIgnoreCase(value)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown narration mode: " + value);
    }
}
