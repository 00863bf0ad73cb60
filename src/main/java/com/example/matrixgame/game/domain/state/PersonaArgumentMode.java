package com.example.matrixgame.game.domain.state;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Whether members of a shared persona draw from one argument allowance.
 */
public enum PersonaArgumentMode {
    SHARED_POOL("shared_pool"),
    INDEPENDENT("independent");

    private final String id;

    PersonaArgumentMode(String id) {
        this.id = id;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    @JsonCreator
    public static PersonaArgumentMode from(String value) {
        if (value == null) {
            return null;
        }
        for (PersonaArgumentMode mode : values()) {
            if (mode.id.equalsIgnoreCase(value) || mode.name().equalsIgnoreCase(value)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown persona argument mode: " + value);
    }
}
