package com.example.matrixgame.game.domain.state;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How members of a shared persona vote.
 */
public enum PersonaVotingMode {
    ONE_PER_PERSONA("one_per_persona"),
    EACH_MEMBER("each_member");

    private final String id;

    PersonaVotingMode(String id) {
        this.id = id;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    @JsonCreator
    public static PersonaVotingMode from(String value) {
        if (value == null) {
            return null;
        }
        for (PersonaVotingMode mode : values()) {
            if (mode.id.equalsIgnoreCase(value) || mode.name().equalsIgnoreCase(value)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown persona voting mode: " + value);
    }
}
