package com.mender.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * File operation carried by a {@link FileChange}.
 */
public enum ChangeOperation {
    CREATE,
    MODIFY,
    DELETE;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static ChangeOperation fromValue(String value) {
        return valueOf(value.trim().toUpperCase());
    }
}
