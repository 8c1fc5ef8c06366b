package com.mender.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Category of a diagnosed code issue.
 */
public enum IssueType {
    MISSING_FILE,
    SYNTAX_ERROR,
    TYPE_ERROR,
    LOGIC_ERROR,
    IMPORT_ERROR;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static IssueType fromValue(String value) {
        return valueOf(value.trim().toUpperCase());
    }
}
