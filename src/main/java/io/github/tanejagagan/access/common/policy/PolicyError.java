package io.github.tanejagagan.access.common.policy;

public enum PolicyError {
    DUPLICATE_PRINCIPAL,
    UNKNOWN_PRINCIPAL,
    UNKNOWN_COLUMN,
    UNKNOWN_RULE,
    UNKNOWN_FILTER_TYPE,
    INVALID_ACCESS_LEVEL,
    EMPTY_SCHEMA,
    NO_COLUMNS_AVAILABLE,
    NO_HEADER_ROW,
    SCHEMA_VALIDATION_FAILED
}
