package io.github.tanejagagan.access.common.policy;

import java.util.Objects;

/**
 * A single row predicate owned by one principal. A kind that takes no value
 * never carries one.
 */
public record RowRule(long id, String column, FilterType filterType, String value) {

    public RowRule {
        Objects.requireNonNull(column, "column");
        Objects.requireNonNull(filterType, "filterType");
        Objects.requireNonNull(value, "value");
        if (!filterType.requiresValue() && !value.isEmpty()) {
            throw new IllegalArgumentException(filterType + " does not take a value");
        }
    }

    /**
     * Builds a rule, dropping the value when the filter type does not take one.
     */
    public static RowRule of(long id, String column, FilterType filterType, String value) {
        var v = filterType.requiresValue() && value != null ? value : "";
        return new RowRule(id, column, filterType, v);
    }

    public RowRule withColumn(String newColumn) {
        return of(id, newColumn, filterType, value);
    }

    public RowRule withFilterType(FilterType newFilterType) {
        return of(id, column, newFilterType, value);
    }

    public RowRule withValue(String newValue) {
        return of(id, column, filterType, newValue);
    }
}
