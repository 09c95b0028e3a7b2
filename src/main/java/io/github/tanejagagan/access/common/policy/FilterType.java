package io.github.tanejagagan.access.common.policy;

import java.util.Optional;

/**
 * The closed set of row filter kinds. Only kinds that carry an auxiliary
 * value have a placeholder describing its format.
 */
public enum FilterType {
    MATCH_CURRENT_USER_ID("Filter by current user ID",
            "Rows are visible only when the value in this column equals the ID of the user reading them.",
            null),
    MATCH_CURRENT_USER_PROPERTY("Filter by user property (e.g. department)",
            "Rows are visible only when the value in this column equals a property of the user, such as department or location.",
            "Enter the attribute name (e.g. department)..."),
    IN_STATIC_LIST("Filter by a fixed list of values",
            "Rows are visible only when the value in this column is one of the comma separated values you provide.",
            "Enter the values, e.g. Hà Nội, Hồ Chí Minh...");

    private final String text;
    private final String description;
    private final String valuePlaceholder;

    FilterType(String text, String description, String valuePlaceholder) {
        this.text = text;
        this.description = description;
        this.valuePlaceholder = valuePlaceholder;
    }

    public String text() {
        return text;
    }

    public String description() {
        return description;
    }

    public boolean requiresValue() {
        return valuePlaceholder != null;
    }

    public Optional<String> valuePlaceholder() {
        return Optional.ofNullable(valuePlaceholder);
    }
}
