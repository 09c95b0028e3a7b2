package io.github.tanejagagan.access.common.policy;

public enum RowRuleField {
    COLUMN("column"),
    FILTER_TYPE("filterType"),
    VALUE("value");

    private final String wireName;

    RowRuleField(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static RowRuleField fromWireName(String name) {
        for (var f : values()) {
            if (f.wireName.equals(name)) {
                return f;
            }
        }
        throw new IllegalArgumentException("Unknown row rule field: " + name);
    }
}
