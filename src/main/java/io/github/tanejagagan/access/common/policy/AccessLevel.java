package io.github.tanejagagan.access.common.policy;

public enum AccessLevel {
    ALLOW("Read allowed"),
    DENY("Denied");

    private final String label;

    AccessLevel(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static AccessLevel parse(String value) throws PolicyException {
        if (value != null) {
            for (var level : values()) {
                if (level.name().equals(value)) {
                    return level;
                }
            }
        }
        throw new PolicyException(PolicyError.INVALID_ACCESS_LEVEL, "Invalid access level: " + value);
    }
}
