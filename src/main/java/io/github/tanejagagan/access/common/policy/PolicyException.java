package io.github.tanejagagan.access.common.policy;

/**
 * Raised by every policy operation that rejects its input. A rejected mutation
 * never leaves a partially applied change behind.
 */
public class PolicyException extends Exception {
    private final PolicyError error;

    public PolicyException(PolicyError error, String msg) {
        super(msg);
        this.error = error;
    }

    public PolicyException(PolicyError error, String msg, Throwable cause) {
        super(msg, cause);
        this.error = error;
    }

    public PolicyError getError() {
        return error;
    }

    public static PolicyException unknownPrincipal(String principal) {
        return new PolicyException(PolicyError.UNKNOWN_PRINCIPAL, "Unknown principal: " + principal);
    }

    public static PolicyException unknownColumn(String column) {
        return new PolicyException(PolicyError.UNKNOWN_COLUMN, "Unknown column: " + column);
    }

    public static PolicyException unknownRule(String principal, long ruleId) {
        return new PolicyException(PolicyError.UNKNOWN_RULE,
                String.format("Unknown rule %d for principal %s", ruleId, principal));
    }

    public static PolicyException validationFailed(String msg) {
        return new PolicyException(PolicyError.SCHEMA_VALIDATION_FAILED, msg);
    }

    public static PolicyException validationFailed(String msg, PolicyException cause) {
        return new PolicyException(PolicyError.SCHEMA_VALIDATION_FAILED, msg + ": " + cause.getMessage(), cause);
    }
}
