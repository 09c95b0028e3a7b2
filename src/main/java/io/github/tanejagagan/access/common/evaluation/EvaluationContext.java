package io.github.tanejagagan.access.common.evaluation;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Identity and attributes of the principal for whom rows are being evaluated,
 * e.g. {@code department -> sales}.
 */
public record EvaluationContext(String identity, Map<String, String> attributes) {

    public EvaluationContext {
        Objects.requireNonNull(identity, "identity");
        var present = new HashMap<String, String>();
        if (attributes != null) {
            attributes.forEach((k, v) -> {
                if (k != null && v != null) {
                    present.put(k, v);
                }
            });
        }
        attributes = Map.copyOf(present);
    }

    public EvaluationContext(String identity) {
        this(identity, Map.of());
    }
}
