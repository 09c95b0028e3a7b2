package io.github.tanejagagan.access.common.policy;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Process wide, read only catalog of {@link FilterType}s keyed by their wire name.
 */
public final class FilterTypeRegistry {

    public record Descriptor(String name,
                             String text,
                             String description,
                             boolean requiresValue,
                             String valuePlaceholder) {
        static Descriptor of(FilterType type) {
            return new Descriptor(type.name(), type.text(), type.description(),
                    type.requiresValue(), type.valuePlaceholder().orElse(null));
        }
    }

    private static final Map<String, FilterType> BY_NAME = Arrays.stream(FilterType.values())
            .collect(Collectors.toUnmodifiableMap(FilterType::name, Function.identity()));

    private static final List<Descriptor> DESCRIPTORS = Arrays.stream(FilterType.values())
            .map(Descriptor::of)
            .toList();

    private FilterTypeRegistry() {
    }

    public static FilterType lookup(String name) throws PolicyException {
        var type = name == null ? null : BY_NAME.get(name);
        if (type == null) {
            throw new PolicyException(PolicyError.UNKNOWN_FILTER_TYPE, "Unknown filter type: " + name);
        }
        return type;
    }

    public static Descriptor describe(String name) throws PolicyException {
        return Descriptor.of(lookup(name));
    }

    public static boolean requiresValue(String name) throws PolicyException {
        return lookup(name).requiresValue();
    }

    public static List<Descriptor> all() {
        return DESCRIPTORS;
    }
}
