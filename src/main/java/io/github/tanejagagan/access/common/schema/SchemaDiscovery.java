package io.github.tanejagagan.access.common.schema;

import io.github.tanejagagan.access.common.policy.PolicyException;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Finds the column names of a tabular source. Implementations return an
 * ordered, de-duplicated and non-empty list, or fail with
 * {@code NO_HEADER_ROW} / {@code EMPTY_SCHEMA}.
 */
public interface SchemaDiscovery {
    List<String> discoverColumns(InputStream source) throws PolicyException, IOException;
}
