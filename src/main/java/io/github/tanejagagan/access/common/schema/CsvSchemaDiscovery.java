package io.github.tanejagagan.access.common.schema;

import io.github.tanejagagan.access.common.policy.PolicyError;
import io.github.tanejagagan.access.common.policy.PolicyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Reads the header record of delimited text. Only the first record is consumed;
 * it spans several lines when a quoted name contains a line break.
 */
public class CsvSchemaDiscovery implements SchemaDiscovery {

    private static final Logger logger = LoggerFactory.getLogger(CsvSchemaDiscovery.class);
    private static final char BOM = '\uFEFF';
    private static final char QUOTE = '"';

    private final char delimiter;

    public CsvSchemaDiscovery() {
        this(',');
    }

    public CsvSchemaDiscovery(char delimiter) {
        if (delimiter == QUOTE || delimiter == '\n' || delimiter == '\r') {
            throw new IllegalArgumentException("Unsupported delimiter: " + delimiter);
        }
        this.delimiter = delimiter;
    }

    @Override
    public List<String> discoverColumns(InputStream source) throws PolicyException, IOException {
        String header;
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(source, StandardCharsets.UTF_8))) {
            header = reader.readLine();
            if (header == null) {
                throw new PolicyException(PolicyError.NO_HEADER_ROW, "Source has no header row");
            }
            while (hasOpenQuote(header)) {
                var next = reader.readLine();
                if (next == null) {
                    throw new PolicyException(PolicyError.NO_HEADER_ROW, "Header row ends inside a quoted name");
                }
                header = header + '\n' + next;
            }
        }
        if (!header.isEmpty() && header.charAt(0) == BOM) {
            header = header.substring(1);
        }
        var columns = new LinkedHashSet<String>();
        for (var field : split(header)) {
            var name = field.trim();
            if (name.isEmpty()) {
                continue;
            }
            if (!columns.add(name)) {
                logger.warn("Dropping duplicate column {}", name);
            }
        }
        if (columns.isEmpty()) {
            throw new PolicyException(PolicyError.EMPTY_SCHEMA, "Header row has no column names");
        }
        return List.copyOf(columns);
    }

    // an escaped quote is two quotes, so an odd count leaves a quoted name open
    private static boolean hasOpenQuote(String text) {
        int quotes = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == QUOTE) {
                quotes++;
            }
        }
        return quotes % 2 != 0;
    }

    List<String> split(String line) {
        var fields = new ArrayList<String>();
        var current = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quoted) {
                if (c == QUOTE) {
                    if (i + 1 < line.length() && line.charAt(i + 1) == QUOTE) {
                        current.append(QUOTE);
                        i++;
                    } else {
                        quoted = false;
                    }
                } else {
                    current.append(c);
                }
            } else if (c == QUOTE) {
                quoted = true;
            } else if (c == delimiter) {
                fields.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        fields.add(current.toString());
        return fields;
    }
}
