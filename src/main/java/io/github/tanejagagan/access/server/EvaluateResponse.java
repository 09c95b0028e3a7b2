package io.github.tanejagagan.access.server;

import java.util.List;
import java.util.Map;
import java.util.Set;

public record EvaluateResponse(Set<String> visibleColumns, List<Map<String, String>> rows) {
}
