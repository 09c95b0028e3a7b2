package io.github.tanejagagan.access.server;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

public record EvaluateRequest(String principal,
                              String identity,
                              Map<String, String> attributes,
                              List<Map<String, JsonNode>> rows) {
}
