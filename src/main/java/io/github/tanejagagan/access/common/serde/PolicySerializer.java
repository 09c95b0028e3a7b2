package io.github.tanejagagan.access.common.serde;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.tanejagagan.access.common.policy.AccessLevel;
import io.github.tanejagagan.access.common.policy.FilterType;
import io.github.tanejagagan.access.common.policy.FilterTypeRegistry;
import io.github.tanejagagan.access.common.policy.PolicyDocument;
import io.github.tanejagagan.access.common.policy.PolicyException;
import io.github.tanejagagan.access.common.policy.RowRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Canonical JSON form of a {@link PolicyDocument}:
 * <pre>
 * { "dataSourceIdentifier": ..., "users": [...],
 *   "columnPermissions": { principal: { column: "ALLOW" | "DENY" } },
 *   "rowRules": { principal: [ { "id", "column", "filterType", "value" } ] } }
 * </pre>
 * Principals are written in document order, columns in schema order. Reading
 * re-checks every document invariant and never repairs its input.
 */
public final class PolicySerializer {

    public static final String DATA_SOURCE_IDENTIFIER = "dataSourceIdentifier";
    public static final String USERS = "users";
    public static final String COLUMN_PERMISSIONS = "columnPermissions";
    public static final String ROW_RULES = "rowRules";
    public static final String ID = "id";
    public static final String COLUMN = "column";
    public static final String FILTER_TYPE = "filterType";
    public static final String VALUE = "value";

    private static final Set<String> TOP_LEVEL = Set.of(DATA_SOURCE_IDENTIFIER, USERS, COLUMN_PERMISSIONS, ROW_RULES);
    private static final Set<String> RULE_FIELDS = Set.of(ID, COLUMN, FILTER_TYPE, VALUE);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final Logger logger = LoggerFactory.getLogger(PolicySerializer.class);

    private PolicySerializer() {
    }

    public static ObjectNode toTree(PolicyDocument document) {
        var root = MAPPER.createObjectNode();
        root.put(DATA_SOURCE_IDENTIFIER, document.dataSourceIdentifier());
        var users = root.putArray(USERS);
        var permissions = root.putObject(COLUMN_PERMISSIONS);
        var rules = root.putObject(ROW_RULES);
        try {
            for (var principal : document.principals()) {
                users.add(principal);
                var row = permissions.putObject(principal);
                for (var column : document.columns()) {
                    row.put(column, document.columnPermission(principal, column).name());
                }
                var list = rules.putArray(principal);
                for (var rule : document.rowRules(principal)) {
                    list.addObject()
                            .put(ID, rule.id())
                            .put(COLUMN, rule.column())
                            .put(FILTER_TYPE, rule.filterType().name())
                            .put(VALUE, rule.value());
                }
            }
        } catch (PolicyException e) {
            // principals and columns are read back from the document itself
            throw new IllegalStateException(e);
        }
        return root;
    }

    public static String serialize(PolicyDocument document) {
        try {
            return MAPPER.writeValueAsString(toTree(document));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(e);
        }
    }

    public static byte[] serializeToBytes(PolicyDocument document) {
        return serialize(document).getBytes(StandardCharsets.UTF_8);
    }

    public static PolicyDocument deserialize(byte[] json) throws PolicyException {
        return deserialize(new String(json, StandardCharsets.UTF_8));
    }

    public static PolicyDocument deserialize(String json) throws PolicyException {
        JsonNode tree;
        try {
            tree = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw PolicyException.validationFailed("Malformed policy JSON: " + e.getOriginalMessage());
        }
        return fromTree(tree);
    }

    /**
     * Same as {@link #deserialize(String)} and additionally requires the
     * document's columns to be exactly the given schema.
     */
    public static PolicyDocument deserialize(String json, List<String> schemaColumns) throws PolicyException {
        var document = deserialize(json);
        if (!document.principals().isEmpty() && !Set.copyOf(document.columns()).equals(Set.copyOf(schemaColumns))) {
            throw PolicyException.validationFailed("Policy columns " + document.columns()
                    + " do not match schema " + schemaColumns);
        }
        return document;
    }

    public static PolicyDocument fromTree(JsonNode tree) throws PolicyException {
        var root = requireObject(tree, "policy");
        root.fieldNames().forEachRemaining(name -> {
            if (!TOP_LEVEL.contains(name)) {
                logger.debug("Ignoring unknown policy member {}", name);
            }
        });
        var dataSourceIdentifier = requireText(root.get(DATA_SOURCE_IDENTIFIER), DATA_SOURCE_IDENTIFIER);

        var users = new ArrayList<String>();
        for (var user : requireArray(root.get(USERS), USERS)) {
            users.add(requireText(user, USERS + "[]"));
        }

        var permissionsNode = requireObject(root.get(COLUMN_PERMISSIONS), COLUMN_PERMISSIONS);
        var permissions = new LinkedHashMap<String, Map<String, AccessLevel>>();
        List<String> columns = null;
        var principalNames = permissionsNode.fieldNames();
        while (principalNames.hasNext()) {
            var principal = principalNames.next();
            var row = requireObject(permissionsNode.get(principal), COLUMN_PERMISSIONS + "." + principal);
            var levels = new LinkedHashMap<String, AccessLevel>();
            var fields = row.fields();
            while (fields.hasNext()) {
                var e = fields.next();
                var level = requireText(e.getValue(), COLUMN_PERMISSIONS + "." + principal + "." + e.getKey());
                try {
                    levels.put(e.getKey(), AccessLevel.parse(level));
                } catch (PolicyException invalid) {
                    throw PolicyException.validationFailed("Bad permission for " + principal, invalid);
                }
            }
            permissions.put(principal, levels);
        }
        // the known columns are the permission row of the first declared principal
        if (!users.isEmpty() && permissions.containsKey(users.get(0))) {
            columns = new ArrayList<>(permissions.get(users.get(0)).keySet());
        }

        var rulesNode = requireObject(root.get(ROW_RULES), ROW_RULES);
        var rules = new LinkedHashMap<String, List<RowRule>>();
        var ruleOwners = rulesNode.fieldNames();
        while (ruleOwners.hasNext()) {
            var principal = ruleOwners.next();
            var list = new ArrayList<RowRule>();
            for (var ruleNode : requireArray(rulesNode.get(principal), ROW_RULES + "." + principal)) {
                list.add(readRule(ruleNode, principal));
            }
            rules.put(principal, list);
        }

        return PolicyDocument.restore(dataSourceIdentifier, columns == null ? List.of() : columns,
                users, permissions, rules);
    }

    private static RowRule readRule(JsonNode node, String principal) throws PolicyException {
        var where = ROW_RULES + "." + principal + "[]";
        var rule = requireObject(node, where);
        var fields = rule.fieldNames();
        while (fields.hasNext()) {
            var name = fields.next();
            if (!RULE_FIELDS.contains(name)) {
                throw PolicyException.validationFailed("Unexpected member " + name + " in " + where);
            }
        }
        var id = rule.get(ID);
        if (id == null || !id.isIntegralNumber() || !id.canConvertToLong()) {
            throw PolicyException.validationFailed("Rule id must be an integer in " + where);
        }
        var column = requireText(rule.get(COLUMN), where + "." + COLUMN);
        FilterType filterType;
        try {
            filterType = FilterTypeRegistry.lookup(requireText(rule.get(FILTER_TYPE), where + "." + FILTER_TYPE));
        } catch (PolicyException unknown) {
            throw PolicyException.validationFailed("Bad rule " + id.asLong() + " for " + principal, unknown);
        }
        var value = requireText(rule.get(VALUE), where + "." + VALUE);
        if (!filterType.requiresValue() && !value.isEmpty()) {
            throw PolicyException.validationFailed(
                    String.format("Rule %d for %s carries a value but %s takes none", id.asLong(), principal, filterType));
        }
        return new RowRule(id.asLong(), column, filterType, value);
    }

    private static ObjectNode requireObject(JsonNode node, String where) throws PolicyException {
        if (node == null || !node.isObject()) {
            throw PolicyException.validationFailed("Expected an object at " + where);
        }
        return (ObjectNode) node;
    }

    private static ArrayNode requireArray(JsonNode node, String where) throws PolicyException {
        if (node == null || !node.isArray()) {
            throw PolicyException.validationFailed("Expected an array at " + where);
        }
        return (ArrayNode) node;
    }

    private static String requireText(JsonNode node, String where) throws PolicyException {
        if (node == null || !node.isTextual()) {
            throw PolicyException.validationFailed("Expected a string at " + where);
        }
        return node.asText();
    }
}
