package io.github.tanejagagan.access.common.policy;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Access policy for one tabular data source: the known columns, the principals
 * in display order, a complete column permission matrix and an ordered list of
 * row rules per principal.
 * <p>
 * All mutations validate their arguments before touching any state, so a
 * rejected call leaves the document exactly as it was. Instances are not
 * thread safe; concurrent editors go through a single owner per document.
 */
public class PolicyDocument {

    private static final class PrincipalEntry {
        final LinkedHashMap<String, AccessLevel> permissions;
        final ArrayList<RowRule> rules;

        PrincipalEntry(LinkedHashMap<String, AccessLevel> permissions, ArrayList<RowRule> rules) {
            this.permissions = permissions;
            this.rules = rules;
        }

        static PrincipalEntry allowAll(List<String> columns) {
            var permissions = new LinkedHashMap<String, AccessLevel>();
            columns.forEach(c -> permissions.put(c, AccessLevel.ALLOW));
            return new PrincipalEntry(permissions, new ArrayList<>());
        }

        PrincipalEntry copy() {
            return new PrincipalEntry(new LinkedHashMap<>(permissions), new ArrayList<>(rules));
        }
    }

    /**
     * Largest rule id, 2^53 - 1. Ids above it do not survive a JSON reader
     * that decodes numbers as doubles.
     */
    public static final long MAX_RULE_ID = 9_007_199_254_740_991L;

    private String dataSourceIdentifier;
    private List<String> columns;
    private LinkedHashMap<String, PrincipalEntry> principals;
    private long nextRuleId;

    private PolicyDocument(String dataSourceIdentifier,
                           List<String> columns,
                           LinkedHashMap<String, PrincipalEntry> principals,
                           long nextRuleId) {
        this.dataSourceIdentifier = dataSourceIdentifier;
        this.columns = columns;
        this.principals = principals;
        this.nextRuleId = nextRuleId;
    }

    /**
     * A document with no columns and no principals.
     */
    public static PolicyDocument empty(String dataSourceIdentifier) {
        Objects.requireNonNull(dataSourceIdentifier, "dataSourceIdentifier");
        return new PolicyDocument(dataSourceIdentifier, List.of(), new LinkedHashMap<>(), 1);
    }

    public static PolicyDocument fromSchema(String dataSourceIdentifier,
                                            List<String> columns,
                                            Collection<String> principals) throws PolicyException {
        var document = empty(dataSourceIdentifier);
        document.initializeFromSchema(dataSourceIdentifier, columns, principals);
        return document;
    }

    /**
     * Rebuilds a document from already decoded parts, checking every invariant.
     * Any violation is reported as {@link PolicyError#SCHEMA_VALIDATION_FAILED}.
     */
    public static PolicyDocument restore(String dataSourceIdentifier,
                                         List<String> columns,
                                         List<String> principals,
                                         Map<String, Map<String, AccessLevel>> columnPermissions,
                                         Map<String, List<RowRule>> rowRules) throws PolicyException {
        if (dataSourceIdentifier == null) {
            throw PolicyException.validationFailed("Missing data source identifier");
        }
        var knownColumns = new LinkedHashSet<String>();
        for (var c : columns) {
            if (c == null || c.isBlank()) {
                throw PolicyException.validationFailed("Blank column name");
            }
            if (!knownColumns.add(c)) {
                throw PolicyException.validationFailed("Duplicate column " + c);
            }
        }
        var declared = new HashSet<String>();
        for (var p : principals) {
            if (p == null || p.isBlank()) {
                throw PolicyException.validationFailed("Blank principal name");
            }
            if (!p.equals(p.trim())) {
                throw PolicyException.validationFailed("Principal name has surrounding whitespace: '" + p + "'");
            }
            if (!declared.add(p)) {
                throw PolicyException.validationFailed("Duplicate principal " + p);
            }
        }
        for (var key : columnPermissions.keySet()) {
            if (!declared.contains(key)) {
                throw PolicyException.validationFailed("Column permissions for undeclared principal " + key);
            }
        }
        for (var key : rowRules.keySet()) {
            if (!declared.contains(key)) {
                throw PolicyException.validationFailed("Row rules for undeclared principal " + key);
            }
        }

        long maxRuleId = 0;
        var entries = new LinkedHashMap<String, PrincipalEntry>();
        for (var p : principals) {
            var granted = columnPermissions.get(p);
            if (granted == null) {
                throw PolicyException.validationFailed("Missing column permissions for principal " + p);
            }
            if (!granted.keySet().equals(knownColumns)) {
                throw PolicyException.validationFailed("Column permissions for principal " + p
                        + " do not cover exactly the known columns " + knownColumns);
            }
            var permissions = new LinkedHashMap<String, AccessLevel>();
            for (var c : knownColumns) {
                var level = granted.get(c);
                if (level == null) {
                    throw PolicyException.validationFailed(
                            String.format("Missing access level for principal %s column %s", p, c));
                }
                permissions.put(c, level);
            }

            var rules = rowRules.get(p);
            if (rules == null) {
                throw PolicyException.validationFailed("Missing row rules for principal " + p);
            }
            var ids = new HashSet<Long>();
            for (var rule : rules) {
                if (rule.id() <= 0 || rule.id() > MAX_RULE_ID) {
                    throw PolicyException.validationFailed(
                            String.format("Rule id must be between 1 and %d: %d", MAX_RULE_ID, rule.id()));
                }
                if (!ids.add(rule.id())) {
                    throw PolicyException.validationFailed(
                            String.format("Duplicate rule id %d for principal %s", rule.id(), p));
                }
                if (!knownColumns.contains(rule.column())) {
                    throw PolicyException.validationFailed("Rule " + rule.id() + " references unknown column",
                            PolicyException.unknownColumn(rule.column()));
                }
                maxRuleId = Math.max(maxRuleId, rule.id());
            }
            entries.put(p, new PrincipalEntry(permissions, new ArrayList<>(rules)));
        }
        return new PolicyDocument(dataSourceIdentifier, List.copyOf(knownColumns), entries, maxRuleId + 1);
    }

    // initialization

    /**
     * Replaces the known columns and the principals. The permission matrix is
     * rebuilt to ALLOW everywhere; row rules of principals that are kept survive
     * only when their column is still part of the schema.
     */
    public void initializeFromSchema(String newDataSourceIdentifier,
                                     List<String> newColumns,
                                     Collection<String> newPrincipals) throws PolicyException {
        Objects.requireNonNull(newDataSourceIdentifier, "dataSourceIdentifier");
        var normalizedColumns = normalizeColumns(newColumns);
        var normalizedPrincipals = new ArrayList<String>();
        for (var p : newPrincipals) {
            var name = normalizePrincipal(p);
            if (normalizedPrincipals.contains(name)) {
                throw new PolicyException(PolicyError.DUPLICATE_PRINCIPAL, "Duplicate principal: " + name);
            }
            normalizedPrincipals.add(name);
        }

        var known = new HashSet<>(normalizedColumns);
        var rebuilt = new LinkedHashMap<String, PrincipalEntry>();
        for (var p : normalizedPrincipals) {
            var entry = PrincipalEntry.allowAll(normalizedColumns);
            var previous = principals.get(p);
            if (previous != null) {
                previous.rules.stream()
                        .filter(r -> known.contains(r.column()))
                        .forEach(entry.rules::add);
            }
            rebuilt.put(p, entry);
        }
        this.dataSourceIdentifier = newDataSourceIdentifier;
        this.columns = normalizedColumns;
        this.principals = rebuilt;
    }

    /**
     * Re-initializes from a new schema keeping the current principals.
     */
    public void initializeFromSchema(List<String> newColumns) throws PolicyException {
        initializeFromSchema(dataSourceIdentifier, newColumns, new ArrayList<>(principals.keySet()));
    }

    private static List<String> normalizeColumns(List<String> columns) throws PolicyException {
        var result = new LinkedHashSet<String>();
        if (columns != null) {
            for (var c : columns) {
                if (c != null && !c.isBlank()) {
                    result.add(c);
                }
            }
        }
        if (result.isEmpty()) {
            throw new PolicyException(PolicyError.EMPTY_SCHEMA, "Schema has no columns");
        }
        return List.copyOf(result);
    }

    private static String normalizePrincipal(String name) throws PolicyException {
        if (name == null || name.isBlank()) {
            throw new PolicyException(PolicyError.DUPLICATE_PRINCIPAL, "Principal name must not be blank");
        }
        return name.trim();
    }

    // principals

    public void addPrincipal(String name) throws PolicyException {
        var principal = normalizePrincipal(name);
        if (principals.containsKey(principal)) {
            throw new PolicyException(PolicyError.DUPLICATE_PRINCIPAL, "Principal already exists: " + principal);
        }
        principals.put(principal, PrincipalEntry.allowAll(columns));
    }

    public void removePrincipal(String name) throws PolicyException {
        if (principals.remove(name) == null) {
            throw PolicyException.unknownPrincipal(name);
        }
    }

    /**
     * Re-keys the permission row and rule list of {@code oldName} under
     * {@code newName}, keeping its display position.
     */
    public void renamePrincipal(String oldName, String newName) throws PolicyException {
        var entry = principals.get(oldName);
        if (entry == null) {
            throw PolicyException.unknownPrincipal(oldName);
        }
        var target = normalizePrincipal(newName);
        if (principals.containsKey(target)) {
            throw new PolicyException(PolicyError.DUPLICATE_PRINCIPAL, "Principal already exists: " + target);
        }
        var rekeyed = new LinkedHashMap<String, PrincipalEntry>();
        principals.forEach((name, e) -> rekeyed.put(name.equals(oldName) ? target : name, e));
        this.principals = rekeyed;
    }

    // column permissions

    public void setColumnPermission(String principal, String column, AccessLevel level) throws PolicyException {
        var entry = entryOf(principal);
        if (!entry.permissions.containsKey(column)) {
            throw PolicyException.unknownColumn(column);
        }
        if (level == null) {
            throw new PolicyException(PolicyError.INVALID_ACCESS_LEVEL, "Access level must be ALLOW or DENY");
        }
        entry.permissions.put(column, level);
    }

    // row rules

    public RowRule addRowRule(String principal) throws PolicyException {
        var entry = entryOf(principal);
        if (columns.isEmpty()) {
            throw new PolicyException(PolicyError.NO_COLUMNS_AVAILABLE, "No columns available for a row rule");
        }
        if (nextRuleId > MAX_RULE_ID) {
            throw new IllegalStateException("Rule ids exhausted for " + dataSourceIdentifier);
        }
        var rule = RowRule.of(nextRuleId++, columns.get(0), FilterType.IN_STATIC_LIST, "");
        entry.rules.add(rule);
        return rule;
    }

    /**
     * Changes one field of a rule. Whatever the field, the value is cleared
     * when the resulting filter type does not take one.
     */
    public RowRule updateRowRule(String principal, long ruleId, RowRuleField field, String newValue)
            throws PolicyException {
        var entry = entryOf(principal);
        int index = indexOf(entry, principal, ruleId);
        var current = entry.rules.get(index);
        var updated = switch (field) {
            case COLUMN -> {
                if (newValue == null || !columns.contains(newValue)) {
                    throw PolicyException.unknownColumn(newValue);
                }
                yield current.withColumn(newValue);
            }
            case FILTER_TYPE -> current.withFilterType(FilterTypeRegistry.lookup(newValue));
            case VALUE -> current.withValue(newValue);
        };
        entry.rules.set(index, updated);
        return updated;
    }

    public void deleteRowRule(String principal, long ruleId) throws PolicyException {
        var entry = entryOf(principal);
        entry.rules.remove(indexOf(entry, principal, ruleId));
    }

    private PrincipalEntry entryOf(String principal) throws PolicyException {
        var entry = principal == null ? null : principals.get(principal);
        if (entry == null) {
            throw PolicyException.unknownPrincipal(principal);
        }
        return entry;
    }

    private static int indexOf(PrincipalEntry entry, String principal, long ruleId) throws PolicyException {
        for (int i = 0; i < entry.rules.size(); i++) {
            if (entry.rules.get(i).id() == ruleId) {
                return i;
            }
        }
        throw PolicyException.unknownRule(principal, ruleId);
    }

    // reads

    public String dataSourceIdentifier() {
        return dataSourceIdentifier;
    }

    public List<String> columns() {
        return columns;
    }

    public List<String> principals() {
        return List.copyOf(principals.keySet());
    }

    public boolean hasPrincipal(String principal) {
        return principal != null && principals.containsKey(principal);
    }

    public AccessLevel columnPermission(String principal, String column) throws PolicyException {
        var level = entryOf(principal).permissions.get(column);
        if (level == null) {
            throw PolicyException.unknownColumn(column);
        }
        return level;
    }

    /**
     * The permission row of a principal, in column order.
     */
    public Map<String, AccessLevel> columnPermissions(String principal) throws PolicyException {
        return Collections.unmodifiableMap(entryOf(principal).permissions);
    }

    public List<RowRule> rowRules(String principal) throws PolicyException {
        return Collections.unmodifiableList(entryOf(principal).rules);
    }

    public PolicyDocument copy() {
        var entries = new LinkedHashMap<String, PrincipalEntry>();
        principals.forEach((name, entry) -> entries.put(name, entry.copy()));
        return new PolicyDocument(dataSourceIdentifier, columns, entries, nextRuleId);
    }

    @Override
    public String toString() {
        return "PolicyDocument{" +
                "dataSourceIdentifier='" + dataSourceIdentifier + '\'' +
                ", columns=" + columns +
                ", principals=" + principals.keySet() +
                '}';
    }
}
