package io.github.tanejagagan.access.common.evaluation;

import io.github.tanejagagan.access.common.policy.AccessLevel;
import io.github.tanejagagan.access.common.policy.PolicyDocument;
import io.github.tanejagagan.access.common.policy.PolicyException;
import io.github.tanejagagan.access.common.policy.RowRule;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Stateless visibility checks against a policy document. Missing data never
 * grants access: an absent row value or attribute makes a rule fail.
 */
public final class RuleEvaluator {

    private RuleEvaluator() {
    }

    /**
     * Known columns the principal may read, in document column order.
     */
    public static Set<String> visibleColumns(String principal, PolicyDocument document) throws PolicyException {
        var permissions = document.columnPermissions(principal);
        var result = new LinkedHashSet<String>();
        for (var column : document.columns()) {
            if (permissions.get(column) == AccessLevel.ALLOW) {
                result.add(column);
            }
        }
        return result;
    }

    /**
     * True when every row rule of the principal accepts the row. A principal
     * without rules sees every row.
     */
    public static boolean isRowVisible(String principal,
                                       PolicyDocument document,
                                       EvaluationContext context,
                                       Map<String, String> row) throws PolicyException {
        for (var rule : document.rowRules(principal)) {
            if (!matches(rule, context, row)) {
                return false;
            }
        }
        return true;
    }

    public static boolean matches(RowRule rule, EvaluationContext context, Map<String, String> row) {
        var cell = row.get(rule.column());
        if (cell == null) {
            return false;
        }
        return switch (rule.filterType()) {
            case MATCH_CURRENT_USER_ID -> cell.equals(context.identity());
            case MATCH_CURRENT_USER_PROPERTY -> {
                var attribute = context.attributes().get(rule.value());
                yield attribute != null && cell.equals(attribute);
            }
            case IN_STATIC_LIST -> staticList(rule.value()).contains(cell.trim());
        };
    }

    static Set<String> staticList(String value) {
        var result = new LinkedHashSet<String>();
        Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .forEach(result::add);
        return result;
    }

    /**
     * Keeps the visible rows, in input order, each reduced to the visible columns.
     */
    public static List<Map<String, String>> apply(String principal,
                                                  PolicyDocument document,
                                                  EvaluationContext context,
                                                  List<Map<String, String>> rows) throws PolicyException {
        var columns = visibleColumns(principal, document);
        var rules = document.rowRules(principal);
        var result = new ArrayList<Map<String, String>>();
        for (var row : rows) {
            if (rules.stream().allMatch(r -> matches(r, context, row))) {
                var projected = new LinkedHashMap<String, String>();
                for (var c : columns) {
                    if (row.containsKey(c)) {
                        projected.put(c, row.get(c));
                    }
                }
                result.add(projected);
            }
        }
        return result;
    }
}
