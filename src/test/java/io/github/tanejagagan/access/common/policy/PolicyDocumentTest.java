package io.github.tanejagagan.access.common.policy;

import io.github.tanejagagan.access.common.serde.PolicySerializer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PolicyDocumentTest {

    private static final String SOURCE = "orders.xlsx";
    private PolicyDocument document;

    @BeforeEach
    public void setUp() throws PolicyException {
        document = PolicyDocument.fromSchema(SOURCE, List.of("region", "owner", "amount"),
                List.of("sales_team", "marketing_team", "manager"));
    }

    private void assertRejected(PolicyError expected, Executable executable) {
        var before = PolicySerializer.serialize(document);
        var thrown = assertThrows(PolicyException.class, executable);
        assertEquals(expected, thrown.getError());
        assertEquals(before, PolicySerializer.serialize(document), "rejected call must not change the document");
    }

    @Test
    public void initializeAllowsEverything() throws PolicyException {
        int entries = 0;
        for (var p : document.principals()) {
            var row = document.columnPermissions(p);
            assertEquals(document.columns(), List.copyOf(row.keySet()));
            for (var level : row.values()) {
                assertEquals(AccessLevel.ALLOW, level);
                entries++;
            }
            assertTrue(document.rowRules(p).isEmpty());
        }
        assertEquals(3 * 3, entries);
    }

    @Test
    public void initializeRequiresColumns() {
        var thrown = assertThrows(PolicyException.class,
                () -> PolicyDocument.fromSchema(SOURCE, List.of(), List.of("a")));
        assertEquals(PolicyError.EMPTY_SCHEMA, thrown.getError());
        thrown = assertThrows(PolicyException.class,
                () -> PolicyDocument.fromSchema(SOURCE, List.of(" ", ""), List.of("a")));
        assertEquals(PolicyError.EMPTY_SCHEMA, thrown.getError());
    }

    @Test
    public void initializeCollapsesDuplicateColumns() throws PolicyException {
        var d = PolicyDocument.fromSchema(SOURCE, List.of("a", "b", "a", " "), List.of("p"));
        assertEquals(List.of("a", "b"), d.columns());
    }

    @Test
    public void reinitializeDropsRulesOnRemovedColumns() throws PolicyException {
        var onOwner = document.addRowRule("sales_team");
        document.updateRowRule("sales_team", onOwner.id(), RowRuleField.COLUMN, "owner");
        var onRegion = document.addRowRule("sales_team");
        document.setColumnPermission("sales_team", "region", AccessLevel.DENY);

        document.initializeFromSchema(List.of("region"));

        assertEquals(List.of("region"), document.columns());
        assertEquals(List.of(onRegion), document.rowRules("sales_team"));
        assertEquals(AccessLevel.ALLOW, document.columnPermission("sales_team", "region"));
        assertEquals(List.of("sales_team", "marketing_team", "manager"), document.principals());
    }

    @Test
    public void addPrincipal() throws PolicyException {
        document.addPrincipal("  finance ");
        assertEquals("finance", document.principals().get(3));
        assertEquals(3, document.columnPermissions("finance").size());
        assertTrue(document.rowRules("finance").isEmpty());
    }

    @Test
    public void addPrincipalRejectsDuplicatesAndBlanks() {
        assertRejected(PolicyError.DUPLICATE_PRINCIPAL, () -> document.addPrincipal("manager"));
        assertRejected(PolicyError.DUPLICATE_PRINCIPAL, () -> document.addPrincipal(" manager"));
        assertRejected(PolicyError.DUPLICATE_PRINCIPAL, () -> document.addPrincipal("   "));
        assertRejected(PolicyError.DUPLICATE_PRINCIPAL, () -> document.addPrincipal(null));
    }

    @Test
    public void removePrincipalLeavesNothingBehind() throws PolicyException {
        document.addRowRule("manager");
        document.removePrincipal("manager");
        assertFalse(document.hasPrincipal("manager"));
        var json = PolicySerializer.toTree(document);
        assertFalse(json.get(PolicySerializer.COLUMN_PERMISSIONS).has("manager"));
        assertFalse(json.get(PolicySerializer.ROW_RULES).has("manager"));
        assertRejected(PolicyError.UNKNOWN_PRINCIPAL, () -> document.removePrincipal("manager"));
    }

    @Test
    public void renameMovesEverything() throws PolicyException {
        document.setColumnPermission("marketing_team", "amount", AccessLevel.DENY);
        var rule = document.addRowRule("marketing_team");
        rule = document.updateRowRule("marketing_team", rule.id(), RowRuleField.VALUE, "north, south");
        var permissions = java.util.Map.copyOf(document.columnPermissions("marketing_team"));

        document.renamePrincipal("marketing_team", "growth");

        assertEquals(List.of("sales_team", "growth", "manager"), document.principals());
        assertFalse(document.hasPrincipal("marketing_team"));
        assertEquals(permissions, document.columnPermissions("growth"));
        assertEquals(List.of(rule), document.rowRules("growth"));
    }

    @Test
    public void renameRejections() {
        assertRejected(PolicyError.UNKNOWN_PRINCIPAL, () -> document.renamePrincipal("nobody", "x"));
        assertRejected(PolicyError.DUPLICATE_PRINCIPAL, () -> document.renamePrincipal("manager", "sales_team"));
        assertRejected(PolicyError.DUPLICATE_PRINCIPAL, () -> document.renamePrincipal("manager", " "));
    }

    @Test
    public void setColumnPermissionIsIdempotent() throws PolicyException {
        document.setColumnPermission("sales_team", "owner", AccessLevel.DENY);
        var once = PolicySerializer.serialize(document);
        document.setColumnPermission("sales_team", "owner", AccessLevel.DENY);
        assertEquals(once, PolicySerializer.serialize(document));
        assertEquals(AccessLevel.DENY, document.columnPermission("sales_team", "owner"));
    }

    @Test
    public void setColumnPermissionRejections() {
        assertRejected(PolicyError.UNKNOWN_PRINCIPAL,
                () -> document.setColumnPermission("nobody", "owner", AccessLevel.DENY));
        assertRejected(PolicyError.UNKNOWN_COLUMN,
                () -> document.setColumnPermission("manager", "salary", AccessLevel.DENY));
        assertRejected(PolicyError.INVALID_ACCESS_LEVEL,
                () -> document.setColumnPermission("manager", "owner", null));
    }

    @Test
    public void addRowRuleDefaults() throws PolicyException {
        var first = document.addRowRule("manager");
        var second = document.addRowRule("manager");
        assertEquals("region", first.column());
        assertEquals(FilterType.IN_STATIC_LIST, first.filterType());
        assertEquals("", first.value());
        assertNotEquals(first.id(), second.id());
        assertEquals(List.of(first, second), document.rowRules("manager"));
    }

    @Test
    public void addRowRuleNeedsColumns() throws PolicyException {
        document = PolicyDocument.empty(SOURCE);
        document.addPrincipal("p");
        assertRejected(PolicyError.NO_COLUMNS_AVAILABLE, () -> document.addRowRule("p"));
        assertRejected(PolicyError.UNKNOWN_PRINCIPAL, () -> document.addRowRule("q"));
    }

    @ParameterizedTest
    @EnumSource(RowRuleField.class)
    public void valueIsClearedWhenTypeTakesNone(RowRuleField field) throws PolicyException {
        var rule = document.addRowRule("manager");
        document.updateRowRule("manager", rule.id(), RowRuleField.VALUE, "Hà Nội");
        document.updateRowRule("manager", rule.id(), RowRuleField.FILTER_TYPE, "MATCH_CURRENT_USER_ID");
        assertEquals("", document.rowRules("manager").get(0).value());

        var newValue = switch (field) {
            case COLUMN -> "owner";
            case FILTER_TYPE -> "MATCH_CURRENT_USER_ID";
            case VALUE -> "stale";
        };
        var updated = document.updateRowRule("manager", rule.id(), field, newValue);
        assertEquals("", updated.value());
        assertEquals(FilterType.MATCH_CURRENT_USER_ID, updated.filterType());
    }

    @Test
    public void updateRowRuleRejections() throws PolicyException {
        var rule = document.addRowRule("manager");
        assertRejected(PolicyError.UNKNOWN_PRINCIPAL,
                () -> document.updateRowRule("nobody", rule.id(), RowRuleField.VALUE, "x"));
        assertRejected(PolicyError.UNKNOWN_RULE,
                () -> document.updateRowRule("manager", rule.id() + 100, RowRuleField.VALUE, "x"));
        assertRejected(PolicyError.UNKNOWN_COLUMN,
                () -> document.updateRowRule("manager", rule.id(), RowRuleField.COLUMN, "salary"));
        assertRejected(PolicyError.UNKNOWN_FILTER_TYPE,
                () -> document.updateRowRule("manager", rule.id(), RowRuleField.FILTER_TYPE, "REGEX"));
    }

    @Test
    public void deleteRowRuleKeepsOthers() throws PolicyException {
        var a = document.addRowRule("sales_team");
        var b = document.addRowRule("sales_team");
        var c = document.addRowRule("sales_team");
        document.deleteRowRule("sales_team", b.id());
        assertEquals(List.of(a, c), document.rowRules("sales_team"));
        assertRejected(PolicyError.UNKNOWN_RULE, () -> document.deleteRowRule("sales_team", b.id()));
        assertRejected(PolicyError.UNKNOWN_PRINCIPAL, () -> document.deleteRowRule("nobody", a.id()));
    }

    @Test
    public void copyIsIndependent() throws PolicyException {
        var copy = document.copy();
        copy.addPrincipal("finance");
        copy.setColumnPermission("manager", "owner", AccessLevel.DENY);
        assertFalse(document.hasPrincipal("finance"));
        assertEquals(AccessLevel.ALLOW, document.columnPermission("manager", "owner"));
    }
}
