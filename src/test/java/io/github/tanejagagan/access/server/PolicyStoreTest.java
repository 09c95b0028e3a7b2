package io.github.tanejagagan.access.server;

import io.github.tanejagagan.access.common.policy.AccessLevel;
import io.github.tanejagagan.access.common.policy.PolicyError;
import io.github.tanejagagan.access.common.policy.PolicyException;
import io.github.tanejagagan.access.common.serde.PolicySerializer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class PolicyStoreTest {

    private static final String SOURCE = "orders.csv";
    private PolicyStore store;

    @BeforeEach
    public void setUp() throws PolicyException {
        store = new PolicyStore();
        store.initialize(SOURCE, List.of("region", "owner"), List.of("sales_team"));
    }

    @Test
    public void failedEditIsNotCommitted() throws Exception {
        var before = PolicySerializer.serialize(store.getOrThrow(SOURCE));
        var thrown = assertThrows(PolicyException.class, () -> store.edit(SOURCE, d -> {
            d.addPrincipal("finance");
            d.setColumnPermission("finance", "salary", AccessLevel.DENY);
            return null;
        }));
        assertEquals(PolicyError.UNKNOWN_COLUMN, thrown.getError());
        assertEquals(before, PolicySerializer.serialize(store.getOrThrow(SOURCE)));
    }

    @Test
    public void readsAreCopies() throws Exception {
        store.getOrThrow(SOURCE).addPrincipal("finance");
        assertFalse(store.getOrThrow(SOURCE).hasPrincipal("finance"));
    }

    @Test
    public void unknownDataSource() {
        assertTrue(store.get("other").isEmpty());
        assertThrows(NoSuchPolicyException.class, () -> store.edit("other", d -> null));
        assertThrows(NoSuchPolicyException.class, () -> store.getOrThrow("other"));
    }

    @Test
    public void removeAndReinitialize() throws Exception {
        store.edit(SOURCE, d -> d.addRowRule("sales_team"));
        assertTrue(store.remove(SOURCE));
        assertFalse(store.remove(SOURCE));
        assertThrows(NoSuchPolicyException.class, () -> store.edit(SOURCE, d -> null));
        var document = store.initialize(SOURCE, List.of("region"), List.of("sales_team"));
        assertTrue(document.rowRules("sales_team").isEmpty());
        assertEquals(List.of(SOURCE), store.dataSources());
    }

    @Test
    public void removedDataSourcesReleaseTheirSlot() throws Exception {
        for (int i = 0; i < 20; i++) {
            var id = "upload-" + i + ".csv";
            store.initialize(id, List.of("region"), List.of("sales_team"));
            assertTrue(store.remove(id));
        }
        assertEquals(1, store.slotCount());
        assertEquals(List.of(SOURCE), store.dataSources());
    }

    @Test
    public void failedFirstInitializeLeavesNoSlot() {
        var thrown = assertThrows(PolicyException.class,
                () -> store.initialize("blank.csv", List.of(" "), List.of("sales_team")));
        assertEquals(PolicyError.EMPTY_SCHEMA, thrown.getError());
        assertEquals(1, store.slotCount());
        assertTrue(store.get("blank.csv").isEmpty());
    }

    @Test
    public void concurrentRemoveAndInitializeKeepTheLastWrite() throws Exception {
        var pool = Executors.newFixedThreadPool(4);
        try {
            var tasks = new ArrayList<Callable<Void>>();
            for (int w = 0; w < 4; w++) {
                tasks.add(() -> {
                    for (int i = 0; i < 200; i++) {
                        store.remove(SOURCE);
                        store.initialize(SOURCE, List.of("region"), List.of("sales_team"));
                    }
                    return null;
                });
            }
            for (var f : pool.invokeAll(tasks)) {
                f.get();
            }
        } finally {
            pool.shutdown();
            assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
        }
        assertEquals(1, store.slotCount());
        assertEquals(List.of("region"), store.getOrThrow(SOURCE).columns());
    }

    @Test
    public void concurrentEditsAreSerialized() throws Exception {
        int writers = 8;
        int perWriter = 50;
        var pool = Executors.newFixedThreadPool(writers);
        try {
            var tasks = new ArrayList<Callable<Void>>();
            for (int w = 0; w < writers; w++) {
                var prefix = "p" + w + "_";
                tasks.add(() -> {
                    for (int i = 0; i < perWriter; i++) {
                        var name = prefix + i;
                        store.edit(SOURCE, d -> {
                            d.addPrincipal(name);
                            return d.addRowRule(name);
                        });
                    }
                    return null;
                });
            }
            for (var f : pool.invokeAll(tasks)) {
                f.get();
            }
        } finally {
            pool.shutdown();
            assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
        }
        var document = store.getOrThrow(SOURCE);
        assertEquals(1 + writers * perWriter, document.principals().size());
        var ids = new java.util.HashSet<Long>();
        for (var p : document.principals()) {
            document.rowRules(p).forEach(r -> ids.add(r.id()));
        }
        assertEquals(writers * perWriter, ids.size());
    }
}
