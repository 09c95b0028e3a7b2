package io.github.tanejagagan.access.server;

import io.github.tanejagagan.access.common.policy.PolicyDocument;
import io.github.tanejagagan.access.common.policy.PolicyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Holds the committed policy of each data source. Writers for the same data
 * source are serialized by one lock; an edit runs against a copy and is
 * published only when it succeeds. Readers get a copy of the last committed
 * snapshot without locking.
 */
public class PolicyStore {

    @FunctionalInterface
    public interface PolicyEdit<T> {
        T apply(PolicyDocument document) throws PolicyException;
    }

    private static final class Slot {
        final ReentrantLock lock = new ReentrantLock();
        volatile PolicyDocument committed;
    }

    private static final Logger logger = LoggerFactory.getLogger(PolicyStore.class);

    private final ConcurrentHashMap<String, Slot> slots = new ConcurrentHashMap<>();

    public Optional<PolicyDocument> get(String dataSourceIdentifier) {
        var slot = slots.get(dataSourceIdentifier);
        var committed = slot == null ? null : slot.committed;
        return committed == null ? Optional.empty() : Optional.of(committed.copy());
    }

    public PolicyDocument getOrThrow(String dataSourceIdentifier) throws NoSuchPolicyException {
        return get(dataSourceIdentifier).orElseThrow(() -> new NoSuchPolicyException(dataSourceIdentifier));
    }

    public List<String> dataSources() {
        return slots.entrySet().stream()
                .filter(e -> e.getValue().committed != null)
                .map(java.util.Map.Entry::getKey)
                .sorted()
                .toList();
    }

    /**
     * Stores a complete document, replacing whatever was committed for its data source.
     */
    public void put(PolicyDocument document) {
        var slot = lockSlot(document.dataSourceIdentifier(), true);
        try {
            slot.committed = document.copy();
            logger.debug("Stored policy {}", document);
        } finally {
            slot.lock.unlock();
        }
    }

    /**
     * Creates the policy from a schema, or re-initializes an existing one.
     */
    public PolicyDocument initialize(String dataSourceIdentifier,
                                     List<String> columns,
                                     Collection<String> principals) throws PolicyException {
        var slot = lockSlot(dataSourceIdentifier, true);
        try {
            var working = slot.committed == null
                    ? PolicyDocument.empty(dataSourceIdentifier)
                    : slot.committed.copy();
            try {
                working.initializeFromSchema(dataSourceIdentifier, columns, principals);
            } catch (PolicyException e) {
                if (slot.committed == null) {
                    slots.remove(dataSourceIdentifier, slot);
                }
                throw e;
            }
            slot.committed = working;
            logger.debug("Initialized policy {}", working);
            return working.copy();
        } finally {
            slot.lock.unlock();
        }
    }

    public <T> T edit(String dataSourceIdentifier, PolicyEdit<T> edit) throws NoSuchPolicyException, PolicyException {
        var slot = lockSlot(dataSourceIdentifier, false);
        if (slot == null) {
            throw new NoSuchPolicyException(dataSourceIdentifier);
        }
        try {
            if (slot.committed == null) {
                throw new NoSuchPolicyException(dataSourceIdentifier);
            }
            var working = slot.committed.copy();
            var result = edit.apply(working);
            slot.committed = working;
            logger.debug("Committed edit on policy {}", dataSourceIdentifier);
            return result;
        } finally {
            slot.lock.unlock();
        }
    }

    /**
     * Drops the policy and its slot. A writer already waiting on the slot's
     * lock sees it detached and retries against a fresh one.
     */
    public boolean remove(String dataSourceIdentifier) {
        var slot = lockSlot(dataSourceIdentifier, false);
        if (slot == null) {
            return false;
        }
        try {
            var existed = slot.committed != null;
            slot.committed = null;
            slots.remove(dataSourceIdentifier, slot);
            return existed;
        } finally {
            slot.lock.unlock();
        }
    }

    int slotCount() {
        return slots.size();
    }

    /**
     * Returns the slot currently mapped to the data source with its lock held,
     * or null when there is none and {@code create} is false.
     */
    private Slot lockSlot(String dataSourceIdentifier, boolean create) {
        while (true) {
            var slot = create
                    ? slots.computeIfAbsent(dataSourceIdentifier, k -> new Slot())
                    : slots.get(dataSourceIdentifier);
            if (slot == null) {
                return null;
            }
            slot.lock.lock();
            if (slots.get(dataSourceIdentifier) == slot) {
                return slot;
            }
            slot.lock.unlock();
        }
    }
}
