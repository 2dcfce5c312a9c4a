package stratadb.datastore.transaction;

import stratadb.datastore.frequency.FrequencyDelta;
import stratadb.datastore.store.BaseStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.google.common.base.Preconditions.checkState;

/**
 * Nested transaction blocks over a {@link BaseStore}.
 *
 * <p>Every key written by an open block has a history list holding one entry per block
 * that wrote it, oldest block first. A block writing the same key again overwrites its
 * own entry instead of appending, so rolling back a block costs one removal per key it
 * touched. The value counts of all open blocks are kept as a single {@link FrequencyDelta}
 * relative to the store.
 */
public class TransactionStack {

    private static final Logger log = LoggerFactory.getLogger(TransactionStack.class);

    private final BaseStore store;
    private final Deque<TransactionLayer> layers;
    private final Map<String, List<VersionEntry>> history;
    private final FrequencyDelta frequencyDelta;

    public TransactionStack(BaseStore store) {
        this.store = store;
        this.layers = new ArrayDeque<>();
        this.history = new HashMap<>();
        this.frequencyDelta = new FrequencyDelta();
    }

    /**
     * @return the latest version written by an open block, or empty when no open block
     *         touched the key and the store value applies
     */
    public Optional<VersionEntry> get(String key) {
        List<VersionEntry> versions = history.get(key);
        if (versions == null || versions.isEmpty()) return Optional.empty();
        return Optional.of(versions.get(versions.size() - 1));
    }

    public void set(String key, String oldValue, String newValue) {
        if (!isActive()) return;

        record(key, VersionEntry.written(newValue));
        frequencyDelta.decrease(oldValue);
        frequencyDelta.increase(newValue);
    }

    public void unset(String key, String oldValue) {
        if (!isActive() || oldValue == null) return;

        record(key, VersionEntry.deleted());
        frequencyDelta.decrease(oldValue);
    }

    private void record(String key, VersionEntry entry) {
        TransactionLayer current = layers.peek();
        List<VersionEntry> versions = history.computeIfAbsent(key, k -> new ArrayList<>());
        if (current.touch(key)) versions.add(entry);
        else versions.set(versions.size() - 1, entry);
    }

    /** Count delta of {@code value} across all open blocks; only meaningful added to the store count. */
    public int numEqualTo(String value) { return frequencyDelta.count(value); }

    public void begin() {
        layers.push(new TransactionLayer());
        log.debug("transaction opened, depth {}", layers.size());
    }

    public void rollback() {
        if (!isActive()) return;

        if (layers.size() == 1) {
            log.debug("rolling back outermost transaction, discarding {} keys", history.size());
            clear();
            return;
        }

        TransactionLayer discarded = layers.pop();
        for (String key : discarded.touchedKeys()) {
            List<VersionEntry> versions = history.get(key);
            checkState(versions != null && !versions.isEmpty(), "no version to undo for key %s", key);

            VersionEntry undone = versions.remove(versions.size() - 1);
            String restored;
            if (versions.isEmpty()) {
                history.remove(key);
                restored = store.get(key);
            } else {
                restored = versions.get(versions.size() - 1).value();
            }

            frequencyDelta.increase(restored);
            frequencyDelta.decrease(undone.value());
        }
        log.debug("rolled back {} keys, depth {}", discarded.size(), layers.size());
    }

    public void commit() {
        if (!isActive()) return;

        // a null value marks a key deleted by the open blocks
        Map<String, String> writes = new HashMap<>();
        for (Map.Entry<String, List<VersionEntry>> entry : history.entrySet()) {
            List<VersionEntry> versions = entry.getValue();
            writes.put(entry.getKey(), versions.get(versions.size() - 1).value());
        }
        log.debug("committing {} transactions with {} keys", layers.size(), writes.size());

        store.commit(writes, frequencyDelta);
        clear();
    }

    private void clear() {
        history.clear();
        layers.clear();
        frequencyDelta.clear();
    }

    public boolean isActive() { return !layers.isEmpty(); }

    public int depth() { return layers.size(); }

    /** Keys written by at least one open block. */
    public Set<String> pendingKeys() { return Collections.unmodifiableSet(history.keySet()); }

    /** Number of history entries held for {@code key}, one per open block that wrote it. */
    int versionCount(String key) {
        List<VersionEntry> versions = history.get(key);
        return versions == null ? 0 : versions.size();
    }
}
