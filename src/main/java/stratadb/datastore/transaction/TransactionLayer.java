package stratadb.datastore.transaction;

import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * One open transaction block. It only remembers which keys it wrote first; the written
 * versions live in the {@link TransactionStack} history, where this layer owns the last
 * entry of each of its keys.
 */
public class TransactionLayer {

    private final Set<String> touchedKeys;

    public TransactionLayer() {
        this.touchedKeys = new HashSet<>();
    }

    /** @return {@code true} if this is the first write of {@code key} in this layer */
    public boolean touch(String key) { return touchedKeys.add(key); }

    public Set<String> touchedKeys() { return Collections.unmodifiableSet(touchedKeys); }

    public int size() { return touchedKeys.size(); }
}
