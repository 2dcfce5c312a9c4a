package stratadb.datastore.frequency;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Signed value counts relative to whatever lies underneath, e.g. the open transactions
 * relative to the committed store. A negative count means the value lost keys.
 */
public class FrequencyDelta implements FrequencyIndex {

    private final Map<String, Integer> deltas;

    public FrequencyDelta() {
        this.deltas = new HashMap<>();
    }

    @Override
    public void modify(String value, int delta) {
        if (value == null || delta == 0) return;
        deltas.merge(value, delta, (current, change) -> current + change == 0 ? null : current + change);
    }

    @Override
    public int count(String value) {
        if (value == null) return 0;
        return deltas.getOrDefault(value, 0);
    }

    @Override
    public boolean isEmpty() { return deltas.isEmpty(); }

    public Map<String, Integer> entries() { return Collections.unmodifiableMap(deltas); }

    public void clear() { deltas.clear(); }

    @Override
    public String toString() { return deltas.toString(); }
}
