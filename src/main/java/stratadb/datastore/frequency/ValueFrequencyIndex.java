package stratadb.datastore.frequency;

import com.google.common.collect.HashMultiset;
import com.google.common.collect.Multiset;

import java.util.Map;

import static com.google.common.base.Preconditions.checkState;

/**
 * Absolute value counts of the committed store. Counts never drop below zero.
 */
public class ValueFrequencyIndex implements FrequencyIndex {

    private final Multiset<String> counts;

    public ValueFrequencyIndex() {
        this.counts = HashMultiset.create();
    }

    @Override
    public void modify(String value, int delta) {
        if (value == null || delta == 0) return;

        if (delta > 0) {
            counts.add(value, delta);
            return;
        }

        int current = counts.count(value);
        checkState(current + delta >= 0,
                "count of value %s would drop below zero (%s %s)", value, current, delta);
        counts.remove(value, -delta);
    }

    /** Folds a signed delta into the absolute counts. */
    public void absorb(FrequencyDelta delta) {
        for (Map.Entry<String, Integer> entry : delta.entries().entrySet()) {
            modify(entry.getKey(), entry.getValue());
        }
    }

    @Override
    public int count(String value) {
        return value == null ? 0 : counts.count(value);
    }

    @Override
    public boolean isEmpty() { return counts.isEmpty(); }

    int distinctValues() { return counts.elementSet().size(); }

    @Override
    public String toString() { return counts.toString(); }
}
