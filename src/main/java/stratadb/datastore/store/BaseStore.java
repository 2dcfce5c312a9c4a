package stratadb.datastore.store;

import com.google.common.collect.ImmutableMap;
import stratadb.datastore.KeyValueStore;
import stratadb.datastore.frequency.FrequencyDelta;
import stratadb.datastore.frequency.ValueFrequencyIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Committed state: the key to value mapping plus the count of keys holding each value.
 */
public class BaseStore implements KeyValueStore {

    private static final Logger log = LoggerFactory.getLogger(BaseStore.class);

    private final Map<String, String> data;
    private final ValueFrequencyIndex frequencies;

    public BaseStore() {
        this.data = new HashMap<>();
        this.frequencies = new ValueFrequencyIndex();
    }

    @Override
    public void put(String key, String value) {
        checkNotNull(value, "store values cannot be null, key %s", key);
        String previous = data.put(key, value);
        frequencies.decrease(previous);
        frequencies.increase(value);
    }

    @Override
    public String get(String key) { return data.get(key); }

    @Override
    public void delete(String key) {
        String previous = data.remove(key);
        frequencies.decrease(previous);
    }

    /**
     * Applies the final value of every key written by the open transactions, then folds
     * their value count delta into the store's counts.
     *
     * @param writes final value per key, {@code null} for a deleted key
     */
    public void commit(Map<String, String> writes, FrequencyDelta delta) {
        for (Map.Entry<String, String> write : writes.entrySet()) {
            if (write.getValue() == null) data.remove(write.getKey());
            else data.put(write.getKey(), write.getValue());
        }
        frequencies.absorb(delta);
        log.debug("committed {} keys, store now holds {} keys", writes.size(), data.size());
    }

    public int count(String value) { return frequencies.count(value); }

    public int size() { return data.size(); }

    boolean containsKey(String key) { return data.containsKey(key); }

    public Map<String, String> snapshot() { return ImmutableMap.copyOf(data); }
}
