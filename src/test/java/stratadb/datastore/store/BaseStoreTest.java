package stratadb.datastore.store;

import stratadb.datastore.frequency.FrequencyDelta;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BaseStoreTest {

    BaseStore store;

    @BeforeEach
    void setUp() {
        store = new BaseStore();
    }

    @Test
    void test_putTracksValueCounts() {
        store.put("a", "1");
        store.put("b", "1");
        store.put("a", "2");

        assertEquals("2", store.get("a"));
        assertEquals(1, store.count("1"));
        assertEquals(1, store.count("2"));
        assertEquals(2, store.size());
    }

    @Test
    void test_deleteTracksValueCounts() {
        store.put("a", "1");
        store.delete("a");
        store.delete("missing");

        assertNull(store.get("a"));
        assertFalse(store.containsKey("a"));
        assertEquals(0, store.count("1"));
    }

    @Test
    void test_putRejectsNullValue() {
        assertThrows(NullPointerException.class, () -> store.put("a", null));
    }

    @Test
    void test_commitAppliesWritesAndDelta() {
        store.put("a", "0");
        store.put("b", "0");

        FrequencyDelta delta = new FrequencyDelta();
        delta.decrease("0");
        delta.increase("10");
        delta.decrease("0");
        delta.increase("100");

        Map<String, String> writes = new HashMap<>();
        writes.put("a", "10");
        writes.put("b", null);
        writes.put("z", "100");
        store.commit(writes, delta);

        assertEquals(Map.of("a", "10", "z", "100"), store.snapshot());
        assertEquals(0, store.count("0"));
        assertEquals(1, store.count("10"));
        assertEquals(1, store.count("100"));
    }
}
