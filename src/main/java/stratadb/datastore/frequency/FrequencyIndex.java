package stratadb.datastore.frequency;

/**
 * Counts how many keys hold each value. A {@code null} value stands for "no value"
 * and is never counted; a count that reaches zero is dropped from the index.
 */
public interface FrequencyIndex {

    default void increase(String value) { modify(value, 1); }

    default void decrease(String value) { modify(value, -1); }

    void modify(String value, int delta);

    /** @return the count for {@code value}, {@code 0} when it is not indexed */
    int count(String value);

    boolean isEmpty();

}
