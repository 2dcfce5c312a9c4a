package stratadb.datastore;

/**
 * A {@link KeyValueStore} with nested transaction blocks and a value count lookup.
 */
public interface TransactionalKeyValueStore extends KeyValueStore {

    /** @return number of keys whose current value equals {@code value} */
    int numEqualTo(String value);

    /** Opens a transaction block nested inside the current one, if any. */
    void begin();

    /**
     * Discards the innermost open transaction block.
     *
     * @return {@code false} when no transaction was open
     */
    boolean rollback();

    /**
     * Makes the writes of every open transaction block permanent and closes all of them.
     *
     * @return {@code false} when no transaction was open
     */
    boolean commit();

    boolean isTransactionActive();

}
