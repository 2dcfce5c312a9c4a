package stratadb.datastore;

import stratadb.datastore.store.BaseStore;
import stratadb.datastore.transaction.TransactionStack;
import stratadb.datastore.transaction.VersionEntry;

import java.util.Objects;
import java.util.Optional;

/**
 * The database session. Writes go straight to the {@link BaseStore} when no transaction is
 * open and to the innermost block of the {@link TransactionStack} otherwise.
 */
public class StrataEngine implements TransactionalKeyValueStore {

    private final BaseStore store;
    private final TransactionStack transactions;

    public StrataEngine() {
        this(new BaseStore());
    }

    public StrataEngine(BaseStore store) {
        this.store = store;
        this.transactions = new TransactionStack(store);
    }

    @Override
    public String get(String key) {
        if (isTransactionActive()) {
            Optional<VersionEntry> pending = transactions.get(key);
            if (pending.isPresent()) return pending.get().value();
        }
        return store.get(key);
    }

    @Override
    public void put(String key, String value) {
        String oldValue = get(key);
        if (Objects.equals(oldValue, value)) return;

        if (isTransactionActive()) transactions.set(key, oldValue, value);
        else store.put(key, value);
    }

    @Override
    public void delete(String key) {
        String oldValue = get(key);

        if (isTransactionActive()) transactions.unset(key, oldValue);
        else store.delete(key);
    }

    @Override
    public int numEqualTo(String value) {
        return store.count(value) + transactions.numEqualTo(value);
    }

    @Override
    public void begin() { transactions.begin(); }

    @Override
    public boolean rollback() {
        if (!isTransactionActive()) return false;
        transactions.rollback();
        return true;
    }

    @Override
    public boolean commit() {
        if (!isTransactionActive()) return false;
        transactions.commit();
        return true;
    }

    @Override
    public boolean isTransactionActive() { return transactions.isActive(); }

    public int transactionDepth() { return transactions.depth(); }

    public BaseStore store() { return store; }

    public TransactionStack transactions() { return transactions; }
}
