package stratadb.datastore.transaction;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A value written to a key inside a transaction, or the marker that the key was deleted.
 * A deleted entry carries a {@code null} value.
 */
public record VersionEntry(String value, boolean isDeleted) {

    private static final VersionEntry DELETED = new VersionEntry(null, true);

    public static VersionEntry written(String value) {
        checkNotNull(value, "written value cannot be null");
        return new VersionEntry(value, false);
    }

    public static VersionEntry deleted() { return DELETED; }
}
