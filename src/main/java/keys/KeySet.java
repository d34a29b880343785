package keys;

import java.util.List;

/**
 * An immutable snapshot of the provider's signing keys, in published order.
 * Refreshing the keys produces a new snapshot.
 */
public final class KeySet {
    private static final KeySet EMPTY = new KeySet(List.of());

    private final List<SigningKeyRecord> keys;

    public KeySet(List<SigningKeyRecord> keys) {
        this.keys = List.copyOf(keys);
    }

    public static KeySet empty() {
        return EMPTY;
    }

    public List<SigningKeyRecord> getKeys() {
        return keys;
    }

    public int size() {
        return keys.size();
    }

    @Override
    public String toString() {
        return "KeySet" + keys;
    }
}
