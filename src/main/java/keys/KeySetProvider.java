package keys;

import config.SystemConfig;
import network.KeySetFetcher;
import storage.KeySetStore;

import java.io.IOException;
import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the current key set snapshot and replaces it on refresh.
 * <p>
 * Readers get whatever snapshot was last published; a refresh builds a new
 * {@link KeySet} and swaps it in, so verifications in flight keep the one they read.
 * Refreshes closer together than the minimum interval reuse the published snapshot.
 */
public class KeySetProvider {
    private final KeySetFetcher fetcher;
    private final KeySetStore store;
    private final long cacheTtlSeconds;
    private final long minRefreshIntervalMillis;
    private final Clock clock;
    private final AtomicReference<KeySet> current = new AtomicReference<>();

    // guarded by this
    private boolean refreshed;
    private long lastRefreshMillis;

    public KeySetProvider(KeySetFetcher fetcher) {
        this(fetcher, null, SystemConfig.KEY_SET_CACHE_TTL_SECONDS);
    }

    /**
     * @param store shared cache consulted before the first fetch and written after each fetch; may be null
     */
    public KeySetProvider(KeySetFetcher fetcher, KeySetStore store, long cacheTtlSeconds) {
        this(fetcher, store, cacheTtlSeconds, SystemConfig.KEY_SET_MIN_REFRESH_INTERVAL_MS, Clock.systemUTC());
    }

    public KeySetProvider(KeySetFetcher fetcher, KeySetStore store, long cacheTtlSeconds,
                          long minRefreshIntervalMillis, Clock clock) {
        if (minRefreshIntervalMillis < 0) {
            throw new IllegalArgumentException("Minimum refresh interval must not be negative");
        }
        this.fetcher = Objects.requireNonNull(fetcher);
        this.store = store;
        this.cacheTtlSeconds = cacheTtlSeconds;
        this.minRefreshIntervalMillis = minRefreshIntervalMillis;
        this.clock = Objects.requireNonNull(clock);
    }

    /**
     * Returns the published snapshot, loading one first if there is none yet.
     */
    public KeySet current() throws IOException {
        KeySet snapshot = current.get();
        if (snapshot != null) {
            return snapshot;
        }
        synchronized (this) {
            snapshot = current.get();
            if (snapshot == null) {
                snapshot = loadFromStore();
                if (snapshot == null) {
                    snapshot = fetchAndPublish();
                } else {
                    current.set(snapshot);
                }
            }
            return snapshot;
        }
    }

    /**
     * Fetches a fresh key set from the provider and publishes it, bypassing the store.
     * Within the minimum interval of the previous refresh attempt the published
     * snapshot is returned instead, whether or not that attempt succeeded.
     */
    public synchronized KeySet refresh() throws IOException {
        long now = clock.millis();
        KeySet snapshot = current.get();
        if (snapshot != null && refreshed && now - lastRefreshMillis < minRefreshIntervalMillis) {
            System.out.println("Key set refreshed " + (now - lastRefreshMillis) + " ms ago, keeping the current one");
            return snapshot;
        }
        refreshed = true;
        lastRefreshMillis = now;
        return fetchAndPublish();
    }

    private KeySet fetchAndPublish() throws IOException {
        byte[] document = fetcher.fetch();
        KeySet fetched;
        try {
            fetched = KeySetParser.parse(document);
        } catch (KeySetParseException e) {
            throw new IOException("Fetched key set is malformed", e);
        }
        current.set(fetched);
        System.out.println("✅ Key set refreshed: " + fetched.size() + " keys");
        if (store != null) {
            store.save(document, cacheTtlSeconds);
        }
        return fetched;
    }

    private KeySet loadFromStore() {
        if (store == null) {
            return null;
        }
        byte[] document = store.load();
        if (document == null) {
            return null;
        }
        try {
            KeySet cached = KeySetParser.parse(document);
            System.out.println("✅ Key set loaded from cache: " + cached.size() + " keys");
            return cached;
        } catch (KeySetParseException e) {
            System.err.println("❌ Cached key set is malformed, fetching a new one: " + e.getMessage());
            return null;
        }
    }
}
