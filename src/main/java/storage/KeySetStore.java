package storage;

import java.io.IOException;

/**
 * Shared storage for the raw key set document, so several processes can reuse one fetch.
 */
public interface KeySetStore {

    /**
     * @return the stored document, or null when nothing is stored or it expired
     */
    byte[] load();

    void save(byte[] document, long ttlSeconds) throws IOException;
}
