package network;

import java.io.IOException;

/**
 * Retrieves the raw bytes of the provider's published key set.
 */
@FunctionalInterface
public interface KeySetFetcher {
    byte[] fetch() throws IOException;
}
