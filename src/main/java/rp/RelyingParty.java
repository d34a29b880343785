package rp;

import keys.KeySet;
import keys.KeySetProvider;
import token.TokenClaims;
import verifier.TokenVerificationException;
import verifier.VerificationError;
import verifier.interfaces.IdTokenVerifier;

import java.io.IOException;
import java.time.Clock;
import java.util.Objects;

/**
 * Authenticates bearers of Google ID tokens for one client id.
 * <p>
 * Verification runs against the provider's current key snapshot. When the token
 * names a key the snapshot does not have, the keys are refreshed once and the
 * whole verification is repeated once.
 */
public class RelyingParty {
    private final String clientId;
    private final KeySetProvider keySetProvider;
    private final IdTokenVerifier verifier;
    private final Clock clock;

    public RelyingParty(String clientId, KeySetProvider keySetProvider, IdTokenVerifier verifier, Clock clock) {
        if (clientId == null || clientId.isBlank()) {
            throw new IllegalArgumentException("Client id must not be empty");
        }
        this.clientId = clientId;
        this.keySetProvider = Objects.requireNonNull(keySetProvider);
        this.verifier = Objects.requireNonNull(verifier);
        this.clock = Objects.requireNonNull(clock);
    }

    /**
     * @return the verified claims of {@code idToken}
     * @throws TokenVerificationException if the token is rejected
     * @throws IOException if the key set could not be obtained
     */
    public TokenClaims authenticate(String idToken) throws TokenVerificationException, IOException {
        long now = clock.instant().getEpochSecond();
        KeySet keySet = keySetProvider.current();
        try {
            return verifier.verify(idToken, keySet, clientId, now);
        } catch (TokenVerificationException e) {
            if (e.getError() != VerificationError.KEY_NOT_FOUND) {
                System.err.println("❌ ID token rejected: " + e.getMessage());
                throw e;
            }
            System.out.println("Key id not in cached key set, refreshing: " + e.getMessage());
        }

        KeySet refreshed = keySetProvider.refresh();
        try {
            return verifier.verify(idToken, refreshed, clientId, now);
        } catch (TokenVerificationException e) {
            System.err.println("❌ ID token rejected after key refresh: " + e.getMessage());
            throw e;
        }
    }

    public String getClientId() {
        return clientId;
    }
}
