package verifier.interfaces;

import keys.KeySet;
import token.TokenClaims;
import verifier.TokenVerificationException;

/**
 * An interface for verifying identity tokens against a snapshot of the provider's keys.
 */
public interface IdTokenVerifier {

    /**
     * Verifies a compact ID token.
     *
     * @param token            the complete token string ("header.payload.signature").
     * @param keySet           the provider keys to check the signature against.
     * @param expectedAudience the client id the token must be addressed to.
     * @param now              the current time in seconds since the epoch.
     * @return the token's claims, only when every check passed.
     * @throws TokenVerificationException naming the first check that failed.
     */
    TokenClaims verify(String token, KeySet keySet, String expectedAudience, long now) throws TokenVerificationException;
}
