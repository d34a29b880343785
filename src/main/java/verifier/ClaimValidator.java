package verifier;

import config.SystemConfig;
import token.TokenClaims;

/**
 * Checks audience, issuer and validity window, in that order.
 */
public final class ClaimValidator {
    private ClaimValidator() {}

    /**
     * @param now current time in seconds since the epoch
     */
    public static void validateClaims(TokenClaims claims, String expectedAudience, long now) throws TokenVerificationException {
        if (!expectedAudience.equals(claims.getAud())) {
            throw new TokenVerificationException(VerificationError.AUDIENCE_MISMATCH,
                    "aud '" + claims.getAud() + "' is not '" + expectedAudience + "'");
        }
        if (!SystemConfig.ACCEPTED_ISSUERS.contains(claims.getIss())) {
            throw new TokenVerificationException(VerificationError.ISSUER_MISMATCH,
                    "iss '" + claims.getIss() + "' is not an accepted issuer");
        }
        // not-yet-valid tokens are reported as expired
        if (now < claims.getIat() || now > claims.getExp()) {
            throw new TokenVerificationException(VerificationError.TOKEN_EXPIRED,
                    "now=" + now + " is outside iat=" + claims.getIat() + ", exp=" + claims.getExp());
        }
    }
}
