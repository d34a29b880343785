package verifier;

/**
 * The ways an ID token can fail verification. Exactly one is reported per failed call.
 */
public enum VerificationError {
    MALFORMED_TOKEN("Token is not valid, Token is malformed"),
    AUDIENCE_MISMATCH("Token is not valid, Audience from token and certificate don't match"),
    ISSUER_MISMATCH("Token is not valid, ISS from token and certificate don't match"),
    TOKEN_EXPIRED("Token is not valid, Token is expired"),
    KEY_NOT_FOUND("Token is not valid, KeyID from token and certificate don't match"),
    INVALID_KEY_MATERIAL("Token is not valid, Signing key could not be reconstructed"),
    INVALID_SIGNATURE("Token is not valid, Signature verification failed");

    private final String description;

    VerificationError(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
