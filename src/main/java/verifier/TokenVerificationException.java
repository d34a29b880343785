package verifier;

/**
 * Thrown when an ID token fails verification. {@link #getError()} names the failed step.
 */
public class TokenVerificationException extends Exception {
    private static final long serialVersionUID = 1L;

    private final VerificationError error;

    public TokenVerificationException(VerificationError error, String detail) {
        super(error.getDescription() + ": " + detail);
        this.error = error;
    }

    public TokenVerificationException(VerificationError error, String detail, Throwable cause) {
        super(error.getDescription() + ": " + detail, cause);
        this.error = error;
    }

    public VerificationError getError() {
        return error;
    }
}
