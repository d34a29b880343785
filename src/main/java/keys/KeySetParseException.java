package keys;

/**
 * Thrown when fetched key set bytes are not a usable JWK set document.
 */
public class KeySetParseException extends Exception {
    public KeySetParseException(String message) {
        super(message);
    }

    public KeySetParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
