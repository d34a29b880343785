package verifier;

/**
 * The three decoded segments of a compact token plus the SHA-256 digest of
 * its signing input ({@code header + "." + payload}, still encoded).
 */
public class SplitToken {
    private final byte[] header;
    private final byte[] payload;
    private final byte[] signature;
    private final byte[] signedMessageDigest;

    SplitToken(byte[] header, byte[] payload, byte[] signature, byte[] signedMessageDigest) {
        this.header = header;
        this.payload = payload;
        this.signature = signature;
        this.signedMessageDigest = signedMessageDigest;
    }

    public byte[] getHeader() { return header.clone(); }
    public byte[] getPayload() { return payload.clone(); }
    public byte[] getSignature() { return signature.clone(); }
    public byte[] getSignedMessageDigest() { return signedMessageDigest.clone(); }
}
