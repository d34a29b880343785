package verifier;

import utils.CryptoUtil;

/**
 * Splits and decodes the compact {@code header.payload.signature} encoding.
 */
public final class TokenCodec {
    private TokenCodec() {}

    /**
     * @param token the compact token as presented by the bearer
     * @return the decoded segments and the digest the signature covers
     * @throws TokenVerificationException {@link VerificationError#MALFORMED_TOKEN} if the
     *         token does not have exactly three segments or a segment is not base64url
     */
    public static SplitToken split(String token) throws TokenVerificationException {
        // limit -1 keeps trailing empty segments so "a.b." is not mistaken for two segments
        String[] parts = token.split("\\.", -1);
        if (parts.length != 3) {
            throw new TokenVerificationException(VerificationError.MALFORMED_TOKEN,
                    "expected 3 segments but found " + parts.length);
        }

        byte[] header = decodeSegment(parts[0], "header");
        byte[] payload = decodeSegment(parts[1], "payload");
        byte[] signature = decodeSegment(parts[2], "signature");
        byte[] digest = CryptoUtil.sha256(parts[0] + "." + parts[1]);
        return new SplitToken(header, payload, signature, digest);
    }

    private static byte[] decodeSegment(String segment, String name) throws TokenVerificationException {
        try {
            return CryptoUtil.base64UrlDecode(segment);
        } catch (IllegalArgumentException e) {
            throw new TokenVerificationException(VerificationError.MALFORMED_TOKEN,
                    name + " segment is not valid base64url", e);
        }
    }
}
