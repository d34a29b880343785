package verifier;

import keys.KeySet;
import keys.SigningKeyRecord;
import org.json.simple.JSONObject;
import org.json.simple.parser.ParseException;
import token.TokenClaims;
import token.TokenHeader;
import utils.JsonFields;
import verifier.interfaces.IdTokenVerifier;

import java.security.interfaces.RSAPublicKey;
import java.time.Clock;
import java.util.Objects;

/**
 * Verifies Google ID tokens (RS256 compact JWS) against an already fetched key set.
 * <p>
 * The checks run in a fixed order and the first failure is thrown:
 * decode, claims, header, key lookup, key reconstruction, signature.
 * The verifier holds no state and is safe to share between threads.
 */
public class GoogleIdTokenVerifier implements IdTokenVerifier {
    private static final String RSA_KEY_TYPE = "RSA";

    @Override
    public TokenClaims verify(String token, KeySet keySet, String expectedAudience, long now)
            throws TokenVerificationException {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(keySet, "keySet");
        if (expectedAudience == null || expectedAudience.isEmpty()) {
            throw new IllegalArgumentException("Expected audience must not be empty");
        }

        // 1. Split and decode the three segments
        SplitToken parts = TokenCodec.split(token);

        // 2. Payload claims
        TokenClaims claims = decodeClaims(parts.getPayload());

        // 3. Audience, issuer, validity window
        ClaimValidator.validateClaims(claims, expectedAudience, now);

        // 4. Header, for the key id
        TokenHeader header = decodeHeader(parts.getHeader());

        // 5. Matching key record
        SigningKeyRecord record = KeySelector.selectKey(keySet, header.getKid());

        // 6. RSA public key from n and e
        if (!record.getKty().isEmpty() && !RSA_KEY_TYPE.equals(record.getKty())) {
            throw new TokenVerificationException(VerificationError.INVALID_KEY_MATERIAL,
                    "key '" + record.getKid() + "' has type " + record.getKty());
        }
        RSAPublicKey publicKey = KeyMaterialBuilder.buildPublicKey(record.getN(), record.getE());

        // 7. PKCS#1 v1.5 signature over the signing input
        SignatureVerifier.verifySignature(publicKey, parts.getSignedMessageDigest(), parts.getSignature());

        return claims;
    }

    /**
     * Verifies against the current time of {@code clock}.
     */
    public TokenClaims verify(String token, KeySet keySet, String expectedAudience, Clock clock)
            throws TokenVerificationException {
        return verify(token, keySet, expectedAudience, clock.instant().getEpochSecond());
    }

    private static TokenClaims decodeClaims(byte[] payload) throws TokenVerificationException {
        try {
            return TokenClaims.fromJson(parseSegment(payload, "payload"));
        } catch (IllegalArgumentException e) {
            throw new TokenVerificationException(VerificationError.MALFORMED_TOKEN, "payload: " + e.getMessage(), e);
        }
    }

    private static TokenHeader decodeHeader(byte[] header) throws TokenVerificationException {
        try {
            return TokenHeader.fromJson(parseSegment(header, "header"));
        } catch (IllegalArgumentException e) {
            throw new TokenVerificationException(VerificationError.MALFORMED_TOKEN, "header: " + e.getMessage(), e);
        }
    }

    private static JSONObject parseSegment(byte[] json, String name) throws TokenVerificationException {
        try {
            return JsonFields.parseObject(json);
        } catch (ParseException e) {
            throw new TokenVerificationException(VerificationError.MALFORMED_TOKEN, name + " is not a JSON object", e);
        }
    }
}
