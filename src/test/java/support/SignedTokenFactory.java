package support;

import keys.KeySet;
import keys.SigningKeyRecord;
import org.json.simple.JSONObject;
import utils.CryptoUtil;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.Signature;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Issues RS256 compact tokens with a local test key and publishes that key as a JWK record.
 */
public class SignedTokenFactory {
    public static final String CLIENT_ID = "client-123";
    public static final String ISSUER = "accounts.google.com";

    private static final int KEY_SIZE = 2048;
    private static SignedTokenFactory primary;
    private static SignedTokenFactory secondary;

    private final KeyPair keyPair;
    private final String kid;

    public SignedTokenFactory(String kid) {
        this.kid = kid;
        try {
            KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
            generator.initialize(KEY_SIZE);
            this.keyPair = generator.generateKeyPair();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to generate RSA test key", e);
        }
    }

    /** Shared signer for kid "key-1"; generated once per test run. */
    public static synchronized SignedTokenFactory primary() {
        if (primary == null) {
            primary = new SignedTokenFactory("key-1");
        }
        return primary;
    }

    /** A second, unrelated signer for kid "key-2". */
    public static synchronized SignedTokenFactory secondary() {
        if (secondary == null) {
            secondary = new SignedTokenFactory("key-2");
        }
        return secondary;
    }

    public String getKid() {
        return kid;
    }

    public RSAPublicKey getPublicKey() {
        return (RSAPublicKey) keyPair.getPublic();
    }

    public RSAPrivateKey getPrivateKey() {
        return (RSAPrivateKey) keyPair.getPrivate();
    }

    public SigningKeyRecord keyRecord() {
        return keyRecordWithKid(kid);
    }

    public SigningKeyRecord keyRecordWithKid(String kid) {
        RSAPublicKey pub = getPublicKey();
        return new SigningKeyRecord("RSA", "RS256", "sig", kid,
                CryptoUtil.base64UrlEncode(unsigned(pub.getModulus())),
                CryptoUtil.base64UrlEncode(unsigned(pub.getPublicExponent())));
    }

    public KeySet keySet() {
        return new KeySet(List.of(keyRecord()));
    }

    /** The JWK set document for this key, as the certificate endpoint would serve it. */
    @SuppressWarnings("unchecked")
    public String jwksJson() {
        SigningKeyRecord r = keyRecord();
        JSONObject key = new JSONObject();
        key.put("kty", r.getKty());
        key.put("alg", r.getAlg());
        key.put("use", r.getUse());
        key.put("kid", r.getKid());
        key.put("n", r.getN());
        key.put("e", r.getE());
        return "{\"keys\":[" + key.toJSONString() + "]}";
    }

    /**
     * Claims for a token addressed to {@link #CLIENT_ID} from {@link #ISSUER}.
     */
    public static Map<String, Object> claims(long iat, long exp) {
        Map<String, Object> claims = new LinkedHashMap<>();
        claims.put("iss", ISSUER);
        claims.put("azp", CLIENT_ID);
        claims.put("aud", CLIENT_ID);
        claims.put("sub", "110169484474386276334");
        claims.put("email", "alice@example.com");
        claims.put("email_verified", true);
        claims.put("at_hash", "HK6E_P6Dh8Y93mRNtsDB1Q");
        claims.put("name", "Alice Example");
        claims.put("given_name", "Alice");
        claims.put("family_name", "Example");
        claims.put("picture", "https://lh3.googleusercontent.com/a/photo.jpg");
        claims.put("locale", "en");
        claims.put("iat", iat);
        claims.put("exp", exp);
        return claims;
    }

    public String sign(Map<String, Object> claims) {
        Map<String, Object> header = new LinkedHashMap<>();
        header.put("alg", "RS256");
        header.put("kid", kid);
        header.put("typ", "JWT");
        return sign(header, claims);
    }

    public String sign(Map<String, Object> header, Map<String, Object> claims) {
        return signRaw(JSONObject.toJSONString(header), JSONObject.toJSONString(claims));
    }

    /**
     * Signs arbitrary header and payload text, which need not be valid JSON.
     */
    public String signRaw(String headerJson, String payloadJson) {
        String contentToSign = CryptoUtil.base64UrlEncode(headerJson.getBytes(StandardCharsets.UTF_8))
                + "." + CryptoUtil.base64UrlEncode(payloadJson.getBytes(StandardCharsets.UTF_8));
        try {
            Signature rsaSign = Signature.getInstance("SHA256withRSA");
            rsaSign.initSign(keyPair.getPrivate());
            rsaSign.update(contentToSign.getBytes(StandardCharsets.UTF_8));
            return contentToSign + "." + CryptoUtil.base64UrlEncode(rsaSign.sign());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to sign test token", e);
        }
    }

    private static byte[] unsigned(BigInteger value) {
        byte[] bytes = value.toByteArray();
        if (bytes.length > 1 && bytes[0] == 0) {
            return Arrays.copyOfRange(bytes, 1, bytes.length);
        }
        return bytes;
    }
}
