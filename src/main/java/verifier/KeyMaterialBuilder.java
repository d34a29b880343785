package verifier;

import utils.CryptoUtil;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.security.KeyFactory;
import java.security.NoSuchAlgorithmException;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.InvalidKeySpecException;
import java.security.spec.RSAPublicKeySpec;

/**
 * Rebuilds an RSA public key from the {@code n} and {@code e} members of a JWK.
 */
public final class KeyMaterialBuilder {
    private static final int EXPONENT_WIDTH = Long.BYTES;

    private KeyMaterialBuilder() {}

    /**
     * The modulus is read as an unsigned big-endian integer of any length. The
     * exponent is left-padded with zero bytes to 8 and read as a 64-bit integer.
     *
     * @throws TokenVerificationException {@link VerificationError#INVALID_KEY_MATERIAL}
     *         if either value does not decode or does not form a usable key
     */
    public static RSAPublicKey buildPublicKey(String modulusB64, String exponentB64) throws TokenVerificationException {
        byte[] modulusBytes = decode(modulusB64, "modulus");
        byte[] exponentBytes = decode(exponentB64, "exponent");

        BigInteger modulus = new BigInteger(1, modulusBytes);
        long exponent = toLong(exponentBytes);
        if (modulus.signum() == 0) {
            throw invalid("modulus is zero", null);
        }
        if (exponent <= 0) {
            throw invalid("exponent does not fit in a positive 64-bit integer", null);
        }

        try {
            KeyFactory factory = KeyFactory.getInstance("RSA");
            return (RSAPublicKey) factory.generatePublic(new RSAPublicKeySpec(modulus, BigInteger.valueOf(exponent)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Platform does not support RSA", e);
        } catch (InvalidKeySpecException e) {
            throw invalid("key factory rejected the key", e);
        }
    }

    private static long toLong(byte[] exponentBytes) throws TokenVerificationException {
        if (exponentBytes.length > EXPONENT_WIDTH) {
            throw invalid("exponent is " + exponentBytes.length + " bytes, at most " + EXPONENT_WIDTH + " allowed", null);
        }
        byte[] padded = new byte[EXPONENT_WIDTH];
        System.arraycopy(exponentBytes, 0, padded, EXPONENT_WIDTH - exponentBytes.length, exponentBytes.length);
        return ByteBuffer.wrap(padded).getLong();
    }

    private static byte[] decode(String value, String name) throws TokenVerificationException {
        if (value == null || value.isEmpty()) {
            throw invalid(name + " is missing", null);
        }
        try {
            return CryptoUtil.base64UrlDecode(value);
        } catch (IllegalArgumentException e) {
            throw invalid(name + " is not valid base64url", e);
        }
    }

    private static TokenVerificationException invalid(String detail, Throwable cause) {
        return new TokenVerificationException(VerificationError.INVALID_KEY_MATERIAL, detail, cause);
    }
}
