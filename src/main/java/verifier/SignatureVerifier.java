package verifier;

import org.bouncycastle.asn1.ASN1Encoding;
import org.bouncycastle.asn1.DERNull;
import org.bouncycastle.asn1.nist.NISTObjectIdentifiers;
import org.bouncycastle.asn1.x509.AlgorithmIdentifier;
import org.bouncycastle.asn1.x509.DigestInfo;
import org.bouncycastle.crypto.DataLengthException;
import org.bouncycastle.crypto.InvalidCipherTextException;
import org.bouncycastle.crypto.encodings.PKCS1Encoding;
import org.bouncycastle.crypto.engines.RSAEngine;
import org.bouncycastle.crypto.params.RSAKeyParameters;
import org.bouncycastle.util.Arrays;

import java.io.IOException;
import java.security.interfaces.RSAPublicKey;

/**
 * RSASSA-PKCS1-v1_5 verification with SHA-256 over an already computed digest.
 * <p>
 * The RSA public operation and the type 1 padding check are done by BouncyCastle's
 * {@link PKCS1Encoding}. The recovered block must then match the DER encoded
 * {@code DigestInfo} for SHA-256 byte for byte, compared in constant time.
 */
public final class SignatureVerifier {
    private static final int SHA256_LENGTH = 32;
    private static final AlgorithmIdentifier SHA256_ALGORITHM =
            new AlgorithmIdentifier(NISTObjectIdentifiers.id_sha256, DERNull.INSTANCE);

    private SignatureVerifier() {}

    /**
     * @param publicKey           the provider key the token names
     * @param signedMessageDigest SHA-256 of the token signing input
     * @param signature           the raw signature bytes
     * @throws TokenVerificationException {@link VerificationError#INVALID_SIGNATURE} on any mismatch
     */
    public static void verifySignature(RSAPublicKey publicKey, byte[] signedMessageDigest, byte[] signature)
            throws TokenVerificationException {
        if (signedMessageDigest.length != SHA256_LENGTH) {
            throw invalid("digest is " + signedMessageDigest.length + " bytes, not a SHA-256 digest", null);
        }
        int modulusLength = (publicKey.getModulus().bitLength() + 7) / 8;
        if (signature.length != modulusLength) {
            throw invalid("signature is " + signature.length + " bytes, modulus is " + modulusLength, null);
        }

        byte[] recovered;
        try {
            PKCS1Encoding engine = new PKCS1Encoding(new RSAEngine());
            engine.init(false, new RSAKeyParameters(false, publicKey.getModulus(), publicKey.getPublicExponent()));
            recovered = engine.processBlock(signature, 0, signature.length);
        } catch (InvalidCipherTextException | DataLengthException e) {
            throw invalid("signature block is malformed", e);
        }

        byte[] expected = encodeDigestInfo(signedMessageDigest);
        if (!Arrays.constantTimeAreEqual(expected, recovered)) {
            throw invalid("signature does not match the signed content", null);
        }
    }

    private static byte[] encodeDigestInfo(byte[] digest) {
        try {
            return new DigestInfo(SHA256_ALGORITHM, digest).getEncoded(ASN1Encoding.DER);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to DER encode DigestInfo", e);
        }
    }

    private static TokenVerificationException invalid(String detail, Throwable cause) {
        return new TokenVerificationException(VerificationError.INVALID_SIGNATURE, detail, cause);
    }
}
