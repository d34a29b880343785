package verifier;

import keys.SigningKeyRecord;
import org.junit.jupiter.api.Test;
import support.SignedTokenFactory;
import utils.CryptoUtil;

import java.math.BigInteger;
import java.security.interfaces.RSAPublicKey;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KeyMaterialBuilderTest {

    private final SignedTokenFactory signer = SignedTokenFactory.primary();

    @Test
    void rebuildsTheSameKeyFromJwkComponents() throws Exception {
        SigningKeyRecord record = signer.keyRecord();

        RSAPublicKey key = KeyMaterialBuilder.buildPublicKey(record.getN(), record.getE());

        assertThat(key.getModulus()).isEqualTo(signer.getPublicKey().getModulus());
        assertThat(key.getPublicExponent()).isEqualTo(BigInteger.valueOf(65537));
    }

    @Test
    void modulusWithHighBitSetIsReadAsUnsigned() throws Exception {
        // RSA moduli always have the top bit of the first byte set
        SigningKeyRecord record = signer.keyRecord();
        byte[] modulusBytes = CryptoUtil.base64UrlDecode(record.getN());
        assertThat(modulusBytes[0] & 0x80).isNotZero();

        RSAPublicKey key = KeyMaterialBuilder.buildPublicKey(record.getN(), "AQAB");
        assertThat(key.getModulus().signum()).isEqualTo(1);
    }

    @Test
    void exponentAqabIs65537() throws Exception {
        RSAPublicKey key = KeyMaterialBuilder.buildPublicKey(signer.keyRecord().getN(), "AQAB");
        assertThat(key.getPublicExponent().longValue()).isEqualTo(65537L);
    }

    @Test
    void singleByteExponentIsNotTruncated() throws Exception {
        // 0x03
        RSAPublicKey key = KeyMaterialBuilder.buildPublicKey(signer.keyRecord().getN(), "Aw");
        assertThat(key.getPublicExponent().longValue()).isEqualTo(3L);
    }

    @Test
    void exponentLongerThanEightBytesIsRejected() {
        String nineBytes = CryptoUtil.base64UrlEncode(new byte[] {1, 0, 0, 0, 0, 0, 0, 0, 1});
        assertThatThrownBy(() -> KeyMaterialBuilder.buildPublicKey(signer.keyRecord().getN(), nineBytes))
                .extracting("error").isEqualTo(VerificationError.INVALID_KEY_MATERIAL);
    }

    @Test
    void exponentOverflowingSignedLongIsRejected() {
        String eightBytes = CryptoUtil.base64UrlEncode(new byte[] {(byte) 0x80, 0, 0, 0, 0, 0, 0, 1});
        assertThatThrownBy(() -> KeyMaterialBuilder.buildPublicKey(signer.keyRecord().getN(), eightBytes))
                .extracting("error").isEqualTo(VerificationError.INVALID_KEY_MATERIAL);
    }

    @Test
    void zeroExponentIsRejected() {
        assertThatThrownBy(() -> KeyMaterialBuilder.buildPublicKey(signer.keyRecord().getN(), "AA"))
                .extracting("error").isEqualTo(VerificationError.INVALID_KEY_MATERIAL);
    }

    @Test
    void invalidBase64IsRejected() {
        assertThatThrownBy(() -> KeyMaterialBuilder.buildPublicKey("n+ot/url*safe", "AQAB"))
                .extracting("error").isEqualTo(VerificationError.INVALID_KEY_MATERIAL);
        assertThatThrownBy(() -> KeyMaterialBuilder.buildPublicKey(signer.keyRecord().getN(), "!!"))
                .extracting("error").isEqualTo(VerificationError.INVALID_KEY_MATERIAL);
    }

    @Test
    void missingComponentsAreRejected() {
        assertThatThrownBy(() -> KeyMaterialBuilder.buildPublicKey("", "AQAB"))
                .extracting("error").isEqualTo(VerificationError.INVALID_KEY_MATERIAL);
        assertThatThrownBy(() -> KeyMaterialBuilder.buildPublicKey(signer.keyRecord().getN(), ""))
                .extracting("error").isEqualTo(VerificationError.INVALID_KEY_MATERIAL);
    }

    @Test
    void zeroModulusIsRejected() {
        assertThatThrownBy(() -> KeyMaterialBuilder.buildPublicKey("AAAA", "AQAB"))
                .extracting("error").isEqualTo(VerificationError.INVALID_KEY_MATERIAL);
    }
}
