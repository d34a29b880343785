package utils;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;

public class CryptoUtil {

    private CryptoUtil() {}

    /**
     * SHA-256 of the UTF-8 bytes of a string.
     */
    public static byte[] sha256(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return digest.digest(content.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Hashing algorithm 'SHA-256' not found", e);
        }
    }

    /**
     * Decodes base64url text that may have had its '=' padding stripped.
     * The input is padded to a multiple of four characters first.
     *
     * @throws IllegalArgumentException if the text is not valid base64url
     */
    public static byte[] base64UrlDecode(String str) {
        int m = str.length() % 4;
        if (m != 0) {
            str = str + "=".repeat(4 - m);
        }
        return Base64.getUrlDecoder().decode(str);
    }

    public static String base64UrlEncode(byte[] bytes) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
