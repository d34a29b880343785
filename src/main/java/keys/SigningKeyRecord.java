package keys;

import org.json.simple.JSONObject;
import utils.JsonFields;

import java.util.Objects;

/**
 * One JWK entry of the provider's published key set.
 * {@code n} and {@code e} are base64url encoded big-endian unsigned integers.
 */
public class SigningKeyRecord {
    private final String kty;
    private final String alg;
    private final String use;
    private final String kid;
    private final String n;
    private final String e;

    public SigningKeyRecord(String kty, String alg, String use, String kid, String n, String e) {
        this.kty = Objects.requireNonNull(kty, "kty");
        this.alg = Objects.requireNonNull(alg, "alg");
        this.use = Objects.requireNonNull(use, "use");
        this.kid = Objects.requireNonNull(kid, "kid");
        this.n = Objects.requireNonNull(n, "n");
        this.e = Objects.requireNonNull(e, "e");
    }

    /**
     * @throws IllegalArgumentException if a known field is not a string
     */
    public static SigningKeyRecord fromJson(JSONObject json) {
        return new SigningKeyRecord(
                JsonFields.getString(json, "kty"),
                JsonFields.getString(json, "alg"),
                JsonFields.getString(json, "use"),
                JsonFields.getString(json, "kid"),
                JsonFields.getString(json, "n"),
                JsonFields.getString(json, "e"));
    }

    public String getKty() { return kty; }
    public String getAlg() { return alg; }
    public String getUse() { return use; }
    public String getKid() { return kid; }
    public String getN() { return n; }
    public String getE() { return e; }

    @Override
    public String toString() {
        return String.format("[kid=%s, kty=%s, alg=%s, use=%s]", kid, kty, alg, use);
    }
}
