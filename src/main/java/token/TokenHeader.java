package token;

import org.json.simple.JSONObject;
import utils.JsonFields;

import java.util.Objects;

/**
 * The decoded JOSE header of an ID token. Only the fields needed to pick a
 * verification key are kept.
 */
public class TokenHeader {
    private final String kid;
    private final String alg;
    private final String typ;

    public TokenHeader(String kid, String alg, String typ) {
        this.kid = Objects.requireNonNull(kid, "kid");
        this.alg = Objects.requireNonNull(alg, "alg");
        this.typ = Objects.requireNonNull(typ, "typ");
    }

    /**
     * @throws IllegalArgumentException if a known field has the wrong JSON type
     */
    public static TokenHeader fromJson(JSONObject json) {
        return new TokenHeader(
                JsonFields.getString(json, "kid"),
                JsonFields.getString(json, "alg"),
                JsonFields.getString(json, "typ"));
    }

    public String getKid() { return kid; }
    public String getAlg() { return alg; }
    public String getTyp() { return typ; }

    @Override
    public String toString() {
        return String.format("[kid=%s, alg=%s, typ=%s]", kid, alg, typ);
    }
}
