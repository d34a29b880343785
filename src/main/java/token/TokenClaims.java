package token;

import org.json.simple.JSONObject;
import utils.JsonFields;

import java.util.Objects;

/**
 * Claims carried by a Google ID token payload.
 * Missing strings are empty, a missing {@code email_verified} is false and
 * missing timestamps are zero.
 */
public final class TokenClaims {
    private final String sub;
    private final String email;
    private final boolean emailVerified;
    private final String name;
    private final String givenName;
    private final String familyName;
    private final String picture;
    private final String locale;
    private final String iss;
    private final String azp;
    private final String aud;
    private final long iat;
    private final long exp;
    private final String atHash;

    private TokenClaims(Builder b) {
        this.sub = b.sub;
        this.email = b.email;
        this.emailVerified = b.emailVerified;
        this.name = b.name;
        this.givenName = b.givenName;
        this.familyName = b.familyName;
        this.picture = b.picture;
        this.locale = b.locale;
        this.iss = b.iss;
        this.azp = b.azp;
        this.aud = b.aud;
        this.iat = b.iat;
        this.exp = b.exp;
        this.atHash = b.atHash;
    }

    /**
     * Reads the claims from a decoded payload object. Unknown fields are ignored.
     *
     * @throws IllegalArgumentException if a known claim has the wrong JSON type
     */
    public static TokenClaims fromJson(JSONObject json) {
        return builder()
                .sub(JsonFields.getString(json, "sub"))
                .email(JsonFields.getString(json, "email"))
                .emailVerified(JsonFields.getBoolean(json, "email_verified"))
                .name(JsonFields.getString(json, "name"))
                .givenName(JsonFields.getString(json, "given_name"))
                .familyName(JsonFields.getString(json, "family_name"))
                .picture(JsonFields.getString(json, "picture"))
                .locale(JsonFields.getString(json, "locale"))
                .iss(JsonFields.getString(json, "iss"))
                .azp(JsonFields.getString(json, "azp"))
                .aud(JsonFields.getString(json, "aud"))
                .iat(JsonFields.getLong(json, "iat"))
                .exp(JsonFields.getLong(json, "exp"))
                .atHash(JsonFields.getString(json, "at_hash"))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getSub() { return sub; }
    public String getEmail() { return email; }
    public boolean isEmailVerified() { return emailVerified; }
    public String getName() { return name; }
    public String getGivenName() { return givenName; }
    public String getFamilyName() { return familyName; }
    public String getPicture() { return picture; }
    public String getLocale() { return locale; }
    public String getIss() { return iss; }
    public String getAzp() { return azp; }
    public String getAud() { return aud; }
    public long getIat() { return iat; }
    public long getExp() { return exp; }
    public String getAtHash() { return atHash; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TokenClaims that = (TokenClaims) o;
        return emailVerified == that.emailVerified
                && iat == that.iat
                && exp == that.exp
                && sub.equals(that.sub)
                && email.equals(that.email)
                && name.equals(that.name)
                && givenName.equals(that.givenName)
                && familyName.equals(that.familyName)
                && picture.equals(that.picture)
                && locale.equals(that.locale)
                && iss.equals(that.iss)
                && azp.equals(that.azp)
                && aud.equals(that.aud)
                && atHash.equals(that.atHash);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sub, email, emailVerified, name, givenName, familyName,
                picture, locale, iss, azp, aud, iat, exp, atHash);
    }

    @Override
    public String toString() {
        return String.format("[sub=%s, email=%s, aud=%s, iss=%s, iat=%d, exp=%d]",
                sub, email, aud, iss, iat, exp);
    }

    public static final class Builder {
        private String sub = "";
        private String email = "";
        private boolean emailVerified;
        private String name = "";
        private String givenName = "";
        private String familyName = "";
        private String picture = "";
        private String locale = "";
        private String iss = "";
        private String azp = "";
        private String aud = "";
        private long iat;
        private long exp;
        private String atHash = "";

        private Builder() {}

        public Builder sub(String sub) { this.sub = Objects.requireNonNull(sub); return this; }
        public Builder email(String email) { this.email = Objects.requireNonNull(email); return this; }
        public Builder emailVerified(boolean emailVerified) { this.emailVerified = emailVerified; return this; }
        public Builder name(String name) { this.name = Objects.requireNonNull(name); return this; }
        public Builder givenName(String givenName) { this.givenName = Objects.requireNonNull(givenName); return this; }
        public Builder familyName(String familyName) { this.familyName = Objects.requireNonNull(familyName); return this; }
        public Builder picture(String picture) { this.picture = Objects.requireNonNull(picture); return this; }
        public Builder locale(String locale) { this.locale = Objects.requireNonNull(locale); return this; }
        public Builder iss(String iss) { this.iss = Objects.requireNonNull(iss); return this; }
        public Builder azp(String azp) { this.azp = Objects.requireNonNull(azp); return this; }
        public Builder aud(String aud) { this.aud = Objects.requireNonNull(aud); return this; }
        public Builder iat(long iat) { this.iat = iat; return this; }
        public Builder exp(long exp) { this.exp = exp; return this; }
        public Builder atHash(String atHash) { this.atHash = Objects.requireNonNull(atHash); return this; }

        public TokenClaims build() {
            return new TokenClaims(this);
        }
    }
}
