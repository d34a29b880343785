package verifier;

import keys.KeySet;
import keys.SigningKeyRecord;

public final class KeySelector {
    private KeySelector() {}

    /**
     * Returns the first record whose key id equals {@code kid}.
     * A miss usually means the provider rotated its keys and {@code keySet} is stale.
     */
    public static SigningKeyRecord selectKey(KeySet keySet, String kid) throws TokenVerificationException {
        for (SigningKeyRecord key : keySet.getKeys()) {
            if (key.getKid().equals(kid)) {
                return key;
            }
        }
        throw new TokenVerificationException(VerificationError.KEY_NOT_FOUND,
                "no key with kid '" + kid + "' among " + keySet.size() + " keys");
    }
}
