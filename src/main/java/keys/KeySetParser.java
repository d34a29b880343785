package keys;

import org.json.simple.JSONArray;
import org.json.simple.JSONObject;
import org.json.simple.parser.ParseException;
import utils.JsonFields;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the JWK set document served by the provider certificate endpoint:
 * {@code {"keys":[{"kty","alg","use","kid","n","e"}, ...]}}.
 */
public final class KeySetParser {
    private KeySetParser() {}

    public static KeySet parse(byte[] document) throws KeySetParseException {
        JSONObject json;
        try {
            json = JsonFields.parseObject(document);
        } catch (ParseException e) {
            throw new KeySetParseException("Key set is not a JSON object", e);
        }

        Object keysProp = json.get("keys");
        if (!(keysProp instanceof JSONArray)) {
            throw new KeySetParseException("Key set has no 'keys' array");
        }

        List<SigningKeyRecord> records = new ArrayList<>();
        for (Object entry : (JSONArray) keysProp) {
            if (!(entry instanceof JSONObject)) {
                throw new KeySetParseException("Key set entry is not a JSON object: " + entry);
            }
            try {
                records.add(SigningKeyRecord.fromJson((JSONObject) entry));
            } catch (IllegalArgumentException e) {
                throw new KeySetParseException("Invalid key set entry", e);
            }
        }
        return new KeySet(records);
    }
}
