package utils;

import org.json.simple.JSONObject;
import org.json.simple.parser.JSONParser;
import org.json.simple.parser.ParseException;

import java.nio.charset.StandardCharsets;

/**
 * Typed field access over json-simple objects.
 * Missing fields fall back to a default; a field holding the wrong JSON type
 * is rejected with {@link IllegalArgumentException}.
 */
public final class JsonFields {
    private JsonFields() {}

    /**
     * Parses UTF-8 JSON bytes that must hold a single object.
     *
     * @throws ParseException if the text is not a JSON object, has an invalid string
     *                        escape, or holds an integer too large for a long
     */
    public static JSONObject parseObject(byte[] json) throws ParseException {
        String text = new String(json, StandardCharsets.UTF_8);
        checkStrings(text);
        Object parsed;
        try {
            parsed = new JSONParser().parse(text);
        } catch (NumberFormatException e) {
            // json-simple reads every integer literal with Long.valueOf
            throw new ParseException(ParseException.ERROR_UNEXPECTED_EXCEPTION, e);
        }
        if (!(parsed instanceof JSONObject)) {
            throw new ParseException(ParseException.ERROR_UNEXPECTED_TOKEN, parsed);
        }
        return (JSONObject) parsed;
    }

    /**
     * Rejects what the json-simple lexer lets through inside string literals:
     * unknown escapes, unicode escapes without four hex digits and raw control characters.
     */
    private static void checkStrings(String text) throws ParseException {
        boolean inString = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (!inString) {
                if (c == '"') {
                    inString = true;
                }
                continue;
            }
            if (c == '"') {
                inString = false;
            } else if (c < 0x20) {
                throw new ParseException(i, ParseException.ERROR_UNEXPECTED_CHAR, c);
            } else if (c == '\\') {
                if (i + 1 >= text.length()) {
                    throw new ParseException(i, ParseException.ERROR_UNEXPECTED_CHAR, c);
                }
                char escaped = text.charAt(++i);
                if (escaped == 'u') {
                    if (i + 4 >= text.length()) {
                        throw new ParseException(i, ParseException.ERROR_UNEXPECTED_CHAR, escaped);
                    }
                    for (int j = i + 1; j <= i + 4; j++) {
                        if (!isHexDigit(text.charAt(j))) {
                            throw new ParseException(j, ParseException.ERROR_UNEXPECTED_CHAR, text.charAt(j));
                        }
                    }
                    i += 4;
                } else if ("\"\\/bfnrt".indexOf(escaped) < 0) {
                    throw new ParseException(i, ParseException.ERROR_UNEXPECTED_CHAR, escaped);
                }
            }
        }
    }

    private static boolean isHexDigit(char c) {
        return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    public static String getString(JSONObject json, String name) {
        Object value = json.get(name);
        if (value == null) {
            return "";
        }
        if (!(value instanceof String)) {
            throw new IllegalArgumentException("Field '" + name + "' is not a string");
        }
        return (String) value;
    }

    public static boolean getBoolean(JSONObject json, String name) {
        Object value = json.get(name);
        if (value == null) {
            return false;
        }
        if (!(value instanceof Boolean)) {
            throw new IllegalArgumentException("Field '" + name + "' is not a boolean");
        }
        return (Boolean) value;
    }

    // json-simple reads integral numbers as Long and anything with a fraction or exponent as Double
    public static long getLong(JSONObject json, String name) {
        Object value = json.get(name);
        if (value == null) {
            return 0L;
        }
        if (!(value instanceof Long)) {
            throw new IllegalArgumentException("Field '" + name + "' is not an integer");
        }
        return (Long) value;
    }
}
