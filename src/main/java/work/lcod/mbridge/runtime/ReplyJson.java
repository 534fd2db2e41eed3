package work.lcod.mbridge.runtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Map;
import work.lcod.mbridge.api.BridgeException;
import work.lcod.mbridge.api.ErrorKind;

/**
 * Assembles a result object from decoded JSON literals and parses it into host values.
 */
final class ReplyJson {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final StringBuilder text = new StringBuilder("{");

    ReplyJson literal(String key, String jsonLiteral) {
        separate();
        text.append('"').append(key).append("\":").append(jsonLiteral);
        return this;
    }

    /**
     * A raw engine value that must be a plain integer, such as a {@code $data} result.
     */
    ReplyJson integer(String key, String raw) {
        try {
            return literal(key, Long.toString(Long.parseLong(raw)));
        } catch (NumberFormatException ex) {
            throw new BridgeException(ErrorKind.ENGINE, 0, "Engine returned a non-integer " + key + ": " + raw);
        }
    }

    ReplyJson array(String key, List<String> jsonLiterals) {
        return literal(key, "[" + String.join(",", jsonLiterals) + "]");
    }

    Map<String, Object> toMap() {
        String json = text + "}";
        try {
            return JSON.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException ex) {
            throw new BridgeException(ErrorKind.ENCODING, "Cannot parse reply " + json, ex);
        }
    }

    private void separate() {
        if (text.length() > 1) {
            text.append(',');
        }
    }
}
