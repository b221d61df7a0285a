package org.dxworks.pagecanvas.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.SerializableString;
import com.fasterxml.jackson.core.io.CharacterEscapes;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Converts JSON values to and from the escaped form stored in canvas attributes such as
 * {@code data-sp-controldata}.
 *
 * Encoding writes compact JSON and then replaces, in this order, {@code "} with {@code &quot;},
 * {@code :} with {@code &#58;}, {@code {} with {@code &#123;} and {@code }} with {@code &#125;}.
 * Decoding reverses the replacements and parses the result, which must be exactly one JSON value.
 */
public final class AttributeJsonCodec {

    private static final String QUOTE = "&quot;";
    private static final String COLON = "&#58;";
    private static final String OPEN_BRACE = "&#123;";
    private static final String CLOSE_BRACE = "&#125;";

    private static final ObjectMapper MAPPER = createMapper();

    private AttributeJsonCodec() {}

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static String encode(Object value) {
        String json;
        try {
            json = MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new CodecException("Failed to write attribute value as JSON: " + e.getOriginalMessage(), e);
        }
        return json
                .replace("\"", QUOTE)
                .replace(":", COLON)
                .replace("{", OPEN_BRACE)
                .replace("}", CLOSE_BRACE);
    }

    public static JsonNode decode(String escaped) {
        String json = unescape(escaped);
        try {
            JsonNode node = MAPPER.readTree(json);
            if (node == null || node.isMissingNode()) {
                throw new CodecException("Attribute value is empty");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new CodecException("Attribute value is not valid encoded JSON: " + e.getOriginalMessage(), e);
        }
    }

    public static <T> T decode(String escaped, Class<T> type) {
        JsonNode node = decode(escaped);
        if (node.isNull()) {
            throw new CodecException("Attribute value is null, expected a " + type.getSimpleName());
        }
        try {
            return MAPPER.treeToValue(node, type);
        } catch (JsonProcessingException e) {
            throw new CodecException("Attribute value does not describe a " + type.getSimpleName()
                    + ": " + e.getOriginalMessage(), e);
        }
    }

    private static String unescape(String escaped) {
        if (escaped == null) {
            throw new CodecException("Attribute value is missing");
        }
        return escaped
                .replace(QUOTE, "\"")
                .replace(COLON, ":")
                .replace(OPEN_BRACE, "{")
                .replace(CLOSE_BRACE, "}");
    }

    private static ObjectMapper createMapper() {
        ObjectMapper mapper = new ObjectMapper()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        mapper.getFactory().setCharacterEscapes(new AmpersandEscapes());
        return mapper;
    }

    /**
     * Writes '&' as a JSON unicode escape so that decoding can never mistake text inside a
     * string value for one of the attribute escapes.
     */
    private static final class AmpersandEscapes extends CharacterEscapes {

        private final int[] asciiEscapes;

        AmpersandEscapes() {
            asciiEscapes = CharacterEscapes.standardAsciiEscapesForJSON();
            asciiEscapes['&'] = CharacterEscapes.ESCAPE_STANDARD;
        }

        @Override
        public int[] getEscapeCodesForAscii() {
            return asciiEscapes;
        }

        @Override
        public SerializableString getEscapeSequence(int ch) {
            return null;
        }
    }
}
