package org.neuralchilli.conductor.messaging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;

/**
 * JSON encoding of everything that crosses the broker or lands in the state store.
 */
@ApplicationScoped
public class MessageCodec {

    private static final Logger log = LoggerFactory.getLogger(MessageCodec.class);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper = new ObjectMapper();

    public String encode(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot encode value of type "
                    + (value != null ? value.getClass().getName() : "null"), e);
        }
    }

    /**
     * Decode a JSON object.
     *
     * @throws IllegalArgumentException if the payload is not a JSON object
     */
    public Map<String, Object> decodeMap(String payload) {
        try {
            Map<String, Object> map = objectMapper.readValue(payload, MAP_TYPE);
            if (map == null) {
                throw new IllegalArgumentException("Payload is JSON null");
            }
            return map;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Payload is not a JSON object: " + abbreviate(payload), e);
        }
    }

    /**
     * Decode any JSON value; a payload that is not JSON comes back as the raw string.
     */
    public Object decode(String payload) {
        if (payload == null) {
            return null;
        }
        try {
            return objectMapper.readValue(payload, Object.class);
        } catch (JsonProcessingException e) {
            log.trace("Payload is not JSON, using raw string: {}", e.getOriginalMessage());
            return payload;
        }
    }

    /**
     * Decode a value that may have been JSON-encoded as a string, possibly wrapped
     * as a bytes literal ({@code b'...'}).
     */
    public Optional<Object> tryDecodeEncoded(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String text = value.trim();
        if (text.length() >= 3 && ((text.startsWith("b'") && text.endsWith("'"))
                || (text.startsWith("b\"") && text.endsWith("\"")))) {
            text = unescapeBytesLiteral(text.substring(2, text.length() - 1));
        }
        if (text.isEmpty() || !(text.startsWith("[") || text.startsWith("{") || text.startsWith("\""))) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.readValue(text, Object.class));
        } catch (JsonProcessingException e) {
            log.trace("Value is not encoded JSON: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    /**
     * Convert a value to plain JSON types (maps, lists, strings, numbers, booleans).
     *
     * @throws IllegalArgumentException if the value cannot be represented as JSON
     */
    public Object toJsonTree(Object value) {
        return objectMapper.convertValue(value, Object.class);
    }

    private static String abbreviate(String payload) {
        if (payload == null) {
            return "null";
        }
        return payload.length() > 120 ? payload.substring(0, 120) + "..." : payload;
    }

    /**
     * Undo the escaping of a bytes literal body: {@code \\}, quotes, {@code \n}, {@code \r},
     * {@code \t} and {@code \xNN}. {@code \xNN} sequences are raw bytes of UTF-8 text.
     * Unknown escapes are kept as written.
     */
    static String unescapeBytesLiteral(String body) {
        if (body.indexOf('\\') < 0) {
            return body;
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream(body.length());
        StringBuilder plain = new StringBuilder();
        int i = 0;
        while (i < body.length()) {
            char c = body.charAt(i);
            if (c != '\\' || i + 1 >= body.length()) {
                plain.append(c);
                i++;
                continue;
            }
            char next = body.charAt(i + 1);
            switch (next) {
                case '\\', '\'', '"' -> plain.append(next);
                case 'n' -> plain.append('\n');
                case 'r' -> plain.append('\r');
                case 't' -> plain.append('\t');
                case 'x' -> {
                    if (i + 3 < body.length() && isHex(body.charAt(i + 2)) && isHex(body.charAt(i + 3))) {
                        flush(plain, out);
                        out.write(Integer.parseInt(body.substring(i + 2, i + 4), 16));
                        i += 4;
                        continue;
                    }
                    plain.append(c).append(next);
                }
                default -> plain.append(c).append(next);
            }
            i += 2;
        }
        flush(plain, out);
        return out.toString(StandardCharsets.UTF_8);
    }

    private static boolean isHex(char c) {
        return Character.digit(c, 16) >= 0;
    }

    private static void flush(StringBuilder plain, ByteArrayOutputStream out) {
        if (plain.length() > 0) {
            out.writeBytes(plain.toString().getBytes(StandardCharsets.UTF_8));
            plain.setLength(0);
        }
    }
}
