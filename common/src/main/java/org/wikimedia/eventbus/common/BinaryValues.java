package org.wikimedia.eventbus.common;

import static java.nio.charset.StandardCharsets.UTF_8;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.google.common.io.BaseEncoding;

/**
 * Makes raw byte values safe to carry in JSON events.
 *
 * Bytes that decode as UTF-8 become plain strings. Anything else is encoded
 * as a {@code data:} URI that the job runner knows how to turn back into the
 * original bytes.
 */
public final class BinaryValues {
    public static final String BINARY_PREFIX = "data:application/octet-stream;base64,";

    private BinaryValues() {
        // Utility class should not be constructed
    }

    /**
     * Replace a single value, leaving anything that is not a byte array untouched.
     */
    public static Object replace(Object value) {
        if (!(value instanceof byte[])) return value;
        byte[] bytes = (byte[]) value;
        Optional<String> text = asUtf8(bytes);
        if (text.isPresent()) return text.get();
        return encode(bytes);
    }

    /**
     * Replace byte values found anywhere in nested maps and lists.
     *
     * Returns a new structure, the input is not modified.
     */
    public static Object replaceRecursive(Object value) {
        if (value instanceof Map) {
            Map<?, ?> map = (Map<?, ?>) value;
            Map<String, Object> replaced = new LinkedHashMap<>();
            map.forEach((k, v) -> replaced.put(String.valueOf(k), replaceRecursive(v)));
            return replaced;
        }
        if (value instanceof List) {
            List<Object> replaced = new ArrayList<>();
            for (Object v : (List<?>) value) {
                replaced.add(replaceRecursive(v));
            }
            return replaced;
        }
        return replace(value);
    }

    public static String encode(byte[] bytes) {
        return BINARY_PREFIX + BaseEncoding.base64().encode(bytes);
    }

    public static boolean isEncoded(Object value) {
        return value instanceof String && ((String) value).startsWith(BINARY_PREFIX);
    }

    /**
     * Decode a value produced by {@link #encode(byte[])}.
     *
     * @throws IllegalArgumentException if the value is not a valid encoded binary value
     */
    public static byte[] decode(String value) {
        if (!value.startsWith(BINARY_PREFIX)) {
            throw new IllegalArgumentException("Not an encoded binary value");
        }
        String payload = value.substring(BINARY_PREFIX.length());
        if (payload.isEmpty()) {
            throw new IllegalArgumentException("Empty base64 payload");
        }
        return BaseEncoding.base64().decode(payload);
    }

    /**
     * Turn values encoded by {@link #replaceRecursive(Object)} back into byte
     * arrays, anywhere in nested maps and lists.
     *
     * Returns a new structure, the input is not modified.
     *
     * @throws IllegalArgumentException if an encoded value cannot be decoded
     */
    public static Object decodeRecursive(Object value) {
        if (value instanceof Map) {
            Map<String, Object> decoded = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                decoded.put(String.valueOf(entry.getKey()), decodeRecursive(entry.getValue()));
            }
            return decoded;
        }
        if (value instanceof List) {
            List<Object> decoded = new ArrayList<>();
            for (Object v : (List<?>) value) {
                decoded.add(decodeRecursive(v));
            }
            return decoded;
        }
        if (isEncoded(value)) return decode((String) value);
        return value;
    }

    private static Optional<String> asUtf8(byte[] bytes) {
        try {
            return Optional.of(UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString());
        } catch (CharacterCodingException e) {
            return Optional.empty();
        }
    }
}
