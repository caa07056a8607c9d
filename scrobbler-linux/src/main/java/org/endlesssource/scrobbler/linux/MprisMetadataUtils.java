package org.endlesssource.scrobbler.linux;

import org.freedesktop.dbus.DBusPath;
import org.freedesktop.dbus.types.Variant;

import java.lang.reflect.Array;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Unwraps D-Bus variants in MPRIS property values into plain maps, lists, strings and numbers.
 */
final class MprisMetadataUtils {
    private MprisMetadataUtils() {
    }

    static Optional<Map<String, Object>> toMetadataMap(Object metadata) {
        if (metadata == null) {
            return Optional.empty();
        }

        Object value;
        if (metadata instanceof Variant<?> metadataVariant) {
            value = metadataVariant.getValue();
        } else if (metadata instanceof Map<?, ?>) {
            // Firefox returns the map directly
            value = metadata;
        } else {
            return Optional.empty();
        }

        if (!(value instanceof Map<?, ?> rawMetadata) || rawMetadata.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(normalizeMap(rawMetadata));
    }

    static Object unwrap(Object value) {
        if (value instanceof Variant<?> variant) {
            return unwrap(variant.getValue());
        }
        if (value instanceof Map<?, ?> nestedMap) {
            return normalizeMap(nestedMap);
        }
        if (value instanceof Collection<?> collection) {
            return collection.stream().map(MprisMetadataUtils::unwrap).toList();
        }
        if (value != null && value.getClass().isArray() && !(value instanceof byte[])) {
            int length = Array.getLength(value);
            List<Object> unwrapped = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                unwrapped.add(unwrap(Array.get(value, i)));
            }
            return unwrapped;
        }
        return value;
    }

    static Optional<String> asString(Object value) {
        if (value instanceof CharSequence sequence && sequence.length() > 0) {
            return Optional.of(sequence.toString());
        }
        // mpris:trackid is an object path
        if (value instanceof DBusPath path) {
            String objectPath = path.getPath();
            return objectPath == null || objectPath.isEmpty() ? Optional.empty() : Optional.of(objectPath);
        }
        if (value instanceof byte[] bytes) {
            String decoded = new String(bytes, StandardCharsets.UTF_8).trim();
            return decoded.isEmpty() ? Optional.empty() : Optional.of(decoded);
        }
        if (value instanceof List<?> list) {
            for (Object element : list) {
                Optional<String> coerced = asString(element);
                if (coerced.isPresent()) {
                    return coerced;
                }
            }
        }
        return Optional.empty();
    }

    /**
     * All non-empty strings of a list value, or the single string of a scalar value.
     */
    static List<String> asStringList(Object value) {
        List<String> strings = new ArrayList<>();
        if (value instanceof List<?> list) {
            for (Object element : list) {
                asString(element).ifPresent(strings::add);
            }
        } else {
            asString(value).ifPresent(strings::add);
        }
        return strings;
    }

    static Optional<Long> asLong(Object value) {
        if (value instanceof Number number) {
            return Optional.of(number.longValue());
        }
        if (value instanceof String text) {
            try {
                return Optional.of(Long.parseLong(text.trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        if (value instanceof List<?> list) {
            for (Object element : list) {
                Optional<Long> coerced = asLong(element);
                if (coerced.isPresent()) {
                    return coerced;
                }
            }
        }
        return Optional.empty();
    }

    private static Map<String, Object> normalizeMap(Map<?, ?> rawMap) {
        Map<String, Object> normalized = new HashMap<>();
        rawMap.forEach((key, rawValue) -> {
            if (key instanceof String keyStr) {
                normalized.put(keyStr, unwrap(rawValue));
            }
        });
        return normalized;
    }
}
