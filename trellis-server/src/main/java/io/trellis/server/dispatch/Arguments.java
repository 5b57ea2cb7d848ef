package io.trellis.server.dispatch;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Lenient readers for loosely typed meta-tool arguments.
final class Arguments {

    private Arguments() {}

    /// Returns a non-blank string argument, or null.
    static String text(Map<String, Object> arguments, String key) {
        Object value = arguments.get(key);
        if (value == null) {
            return null;
        }
        String text = value.toString();
        return text.isBlank() ? null : text;
    }

    /// Returns true for `true` or the string `"true"` (any case).
    static boolean flag(Map<String, Object> arguments, String key) {
        Object value = arguments.get(key);
        if (value instanceof Boolean b) {
            return b;
        }
        return value != null && "true".equalsIgnoreCase(value.toString());
    }

    /// Returns an integer argument, accepting numbers and numeric strings.
    static int integer(Map<String, Object> arguments, String key, int defaultValue) {
        Object value = arguments.get(key);
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value != null) {
            try {
                return Integer.parseInt(value.toString().trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    /// Returns a list argument as strings; a single string becomes a one-element list.
    static List<String> strings(Map<String, Object> arguments, String key) {
        return strings(arguments.get(key));
    }

    static List<String> strings(Object value) {
        List<String> result = new ArrayList<>();
        if (value instanceof List<?> list) {
            for (Object element : list) {
                if (element != null) {
                    result.add(element.toString());
                }
            }
        } else if (value != null && !value.toString().isBlank()) {
            result.add(value.toString());
        }
        return result;
    }

    /// Returns an object argument with string keys, or null.
    static Map<String, Object> object(Map<String, Object> arguments, String key) {
        if (!(arguments.get(key) instanceof Map<?, ?> map)) {
            return null;
        }
        Map<String, Object> result = new LinkedHashMap<>();
        map.forEach((k, v) -> result.put(String.valueOf(k), v));
        return result;
    }
}
