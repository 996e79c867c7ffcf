package org.neuralchilli.conductor.util;

import java.util.List;
import java.util.Map;

/**
 * Dotted-path lookups into decoded JSON values, e.g. {@code "meta.links.0.href"}.
 */
public final class PathValues {

    private PathValues() {
    }

    /**
     * Resolve {@code path} against {@code root}. A blank path yields the root itself;
     * a path that runs into a missing key or a scalar yields null.
     */
    public static Object resolve(Object root, String path) {
        if (path == null || path.isBlank()) {
            return root;
        }
        Object current = root;
        for (String segment : path.split("\\.")) {
            if (current instanceof Map) {
                current = ((Map<?, ?>) current).get(segment);
            } else if (current instanceof List && isIndex(segment)) {
                List<?> list = (List<?>) current;
                int index = Integer.parseInt(segment);
                current = index < list.size() ? list.get(index) : null;
            } else {
                return null;
            }
            if (current == null) {
                return null;
            }
        }
        return current;
    }

    /**
     * Path without its first segment, or "" when it has only one.
     */
    public static String tail(String path) {
        int idx = path.indexOf('.');
        return idx >= 0 ? path.substring(idx + 1) : "";
    }

    public static String head(String path) {
        int idx = path.indexOf('.');
        return idx >= 0 ? path.substring(0, idx) : path;
    }

    private static boolean isIndex(String segment) {
        if (segment.isEmpty() || segment.length() > 9) {
            return false;
        }
        for (int i = 0; i < segment.length(); i++) {
            if (!Character.isDigit(segment.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
