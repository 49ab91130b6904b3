package io.storyforge.core;

import java.util.LinkedHashMap;
import java.util.Map;

/** Lenient coercion of loosely typed payload values. */
final class PayloadValues {

    private PayloadValues() {}

    static String string(Map<String, Object> payload, String key) {
        Object v = payload.get(key);
        return v == null ? null : String.valueOf(v);
    }

    /** Out-of-range values saturate at the {@code int} bounds. */
    static int integer(Map<String, Object> payload, String key, int fallback) {
        return saturate(longValue(payload.get(key), fallback));
    }

    /** Absolute value, saturating at {@link Integer#MAX_VALUE}. */
    static int magnitude(Map<String, Object> payload, String key) {
        long v = longValue(payload.get(key), 0);
        return v == Long.MIN_VALUE ? Integer.MAX_VALUE : saturate(Math.abs(v));
    }

    static int saturate(long v) {
        return (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, v));
    }

    static long longValue(Object v, long fallback) {
        if (v instanceof Number n) return n.longValue();
        if (v instanceof String s) {
            try {
                return Long.parseLong(s.trim());
            } catch (NumberFormatException e) {
                return fallback;
            }
        }
        return fallback;
    }

    static Integer nullableInteger(Map<String, Object> payload, String key) {
        Object v = payload.get(key);
        if (v == null) return null;
        long parsed = longValue(v, Long.MIN_VALUE);
        return parsed == Long.MIN_VALUE ? null : saturate(parsed);
    }

    static Map<String, Object> map(Map<String, Object> payload, String key) {
        var out = new LinkedHashMap<String, Object>();
        if (payload.get(key) instanceof Map<?, ?> m) m.forEach((k, v) -> out.put(String.valueOf(k), v));
        return out;
    }
}
