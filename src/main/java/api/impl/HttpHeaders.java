package api.impl;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Request header block. Names are lowercased here and nowhere else; a repeated name
 * replaces the earlier value but keeps its original position.
 */
public final class HttpHeaders {

    private final Map<String, String> values = new LinkedHashMap<>();

    public void put(String name, String value) {
        values.put(normalize(name), value);
    }

    public String get(String name) {
        if (name == null) return null;
        return values.get(normalize(name));
    }

    /** Read-only snapshot. */
    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    private static String normalize(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
