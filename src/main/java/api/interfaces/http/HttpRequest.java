package api.interfaces.http;

import java.util.Map;

/** Parsed, immutable request. */
public interface HttpRequest {
    String method();
    String path();
    String version();

    /** Case-insensitive lookup, {@code null} when absent. */
    String header(String name);

    /** Lowercase name to raw value, in arrival order. */
    Map<String, String> headers();

    byte[] body();

    /** True for the placeholder produced when no header terminator was found. */
    boolean isEmpty();
}
