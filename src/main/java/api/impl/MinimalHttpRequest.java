package api.impl;

import api.interfaces.http.HttpRequest;

import java.util.Locale;
import java.util.Map;

public class MinimalHttpRequest implements HttpRequest {
    private static final byte[] NO_BODY = new byte[0];

    private final String method;
    private final String path;
    private final String version;
    private final Map<String, String> headers;
    private final byte[] body;

    public MinimalHttpRequest(String method, String path, String version,
                              HttpHeaders headers, byte[] body) {
        this.method = method == null ? "" : method;
        this.path = path == null ? "" : path;
        this.version = version == null ? "" : version;
        this.headers = headers == null ? Map.of() : headers.asMap();
        this.body = body == null ? NO_BODY : body.clone();
    }

    /** Placeholder for a frame with no header terminator; routes to 404. */
    public static MinimalHttpRequest empty() {
        return new MinimalHttpRequest("", "", "", null, NO_BODY);
    }

    @Override public String method() { return method; }
    @Override public String path() { return path; }
    @Override public String version() { return version; }

    @Override
    public String header(String name) {
        if (name == null) return null;
        return headers.get(name.toLowerCase(Locale.ROOT));
    }

    @Override public Map<String, String> headers() { return headers; }

    @Override public byte[] body() { return body.clone(); }

    @Override public boolean isEmpty() { return method.isEmpty(); }

    @Override
    public String toString() {
        return method + " " + path + " " + version + " (" + body.length + " body bytes)";
    }
}
