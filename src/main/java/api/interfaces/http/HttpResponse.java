package api.interfaces.http;

/**
 * Response being built by a handler. A response that never gets a content type is
 * written status-only.
 */
public interface HttpResponse {
    void status(int code, String reason);
    void contentType(String contentType);
    void body(byte[] bytes);

    /** Encodes {@code text} as ISO-8859-1, so text taken from the request goes back byte for byte. */
    void body(String text);
}
