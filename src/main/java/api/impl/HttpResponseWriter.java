package api.impl;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Serializes responses onto a connection. Failures surface as {@link IOException}
 * and are fatal for that connection.
 */
public final class HttpResponseWriter {

    private static final String CRLF = "\r\n";

    private HttpResponseWriter() {}

    public static void write(OutputStream out, HttpResponseImpl res, boolean closing) throws IOException {
        if (res.isStatusOnly()) {
            sendRaw(out, statusOnly(res.statusLine()));
        } else {
            sendStructured(out, res.statusLine(), res.contentType(), res.body(), closing);
        }
    }

    /**
     * Status line, Content-Type, Content-Length and Connection, then the body.
     * Headers and body go out in a single write.
     */
    public static void sendStructured(OutputStream out, String status, String contentType,
                                      byte[] body, boolean closing) throws IOException {
        String head = "HTTP/1.1 " + status + CRLF
                + "Content-Type: " + contentType + CRLF
                + "Content-Length: " + body.length + CRLF
                + "Connection: " + (closing ? "close" : "keep-alive") + CRLF
                + CRLF;
        ByteArrayOutputStream frame = new ByteArrayOutputStream(head.length() + body.length);
        frame.write(head.getBytes(StandardCharsets.US_ASCII));
        frame.write(body);
        sendRaw(out, frame.toByteArray());
    }

    public static void sendRaw(OutputStream out, byte[] raw) throws IOException {
        out.write(raw);
        out.flush();
    }

    /** {@code HTTP/1.1 <status>\r\n\r\n}, no headers at all. */
    public static byte[] statusOnly(String status) {
        return ("HTTP/1.1 " + status + CRLF + CRLF).getBytes(StandardCharsets.US_ASCII);
    }
}
