package api.impl;

import api.interfaces.ByteSource;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Frames one request out of the bytes of a single read, pulling further body bytes
 * from a {@link ByteSource} until the declared Content-Length is reached.
 * <p>
 * Header text is decoded as ISO-8859-1, one char per byte, so paths and header values
 * are carried exactly as received. Stateless; one instance is shared by all sessions.
 */
public final class HttpRequestParser {

    private static final Logger LOG = Logger.getLogger(HttpRequestParser.class.getName());

    private static final byte[] HEADER_END = {'\r', '\n', '\r', '\n'};
    private static final String HEADER_SEPARATOR = ": ";

    private final int chunkSize;

    public HttpRequestParser(int chunkSize) {
        if (chunkSize <= 0) throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
        this.chunkSize = chunkSize;
    }

    /**
     * @param readMore continuation for body bytes not yet in {@code buffer}
     * @param buffer   bytes of the initial read
     * @param length   number of valid bytes in {@code buffer}
     * @return the request, or {@link MinimalHttpRequest#empty()} if {@code buffer} holds no CRLF CRLF
     * @throws MalformedRequestException if Content-Length is not a non-negative integer
     */
    public MinimalHttpRequest parse(ByteSource readMore, byte[] buffer, int length) throws MalformedRequestException {
        int headerEnd = indexOf(buffer, length, HEADER_END);
        if (headerEnd < 0) {
            LOG.fine("no header terminator in " + length + " bytes, treating as empty request");
            return MinimalHttpRequest.empty();
        }

        String headerSection = new String(buffer, 0, headerEnd, StandardCharsets.ISO_8859_1);
        String[] lines = headerSection.split("\n", -1);

        String[] requestLine = lines[0].trim().split("\\s+");
        String method = token(requestLine, 0);
        String path = token(requestLine, 1);
        String version = token(requestLine, 2);

        HttpHeaders headers = new HttpHeaders();
        for (int i = 1; i < lines.length; i++) {
            String line = lines[i];
            if (line.endsWith("\r")) line = line.substring(0, line.length() - 1);
            int sep = line.indexOf(HEADER_SEPARATOR);
            if (sep < 0) continue;
            headers.put(line.substring(0, sep), line.substring(sep + HEADER_SEPARATOR.length()));
        }

        int contentLength = contentLength(headers.get("content-length"));
        byte[] body = readBody(readMore, buffer, headerEnd + HEADER_END.length, length, contentLength);
        return new MinimalHttpRequest(method, path, version, headers, body);
    }

    private byte[] readBody(ByteSource readMore, byte[] buffer, int bodyStart, int length, int contentLength) {
        if (contentLength == 0) return new byte[0];

        // sized by what arrives, not by the declared length
        ByteArrayOutputStream body = new ByteArrayOutputStream(Math.min(contentLength, chunkSize));
        body.write(buffer, bodyStart, Math.min(length - bodyStart, contentLength));

        byte[] chunk = new byte[chunkSize];
        while (body.size() < contentLength) {
            int n;
            try {
                n = readMore.read(chunk);
            } catch (IOException e) {
                LOG.log(Level.FINE, "body read failed after " + body.size() + " of " + contentLength + " bytes", e);
                break;
            }
            if (n < 0) {
                LOG.fine("peer closed after " + body.size() + " of " + contentLength + " body bytes");
                break;
            }
            body.write(chunk, 0, Math.min(n, contentLength - body.size()));
        }
        return body.toByteArray();
    }

    /** Absent header means 0. */
    static int contentLength(String value) throws MalformedRequestException {
        if (value == null) return 0;
        try {
            int n = Integer.parseInt(value.trim());
            if (n < 0) throw new MalformedRequestException("negative Content-Length: " + value);
            return n;
        } catch (NumberFormatException e) {
            throw new MalformedRequestException("invalid Content-Length: " + value, e);
        }
    }

    /** First occurrence of {@code pattern} in {@code data[0, length)}, or -1. */
    static int indexOf(byte[] data, int length, byte[] pattern) {
        outer:
        for (int i = 0; i <= length - pattern.length; i++) {
            for (int j = 0; j < pattern.length; j++) {
                if (data[i + j] != pattern[j]) continue outer;
            }
            return i;
        }
        return -1;
    }

    private static String token(String[] parts, int index) {
        return index < parts.length ? parts[index] : "";
    }
}
