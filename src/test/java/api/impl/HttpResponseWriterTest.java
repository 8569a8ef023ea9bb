package api.impl;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class HttpResponseWriterTest {

    @Test
    void structuredResponseHasExactFraming() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        HttpResponseWriter.sendStructured(out, "200 OK", "text/plain",
                "abc".getBytes(StandardCharsets.US_ASCII), false);

        assertEquals("HTTP/1.1 200 OK\r\n"
                + "Content-Type: text/plain\r\n"
                + "Content-Length: 3\r\n"
                + "Connection: keep-alive\r\n"
                + "\r\n"
                + "abc", out.toString(StandardCharsets.US_ASCII));
    }

    @Test
    void closingFlagSelectsConnectionClose() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        HttpResponseWriter.sendStructured(out, "200 OK", "text/plain", new byte[0], true);

        String r = out.toString(StandardCharsets.US_ASCII);
        assertTrue(r.contains("Connection: close\r\n"));
        assertTrue(r.contains("Content-Length: 0\r\n"));
        assertTrue(r.endsWith("\r\n\r\n"));
    }

    @Test
    void contentLengthCountsBytesNotChars() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] body = {0, 1, 2, (byte) 0xFF};
        HttpResponseWriter.sendStructured(out, "200 OK", "application/octet-stream", body, false);

        byte[] all = out.toByteArray();
        String head = new String(all, 0, all.length - body.length, StandardCharsets.US_ASCII);
        assertTrue(head.contains("Content-Length: 4\r\n"));
        assertEquals((byte) 0xFF, all[all.length - 1]);
    }

    @Test
    void rawIsWrittenUnmodified() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] raw = "HTTP/1.1 201 Created\r\n\r\n".getBytes(StandardCharsets.US_ASCII);
        HttpResponseWriter.sendRaw(out, raw);
        assertArrayEquals(raw, out.toByteArray());
    }

    @Test
    void statusOnlyResponseCarriesNoHeaders() throws IOException {
        HttpResponseImpl res = new HttpResponseImpl();
        res.status(404, "Not Found");
        assertTrue(res.isStatusOnly());

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        HttpResponseWriter.write(out, res, true);

        assertEquals("HTTP/1.1 404 Not Found\r\n\r\n", out.toString(StandardCharsets.US_ASCII));
    }

    @Test
    void writeUsesStructuredFormWhenContentTypeSet() throws IOException {
        HttpResponseImpl res = new HttpResponseImpl();
        res.status(200, "OK");
        res.contentType("text/plain");
        res.body("hi");

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        HttpResponseWriter.write(out, res, false);

        String r = out.toString(StandardCharsets.US_ASCII);
        assertTrue(r.startsWith("HTTP/1.1 200 OK\r\nContent-Type: text/plain\r\n"));
        assertTrue(r.endsWith("Connection: keep-alive\r\n\r\nhi"));
    }

    @Test
    void responseBodyIsCopiedFromCaller() throws IOException {
        byte[] content = "abc".getBytes(StandardCharsets.US_ASCII);
        HttpResponseImpl res = new HttpResponseImpl();
        res.contentType("application/octet-stream");
        res.body(content);
        content[0] = 'X';

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        HttpResponseWriter.write(out, res, false);

        assertTrue(out.toString(StandardCharsets.US_ASCII).endsWith("\r\n\r\nabc"));
    }

    @Test
    void writeFailurePropagates() {
        OutputStream broken = new OutputStream() {
            @Override public void write(int b) throws IOException { throw new IOException("broken pipe"); }
            @Override public void write(byte[] b, int off, int len) throws IOException { throw new IOException("broken pipe"); }
        };
        assertThrows(IOException.class,
                () -> HttpResponseWriter.sendRaw(broken, HttpResponseWriter.statusOnly("200 OK")));
    }
}
