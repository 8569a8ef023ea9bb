package api.impl;

import api.interfaces.http.HttpResponse;

import java.nio.charset.StandardCharsets;

public class HttpResponseImpl implements HttpResponse {
    private int status = 200;
    private String reason = "OK";
    private String contentType;
    private byte[] body = new byte[0];

    @Override
    public void status(int code, String reason) {
        this.status = code;
        this.reason = reason;
    }

    @Override
    public void contentType(String contentType) {
        this.contentType = contentType;
    }

    @Override
    public void body(byte[] bytes) {
        this.body = bytes == null ? new byte[0] : bytes.clone();
    }

    @Override
    public void body(String text) {
        this.body = text == null ? new byte[0] : text.getBytes(StandardCharsets.ISO_8859_1);
    }

    // getters used by writer
    public int status() { return status; }
    public String reason() { return reason; }
    public String statusLine() { return status + " " + reason; }
    public String contentType() { return contentType; }
    public byte[] body() { return body; }

    /** No content type set: written as a bare status line with no headers. */
    public boolean isStatusOnly() { return contentType == null; }
}
