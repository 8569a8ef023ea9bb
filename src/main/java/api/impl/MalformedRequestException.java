package api.impl;

/** The header block was found but cannot be framed, e.g. a non-numeric Content-Length. */
public class MalformedRequestException extends Exception {
    public MalformedRequestException(String message) {
        super(message);
    }

    public MalformedRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
