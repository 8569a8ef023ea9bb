package api.interfaces;

import java.io.IOException;

/**
 * Continuation used by the request parser to pull more body bytes off the connection.
 * Same contract as {@link java.io.InputStream#read(byte[])}: blocks until at least one
 * byte is available, returns {@code -1} at end of stream.
 */
@FunctionalInterface
public interface ByteSource {
    int read(byte[] chunk) throws IOException;
}
