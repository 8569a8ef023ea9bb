package infrastructure.interfaces;

import java.io.IOException;
import java.util.Optional;

/** Binary files addressed by the name segment of a {@code /files/<name>} path. */
public interface IFileStore {

    /** Whole file contents, or empty if the file is missing or cannot be read. */
    Optional<byte[]> read(String name);

    /** Creates or truncates the file and writes {@code data} verbatim. */
    void write(String name, byte[] data) throws IOException;
}
