package infrastructure.impl;

import infrastructure.interfaces.IFileStore;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Files under a base directory. The path is {@code baseDir + "/" + name} with no
 * normalization or escaping, so {@code name} may contain further separators.
 * Holds no mutable state and is shared by all sessions.
 */
public final class DirectoryFileStore implements IFileStore {
    private static final Logger LOG = Logger.getLogger(DirectoryFileStore.class.getName());

    private final String baseDir;

    public DirectoryFileStore(String baseDir) {
        this.baseDir = baseDir;
    }

    @Override
    public Optional<byte[]> read(String name) {
        try {
            Path file = resolve(name);
            if (!Files.isRegularFile(file)) return Optional.empty();
            return Optional.of(Files.readAllBytes(file));
        } catch (IOException | InvalidPathException e) {
            LOG.log(Level.FINE, "cannot read " + baseDir + "/" + name, e);
            return Optional.empty();
        }
    }

    @Override
    public void write(String name, byte[] data) throws IOException {
        Path file;
        try {
            file = resolve(name);
        } catch (InvalidPathException e) {
            throw new IOException("invalid file name: " + name, e);
        }
        // no createDirectories: a missing parent is a write failure
        try (OutputStream os = Files.newOutputStream(file,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
            os.write(data);
            os.flush();
        }
    }

    Path resolve(String name) {
        return Paths.get(baseDir + "/" + name);
    }
}
