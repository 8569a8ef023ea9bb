package infrastructure.impl;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class DirectoryFileStoreTest {

    @TempDir Path tmp;

    @Test
    void writeThenRead() throws IOException {
        DirectoryFileStore store = new DirectoryFileStore(tmp.toString());
        byte[] data = {0, 1, 2, (byte) 0x80, (byte) 0xFF};

        store.write("blob.bin", data);

        assertArrayEquals(data, Files.readAllBytes(tmp.resolve("blob.bin")));
        assertArrayEquals(data, store.read("blob.bin").orElseThrow());
    }

    @Test
    void writeOverwritesAndTruncates() throws IOException {
        DirectoryFileStore store = new DirectoryFileStore(tmp.toString());
        store.write("f.txt", "a much longer first version".getBytes(StandardCharsets.US_ASCII));
        store.write("f.txt", "short".getBytes(StandardCharsets.US_ASCII));

        assertEquals("short", Files.readString(tmp.resolve("f.txt"), StandardCharsets.US_ASCII));
    }

    @Test
    void emptyBodyCreatesEmptyFile() throws IOException {
        DirectoryFileStore store = new DirectoryFileStore(tmp.toString());
        store.write("empty", new byte[0]);
        assertEquals(0L, Files.size(tmp.resolve("empty")));
        assertEquals(0, store.read("empty").orElseThrow().length);
    }

    @Test
    void missingFileReadsEmpty() {
        DirectoryFileStore store = new DirectoryFileStore(tmp.toString());
        assertEquals(Optional.empty(), store.read("does-not-exist"));
    }

    @Test
    void directoryIsNotReadable() throws IOException {
        Files.createDirectory(tmp.resolve("sub"));
        DirectoryFileStore store = new DirectoryFileStore(tmp.toString());
        assertTrue(store.read("sub").isEmpty());
    }

    @Test
    void writeIntoMissingDirectoryFails() {
        DirectoryFileStore store = new DirectoryFileStore(tmp.toString());
        assertThrows(IOException.class, () -> store.write("no/such/dir/file.txt", new byte[]{1}));
        assertFalse(Files.exists(tmp.resolve("no")));
    }

    @Test
    void nameIsAppendedVerbatim() throws IOException {
        Files.createDirectory(tmp.resolve("nested"));
        DirectoryFileStore store = new DirectoryFileStore(tmp.toString());

        store.write("nested/inner.txt", new byte[]{42});

        assertEquals(tmp.resolve("nested").resolve("inner.txt"), store.resolve("nested/inner.txt"));
        assertArrayEquals(new byte[]{42}, Files.readAllBytes(tmp.resolve("nested/inner.txt")));
    }

    @Test
    void invalidNameFailsAsIOException() {
        DirectoryFileStore store = new DirectoryFileStore(tmp.toString());
        assertThrows(IOException.class, () -> store.write("bad\u0000name", new byte[]{1}));
        assertTrue(store.read("bad\u0000name").isEmpty());
    }
}
