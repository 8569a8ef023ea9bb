package infrastructure.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads a JSON settings file on top of a base config. Keys that are missing or null
 * keep the base value:
 * <pre>
 * { "port": 4221, "directory": "/tmp/files", "backlog": 5,
 *   "readBufferSize": 4096, "readTimeoutMillis": 0, "shutdownGraceMillis": 5000 }
 * </pre>
 */
public final class ServerConfigLoader {
    private static final Gson gson = new GsonBuilder().create();

    private ServerConfigLoader() {}

    /** @throws IllegalArgumentException if the file cannot be read or is not valid settings JSON */
    public static ServerConfig load(Path file, ServerConfig base) {
        String json;
        try {
            json = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalArgumentException("cannot read config file " + file + ": " + e.getMessage(), e);
        }
        return parse(json, base);
    }

    public static ServerConfig parse(String json, ServerConfig base) {
        Settings s;
        try {
            s = gson.fromJson(json, Settings.class);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("invalid config JSON: " + e.getMessage(), e);
        }
        if (s == null) return base;

        ServerConfig.Builder b = base.toBuilder();
        if (s.port != null) b.port(s.port);
        if (s.directory != null) b.directory(s.directory);
        if (s.backlog != null) b.backlog(s.backlog);
        if (s.readBufferSize != null) b.readBufferSize(s.readBufferSize);
        if (s.readTimeoutMillis != null) b.readTimeoutMillis(s.readTimeoutMillis);
        if (s.shutdownGraceMillis != null) b.shutdownGraceMillis(s.shutdownGraceMillis);
        return b.build();
    }

    /** Wire shape of the file; Gson fills the fields reflectively. */
    private static final class Settings {
        Integer port;
        String directory;
        Integer backlog;
        Integer readBufferSize;
        Integer readTimeoutMillis;
        Long shutdownGraceMillis;
    }
}
