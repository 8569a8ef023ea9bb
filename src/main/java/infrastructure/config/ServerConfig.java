package infrastructure.config;

import java.util.Objects;

/**
 * Immutable server settings, built once at startup and handed to the listener,
 * the sessions and the file store.
 */
public final class ServerConfig {

    public static final int DEFAULT_PORT = 4221;
    public static final String DEFAULT_DIRECTORY = ".";
    public static final int DEFAULT_BACKLOG = 5;
    public static final int DEFAULT_READ_BUFFER_SIZE = 4096;
    /** 0 means a session waits forever for the next bytes. */
    public static final int DEFAULT_READ_TIMEOUT_MILLIS = 0;
    public static final long DEFAULT_SHUTDOWN_GRACE_MILLIS = 5_000L;

    private final int port;
    private final String directory;
    private final int backlog;
    private final int readBufferSize;
    private final int readTimeoutMillis;
    private final long shutdownGraceMillis;

    private ServerConfig(Builder b) {
        this.port = b.port;
        this.directory = b.directory;
        this.backlog = b.backlog;
        this.readBufferSize = b.readBufferSize;
        this.readTimeoutMillis = b.readTimeoutMillis;
        this.shutdownGraceMillis = b.shutdownGraceMillis;
    }

    public static ServerConfig defaults() { return builder().build(); }

    public static Builder builder() { return new Builder(); }

    public int port() { return port; }

    /** Base directory, used verbatim as a path prefix. */
    public String directory() { return directory; }

    public int backlog() { return backlog; }
    public int readBufferSize() { return readBufferSize; }
    public int readTimeoutMillis() { return readTimeoutMillis; }
    public long shutdownGraceMillis() { return shutdownGraceMillis; }

    public Builder toBuilder() {
        return builder()
                .port(port)
                .directory(directory)
                .backlog(backlog)
                .readBufferSize(readBufferSize)
                .readTimeoutMillis(readTimeoutMillis)
                .shutdownGraceMillis(shutdownGraceMillis);
    }

    @Override
    public String toString() {
        return "ServerConfig{port=" + port + ", directory='" + directory + "', backlog=" + backlog
                + ", readBufferSize=" + readBufferSize + ", readTimeoutMillis=" + readTimeoutMillis
                + ", shutdownGraceMillis=" + shutdownGraceMillis + "}";
    }

    public static final class Builder {
        private int port = DEFAULT_PORT;
        private String directory = DEFAULT_DIRECTORY;
        private int backlog = DEFAULT_BACKLOG;
        private int readBufferSize = DEFAULT_READ_BUFFER_SIZE;
        private int readTimeoutMillis = DEFAULT_READ_TIMEOUT_MILLIS;
        private long shutdownGraceMillis = DEFAULT_SHUTDOWN_GRACE_MILLIS;

        private Builder() {}

        public Builder port(int port) {
            if (port < 0 || port > 65_535) throw new IllegalArgumentException("port out of range: " + port);
            this.port = port;
            return this;
        }

        public Builder directory(String directory) {
            Objects.requireNonNull(directory, "directory");
            if (directory.isEmpty()) throw new IllegalArgumentException("directory must not be empty");
            this.directory = directory;
            return this;
        }

        public Builder backlog(int backlog) {
            if (backlog < 1) throw new IllegalArgumentException("backlog must be >= 1: " + backlog);
            this.backlog = backlog;
            return this;
        }

        public Builder readBufferSize(int readBufferSize) {
            // room for at least a request line and the blank line
            if (readBufferSize < 16) throw new IllegalArgumentException("readBufferSize too small: " + readBufferSize);
            this.readBufferSize = readBufferSize;
            return this;
        }

        public Builder readTimeoutMillis(int readTimeoutMillis) {
            if (readTimeoutMillis < 0) throw new IllegalArgumentException("readTimeoutMillis must be >= 0: " + readTimeoutMillis);
            this.readTimeoutMillis = readTimeoutMillis;
            return this;
        }

        public Builder shutdownGraceMillis(long shutdownGraceMillis) {
            this.shutdownGraceMillis = Math.max(0L, shutdownGraceMillis);
            return this;
        }

        public ServerConfig build() { return new ServerConfig(this); }
    }
}
