package api.interfaces;

/*
AutoCloseable so the launcher and tests can use try-with-resources
 */
public interface IHttpServer extends AutoCloseable {

    /** Binds {@code port} (0 = ephemeral) and starts accepting in the background. */
    void start(int port) throws Exception;

    /** Bound port, or -1 before {@link #start(int)}. */
    int port();

    /** Blocks until the accept loop has stopped. */
    void awaitTermination() throws InterruptedException;

    @Override void close() throws Exception;
}
