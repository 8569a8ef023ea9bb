package api.impl;

import api.interfaces.IHandlerFactory;
import api.interfaces.http.HttpRequest;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.util.Arrays;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns one accepted connection for its whole life: read, parse, route, write, and
 * repeat until the client asks to close or the connection fails.
 * <p>
 * Every exit path goes through {@link State#CLOSED}, which closes the socket exactly once
 * and reports the session back to its owner.
 */
public final class ConnectionSession implements Runnable {

    private static final Logger LOG = Logger.getLogger(ConnectionSession.class.getName());

    public enum State { AWAITING_REQUEST, PARSING, DISPATCHING, RESPONDING, CLOSED }

    private final Socket socket;
    private final IHandlerFactory routes;
    private final HttpRequestParser parser;
    private final byte[] buffer;
    private final Consumer<ConnectionSession> onClose;
    private final String peer;

    private volatile State state = State.AWAITING_REQUEST;
    private boolean closing;
    private int served;

    public ConnectionSession(Socket socket, IHandlerFactory routes, HttpRequestParser parser,
                             int readBufferSize, Consumer<ConnectionSession> onClose) {
        this.socket = socket;
        this.routes = routes;
        this.parser = parser;
        this.buffer = new byte[readBufferSize];
        this.onClose = onClose;
        this.peer = String.valueOf(socket.getRemoteSocketAddress());
    }

    public State state() { return state; }

    /** Requests answered so far on this connection. */
    public int served() { return served; }

    @Override
    public void run() {
        LOG.fine(() -> "session opened for " + peer);
        try (socket; InputStream in = socket.getInputStream(); OutputStream out = socket.getOutputStream()) {
            while (true) {
                state = State.AWAITING_REQUEST;
                int n = in.read(buffer);
                if (n <= 0) break; // peer closed

                state = State.PARSING;
                closing = false;
                HttpRequest req;
                try {
                    req = parser.parse(in::read, buffer, n);
                } catch (MalformedRequestException e) {
                    LOG.fine(() -> peer + ": " + e.getMessage());
                    req = MinimalHttpRequest.empty();
                    closing = true; // stream position is unknown past this frame
                }

                state = State.DISPATCHING;
                String connection = req.header("connection");
                if (connection != null && connection.trim().equalsIgnoreCase("close")) {
                    closing = true;
                }
                HttpResponseImpl res = routes.route(req);
                final HttpRequest logged = req;
                LOG.fine(() -> peer + " " + logged + " -> " + res.statusLine());

                state = State.RESPONDING;
                HttpResponseWriter.write(out, res, closing);
                served++;

                if (closing) break;
                Arrays.fill(buffer, 0, n, (byte) 0);
            }
        } catch (SocketTimeoutException e) {
            LOG.fine(() -> peer + ": read timed out");
        } catch (SocketException e) {
            // reset by peer, broken pipe, or closed by abort()
            LOG.fine(() -> peer + ": " + e.getMessage());
        } catch (IOException e) {
            LOG.log(Level.WARNING, peer + ": I/O error in state " + state, e);
        } catch (Exception e) {
            LOG.log(Level.WARNING, peer + ": request failed in state " + state, e);
        } finally {
            state = State.CLOSED;
            LOG.fine(() -> "session closed for " + peer + " after " + served + " request(s)");
            onClose.accept(this);
        }
    }

    /** Closes the socket from another thread, unblocking any pending read. */
    public void abort() {
        try {
            socket.close();
        } catch (IOException e) {
            LOG.log(Level.FINE, peer + ": close failed", e);
        }
    }
}
