package api.impl;

import api.interfaces.IHandlerFactory;
import api.interfaces.IHttpServer;
import infrastructure.config.ServerConfig;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Accept loop plus a pool with one worker per open connection.
 * <p>
 * The pool is unbounded: the only limit on concurrent sessions is the listen backlog
 * and what the OS allows. Live sessions are tracked so {@link #close()} can end them.
 */
public final class SocketHttpServer implements IHttpServer {

    private static final Logger LOG = Logger.getLogger(SocketHttpServer.class.getName());

    private final ServerConfig config;
    private final IHandlerFactory routes;
    private final HttpRequestParser parser;
    private final ExecutorService workers;
    private final Set<ConnectionSession> sessions = ConcurrentHashMap.newKeySet();

    private volatile ServerSocket serverSocket;
    private Thread acceptor;

    public SocketHttpServer(ServerConfig config, IHandlerFactory routes) {
        this.config = config;
        this.routes = routes;
        this.parser = new HttpRequestParser(config.readBufferSize());
        this.workers = Executors.newCachedThreadPool(new SessionThreadFactory());
    }

    @Override
    public synchronized void start(int port) throws IOException {
        if (serverSocket != null) throw new IllegalStateException("already started");

        ServerSocket ss = new ServerSocket();
        try {
            ss.setReuseAddress(true);
            ss.bind(new InetSocketAddress(port), config.backlog());
        } catch (IOException e) {
            ss.close();
            throw e;
        }
        serverSocket = ss;
        LOG.info(() -> "listening on port " + ss.getLocalPort() + ", serving " + config.directory());

        acceptor = new Thread(() -> acceptLoop(ss), "http-acceptor");
        acceptor.start();
    }

    private void acceptLoop(ServerSocket ss) {
        while (!ss.isClosed()) {
            Socket client;
            try {
                client = ss.accept();
            } catch (SocketException e) {
                if (ss.isClosed()) break;
                LOG.log(Level.WARNING, "accept failed", e);
                continue;
            } catch (IOException e) {
                LOG.log(Level.WARNING, "accept failed", e);
                continue;
            }
            dispatch(client);
        }
        LOG.info("accept loop stopped");
    }

    private void dispatch(Socket client) {
        ConnectionSession session;
        try {
            client.setSoTimeout(config.readTimeoutMillis());
            session = new ConnectionSession(client, routes, parser, config.readBufferSize(), sessions::remove);
        } catch (SocketException e) {
            LOG.log(Level.FINE, "dropping connection before session start", e);
            closeQuietly(client);
            return;
        }
        sessions.add(session);
        try {
            workers.execute(session);
        } catch (RejectedExecutionException e) {
            // shutting down
            sessions.remove(session);
            closeQuietly(client);
        }
    }

    @Override
    public int port() {
        ServerSocket ss = serverSocket;
        return ss == null ? -1 : ss.getLocalPort();
    }

    /** Sessions accepted and not yet closed. */
    public int activeSessions() {
        return sessions.size();
    }

    @Override
    public void awaitTermination() throws InterruptedException {
        Thread t;
        synchronized (this) { t = acceptor; }
        if (t != null) t.join();
    }

    @Override
    public void close() throws IOException, InterruptedException {
        ServerSocket ss = serverSocket;
        if (ss != null) ss.close();

        workers.shutdown();
        for (ConnectionSession s : sessions) s.abort();
        if (!workers.awaitTermination(config.shutdownGraceMillis(), TimeUnit.MILLISECONDS)) {
            LOG.warning("sessions still running after " + config.shutdownGraceMillis() + "ms, interrupting");
            workers.shutdownNow();
        }
        awaitTermination();
    }

    private static void closeQuietly(Socket s) {
        try {
            s.close();
        } catch (IOException e) {
            LOG.log(Level.FINE, "close failed", e);
        }
    }

    private static final class SessionThreadFactory implements ThreadFactory {
        private final AtomicInteger seq = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "http-session-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
