package app;

import api.impl.SocketHttpServer;
import api.impl.handlers.RouteTable;
import infrastructure.config.ServerConfig;
import infrastructure.config.ServerConfigLoader;
import infrastructure.impl.DirectoryFileStore;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Paths;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Entry point.
 * <pre>
 *   java -jar http-file-server.jar [--directory DIR] [--port N] [--config FILE.json]
 * </pre>
 * Flags win over the config file, which wins over the defaults.
 */
public class FileServerMain {

    private static final Logger LOG = Logger.getLogger(FileServerMain.class.getName());

    static final String USAGE = "usage: FileServerMain [--directory DIR] [--port N] [--config FILE.json]";

    public static void main(String[] args) throws Exception {
        configureLogging();

        ServerConfig config;
        try {
            config = parseArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(USAGE);
            System.exit(1);
            return;
        }
        LOG.info(config::toString);

        SocketHttpServer server = new SocketHttpServer(config,
                RouteTable.defaults(new DirectoryFileStore(config.directory())));
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                server.close();
            } catch (Exception e) {
                LOG.log(Level.WARNING, "shutdown failed", e);
            }
        }, "http-shutdown"));

        server.start(config.port());
        server.awaitTermination();
    }

    /** @throws IllegalArgumentException on unknown flags, missing values or bad numbers */
    static ServerConfig parseArgs(String[] args) {
        String directory = null;
        String port = null;
        String configFile = null;
        for (int i = 0; i < args.length; i++) {
            String flag = args[i];
            switch (flag) {
                case "--directory" -> directory = value(args, ++i, flag);
                case "--port" -> port = value(args, ++i, flag);
                case "--config" -> configFile = value(args, ++i, flag);
                default -> throw new IllegalArgumentException("unknown argument: " + flag);
            }
        }

        ServerConfig config = ServerConfig.defaults();
        if (configFile != null) config = ServerConfigLoader.load(Paths.get(configFile), config);

        ServerConfig.Builder b = config.toBuilder();
        if (directory != null) b.directory(directory);
        if (port != null) {
            try {
                b.port(Integer.parseInt(port));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("--port expects a number: " + port, e);
            }
        }
        return b.build();
    }

    private static String value(String[] args, int i, String flag) {
        if (i >= args.length) throw new IllegalArgumentException(flag + " needs a value");
        return args[i];
    }

    private static void configureLogging() {
        try (InputStream in = FileServerMain.class.getResourceAsStream("/logging.properties")) {
            if (in != null) LogManager.getLogManager().readConfiguration(in);
        } catch (IOException e) {
            System.err.println("[Server] logging config not loaded: " + e.getMessage());
        }
    }
}
