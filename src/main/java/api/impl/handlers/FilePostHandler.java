package api.impl.handlers;

import api.interfaces.IHttpHandler;
import api.interfaces.http.HttpRequest;
import api.interfaces.http.HttpResponse;
import infrastructure.interfaces.IFileStore;

import java.io.IOException;
import java.util.logging.Level;
import java.util.logging.Logger;

/** Stores the request body under the name after {@code /files/}, overwriting any existing file. */
public class FilePostHandler implements IHttpHandler {
    private static final Logger LOG = Logger.getLogger(FilePostHandler.class.getName());

    private final IFileStore store;

    public FilePostHandler(IFileStore store) { this.store = store; }

    @Override
    public void handle(HttpRequest req, HttpResponse res) {
        String name = req.path().substring(FileGetHandler.PREFIX.length());
        byte[] body = req.body();
        try {
            store.write(name, body);
        } catch (IOException e) {
            LOG.log(Level.WARNING, "write of " + name + " failed: " + e.getMessage(), e);
            res.status(500, "Internal Server Error");
            return;
        }
        LOG.fine(() -> "stored " + body.length + " bytes as " + name);
        res.status(201, "Created");
    }
}
