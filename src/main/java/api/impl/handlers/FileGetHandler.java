package api.impl.handlers;

import api.interfaces.IHttpHandler;
import api.interfaces.http.HttpRequest;
import api.interfaces.http.HttpResponse;
import infrastructure.interfaces.IFileStore;

import java.util.Optional;

public class FileGetHandler implements IHttpHandler {
    public static final String PREFIX = "/files/";

    private final IFileStore store;

    public FileGetHandler(IFileStore store) { this.store = store; }

    @Override
    public void handle(HttpRequest req, HttpResponse res) {
        Optional<byte[]> content = store.read(req.path().substring(PREFIX.length()));
        if (content.isEmpty()) {
            res.status(404, "Not Found");
            return;
        }
        res.status(200, "OK");
        res.contentType("application/octet-stream");
        res.body(content.get());
    }
}
