package api.impl.handlers;

import api.interfaces.IHttpHandler;
import api.interfaces.http.HttpRequest;
import api.interfaces.http.HttpResponse;

/** Replies with whatever follows {@code /echo/}, undecoded. */
public class EchoHandler implements IHttpHandler {
    public static final String PREFIX = "/echo/";

    @Override
    public void handle(HttpRequest req, HttpResponse res) {
        res.status(200, "OK");
        res.contentType("text/plain");
        res.body(req.path().substring(PREFIX.length()));
    }
}
