package api.impl.handlers;

import api.interfaces.IHttpHandler;
import api.interfaces.http.HttpRequest;
import api.interfaces.http.HttpResponse;

public class UserAgentHandler implements IHttpHandler {
    static final String UNKNOWN = "Unknown";

    @Override
    public void handle(HttpRequest req, HttpResponse res) {
        String agent = req.header("user-agent");
        res.status(200, "OK");
        res.contentType("text/plain");
        res.body(agent == null ? UNKNOWN : agent);
    }
}
