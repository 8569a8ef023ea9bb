package api.interfaces;

import api.interfaces.http.HttpRequest;
import api.interfaces.http.HttpResponse;

/**
 * One route action. Fills {@code res} from {@code req}; anything thrown escapes to the
 * connection session, which closes the connection.
 */
@FunctionalInterface
public interface IHttpHandler {
    void handle(HttpRequest req, HttpResponse res) throws Exception;
}
