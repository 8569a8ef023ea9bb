package api.interfaces;

import api.impl.HttpResponseImpl;
import api.interfaces.http.HttpRequest;

/** Picks the handler for a request and runs it. */
public interface IHandlerFactory {

    /** Handler of the first matching rule, never {@code null}. */
    IHttpHandler create(HttpRequest req);

    /** Runs {@link #create(HttpRequest)}'s handler against a fresh response. */
    HttpResponseImpl route(HttpRequest req) throws Exception;
}
