package api.impl.handlers;

import api.interfaces.IHttpHandler;
import api.interfaces.http.HttpRequest;

import java.util.Objects;
import java.util.function.Predicate;

/** One routing rule: exact method plus a predicate on the raw path. */
public record Route(String method, Predicate<String> path, IHttpHandler handler) {

    public Route {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(handler, "handler");
    }

    public boolean matches(HttpRequest req) {
        return method.equals(req.method()) && path.test(req.path());
    }

    public static Predicate<String> exact(String p) {
        return p::equals;
    }

    public static Predicate<String> prefix(String p) {
        return candidate -> candidate.startsWith(p);
    }
}
