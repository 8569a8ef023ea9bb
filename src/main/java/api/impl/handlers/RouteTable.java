package api.impl.handlers;

import api.impl.HttpResponseImpl;
import api.interfaces.IHandlerFactory;
import api.interfaces.IHttpHandler;
import api.interfaces.http.HttpRequest;
import infrastructure.interfaces.IFileStore;

import java.util.List;

/**
 * Ordered rule list, first match wins, {@link NotFoundHandler} otherwise.
 * Immutable and shared by every session.
 */
public class RouteTable implements IHandlerFactory {

    private static final IHttpHandler NOT_FOUND = new NotFoundHandler();

    private final List<Route> routes;

    public RouteTable(List<Route> routes) {
        this.routes = List.copyOf(routes);
    }

    /**
     * The server's endpoints:
     * <ol>
     *   <li>{@code GET /}</li>
     *   <li>{@code GET /echo/<tail>}</li>
     *   <li>{@code GET /user-agent}</li>
     *   <li>{@code GET /files/<name>}</li>
     *   <li>{@code POST /files/<name>}</li>
     * </ol>
     */
    public static RouteTable defaults(IFileStore store) {
        return new RouteTable(List.of(
                new Route("GET", Route.exact("/"), new RootHandler()),
                new Route("GET", Route.prefix(EchoHandler.PREFIX), new EchoHandler()),
                new Route("GET", Route.exact("/user-agent"), new UserAgentHandler()),
                new Route("GET", Route.prefix(FileGetHandler.PREFIX), new FileGetHandler(store)),
                new Route("POST", Route.prefix(FileGetHandler.PREFIX), new FilePostHandler(store))
        ));
    }

    public List<Route> routes() { return routes; }

    @Override
    public IHttpHandler create(HttpRequest req) {
        for (Route r : routes) {
            if (r.matches(req)) return r.handler();
        }
        return NOT_FOUND;
    }

    @Override
    public HttpResponseImpl route(HttpRequest req) throws Exception {
        HttpResponseImpl res = new HttpResponseImpl();
        create(req).handle(req, res);
        return res;
    }
}
