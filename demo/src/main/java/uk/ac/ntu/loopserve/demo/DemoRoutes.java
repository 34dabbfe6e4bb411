package uk.ac.ntu.loopserve.demo;

import uk.ac.ntu.loopserve.server.data.DataUpdate;
import uk.ac.ntu.loopserve.server.route.RouteConfig;
import uk.ac.ntu.loopserve.server.route.RouteMap;
import uk.ac.ntu.loopserve.server.route.RouteRequest;

import java.util.Map;

/**
 * The demo's routes: a greeting, a greeting built from the greeting through the
 * loopback client, a table backed by the {@code Hello} migration and a shared counter.
 */
public final class DemoRoutes {
    static final String COUNTER = "counter";

    private DemoRoutes() {}

    public static RouteMap routes() {
        return RouteMap.builder()
                .get("/hello", req -> "Hello")
                .get("/world", req -> req.<String>get("/hello").thenApply(hello -> hello + " world!"))
                .path("/db", RouteConfig.builder()
                        .get(DemoRoutes::listWorlds)
                        .post(DemoRoutes::addWorld)
                        .build())
                .path("/counter", RouteConfig.builder()
                        .get(req -> req.data(COUNTER, 0))
                        .post(req -> req.data(COUNTER, 0, DataUpdate.<Integer>of(n -> n + 1)))
                        .build())
                .build();
    }

    private static Object listWorlds(RouteRequest req) throws Exception {
        req.db().dumpTable("Hello");
        return req.db().all("SELECT world FROM Hello");
    }

    private static Object addWorld(RouteRequest req) throws Exception {
        Object body = req.body();
        Object world = body instanceof Map<?, ?> m ? m.get("world") : null;
        return req.db().run("INSERT INTO Hello (world) VALUES (?)", world == null ? "world" : world.toString());
    }
}
