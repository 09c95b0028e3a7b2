package io.github.tanejagagan.access.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import io.github.tanejagagan.access.common.policy.FilterTypeRegistry;

import java.io.IOException;

import static io.github.tanejagagan.access.server.Routers.get;

/**
 * Lists the row filter kinds so an editor can render them.
 */
public class FilterTypeHandler implements HttpHandler {
    public static final String CONTEXT = "/filter-types";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public void handle(HttpExchange exchange) throws IOException {
        if (!get.test(exchange)) {
            exchange.getResponseHeaders().set("Allow", "GET");
            PolicyHandler.send(exchange, 405, null, null);
            return;
        }
        var body = MAPPER.writeValueAsBytes(FilterTypeRegistry.all());
        PolicyHandler.send(exchange, 200, ContentTypes.APPLICATION_JSON, body);
    }
}
