package io.github.tanejagagan.access.server;

import com.sun.net.httpserver.HttpExchange;

import java.util.function.Predicate;

public class Routers {

    public static final String CONTENT_TYPE = "Content-Type";

    public static final Predicate<HttpExchange> post = r -> r.getRequestMethod().equals("POST");
    public static final Predicate<HttpExchange> get = r -> r.getRequestMethod().equals("GET");
    public static final Predicate<HttpExchange> put = r -> r.getRequestMethod().equals("PUT");
    public static final Predicate<HttpExchange> delete = r -> r.getRequestMethod().equals("DELETE");

    public static Predicate<HttpExchange> contentType(String contentType) {
        return r -> {
            var headerValue = r.getRequestHeaders().get(CONTENT_TYPE);
            if (headerValue == null || headerValue.isEmpty()) {
                return false;
            }
            return headerValue.get(0).startsWith(contentType);
        };
    }
}
