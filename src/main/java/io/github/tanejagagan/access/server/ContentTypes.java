package io.github.tanejagagan.access.server;

public class ContentTypes {
    public static final String APPLICATION_JSON = "application/json";
    public static final String TEXT_PLAIN = "text/plain; charset=utf-8";
    public static final String TEXT_CSV = "text/csv";
}
