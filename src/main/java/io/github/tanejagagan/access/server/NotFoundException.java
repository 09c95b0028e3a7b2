package io.github.tanejagagan.access.server;

public class NotFoundException extends HttpException {
    public NotFoundException(String msg) {
        super(404, msg);
    }
}
