package io.github.tanejagagan.access.server;

public class BadRequestException extends HttpException {
    public BadRequestException(String msg) {
        super(400, msg);
    }
}
