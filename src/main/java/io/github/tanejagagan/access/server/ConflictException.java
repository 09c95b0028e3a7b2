package io.github.tanejagagan.access.server;

public class ConflictException extends HttpException {
    public ConflictException(String msg) {
        super(409, msg);
    }
}
