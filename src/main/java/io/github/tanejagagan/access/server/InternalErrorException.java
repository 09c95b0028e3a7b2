package io.github.tanejagagan.access.server;

public class InternalErrorException extends HttpException {
    public InternalErrorException(String msg) {
        super(500, msg);
    }

    public InternalErrorException(String msg, Throwable cause) {
        super(500, msg, cause);
    }
}
