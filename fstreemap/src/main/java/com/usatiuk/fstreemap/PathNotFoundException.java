package com.usatiuk.fstreemap;

/**
 * Thrown when an operation that requires a path to exist runs into a missing segment.
 */
public class PathNotFoundException extends RuntimeException {
    private final String _path;

    public PathNotFoundException(String path) {
        super("Path not found: " + path);
        _path = path;
    }

    public String getPath() {
        return _path;
    }

    @Override
    public synchronized Throwable fillInStackTrace() {
        return this;
    }
}
