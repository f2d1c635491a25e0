package com.usatiuk.fstreemap;

/**
 * Thrown when a file is inserted at a path whose name is already taken by a sibling.
 */
public class AlreadyExistsException extends RuntimeException {
    private final String _path;

    public AlreadyExistsException(String path) {
        super("Already exists: " + path);
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
