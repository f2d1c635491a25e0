package com.usatiuk.fstreemap;

/**
 * Thrown when a path is used against a node of the wrong kind,
 * like traversing through a file or asking a directory for its value.
 */
public class ShapeViolationException extends RuntimeException {
    /**
     * What the operation expected to find.
     */
    public enum Kind {
        NOT_A_DIRECTORY,
        NOT_A_FILE
    }

    private final Kind _kind;
    private final String _path;

    public ShapeViolationException(Kind kind, String path) {
        super(switch (kind) {
            case NOT_A_DIRECTORY -> "Path is not a directory: " + path;
            case NOT_A_FILE -> "Path is not a file: " + path;
        });
        _kind = kind;
        _path = path;
    }

    public Kind getKind() {
        return _kind;
    }

    public String getPath() {
        return _path;
    }
}
