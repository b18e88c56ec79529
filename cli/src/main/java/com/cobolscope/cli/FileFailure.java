package com.cobolscope.cli;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A source file that could not be analyzed, with the reason
 */
public final class FileFailure {
    
    private final Path path;
    private final String message;
    
    public FileFailure(Path path, String message) {
        this.path = Objects.requireNonNull(path, "Path cannot be null");
        this.message = message;
    }
    
    static FileFailure of(Path path, Exception cause) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new FileFailure(path, message);
    }
    
    public Path getPath() { return path; }
    public String getMessage() { return message; }
    
    @Override
    public String toString() {
        return path + ": " + message;
    }
}
