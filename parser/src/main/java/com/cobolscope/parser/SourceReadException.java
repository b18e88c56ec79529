package com.cobolscope.parser;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * A source file could not be read, so no program model was produced for it.
 */
public class SourceReadException extends IOException {
    
    private static final long serialVersionUID = 1L;
    
    private final transient Path sourcePath;
    
    public SourceReadException(Path sourcePath, IOException cause) {
        super("Cannot read COBOL source " + sourcePath + ": " + cause.getMessage(), cause);
        this.sourcePath = Objects.requireNonNull(sourcePath, "Source path cannot be null");
    }
    
    public Path getSourcePath() {
        return sourcePath;
    }
}
