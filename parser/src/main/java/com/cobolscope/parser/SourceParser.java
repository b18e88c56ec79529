package com.cobolscope.parser;

import com.cobolscope.parser.model.CobolProgram;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Parses one source file into a {@link CobolProgram}.
 */
public interface SourceParser {
    
    /**
     * Check if this parser can handle the given file type
     */
    boolean canParse(Path filePath);
    
    /**
     * Parse the file. Fails as a whole when the file cannot be read; no partial program is
     * returned.
     */
    CobolProgram parse(Path filePath) throws IOException;
}
