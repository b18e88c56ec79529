package com.cobolscope.analyzer;

import com.cobolscope.parser.SourceParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Walks a directory tree for files a {@link SourceParser} accepts, in walk order
 */
public class CobolSourceFinder {
    
    private static final Logger logger = LoggerFactory.getLogger(CobolSourceFinder.class);
    
    private final SourceParser parser;
    
    public CobolSourceFinder(SourceParser parser) {
        this.parser = parser;
    }
    
    public List<Path> find(Path root) throws IOException {
        try (Stream<Path> paths = Files.walk(root)) {
            List<Path> sources = paths
                .filter(Files::isRegularFile)
                .filter(parser::canParse)
                .collect(Collectors.toList());
            logger.debug("Found {} COBOL sources under {}", sources.size(), root);
            return sources;
        }
    }
}
