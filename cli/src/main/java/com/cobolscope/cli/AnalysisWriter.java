package com.cobolscope.cli;

import com.cobolscope.analyzer.CobolAnalyzer;
import com.cobolscope.parser.model.CobolProgram;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Exports analysis results as JSON. Each program gets {@code <PROGRAM>_analysis.json} and
 * {@code <PROGRAM>_paragraphs.json} (paragraph name to source text); the whole set gets
 * {@code call-graph.json} and {@code resource-usage.json}.
 */
public class AnalysisWriter {
    
    private static final Logger logger = LoggerFactory.getLogger(AnalysisWriter.class);
    
    static final String CALL_GRAPH_FILE = "call-graph.json";
    static final String RESOURCE_USAGE_FILE = "resource-usage.json";
    static final String PROGRAM_FILE_SUFFIX = "_analysis.json";
    static final String PARAGRAPH_FILE_SUFFIX = "_paragraphs.json";
    
    private final Path outputDir;
    private final ObjectMapper objectMapper;
    
    public AnalysisWriter(Path outputDir) {
        this.outputDir = Objects.requireNonNull(outputDir, "Output directory cannot be null");
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }
    
    /**
     * @return the files written, programs first
     */
    public List<Path> writeAll(CobolAnalyzer analyzer) throws IOException {
        Files.createDirectories(outputDir);
        List<Path> written = new ArrayList<>();
        
        for (CobolProgram program : analyzer.getPrograms().values()) {
            written.add(write(program.getName() + PROGRAM_FILE_SUFFIX, program));
            written.add(write(program.getName() + PARAGRAPH_FILE_SUFFIX, program.getParagraphSources()));
        }
        written.add(write(CALL_GRAPH_FILE, analyzer.getCallGraph().asMap()));
        written.add(write(RESOURCE_USAGE_FILE, analyzer.getResourceUsage().asMap()));
        
        logger.info("Wrote {} files to {}", written.size(), outputDir);
        return written;
    }
    
    private Path write(String fileName, Object value) throws IOException {
        Path target = outputDir.resolve(fileName);
        objectMapper.writeValue(target.toFile(), value);
        logger.debug("Wrote {}", target);
        return target;
    }
}
