package com.cobolscope.analyzer;

import com.cobolscope.parser.CobolParser;
import com.cobolscope.parser.SourceParser;
import com.cobolscope.parser.model.CobolProgram;
import com.cobolscope.parser.model.ProgramCall;
import com.cobolscope.parser.model.Resource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Analyzes COBOL programs across files: keeps the parsed programs by name, the call graph
 * between them and an index of the embedded resources each one uses.
 * <p>
 * Analysis only accumulates. Re-analyzing a program replaces its registry entry but keeps
 * the call edges and resource entries recorded for the earlier version. Not thread-safe;
 * use one analyzer per thread and {@link #merge(CobolAnalyzer)} the results.
 */
public class CobolAnalyzer {
    
    private static final Logger logger = LoggerFactory.getLogger(CobolAnalyzer.class);
    
    private final SourceParser parser;
    private final CobolSourceFinder sourceFinder;
    private final Map<String, CobolProgram> programs = new LinkedHashMap<>();
    private final CallGraph callGraph = new CallGraph();
    private final ResourceUsageIndex resourceUsage = new ResourceUsageIndex();
    
    public CobolAnalyzer() {
        this(new CobolParser());
    }
    
    public CobolAnalyzer(SourceParser parser) {
        this.parser = parser;
        this.sourceFinder = new CobolSourceFinder(parser);
    }
    
    /**
     * Parse one file and record it in the registry, call graph and resource index
     */
    public CobolProgram analyzeProgram(Path filePath) throws IOException {
        CobolProgram program = parser.parse(filePath);
        register(program);
        return program;
    }
    
    /**
     * Analyze every COBOL source under {@code directory}. The first file that fails aborts the
     * walk; programs analyzed before it stay registered.
     *
     * @return every program registered so far, keyed by name
     */
    public Map<String, CobolProgram> analyzeDirectory(Path directory) throws IOException {
        List<Path> sources = sourceFinder.find(directory);
        logger.info("Analyzing {} COBOL files under {}", sources.size(), directory);
        
        for (Path source : sources) {
            analyzeProgram(source);
        }
        
        logger.info("Analysis complete: {} programs, {}, {}", programs.size(), callGraph, resourceUsage);
        return getPrograms();
    }
    
    /**
     * Record an already parsed program
     */
    public void register(CobolProgram program) {
        String name = program.getName();
        if (programs.put(name, program) != null) {
            logger.warn("Program {} analyzed again; replacing earlier entry", name);
        }
        
        callGraph.addNode(name);
        for (ProgramCall call : program.getCalls()) {
            callGraph.addEdge(name, call.getTarget());
        }
        for (Resource resource : program.getResources()) {
            resourceUsage.record(resource, name);
        }
        
        logger.debug("Registered {}: {} calls, {} resources", name, program.getCalls().size(), program.getResources().size());
    }
    
    public Optional<CobolProgram> getProgram(String name) {
        return Optional.ofNullable(programs.get(name));
    }
    
    public Map<String, CobolProgram> getPrograms() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(programs));
    }
    
    public Set<String> callersOf(String program) {
        return callGraph.callersOf(program);
    }
    
    public Set<String> calleesOf(String program) {
        return callGraph.calleesOf(program);
    }
    
    public Set<String> programsUsing(String type, String name) {
        return resourceUsage.programsUsing(type, name);
    }
    
    /**
     * Copy of the call graph; edges added to it do not reach this analyzer
     */
    public CallGraph getCallGraph() {
        CallGraph snapshot = new CallGraph();
        snapshot.merge(callGraph);
        return snapshot;
    }
    
    /**
     * Copy of the resource usage index; entries recorded in it do not reach this analyzer
     */
    public ResourceUsageIndex getResourceUsage() {
        ResourceUsageIndex snapshot = new ResourceUsageIndex();
        snapshot.merge(resourceUsage);
        return snapshot;
    }
    
    /**
     * Fold another analyzer's results into this one. Programs present in both are taken from
     * {@code other}; graph edges and index entries are unioned.
     */
    public void merge(CobolAnalyzer other) {
        programs.putAll(other.programs);
        callGraph.merge(other.callGraph);
        resourceUsage.merge(other.resourceUsage);
    }
}
