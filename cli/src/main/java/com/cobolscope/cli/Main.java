package com.cobolscope.cli;

import com.cobolscope.analyzer.CallGraph;
import com.cobolscope.parser.CobolParser;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * Main CLI entry point for COBOL Scope.
 * Provides commands for analyzing sources, querying the call graph and listing resource usage.
 */
@Command(name = "cobol-scope", 
         mixinStandardHelpOptions = true,
         version = "COBOL Scope 1.0.0",
         description = "Static analysis of fixed-format COBOL programs",
         subcommands = {
             AnalyzeCommand.class,
             CallsCommand.class,
             ResourcesCommand.class
         })
public class Main implements Callable<Integer> {
    
    public static void main(String[] args) {
        LoggingOptions.applyFrom(args);
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }
    
    @Override
    public Integer call() {
        System.out.println("COBOL Scope v1.0.0");
        System.out.println("Use --help to see available commands");
        return 0;
    }
    
    static AnalysisResult analyze(Path sourcePath, int threads, boolean failFast) throws IOException {
        return new AnalysisRunner(CobolParser::new, threads, failFast).run(sourcePath);
    }
    
    static void printFailures(AnalysisResult result) {
        for (FileFailure failure : result.getFailures()) {
            System.err.println(failure);
        }
    }
}

/**
 * Analyze command: parses every COBOL source under a path and reports what it found
 */
@Command(name = "analyze", 
         description = "Analyze a COBOL file or a directory of COBOL sources")
class AnalyzeCommand implements Callable<Integer> {
    
    private static final Logger logger = LoggerFactory.getLogger(AnalyzeCommand.class);
    
    @Parameters(index = "0", description = "COBOL source file or directory")
    private Path sourcePath;
    
    @Option(names = {"-o", "--output"}, 
            description = "Directory to write JSON analysis files to")
    private Path outputPath;
    
    @Option(names = {"-t", "--threads"}, 
            description = "Number of worker analyzers (default: 1)")
    private int threads = 1;
    
    @Option(names = {"--fail-fast"}, 
            description = "Stop at the first file that cannot be analyzed")
    private boolean failFast = false;
    
    @Mixin
    private LoggingOptions loggingOptions;
    
    @Override
    public Integer call() {
        try {
            logger.info("Source path: {}", sourcePath.toAbsolutePath());
            logger.debug("Threads: {}, fail fast: {}", threads, failFast);
            
            AnalysisResult result = Main.analyze(sourcePath, threads, failFast);
            
            System.out.println("\n" + "=".repeat(60));
            System.out.println("ANALYSIS COMPLETED");
            System.out.println("=".repeat(60));
            System.out.printf("Files found: %d%n", result.getTotalFiles());
            System.out.printf("Programs analyzed: %d%n", result.getProgramCount());
            System.out.printf("Program calls: %d%n", result.getCallCount());
            System.out.printf("Call graph: %d nodes, %d edges%n",
                result.getAnalyzer().getCallGraph().getNodes().size(),
                result.getAnalyzer().getCallGraph().edgeCount());
            System.out.printf("Embedded resources: %d (%d distinct)%n",
                result.getResourceCount(), result.getAnalyzer().getResourceUsage().size());
            System.out.printf("Copybooks referenced: %d%n", result.getCopybookCount());
            System.out.printf("Failures: %d%n", result.getFailures().size());
            System.out.printf("Processing time: %.2f seconds%n", result.getProcessingTimeSeconds());
            
            if (outputPath != null) {
                List<Path> written = new AnalysisWriter(outputPath).writeAll(result.getAnalyzer());
                System.out.printf("JSON files written: %d to %s%n", written.size(), outputPath.toAbsolutePath());
            }
            System.out.println("=".repeat(60));
            
            Main.printFailures(result);
            return result.exitCode();
            
        } catch (Exception e) {
            logger.error("Analysis failed", e);
            System.err.println("Error: " + e.getMessage());
            return 1;
        }
    }
}

/**
 * Calls command: shows who calls a program and what it calls
 */
@Command(name = "calls", 
         description = "Show the callers and callees of a program")
class CallsCommand implements Callable<Integer> {
    
    private static final Logger logger = LoggerFactory.getLogger(CallsCommand.class);
    
    @Parameters(index = "0", description = "COBOL source file or directory")
    private Path sourcePath;
    
    @Parameters(index = "1", description = "Program name")
    private String program;
    
    @Mixin
    private LoggingOptions loggingOptions;
    
    @Override
    public Integer call() {
        try {
            AnalysisResult result = Main.analyze(sourcePath, 1, false);
            Main.printFailures(result);
            
            CallGraph callGraph = result.getAnalyzer().getCallGraph();
            if (!callGraph.containsNode(program)) {
                System.err.printf("Program %s does not appear in the call graph%n", program);
                return 1;
            }
            
            System.out.println("Program: " + program);
            System.out.println("=".repeat(40));
            printNames("Called by", callGraph.callersOf(program));
            printNames("Calls", callGraph.calleesOf(program));
            
            return result.exitCode();
            
        } catch (Exception e) {
            logger.error("Call graph query failed", e);
            System.err.println("Error: " + e.getMessage());
            return 1;
        }
    }
    
    private static void printNames(String heading, Set<String> names) {
        System.out.printf("%s (%d):%n", heading, names.size());
        if (names.isEmpty()) {
            System.out.println("  (none)");
        }
        for (String name : names) {
            System.out.println("  " + name);
        }
    }
}

/**
 * Resources command: lists every embedded resource and the programs using it
 */
@Command(name = "resources", 
         description = "List embedded SQL/CICS/MQ resources and the programs that use them")
class ResourcesCommand implements Callable<Integer> {
    
    private static final Logger logger = LoggerFactory.getLogger(ResourcesCommand.class);
    
    @Parameters(index = "0", description = "COBOL source file or directory")
    private Path sourcePath;
    
    @Mixin
    private LoggingOptions loggingOptions;
    
    @Override
    public Integer call() {
        try {
            AnalysisResult result = Main.analyze(sourcePath, 1, false);
            Main.printFailures(result);
            
            Map<String, Set<String>> usage = result.getAnalyzer().getResourceUsage().asMap();
            System.out.printf("Resources: %d%n", usage.size());
            System.out.println("=".repeat(40));
            for (Map.Entry<String, Set<String>> entry : usage.entrySet()) {
                System.out.printf("%s -> %s%n", entry.getKey(), String.join(", ", entry.getValue()));
            }
            
            return result.exitCode();
            
        } catch (Exception e) {
            logger.error("Resource listing failed", e);
            System.err.println("Error: " + e.getMessage());
            return 1;
        }
    }
}
