package com.cobolscope.cli;

import com.cobolscope.analyzer.CobolAnalyzer;
import com.cobolscope.parser.model.CobolProgram;

import java.util.List;
import java.util.Set;

/**
 * Outcome of one CLI analysis run: the merged analyzer plus the files that failed
 */
public class AnalysisResult {
    
    private final CobolAnalyzer analyzer;
    private final List<FileFailure> failures;
    private final int totalFiles;
    private final double processingTimeSeconds;
    
    public AnalysisResult(CobolAnalyzer analyzer, List<FileFailure> failures, int totalFiles,
                          double processingTimeSeconds) {
        this.analyzer = analyzer;
        this.failures = List.copyOf(failures);
        this.totalFiles = totalFiles;
        this.processingTimeSeconds = processingTimeSeconds;
    }
    
    public CobolAnalyzer getAnalyzer() { return analyzer; }
    public List<FileFailure> getFailures() { return failures; }
    public int getTotalFiles() { return totalFiles; }
    public double getProcessingTimeSeconds() { return processingTimeSeconds; }
    
    public int getProgramCount() {
        return analyzer.getPrograms().size();
    }
    
    public int getCallCount() {
        return analyzer.getPrograms().values().stream().mapToInt(p -> p.getCalls().size()).sum();
    }
    
    public int getResourceCount() {
        return analyzer.getPrograms().values().stream().mapToInt(p -> p.getResources().size()).sum();
    }
    
    public int getCopybookCount() {
        return (int) analyzer.getPrograms().values().stream()
            .map(CobolProgram::getCopybooks)
            .flatMap(Set::stream)
            .distinct()
            .count();
    }
    
    public boolean hasFailures() {
        return !failures.isEmpty();
    }
    
    /**
     * 0 when every file was analyzed, 1 when none was, 2 for a partial run
     */
    public int exitCode() {
        if (failures.isEmpty()) {
            return 0;
        }
        return failures.size() == totalFiles ? 1 : 2;
    }
}
