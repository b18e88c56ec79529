package com.cobolscope.cli;

import com.cobolscope.analyzer.CobolAnalyzer;
import com.cobolscope.analyzer.CobolSourceFinder;
import com.cobolscope.parser.SourceParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Supplier;

/**
 * Runs analysis over a file or directory with a per-file failure policy. A file that fails to
 * parse is recorded and skipped, or with fail-fast aborts the run. With more than one thread
 * each worker gets its own analyzer and the results are merged afterwards.
 */
public class AnalysisRunner {
    
    private static final Logger logger = LoggerFactory.getLogger(AnalysisRunner.class);
    
    private final Supplier<? extends SourceParser> parserFactory;
    private final int threads;
    private final boolean failFast;
    
    public AnalysisRunner(Supplier<? extends SourceParser> parserFactory, int threads, boolean failFast) {
        if (threads < 1) {
            throw new IllegalArgumentException("Thread count must be at least 1, got " + threads);
        }
        this.parserFactory = parserFactory;
        this.threads = threads;
        this.failFast = failFast;
    }
    
    public AnalysisResult run(Path sourcePath) throws IOException {
        long startTime = System.currentTimeMillis();
        
        List<Path> sources = collectSources(sourcePath);
        logger.info("Analyzing {} files with {} worker(s)", sources.size(), threads);
        
        WorkerResult result = threads == 1 || sources.size() < 2
            ? analyze(sources)
            : analyzeInParallel(sources);
        
        double seconds = (System.currentTimeMillis() - startTime) / 1000.0;
        logger.info("Analyzed {} programs, {} failures in {} s",
            result.analyzer.getPrograms().size(), result.failures.size(), seconds);
        return new AnalysisResult(result.analyzer, result.failures, sources.size(), seconds);
    }
    
    /**
     * A single file is taken as is; a directory is walked for COBOL sources
     */
    List<Path> collectSources(Path sourcePath) throws IOException {
        if (Files.isRegularFile(sourcePath)) {
            return List.of(sourcePath);
        }
        if (!Files.isDirectory(sourcePath)) {
            throw new NoSuchFileException(sourcePath.toString());
        }
        return new CobolSourceFinder(parserFactory.get()).find(sourcePath);
    }
    
    private WorkerResult analyze(List<Path> files) throws IOException {
        CobolAnalyzer analyzer = new CobolAnalyzer(parserFactory.get());
        List<FileFailure> failures = new ArrayList<>();
        
        for (Path file : files) {
            try {
                analyzer.analyzeProgram(file);
            } catch (IOException | RuntimeException e) {
                if (failFast) {
                    throw e;
                }
                logger.error("Failed to analyze {}: {}", file, e.getMessage());
                failures.add(FileFailure.of(file, e));
            }
        }
        return new WorkerResult(analyzer, failures);
    }
    
    private WorkerResult analyzeInParallel(List<Path> sources) throws IOException {
        List<List<Path>> batches = partition(sources, threads);
        ExecutorService executor = Executors.newFixedThreadPool(batches.size());
        try {
            List<Future<WorkerResult>> futures = new ArrayList<>();
            for (List<Path> batch : batches) {
                futures.add(executor.submit(() -> analyze(batch)));
            }
            
            CobolAnalyzer merged = new CobolAnalyzer(parserFactory.get());
            List<FileFailure> failures = new ArrayList<>();
            for (Future<WorkerResult> future : futures) {
                WorkerResult worker = await(future);
                merged.merge(worker.analyzer);
                failures.addAll(worker.failures);
            }
            return new WorkerResult(merged, failures);
        } finally {
            executor.shutdownNow();
        }
    }
    
    private static WorkerResult await(Future<WorkerResult> future) throws IOException {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Analysis interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("Analysis worker failed", cause);
        }
    }
    
    /**
     * Round-robin split into at most {@code count} non-empty batches
     */
    static List<List<Path>> partition(List<Path> files, int count) {
        int batchCount = Math.min(count, files.size());
        List<List<Path>> batches = new ArrayList<>(batchCount);
        for (int i = 0; i < batchCount; i++) {
            batches.add(new ArrayList<>());
        }
        for (int i = 0; i < files.size(); i++) {
            batches.get(i % batchCount).add(files.get(i));
        }
        return batches;
    }
    
    private static final class WorkerResult {
        private final CobolAnalyzer analyzer;
        private final List<FileFailure> failures;
        
        WorkerResult(CobolAnalyzer analyzer, List<FileFailure> failures) {
            this.analyzer = analyzer;
            this.failures = failures;
        }
    }
}
