package com.cobolscope.cli;

import picocli.CommandLine.Option;

import java.util.List;

/**
 * Logging flag shared by every subcommand.
 */
class LoggingOptions {
    
    static final String LOG_LEVEL_PROPERTY = "org.slf4j.simpleLogger.defaultLogLevel";
    
    // Declared so picocli accepts and documents the flag. slf4j-simple fixes its level when the
    // first logger is created, so the value is acted on by applyFrom before any command exists.
    @Option(names = {"-v", "--verbose"},
            description = "Enable verbose (debug) logging; applied at startup")
    boolean verbose = false;
    
    /**
     * Switches slf4j-simple to debug when the raw arguments carry the verbose flag
     */
    static boolean applyFrom(String[] args) {
        List<String> arguments = List.of(args);
        if (arguments.contains("-v") || arguments.contains("--verbose")) {
            System.setProperty(LOG_LEVEL_PROPERTY, "debug");
            return true;
        }
        return false;
    }
}
