package com.cobolscope.cli;

import com.cobolscope.parser.model.CobolProgram;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MainTest {
    
    @TempDir
    Path workDir;
    
    private int execute(String... args) {
        return new CommandLine(new Main()).execute(args);
    }
    
    @Test
    void analyzeWritesJsonExports() throws IOException {
        Path sources = writeSources();
        Path output = workDir.resolve("out");
        
        int exitCode = execute("analyze", sources.toString(), "--output", output.toString());
        
        assertEquals(0, exitCode);
        assertTrue(Files.exists(output.resolve("ORDERS_analysis.json")));
        assertTrue(Files.exists(output.resolve("PAYMENT_analysis.json")));
        
        ObjectMapper mapper = new ObjectMapper();
        CobolProgram orders = mapper.readValue(output.resolve("ORDERS_analysis.json").toFile(), CobolProgram.class);
        assertEquals("ORDERS", orders.getName());
        assertEquals("PAYMENT", orders.getCalls().get(0).getTarget());
        assertFalse(orders.getCalls().get(0).isDynamic());
        assertEquals("X(10)", orders.dataItem("WS-ID").orElseThrow().getPicture());
        assertTrue(orders.paragraphAt(orders.getCalls().get(0).getLocation().getLine()).isPresent());
        assertEquals(Map.of("MAIN-PARA", " MAIN-PARA.\n     CALL 'PAYMENT' USING WS-ID.\n     GOBACK."),
                orders.getParagraphSources());
        
        Map<String, String> paragraphs = mapper.readValue(output.resolve("PAYMENT" + AnalysisWriter.PARAGRAPH_FILE_SUFFIX).toFile(),
                new TypeReference<Map<String, String>>() { });
        assertEquals(List.of("MAIN-PARA"), List.copyOf(paragraphs.keySet()));
        assertTrue(paragraphs.get("MAIN-PARA").contains("EXEC SQL INSERT INTO LEDGER"));
        
        Map<String, List<String>> callGraph = mapper.readValue(output.resolve(AnalysisWriter.CALL_GRAPH_FILE).toFile(),
                new TypeReference<Map<String, List<String>>>() { });
        assertEquals(List.of("PAYMENT"), callGraph.get("ORDERS"));
        assertEquals(List.of(), callGraph.get("PAYMENT"));
        
        Map<String, List<String>> usage = mapper.readValue(output.resolve(AnalysisWriter.RESOURCE_USAGE_FILE).toFile(),
                new TypeReference<Map<String, List<String>>>() { });
        assertEquals(List.of("PAYMENT"), usage.get("SQL:LEDGER"));
    }
    
    @Test
    void callsCommandReportsUnknownProgram() throws IOException {
        Path sources = writeSources();
        
        assertEquals(0, execute("calls", sources.toString(), "PAYMENT"));
        assertEquals(1, execute("calls", sources.toString(), "NOBODY"));
    }
    
    @Test
    void resourcesCommandSucceeds() throws IOException {
        assertEquals(0, execute("resources", writeSources().toString()));
    }
    
    @Test
    void verboseFlagIsAcceptedByEverySubcommand() throws IOException {
        Path sources = writeSources();
        
        assertEquals(0, execute("resources", sources.toString(), "--verbose"));
        assertEquals(0, execute("calls", "-v", sources.toString(), "PAYMENT"));
        assertEquals(0, execute("analyze", sources.toString(), "-v"));
        assertFalse(LoggingOptions.applyFrom(new String[] {"analyze", sources.toString()}));
    }
    
    @Test
    void missingSourcePathFails() {
        assertEquals(1, execute("analyze", workDir.resolve("absent").toString()));
    }
    
    private Path writeSources() throws IOException {
        Path dir = workDir.resolve("src");
        Files.createDirectories(dir);
        write(dir.resolve("ORDERS.cbl"),
                "000100 IDENTIFICATION DIVISION.",
                "000200 PROGRAM-ID. ORDERS.",
                "000300 DATA DIVISION.",
                "000400 WORKING-STORAGE SECTION.",
                "000500 01  WS-ID              PIC X(10).",
                "000600 PROCEDURE DIVISION.",
                "000700 MAIN-PARA.",
                "000800     CALL 'PAYMENT' USING WS-ID.",
                "000900     GOBACK.");
        write(dir.resolve("PAYMENT.cbl"),
                "000100 IDENTIFICATION DIVISION.",
                "000200 PROGRAM-ID. PAYMENT.",
                "000300 PROCEDURE DIVISION.",
                "000400 MAIN-PARA.",
                "000500     EXEC SQL INSERT INTO LEDGER VALUES (:WS-AMT) END-EXEC.",
                "000600     GOBACK.");
        return dir;
    }
    
    private static void write(Path file, String... lines) throws IOException {
        Files.write(file, String.join("\n", lines).getBytes(StandardCharsets.UTF_8));
    }
}
