package com.cobolscope.parser;

import com.cobolscope.parser.extract.ProgramCallPass;
import com.cobolscope.parser.model.CobolProgram;
import com.cobolscope.parser.model.DataItem;
import com.cobolscope.parser.model.Division;
import com.cobolscope.parser.model.FileReference;
import com.cobolscope.parser.model.Paragraph;
import com.cobolscope.parser.model.ProgramCall;
import com.cobolscope.parser.model.Resource;
import com.cobolscope.parser.model.Section;
import com.cobolscope.parser.token.CobolTokenizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CobolParserTest {
    
    private CobolParser parser;
    
    @BeforeEach
    void setUp() {
        parser = new CobolParser();
    }
    
    @Test
    void acceptsCobolExtensionsCaseInsensitively() {
        assertTrue(parser.canParse(Paths.get("src/A.CBL")));
        assertTrue(parser.canParse(Paths.get("B.cob")));
        assertTrue(parser.canParse(Paths.get("C.Cobol")));
        assertFalse(parser.canParse(Paths.get("C.txt")));
        assertFalse(parser.canParse(Paths.get("cbl")));
    }
    
    @Test
    void parsesSampleBatchProgram() throws Exception {
        CobolProgram program = parser.parse(sample("ORDERPROC.cbl"));
        
        assertEquals("ORDERPROC", program.getName());
        assertEquals(List.of(Division.IDENTIFICATION, Division.ENVIRONMENT, Division.DATA, Division.PROCEDURE),
                new ArrayList<>(program.getDivisions().keySet()));
        
        Division identification = program.division(Division.IDENTIFICATION).orElseThrow();
        assertEquals(1, identification.getStartLine());
        assertEquals(3, identification.getEndLine());
        
        Division data = program.division(Division.DATA).orElseThrow();
        assertEquals(List.of("FILE", "WORKING-STORAGE"), new ArrayList<>(data.getSections().keySet()));
        Section workingStorage = data.getSections().get("WORKING-STORAGE");
        assertEquals(17, workingStorage.getStartLine());
        assertEquals(22, workingStorage.getEndLine());
        
        Section procedure = program.division(Division.PROCEDURE).orElseThrow().getSections().get("PROCEDURE");
        Paragraph mainLogic = procedure.getParagraphs().get("MAIN-LOGIC");
        Paragraph cleanup = procedure.getParagraphs().get("CLEANUP");
        assertEquals(24, mainLogic.getStartLine());
        assertEquals(33, mainLogic.getEndLine());
        assertEquals(34, cleanup.getStartLine());
        assertEquals(35, cleanup.getEndLine());
    }
    
    @Test
    void extractsParagraphSourcesFromSample() throws Exception {
        CobolProgram program = parser.parse(sample("ORDERPROC.cbl"));
        
        assertEquals(List.of("MAIN-LOGIC", "CLEANUP"), new ArrayList<>(program.getParagraphSources().keySet()));
        assertEquals(" CLEANUP.\n     CLOSE ORDER-FILE.", program.paragraphSource("CLEANUP").orElseThrow());
        
        String mainLogic = program.paragraphSource("MAIN-LOGIC").orElseThrow();
        assertTrue(mainLogic.startsWith(" MAIN-LOGIC.\n     OPEN INPUT ORDER-FILE\n"));
        assertTrue(mainLogic.contains("     CALL \"BILLING\" USING ORD-ID ORD-AMOUNT."));
        assertTrue(mainLogic.endsWith("     STOP RUN."));
        assertEquals(10, mainLogic.split("\n").length);
        assertFalse(mainLogic.contains("002500"));
    }
    
    @Test
    void paragraphSourceLeavesOutCommentAndBlankLines() {
        String source = CobolSource.code("PROCEDURE DIVISION.", "MAIN-PARA.")
                + "000300* TRACE ONLY\n"
                + CobolSource.code("    DISPLAY 'A'.", "", "NEXT-PARA.", "    GOBACK.");
        
        CobolProgram program = parser.parseSource("P", "P.cbl", source);
        
        assertEquals(" MAIN-PARA.\n     DISPLAY 'A'.", program.paragraphSource("MAIN-PARA").orElseThrow());
        assertEquals(" NEXT-PARA.\n     GOBACK.", program.paragraphSource("NEXT-PARA").orElseThrow());
    }
    
    @Test
    void extractsDataItemsFromSample() throws Exception {
        CobolProgram program = parser.parse(sample("ORDERPROC.cbl"));
        
        assertEquals(7, program.getDataItems().size());
        
        DataItem amount = program.dataItem("ORD-AMOUNT").orElseThrow();
        assertEquals(5, amount.getLevel());
        assertEquals("S9(7)V99", amount.getPicture());
        assertEquals("COMP-3", amount.getUsage());
        
        DataItem programName = program.dataItem("WS-PROGRAM-NAME").orElseThrow();
        assertEquals("X(8)", programName.getPicture());
        assertEquals("BILLING", programName.getValue());
        
        DataItem entry = program.dataItem("WS-ENTRY").orElseThrow();
        assertEquals(10, entry.getOccurs());
        assertEquals(List.of("WS-IDX"), entry.getIndexedBy());
    }
    
    @Test
    void extractsDependenciesFromSample() throws Exception {
        CobolProgram program = parser.parse(sample("ORDERPROC.cbl"));
        
        assertEquals(1, program.getFiles().size());
        FileReference orderFile = program.getFiles().get(0);
        assertEquals("ORDER-FILE", orderFile.getName());
        assertEquals("INDEXED", orderFile.getOrganization());
        assertEquals("DYNAMIC", orderFile.getAccessMode());
        assertEquals("ORD-ID", orderFile.getRecordKey());
        
        List<ProgramCall> calls = program.getCalls();
        assertEquals(2, calls.size());
        assertEquals("BILLING", calls.get(0).getTarget());
        assertFalse(calls.get(0).isDynamic());
        assertEquals(List.of("ORD-ID", "ORD-AMOUNT"), calls.get(0).getParameters());
        assertEquals("WS-PROGRAM-NAME", calls.get(1).getTarget());
        assertTrue(calls.get(1).isDynamic());
        
        assertEquals(1, program.getResources().size());
        Resource orders = program.getResources().get(0);
        assertEquals("SQL", orders.getType());
        assertEquals("SELECT", orders.getOperation());
        assertEquals("ORDERS", orders.getName());
        assertEquals(28, orders.getLocation().getLine());
        
        assertEquals(Set.of("ORDCOPY"), program.getCopybooks());
        assertTrue(program.getMapsUsed().isEmpty());
    }
    
    @Test
    void parsesOnlineProgramWithCicsBlocks() throws Exception {
        CobolProgram program = parser.parse(sample("BILLING.cob"));
        
        assertEquals("BILLING", program.getName());
        assertEquals(Set.of("BILLMAP"), program.getMapsUsed());
        assertEquals(2, program.getResources().size());
        assertEquals("CICS:" + Resource.UNKNOWN_NAME, program.getResources().get(0).usageKey());
        assertEquals("SEND", program.getResources().get(0).getOperation());
        assertEquals("CICS:AUDITLOG", program.getResources().get(1).usageKey());
        assertEquals("LINK", program.getResources().get(1).getOperation());
        assertEquals("ORDERPROC", program.getCalls().get(0).getTarget());
        assertTrue(program.getFiles().isEmpty());
    }
    
    @Test
    void missingFileFailsWithSourceReadException(@TempDir Path tempDir) {
        Path missing = tempDir.resolve("GONE.cbl");
        
        SourceReadException e = assertThrows(SourceReadException.class, () -> parser.parse(missing));
        assertEquals(missing, e.getSourcePath());
        assertTrue(e.getMessage().contains("GONE.cbl"));
    }
    
    @Test
    void invalidUtf8IsReplacedNotRejected(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("BADENC.cbl");
        byte[] prefix = CobolSource.code("PROCEDURE DIVISION.", "MAIN-PARA.", "    DISPLAY 'X").getBytes(StandardCharsets.UTF_8);
        byte[] bytes = new byte[prefix.length + 2];
        System.arraycopy(prefix, 0, bytes, 0, prefix.length);
        bytes[prefix.length] = (byte) 0xC3;
        bytes[prefix.length + 1] = (byte) 0x28;
        Files.write(file, bytes);
        
        CobolProgram program = parser.parse(file);
        
        assertEquals("BADENC", program.getName());
        assertTrue(program.division(Division.PROCEDURE).isPresent());
    }
    
    @Test
    void emptySourceGivesEmptyProgram() {
        CobolProgram program = parser.parseSource("EMPTY", "EMPTY.cbl", "");
        
        assertTrue(program.getDivisions().isEmpty());
        assertTrue(program.getDataItems().isEmpty());
        assertTrue(program.getCalls().isEmpty());
        assertTrue(program.getParagraphSources().isEmpty());
    }
    
    @Test
    void passesCanBeReplaced() {
        CobolParser callsOnly = new CobolParser(new CobolTokenizer(), List.of(new ProgramCallPass()));
        
        CobolProgram program = callsOnly.parseSource("P", "P.cbl",
                CobolSource.code("PROCEDURE DIVISION.", "MAIN-PARA.", "    CALL 'SUB1'."));
        
        assertEquals(1, program.getCalls().size());
        assertTrue(program.getDivisions().isEmpty());
    }
    
    private static Path sample(String name) throws URISyntaxException {
        return Paths.get(CobolParserTest.class.getResource("/samples/" + name).toURI());
    }
}
