package com.cobolscope.parser.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CobolProgramTest {
    
    private static DataItem item(String name, int level) {
        return DataItem.builder().name(name).level(level).build();
    }
    
    @Test
    void childGroupingIsByNamePrefix() {
        DataItem custRec = item("CUST-REC", 1);
        CobolProgram program = CobolProgram.builder("CUST", "CUST.cbl")
                .dataItem(custRec)
                .dataItem(item("CUST-REC-ID", 5))
                .dataItem(item("CUST-NAME", 5))
                .dataItem(item("CUST-RECALL", 1))
                .dataItem(item("CUST-RECALL-DATE", 5))
                .build();
        
        assertEquals(List.of("CUST-REC", "CUST-RECALL"), names(program.topLevelRecords()));
        
        // CUST-RECALL-DATE belongs to the unrelated CUST-RECALL record but shares the prefix;
        // CUST-NAME sits under CUST-REC in the source but does not
        assertEquals(List.of("CUST-REC-ID", "CUST-RECALL-DATE"), names(program.childrenOf(custRec)));
        assertTrue(program.dataItem("CUST-RECALL").orElseThrow().getName().startsWith(custRec.getName()));
    }
    
    @Test
    void paragraphAtSearchesAllSections() {
        Section first = new Section("FIRST-STEP", 2, 5, Map.of("PARA-A", new Paragraph("PARA-A", 3, 5)));
        Section second = new Section("SECOND-STEP", 6, 9, Map.of("PARA-B", new Paragraph("PARA-B", 7, 9)));
        Map<String, Section> sections = new LinkedHashMap<>();
        sections.put(first.getName(), first);
        sections.put(second.getName(), second);
        
        CobolProgram program = CobolProgram.builder("P", "P.cbl")
                .division(new Division(Division.PROCEDURE, 1, 9, sections))
                .build();
        
        assertEquals("PARA-B", program.paragraphAt(8).orElseThrow().getName());
        assertEquals("PARA-A", program.paragraphAt(3).orElseThrow().getName());
        assertFalse(program.paragraphAt(6).isPresent());
        assertFalse(program.paragraphAt(42).isPresent());
    }
    
    @Test
    void builtProgramIsIndependentOfItsBuilder() {
        CobolProgram.Builder builder = CobolProgram.builder("P", "P.cbl").copybook("ONE");
        CobolProgram program = builder.build();
        builder.copybook("TWO");
        
        assertEquals(List.of("ONE"), new ArrayList<>(program.getCopybooks()));
        assertThrows(UnsupportedOperationException.class, () -> program.getCopybooks().add("THREE"));
    }
    
    @Test
    void resourceWithoutNameIsUnknown() {
        Resource resource = new Resource(null, "CICS", "RETURN", new SourceLocation(4, 12));
        
        assertEquals(Resource.UNKNOWN_NAME, resource.getName());
        assertEquals("CICS:UNKNOWN", resource.usageKey());
    }
    
    @Test
    void programNameIsRequired() {
        assertThrows(NullPointerException.class, () -> CobolProgram.builder(null, "X.cbl"));
    }
    
    private static List<String> names(List<DataItem> items) {
        return items.stream().map(DataItem::getName).collect(Collectors.toList());
    }
}
