package com.cobolscope.parser.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A named paragraph and the source lines it spans (inclusive).
 */
public final class Paragraph {
    
    private final String name;
    private final int startLine;
    private final int endLine;
    
    @JsonCreator
    public Paragraph(@JsonProperty("name") String name,
                     @JsonProperty("startLine") int startLine,
                     @JsonProperty("endLine") int endLine) {
        this.name = Objects.requireNonNull(name, "Paragraph name cannot be null");
        this.startLine = startLine;
        this.endLine = endLine;
    }
    
    public String getName() { return name; }
    public int getStartLine() { return startLine; }
    public int getEndLine() { return endLine; }
    
    public boolean contains(int line) {
        return line >= startLine && line <= endLine;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Paragraph that = (Paragraph) o;
        return startLine == that.startLine && endLine == that.endLine && name.equals(that.name);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(name, startLine, endLine);
    }
    
    @Override
    public String toString() {
        return "Paragraph{" + name + ", lines=" + startLine + "-" + endLine + '}';
    }
}
