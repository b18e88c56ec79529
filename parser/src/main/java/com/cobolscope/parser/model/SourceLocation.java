package com.cobolscope.parser.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Line and column (both 1-based) of the token a model element was recognised at.
 */
public final class SourceLocation {
    
    private final int line;
    private final int column;
    
    @JsonCreator
    public SourceLocation(@JsonProperty("line") int line,
                          @JsonProperty("column") int column) {
        this.line = line;
        this.column = column;
    }
    
    public int getLine() { return line; }
    public int getColumn() { return column; }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SourceLocation that = (SourceLocation) o;
        return line == that.line && column == that.column;
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(line, column);
    }
    
    @Override
    public String toString() {
        return line + ":" + column;
    }
}
