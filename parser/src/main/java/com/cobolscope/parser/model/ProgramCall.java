package com.cobolscope.parser.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * A CALL statement. A literal target is static; an identifier target is dynamic and names
 * the data item expected to hold the program name at run time.
 */
public final class ProgramCall {
    
    private final String target;
    private final boolean dynamic;
    private final List<String> parameters;
    private final SourceLocation location;
    
    @JsonCreator
    public ProgramCall(@JsonProperty("target") String target,
                       @JsonProperty("dynamic") boolean dynamic,
                       @JsonProperty("parameters") List<String> parameters,
                       @JsonProperty("location") SourceLocation location) {
        this.target = Objects.requireNonNull(target, "Call target cannot be null");
        this.dynamic = dynamic;
        this.parameters = parameters != null ? List.copyOf(parameters) : List.of();
        this.location = location;
    }
    
    public String getTarget() { return target; }
    public boolean isDynamic() { return dynamic; }
    public List<String> getParameters() { return parameters; }
    public SourceLocation getLocation() { return location; }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ProgramCall that = (ProgramCall) o;
        return dynamic == that.dynamic &&
               target.equals(that.target) &&
               parameters.equals(that.parameters) &&
               Objects.equals(location, that.location);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(target, dynamic, parameters, location);
    }
    
    @Override
    public String toString() {
        return "ProgramCall{" + target + (dynamic ? " (dynamic)" : "") +
                (parameters.isEmpty() ? "" : " USING " + String.join(" ", parameters)) + '}';
    }
}
