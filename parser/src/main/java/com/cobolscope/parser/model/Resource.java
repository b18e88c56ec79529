package com.cobolscope.parser.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A resource touched from an EXEC ... END-EXEC block: a table, a CICS program, transaction,
 * queue or file, an MQ queue. {@code type} is the sublanguage name (SQL, CICS, MQ, ...).
 */
public final class Resource {
    
    public static final String UNKNOWN_NAME = "UNKNOWN";
    
    private final String name;
    private final String type;
    private final String operation;
    private final SourceLocation location;
    
    @JsonCreator
    public Resource(@JsonProperty("name") String name,
                    @JsonProperty("type") String type,
                    @JsonProperty("operation") String operation,
                    @JsonProperty("location") SourceLocation location) {
        this.name = name != null ? name : UNKNOWN_NAME;
        this.type = Objects.requireNonNull(type, "Resource type cannot be null");
        this.operation = Objects.requireNonNull(operation, "Resource operation cannot be null");
        this.location = location;
    }
    
    public String getName() { return name; }
    public String getType() { return type; }
    public String getOperation() { return operation; }
    public SourceLocation getLocation() { return location; }
    
    /**
     * Key under which the resource is indexed across programs: {@code TYPE:NAME}
     */
    public String usageKey() {
        return usageKey(type, name);
    }
    
    public static String usageKey(String type, String name) {
        return type + ":" + name;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Resource that = (Resource) o;
        return name.equals(that.name) &&
               type.equals(that.type) &&
               operation.equals(that.operation) &&
               Objects.equals(location, that.location);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(name, type, operation, location);
    }
    
    @Override
    public String toString() {
        return String.format("Resource{%s %s %s}", type, operation, name);
    }
}
