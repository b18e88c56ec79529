package com.cobolscope.parser.extract;

import java.util.Locale;
import java.util.Set;

/**
 * Sublanguages that appear inside EXEC ... END-EXEC, with the words after which each one names
 * the resource it touches.
 */
public enum EmbeddedLanguage {
    
    SQL(Set.of("FROM", "INTO", "UPDATE", "TABLE")),
    CICS(Set.of("PROGRAM", "TRANSID", "QUEUE", "FILE")),
    MQ(Set.of("QNAME", "QUEUE")),
    OTHER(Set.of());
    
    private final Set<String> nameKeywords;
    
    EmbeddedLanguage(Set<String> nameKeywords) {
        this.nameKeywords = nameKeywords;
    }
    
    public boolean isNameKeyword(String word) {
        return nameKeywords.contains(word.toUpperCase(Locale.ROOT));
    }
    
    /**
     * Whether a dotted name such as {@code OWNER.TABLE} is one resource name
     */
    public boolean allowsQualifiedNames() {
        return this == SQL;
    }
    
    public static EmbeddedLanguage of(String name) {
        if (name == null) {
            return OTHER;
        }
        switch (name.toUpperCase(Locale.ROOT)) {
            case "SQL":
                return SQL;
            case "CICS":
                return CICS;
            case "MQ":
                return MQ;
            default:
                return OTHER;
        }
    }
}
