package com.cobolscope.parser.token;

import org.apache.commons.lang3.StringUtils;

import java.util.Locale;
import java.util.Objects;

/**
 * A single lexeme of COBOL source with its 1-based line and column.
 */
public final class Token {
    
    private final TokenType type;
    private final String text;
    private final int line;
    private final int column;
    
    public Token(TokenType type, String text, int line, int column) {
        this.type = Objects.requireNonNull(type, "Type cannot be null");
        this.text = Objects.requireNonNull(text, "Text cannot be null");
        this.line = line;
        this.column = column;
    }
    
    public TokenType getType() { return type; }
    public String getText() { return text; }
    public int getLine() { return line; }
    public int getColumn() { return column; }
    
    public String getUpperText() {
        return text.toUpperCase(Locale.ROOT);
    }
    
    public boolean is(TokenType expected) {
        return type == expected;
    }
    
    /**
     * Case-insensitive comparison against one or more words
     */
    public boolean isWord(String... words) {
        return StringUtils.equalsAnyIgnoreCase(text, words);
    }
    
    public boolean isKeyword(String word) {
        return type == TokenType.KEYWORD && text.equalsIgnoreCase(word);
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Token token = (Token) o;
        return line == token.line &&
               column == token.column &&
               type == token.type &&
               text.equals(token.text);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(type, text, line, column);
    }
    
    @Override
    public String toString() {
        return String.format("%s: '%s' at line %d, column %d", type, text, line, column);
    }
}
