package com.cobolscope.parser.token;

/**
 * Lexical classes produced by the tokenizer.
 */
public enum TokenType {
    KEYWORD, IDENTIFIER, LITERAL, NUMBER, OPERATOR, PUNCTUATION, COMMENT, DIVISION, SPECIAL, UNKNOWN
}
