package com.cobolscope.parser.extract;

import com.cobolscope.parser.model.SourceLocation;
import com.cobolscope.parser.token.Token;
import com.cobolscope.parser.token.TokenType;

import java.util.List;

/**
 * Small lookahead helpers shared by the extraction passes. All lookups are bounds-checked and
 * return {@code null} or {@code -1} rather than throwing.
 */
final class TokenScan {
    
    static final String EXEC = "EXEC";
    static final String END_EXEC = "END-EXEC";
    
    private TokenScan() {
    }
    
    static Token at(List<Token> tokens, int index) {
        return index >= 0 && index < tokens.size() ? tokens.get(index) : null;
    }
    
    static boolean sameLine(Token a, Token b) {
        return a != null && b != null && a.getLine() == b.getLine();
    }
    
    static boolean isWordAt(List<Token> tokens, int index, String word) {
        Token token = at(tokens, index);
        return token != null && token.isWord(word);
    }
    
    static boolean isPeriod(Token token) {
        return token != null && token.is(TokenType.PUNCTUATION) && ".".equals(token.getText());
    }
    
    static boolean isExecStart(Token token) {
        return token != null && token.isKeyword(EXEC);
    }
    
    /**
     * Index of the first END-EXEC at or after {@code from}, or -1 when the block is unterminated
     */
    static int findEndExec(List<Token> tokens, int from) {
        for (int i = Math.max(from, 0); i < tokens.size(); i++) {
            if (tokens.get(i).isWord(END_EXEC)) {
                return i;
            }
        }
        return -1;
    }
    
    /**
     * Skip the noise word IS if it sits at {@code index}
     */
    static int skipIs(List<Token> tokens, int index) {
        Token token = at(tokens, index);
        return token != null && token.isWord("IS") ? index + 1 : index;
    }
    
    /**
     * Skip an opening parenthesis, as in {@code PROGRAM('SUB1')} or {@code MAP('MENU1')}
     */
    static int skipOpenParen(List<Token> tokens, int index) {
        Token token = at(tokens, index);
        return token != null && token.is(TokenType.SPECIAL) && "(".equals(token.getText()) ? index + 1 : index;
    }
    
    static SourceLocation locationOf(Token token) {
        return new SourceLocation(token.getLine(), token.getColumn());
    }
}
