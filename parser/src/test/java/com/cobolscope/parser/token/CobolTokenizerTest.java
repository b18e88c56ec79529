package com.cobolscope.parser.token;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CobolTokenizerTest {
    
    private final CobolTokenizer tokenizer = new CobolTokenizer();
    
    @Test
    void asteriskInIndicatorColumnMakesWholeLineOneComment() {
        List<Token> tokens = tokenizer.tokenize("000100* MOVE A TO B. CALL 'X'.");
        
        assertEquals(1, tokens.size());
        Token comment = tokens.get(0);
        assertEquals(TokenType.COMMENT, comment.getType());
        assertEquals("MOVE A TO B. CALL 'X'.", comment.getText());
        assertEquals(1, comment.getLine());
        assertEquals(7, comment.getColumn());
    }
    
    @Test
    void slashInIndicatorColumnIsAlsoAComment() {
        List<Token> tokens = tokenizer.tokenize("      /PAGE HEADER");
        
        assertEquals(1, tokens.size());
        assertEquals(TokenType.COMMENT, tokens.get(0).getType());
    }
    
    @Test
    void blankContentAreaYieldsNoTokens() {
        assertTrue(tokenizer.tokenize("000100          \n      \n123").isEmpty());
    }
    
    @Test
    void sequenceAreaIsIgnoredAndColumnsAreOneBased() {
        List<Token> tokens = tokenizer.tokenize("ABCDEF MOVE WS-A TO WS-B.");
        
        assertEquals(List.of("MOVE", "WS-A", "TO", "WS-B", "."), texts(tokens));
        assertEquals(8, tokens.get(0).getColumn());
        assertEquals(13, tokens.get(1).getColumn());
        assertEquals(TokenType.KEYWORD, tokens.get(0).getType());
        assertEquals(TokenType.IDENTIFIER, tokens.get(1).getType());
        assertEquals(TokenType.PUNCTUATION, tokens.get(4).getType());
    }
    
    @Test
    void classifiesDivisionsKeywordsAndIdentifiersCaseInsensitively() {
        List<Token> tokens = tokenizer.tokenize("       procedure division using ws-area.");
        
        assertEquals(TokenType.DIVISION, tokens.get(0).getType());
        assertEquals(TokenType.KEYWORD, tokens.get(1).getType());
        assertEquals(TokenType.KEYWORD, tokens.get(2).getType());
        assertEquals(TokenType.IDENTIFIER, tokens.get(3).getType());
        assertEquals("ws-area", tokens.get(3).getText());
        assertEquals("WS-AREA", tokens.get(3).getUpperText());
    }
    
    @Test
    void nativeBinaryUsagesAreKeywords() {
        List<Token> tokens = tokenizer.tokenize("       01 WS-A PIC S9(9) COMP-5 COMPUTATIONAL-5.");
        
        assertEquals("COMP-5", tokens.get(7).getText());
        assertEquals(TokenType.KEYWORD, tokens.get(7).getType());
        assertEquals(TokenType.KEYWORD, tokens.get(8).getType());
    }
    
    @Test
    void literalsDropTheirQuotes() {
        List<Token> tokens = tokenizer.tokenize("       CALL \"SUBPROG\" 'SINGLE Q'.");
        
        assertEquals(TokenType.LITERAL, tokens.get(1).getType());
        assertEquals("SUBPROG", tokens.get(1).getText());
        assertEquals(TokenType.LITERAL, tokens.get(2).getType());
        assertEquals("SINGLE Q", tokens.get(2).getText());
    }
    
    @Test
    void numbersAndNumericPrefixedWords() {
        List<Token> tokens = tokenizer.tokenize("       05 1000-INIT 12.50 9V99");
        
        assertEquals(TokenType.NUMBER, tokens.get(0).getType());
        assertEquals(TokenType.IDENTIFIER, tokens.get(1).getType());
        assertEquals("1000-INIT", tokens.get(1).getText());
        assertEquals(TokenType.NUMBER, tokens.get(2).getType());
        assertEquals("12.50", tokens.get(2).getText());
        assertEquals(TokenType.IDENTIFIER, tokens.get(3).getType());
    }
    
    @Test
    void floatingCommentMarkerEndsTheLineButLoneAsteriskIsAnOperator() {
        List<Token> tokens = tokenizer.tokenize("       SELECT * FROM T *> trailing note");
        
        assertEquals(List.of("SELECT", "*", "FROM", "T", "*> trailing note"), texts(tokens));
        assertEquals(TokenType.OPERATOR, tokens.get(1).getType());
        assertEquals(TokenType.COMMENT, tokens.get(4).getType());
    }
    
    @Test
    void unrecognisedCharactersBecomeUnknownTokens() {
        List<Token> tokens = tokenizer.tokenize("       MOVE @ TO X");
        
        assertEquals(TokenType.UNKNOWN, tokens.get(1).getType());
        assertEquals("@", tokens.get(1).getText());
        assertEquals(4, tokens.size());
    }
    
    @Test
    void specialCharactersAndLineNumbers() {
        List<Token> tokens = tokenizer.tokenize("       01 A.\r\n       05 B PIC X(3).");
        
        assertEquals(1, tokens.get(0).getLine());
        Token open = tokens.stream().filter(t -> t.getText().equals("(")).findFirst().orElseThrow();
        assertEquals(TokenType.SPECIAL, open.getType());
        assertEquals(2, open.getLine());
    }
    
    @Test
    void reservedWordsCoverEmbeddedVerbs() {
        assertTrue(ReservedWords.isKeyword("exec"));
        assertTrue(ReservedWords.isKeyword("END-EXEC"));
        assertTrue(ReservedWords.isKeyword("XCTL"));
        assertTrue(ReservedWords.isKeyword("MQPUT"));
        assertTrue(ReservedWords.isDivision("Data"));
        assertTrue(ReservedWords.size() > 300);
    }
    
    private static List<String> texts(List<Token> tokens) {
        return tokens.stream().map(Token::getText).collect(Collectors.toList());
    }
}
