package com.cobolscope.parser.token;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns fixed-format COBOL source into an ordered token stream.
 * Columns 1-6 (sequence area) are ignored, an asterisk or slash in column 7 makes the line a
 * comment, and everything from column 7 onwards is scanned left to right. Continuation lines
 * are not merged. The tokenizer never fails: characters it cannot classify become
 * {@link TokenType#UNKNOWN} tokens.
 */
public class CobolTokenizer {
    
    private static final int SEQUENCE_AREA_WIDTH = 6;
    private static final int INDICATOR_COLUMN = 7;
    
    private static final Pattern LINE_BREAK = Pattern.compile("\\R");
    
    // Scan order matters: first pattern that matches at the current position wins
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern INLINE_COMMENT = Pattern.compile("\\*>.*");
    private static final Pattern STRING_LITERAL = Pattern.compile("\"([^\"]*)\"|'([^']*)'");
    // A digit run glued to letters or hyphens is a word, e.g. paragraph 1000-INIT or picture 9V99
    private static final Pattern NUMBER = Pattern.compile("\\d+(\\.\\d+)?(?![-A-Za-z0-9])");
    private static final Pattern WORD = Pattern.compile("[A-Za-z0-9][-A-Za-z0-9]*");
    private static final Pattern OPERATOR = Pattern.compile("[+\\-*/=<>]");
    private static final Pattern PUNCTUATION = Pattern.compile("[.,;:]");
    private static final Pattern SPECIAL = Pattern.compile("[(){}\\[\\]]");
    
    /**
     * Tokenize a complete source text. Line numbers are 1-based.
     */
    public List<Token> tokenize(String sourceCode) {
        List<Token> tokens = new ArrayList<>();
        if (sourceCode == null || sourceCode.isEmpty()) {
            return tokens;
        }
        
        String[] lines = LINE_BREAK.split(sourceCode);
        for (int i = 0; i < lines.length; i++) {
            tokenizeLine(lines[i], i + 1, tokens);
        }
        return tokens;
    }
    
    void tokenizeLine(String line, int lineNumber, List<Token> out) {
        if (line.length() <= SEQUENCE_AREA_WIDTH) {
            return;
        }
        
        char indicator = line.charAt(SEQUENCE_AREA_WIDTH);
        if (indicator == '*' || indicator == '/') {
            out.add(new Token(TokenType.COMMENT, line.substring(INDICATOR_COLUMN).strip(),
                    lineNumber, INDICATOR_COLUMN));
            return;
        }
        
        String content = line.substring(SEQUENCE_AREA_WIDTH).stripTrailing();
        scanContent(content, lineNumber, out);
    }
    
    private void scanContent(String content, int lineNumber, List<Token> out) {
        int position = 0;
        int length = content.length();
        
        while (position < length) {
            int column = position + INDICATOR_COLUMN;
            Matcher matcher;
            
            if ((matcher = matchAt(WHITESPACE, content, position)) != null) {
                position = matcher.end();
                continue;
            }
            
            if ((matcher = matchAt(INLINE_COMMENT, content, position)) != null) {
                out.add(new Token(TokenType.COMMENT, matcher.group(), lineNumber, column));
                position = matcher.end();
                continue;
            }
            
            if ((matcher = matchAt(STRING_LITERAL, content, position)) != null) {
                String value = matcher.group(1) != null ? matcher.group(1) : matcher.group(2);
                out.add(new Token(TokenType.LITERAL, value, lineNumber, column));
                position = matcher.end();
                continue;
            }
            
            if ((matcher = matchAt(NUMBER, content, position)) != null) {
                out.add(new Token(TokenType.NUMBER, matcher.group(), lineNumber, column));
                position = matcher.end();
                continue;
            }
            
            if ((matcher = matchAt(WORD, content, position)) != null) {
                String text = matcher.group();
                out.add(new Token(classifyWord(text), text, lineNumber, column));
                position = matcher.end();
                continue;
            }
            
            if ((matcher = matchAt(OPERATOR, content, position)) != null) {
                out.add(new Token(TokenType.OPERATOR, matcher.group(), lineNumber, column));
                position = matcher.end();
                continue;
            }
            
            if ((matcher = matchAt(PUNCTUATION, content, position)) != null) {
                out.add(new Token(TokenType.PUNCTUATION, matcher.group(), lineNumber, column));
                position = matcher.end();
                continue;
            }
            
            if ((matcher = matchAt(SPECIAL, content, position)) != null) {
                out.add(new Token(TokenType.SPECIAL, matcher.group(), lineNumber, column));
                position = matcher.end();
                continue;
            }
            
            // Unrecognised character: emit it alone so the scan always advances
            out.add(new Token(TokenType.UNKNOWN, String.valueOf(content.charAt(position)), lineNumber, column));
            position++;
        }
    }
    
    static TokenType classifyWord(String text) {
        if (ReservedWords.isDivision(text)) {
            return TokenType.DIVISION;
        }
        return ReservedWords.isKeyword(text) ? TokenType.KEYWORD : TokenType.IDENTIFIER;
    }
    
    private static Matcher matchAt(Pattern pattern, String content, int position) {
        Matcher matcher = pattern.matcher(content);
        matcher.region(position, content.length());
        return matcher.lookingAt() ? matcher : null;
    }
}
