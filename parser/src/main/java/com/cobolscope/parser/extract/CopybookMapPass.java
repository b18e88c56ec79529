package com.cobolscope.parser.extract;

import com.cobolscope.parser.model.CobolProgram;
import com.cobolscope.parser.token.Token;
import com.cobolscope.parser.token.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Records copybook names ({@code COPY member}, {@code EXEC SQL INCLUDE member END-EXEC}) and
 * BMS map names ({@code SEND MAP name}, {@code RECEIVE MAP name}, bare or inside EXEC CICS).
 * Copybooks are recorded by name only, never expanded.
 */
public class CopybookMapPass implements ExtractionPass {
    
    private static final Logger logger = LoggerFactory.getLogger(CopybookMapPass.class);
    
    @Override
    public void extract(List<Token> tokens, CobolProgram.Builder program) {
        int i = 0;
        while (i < tokens.size()) {
            Token token = tokens.get(i);
            
            if (token.isKeyword("COPY")) {
                Token member = TokenScan.at(tokens, i + 1);
                if (member != null && (member.is(TokenType.IDENTIFIER) || member.is(TokenType.LITERAL))) {
                    program.copybook(member.getUpperText());
                }
                i++;
                
            } else if (TokenScan.isExecStart(token)) {
                i = scanExecBlock(tokens, i, program);
                
            } else {
                String mapName = mapNameAt(tokens, i);
                if (mapName != null) {
                    program.map(mapName);
                }
                i++;
            }
        }
        logger.debug("Copybook and map scan finished for {}", program.getName());
    }
    
    /**
     * @return index just past the block's END-EXEC, or the stream size if it is unterminated
     */
    private int scanExecBlock(List<Token> tokens, int execIndex, CobolProgram.Builder program) {
        Token language = TokenScan.at(tokens, execIndex + 1);
        int end = TokenScan.findEndExec(tokens, execIndex + 1);
        int limit = end >= 0 ? end : tokens.size();
        
        if (language != null && language.isWord("CICS")) {
            for (int j = execIndex + 2; j < limit; j++) {
                String mapName = mapNameAt(tokens, j);
                if (mapName != null) {
                    program.map(mapName);
                }
            }
        } else if (language != null && language.isWord("SQL") && TokenScan.isWordAt(tokens, execIndex + 2, "INCLUDE")) {
            Token member = TokenScan.at(tokens, execIndex + 3);
            if (member != null && execIndex + 3 < limit &&
                    (member.is(TokenType.IDENTIFIER) || member.is(TokenType.LITERAL))) {
                program.copybook(member.getUpperText());
            }
        }
        return limit + 1;
    }
    
    /**
     * Map name if {@code SEND MAP name} / {@code RECEIVE MAP name} starts at {@code index}.
     * The name may be parenthesised, as in {@code MAP('MENU1')}.
     */
    private String mapNameAt(List<Token> tokens, int index) {
        Token verb = TokenScan.at(tokens, index);
        if (verb == null || !verb.is(TokenType.KEYWORD) || !verb.isWord("SEND", "RECEIVE")) {
            return null;
        }
        if (!TokenScan.isWordAt(tokens, index + 1, "MAP")) {
            return null;
        }
        Token name = TokenScan.at(tokens, TokenScan.skipOpenParen(tokens, index + 2));
        if (name == null || !(name.is(TokenType.IDENTIFIER) || name.is(TokenType.LITERAL))) {
            return null;
        }
        return name.getUpperText();
    }
}
