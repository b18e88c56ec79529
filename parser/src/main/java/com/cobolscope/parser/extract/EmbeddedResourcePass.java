package com.cobolscope.parser.extract;

import com.cobolscope.parser.model.CobolProgram;
import com.cobolscope.parser.model.Resource;
import com.cobolscope.parser.token.Token;
import com.cobolscope.parser.token.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Turns each EXEC ... END-EXEC block into at most one {@link Resource}. The word after EXEC is
 * the resource type, the first keyword inside the block is the operation, and the name is the
 * operand of the last sublanguage-specific naming word (FROM, PROGRAM, QNAME, ...). A block
 * that is never closed by END-EXEC produces nothing.
 */
public class EmbeddedResourcePass implements ExtractionPass {
    
    private static final Logger logger = LoggerFactory.getLogger(EmbeddedResourcePass.class);
    
    @Override
    public void extract(List<Token> tokens, CobolProgram.Builder program) {
        int count = 0;
        int i = 0;
        while (i < tokens.size()) {
            Token exec = tokens.get(i);
            if (!TokenScan.isExecStart(exec) || i + 1 >= tokens.size() || tokens.get(i + 1).isWord(TokenScan.END_EXEC)) {
                i++;
                continue;
            }
            
            String type = tokens.get(i + 1).getUpperText();
            EmbeddedLanguage language = EmbeddedLanguage.of(type);
            int end = TokenScan.findEndExec(tokens, i + 2);
            int limit = end >= 0 ? end : tokens.size();
            
            String operation = null;
            String name = null;
            for (int j = i + 2; j < limit; j++) {
                Token token = tokens.get(j);
                if (operation == null && token.is(TokenType.KEYWORD)) {
                    operation = token.getUpperText();
                }
                if (language.isNameKeyword(token.getText())) {
                    NameMatch match = readName(tokens, j + 1, limit, language);
                    if (match != null) {
                        name = match.name;
                        j = match.lastIndex;
                    }
                }
            }
            
            if (end < 0) {
                logger.debug("Unterminated EXEC {} block at line {} in {}", type, exec.getLine(), program.getName());
            } else if (operation != null) {
                program.resource(new Resource(name, type, operation, TokenScan.locationOf(exec)));
                count++;
            }
            
            // Continue after END-EXEC, or stop at the end of the stream
            i = limit + 1;
        }
        logger.debug("Embedded resources in {}: {}", program.getName(), count);
    }
    
    /**
     * Name operand starting at {@code index}: an optional opening parenthesis, then an identifier,
     * literal or keyword. A {@code :} marks a host variable, which is never a resource name. In SQL,
     * a dotted qualified name written without spaces ({@code OWNER.TABLE}) is kept whole.
     */
    private NameMatch readName(List<Token> tokens, int index, int limit, EmbeddedLanguage language) {
        int k = TokenScan.skipOpenParen(tokens, index);
        if (k >= limit) {
            return null;
        }
        
        Token first = tokens.get(k);
        if (!isNameToken(first)) {
            return null;
        }
        
        StringBuilder name = new StringBuilder(first.getUpperText());
        if (language.allowsQualifiedNames() && !first.is(TokenType.LITERAL)) {
            Token last = first;
            while (k + 2 < limit) {
                Token dot = tokens.get(k + 1);
                Token part = tokens.get(k + 2);
                if (!TokenScan.isPeriod(dot) || !touches(last, dot) || !touches(dot, part) ||
                        !isNameToken(part) || part.is(TokenType.LITERAL)) {
                    break;
                }
                name.append('.').append(part.getUpperText());
                last = part;
                k += 2;
            }
        }
        return new NameMatch(name.toString(), k);
    }
    
    private static boolean isNameToken(Token token) {
        return token.is(TokenType.IDENTIFIER) || token.is(TokenType.LITERAL) || token.is(TokenType.KEYWORD);
    }
    
    private static boolean touches(Token left, Token right) {
        return left.getLine() == right.getLine() &&
                left.getColumn() + left.getText().length() == right.getColumn();
    }
    
    private static final class NameMatch {
        private final String name;
        private final int lastIndex;
        
        private NameMatch(String name, int lastIndex) {
            this.name = name;
            this.lastIndex = lastIndex;
        }
    }
}
