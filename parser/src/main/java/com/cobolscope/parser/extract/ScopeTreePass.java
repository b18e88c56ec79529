package com.cobolscope.parser.extract;

import com.cobolscope.parser.model.CobolProgram;
import com.cobolscope.parser.model.DataItem;
import com.cobolscope.parser.model.Division;
import com.cobolscope.parser.model.Paragraph;
import com.cobolscope.parser.model.Section;
import com.cobolscope.parser.token.Token;
import com.cobolscope.parser.token.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the division / section / paragraph tree and the data item table.
 * <p>
 * Scopes have no explicit terminators in COBOL, so a scope is closed when the next scope of the
 * same or a coarser kind opens (end line = that token's line - 1) or when the token stream
 * ends (end line = last token's line). Duplicate names in the same scope replace the earlier
 * entry.
 */
public class ScopeTreePass implements ExtractionPass {
    
    private static final Logger logger = LoggerFactory.getLogger(ScopeTreePass.class);
    
    private static final String SECTION = "SECTION";
    
    private final DataItemReader dataItemReader = new DataItemReader();
    
    @Override
    public void extract(List<Token> tokens, CobolProgram.Builder program) {
        ScopeState state = new ScopeState(program);
        
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            Token previous = TokenScan.at(tokens, i - 1);
            Token next = TokenScan.at(tokens, i + 1);
            
            if (token.is(TokenType.DIVISION)) {
                state.closeDivision(token.getLine() - 1);
                state.openDivision(token.getUpperText(), token.getLine());
                
            } else if (token.isKeyword(SECTION)) {
                if (state.division != null && isSectionName(previous)) {
                    state.closeSection(token.getLine() - 1);
                    state.openSection(previous.getUpperText(), token.getLine());
                }
                
            } else if (isParagraphHeader(state, token, previous, next)) {
                state.closeParagraph(token.getLine() - 1);
                if (state.section == null) {
                    // Paragraphs outside any SECTION live in an implicit section named after the division
                    state.openSection(state.division.name, token.getLine());
                }
                state.openParagraph(token.getUpperText(), token.getLine());
                
            } else if (state.inDivision(Division.DATA) &&
                    token.is(TokenType.NUMBER) &&
                    next != null && next.is(TokenType.IDENTIFIER)) {
                DataItem item = dataItemReader.read(tokens, i);
                if (item != null) {
                    program.dataItem(item);
                }
            }
        }
        
        if (!tokens.isEmpty()) {
            state.closeDivision(tokens.get(tokens.size() - 1).getLine());
        }
        
        logger.debug("Scope tree for {}: {} divisions", program.getName(), state.divisionCount);
    }
    
    private static boolean isSectionName(Token previous) {
        return previous != null &&
                (previous.is(TokenType.IDENTIFIER) || previous.is(TokenType.KEYWORD)) &&
                !previous.isWord(SECTION);
    }
    
    private static boolean isParagraphHeader(ScopeState state, Token token, Token previous, Token next) {
        return token.is(TokenType.IDENTIFIER) &&
                state.inDivision(Division.PROCEDURE) &&
                (previous == null || previous.getLine() != token.getLine()) &&
                (next == null || !next.isKeyword(SECTION));
    }
    
    /**
     * The three open scopes. Closing a scope first closes everything nested in it.
     */
    private static final class ScopeState {
        private final CobolProgram.Builder program;
        private OpenScope division;
        private OpenScope section;
        private OpenScope paragraph;
        private int divisionCount;
        
        private ScopeState(CobolProgram.Builder program) {
            this.program = program;
        }
        
        boolean inDivision(String name) {
            return division != null && division.name.equals(name);
        }
        
        void openDivision(String name, int line) {
            division = new OpenScope(name, line);
        }
        
        void openSection(String name, int line) {
            section = new OpenScope(name, line);
        }
        
        void openParagraph(String name, int line) {
            paragraph = new OpenScope(name, line);
        }
        
        void closeParagraph(int endLine) {
            if (paragraph == null) {
                return;
            }
            if (section != null) {
                section.paragraphs.put(paragraph.name, new Paragraph(paragraph.name, paragraph.startLine, endLine));
            }
            paragraph = null;
        }
        
        void closeSection(int endLine) {
            closeParagraph(endLine);
            if (section == null) {
                return;
            }
            if (division != null) {
                division.sections.put(section.name,
                        new Section(section.name, section.startLine, endLine, section.paragraphs));
            }
            section = null;
        }
        
        void closeDivision(int endLine) {
            closeSection(endLine);
            if (division == null) {
                return;
            }
            program.division(new Division(division.name, division.startLine, endLine, division.sections));
            divisionCount++;
            division = null;
        }
    }
    
    private static final class OpenScope {
        private final String name;
        private final int startLine;
        private final Map<String, Paragraph> paragraphs = new LinkedHashMap<>();
        private final Map<String, Section> sections = new LinkedHashMap<>();
        
        private OpenScope(String name, int startLine) {
            this.name = name;
            this.startLine = startLine;
        }
    }
}
