package com.cobolscope.parser.extract;

import com.cobolscope.parser.model.DataItem;
import com.cobolscope.parser.token.Token;
import com.cobolscope.parser.token.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Reads one {@code <level> <name> [clauses]} declaration. Only clauses on the declaration's own
 * source line are considered; anything else on that line is skipped one token at a time.
 */
class DataItemReader {
    
    private static final Logger logger = LoggerFactory.getLogger(DataItemReader.class);
    
    private static final Set<String> BARE_USAGES = Set.of(
            "BINARY", "COMP", "COMP-1", "COMP-2", "COMP-3", "COMP-4", "COMP-5",
            "COMPUTATIONAL", "COMPUTATIONAL-1", "COMPUTATIONAL-2", "COMPUTATIONAL-3",
            "COMPUTATIONAL-4", "COMPUTATIONAL-5", "PACKED-DECIMAL", "DISPLAY", "INDEX", "POINTER");
    
    /**
     * @param levelIndex index of the level-number token; the name token follows it
     * @return the item, or {@code null} when the level number is not an integer
     */
    DataItem read(List<Token> tokens, int levelIndex) {
        Token levelToken = tokens.get(levelIndex);
        Token nameToken = tokens.get(levelIndex + 1);
        
        int level;
        try {
            level = Integer.parseInt(levelToken.getText());
        } catch (NumberFormatException e) {
            logger.warn("Skipping data item {} at line {}: invalid level number '{}'",
                    nameToken.getText(), levelToken.getLine(), levelToken.getText());
            return null;
        }
        
        DataItem.Builder item = DataItem.builder()
                .name(nameToken.getUpperText())
                .level(level)
                .location(TokenScan.locationOf(levelToken));
        
        int line = levelToken.getLine();
        int j = levelIndex + 2;
        while (j < tokens.size() && tokens.get(j).getLine() == line) {
            Token clause = tokens.get(j);
            
            if (clause.isWord("PIC", "PICTURE")) {
                j = readPicture(tokens, j, line, item);
            } else if (clause.isWord("USAGE")) {
                j = readOperand(tokens, j, line, item::usage, false);
            } else if (clause.isWord("VALUE", "VALUES")) {
                j = readOperand(tokens, j, line, item::value, false);
            } else if (clause.isWord("REDEFINES")) {
                j = readOperand(tokens, j, line, item::redefines, true);
            } else if (clause.isWord("OCCURS")) {
                j = readOccurs(tokens, j, line, item, nameToken);
            } else if (clause.isWord("INDEXED")) {
                j = readIndexedBy(tokens, j, line, item);
            } else if (!item.hasUsage() && !clause.is(TokenType.LITERAL) && BARE_USAGES.contains(clause.getUpperText())) {
                item.usage(clause.getUpperText());
                j++;
            } else {
                j++;
            }
        }
        
        return item.build();
    }
    
    private int readOperand(List<Token> tokens, int clauseIndex, int line,
                            Consumer<String> target, boolean upperCase) {
        int operandIndex = TokenScan.skipIs(tokens, clauseIndex + 1);
        Token operand = TokenScan.at(tokens, operandIndex);
        if (operand == null || operand.getLine() != line) {
            return clauseIndex + 1;
        }
        target.accept(upperCase ? operand.getUpperText() : operand.getText());
        return operandIndex + 1;
    }
    
    /**
     * A picture string is lexed into several tokens ({@code S9}, {@code (}, {@code 7}, {@code )},
     * {@code V99}); glue back every token that touches the previous one. A touching period is
     * only part of the picture when another picture token follows it.
     */
    private int readPicture(List<Token> tokens, int clauseIndex, int line, DataItem.Builder item) {
        int j = TokenScan.skipIs(tokens, clauseIndex + 1);
        Token first = TokenScan.at(tokens, j);
        if (first == null || first.getLine() != line || first.is(TokenType.LITERAL)) {
            return clauseIndex + 1;
        }
        
        StringBuilder picture = new StringBuilder(first.getText());
        int end = first.getColumn() + first.getText().length();
        j++;
        while (j < tokens.size()) {
            Token next = tokens.get(j);
            if (next.getLine() != line || next.getColumn() != end || next.is(TokenType.LITERAL)) {
                break;
            }
            if (TokenScan.isPeriod(next)) {
                Token after = TokenScan.at(tokens, j + 1);
                if (after == null || after.getLine() != line || after.getColumn() != end + 1) {
                    break;
                }
            }
            picture.append(next.getText());
            end = next.getColumn() + next.getText().length();
            j++;
        }
        item.picture(picture.toString());
        return j;
    }
    
    private int readOccurs(List<Token> tokens, int clauseIndex, int line, DataItem.Builder item, Token nameToken) {
        Token count = TokenScan.at(tokens, clauseIndex + 1);
        if (count == null || count.getLine() != line) {
            return clauseIndex + 1;
        }
        try {
            item.occurs(Integer.parseInt(count.getText()));
        } catch (NumberFormatException e) {
            logger.warn("Invalid OCCURS count '{}' for {} at line {}, recording 0",
                    count.getText(), nameToken.getText(), line);
            item.occurs(0);
        }
        return clauseIndex + 2;
    }
    
    private int readIndexedBy(List<Token> tokens, int clauseIndex, int line, DataItem.Builder item) {
        int j = clauseIndex + 1;
        Token by = TokenScan.at(tokens, j);
        if (by != null && by.getLine() == line && by.isWord("BY")) {
            j++;
        }
        
        List<String> indexes = new ArrayList<>();
        while (j < tokens.size() && tokens.get(j).getLine() == line && tokens.get(j).is(TokenType.IDENTIFIER)) {
            indexes.add(tokens.get(j).getUpperText());
            j++;
        }
        if (!indexes.isEmpty()) {
            item.indexedBy(indexes);
        }
        return j;
    }
}
