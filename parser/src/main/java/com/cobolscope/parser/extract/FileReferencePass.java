package com.cobolscope.parser.extract;

import com.cobolscope.parser.model.CobolProgram;
import com.cobolscope.parser.model.FileReference;
import com.cobolscope.parser.token.Token;
import com.cobolscope.parser.token.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;

/**
 * Collects files from {@code SELECT} entries and, as a fallback, from identifiers that follow
 * an I/O verb on the same line. Both scans ignore tokens inside EXEC ... END-EXEC blocks, where
 * SELECT, READ, DELETE and friends belong to the embedded language.
 */
public class FileReferencePass implements ExtractionPass {
    
    private static final Logger logger = LoggerFactory.getLogger(FileReferencePass.class);
    
    private static final Set<String> IO_VERBS = Set.of("OPEN", "CLOSE", "READ", "WRITE", "REWRITE", "DELETE", "START");
    
    @Override
    public void extract(List<Token> tokens, CobolProgram.Builder program) {
        int declared = extractSelectEntries(tokens, program);
        int inferred = extractUndeclaredFiles(tokens, program);
        logger.debug("Files in {}: {} declared, {} inferred from I/O verbs", program.getName(), declared, inferred);
    }
    
    private int extractSelectEntries(List<Token> tokens, CobolProgram.Builder program) {
        int count = 0;
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (TokenScan.isExecStart(token)) {
                i = skipExecBlock(tokens, i);
                continue;
            }
            if (!token.isKeyword("SELECT")) {
                continue;
            }
            
            int nameIndex = i + 1;
            Token name = TokenScan.at(tokens, nameIndex);
            if (name != null && name.isWord("OPTIONAL")) {
                name = TokenScan.at(tokens, ++nameIndex);
            }
            if (name == null || !name.is(TokenType.IDENTIFIER)) {
                continue;
            }
            
            program.file(readSelectEntry(tokens, token, name, nameIndex + 1));
            count++;
        }
        return count;
    }
    
    /**
     * Reads the clauses of one SELECT entry, up to the next SELECT or the terminating period
     */
    private FileReference readSelectEntry(List<Token> tokens, Token select, Token name, int from) {
        String accessMode = FileReference.ACCESS_SEQUENTIAL;
        String organization = null;
        String recordKey = null;
        
        int j = from;
        while (j < tokens.size() && !tokens.get(j).isWord("SELECT")) {
            Token token = tokens.get(j);
            
            if (TokenScan.isPeriod(token)) {
                break;
            }
            
            if (token.isWord("ORGANIZATION")) {
                Token value = TokenScan.at(tokens, TokenScan.skipIs(tokens, j + 1));
                if (value != null) {
                    organization = value.getUpperText();
                }
            } else if (token.isWord("ACCESS") && TokenScan.isWordAt(tokens, j + 1, "MODE")) {
                Token value = TokenScan.at(tokens, TokenScan.skipIs(tokens, j + 2));
                if (value != null) {
                    accessMode = value.getUpperText();
                }
            } else if (token.isWord("RECORD") && TokenScan.isWordAt(tokens, j + 1, "KEY")) {
                Token value = TokenScan.at(tokens, TokenScan.skipIs(tokens, j + 2));
                if (value != null) {
                    recordKey = value.getUpperText();
                }
            }
            j++;
        }
        
        return new FileReference(name.getUpperText(), accessMode, organization, recordKey,
                TokenScan.locationOf(select));
    }
    
    private int extractUndeclaredFiles(List<Token> tokens, CobolProgram.Builder program) {
        int count = 0;
        for (int i = 0; i < tokens.size(); i++) {
            Token verb = tokens.get(i);
            if (TokenScan.isExecStart(verb)) {
                i = skipExecBlock(tokens, i);
                continue;
            }
            if (!verb.is(TokenType.KEYWORD) || !IO_VERBS.contains(verb.getUpperText())) {
                continue;
            }
            
            for (int j = i + 1; j < tokens.size() && TokenScan.sameLine(tokens.get(j), verb); j++) {
                Token candidate = tokens.get(j);
                if (!candidate.is(TokenType.IDENTIFIER)) {
                    continue;
                }
                String fileName = candidate.getUpperText();
                if (!program.hasFile(fileName)) {
                    program.file(new FileReference(fileName, FileReference.ACCESS_UNKNOWN, null, null,
                            TokenScan.locationOf(verb)));
                    count++;
                }
            }
        }
        return count;
    }
    
    
    private static int skipExecBlock(List<Token> tokens, int execIndex) {
        int end = TokenScan.findEndExec(tokens, execIndex + 1);
        return end >= 0 ? end : tokens.size();
    }
}
