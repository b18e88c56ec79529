package com.cobolscope.parser.extract;

import com.cobolscope.parser.model.CobolProgram;
import com.cobolscope.parser.token.Token;

import java.util.List;

/**
 * One forward scan over a program's token stream. Passes only read the tokens and only write
 * their own part of the program, so they can run in any order. A pass never fails on malformed
 * input; clauses it cannot make sense of are skipped.
 */
public interface ExtractionPass {
    
    /**
     * Scan the tokens and record what this pass recognises into the program builder
     */
    void extract(List<Token> tokens, CobolProgram.Builder program);
    
    /**
     * Short name used in log messages
     */
    default String getName() {
        return getClass().getSimpleName();
    }
}
