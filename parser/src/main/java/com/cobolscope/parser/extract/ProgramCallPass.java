package com.cobolscope.parser.extract;

import com.cobolscope.parser.model.CobolProgram;
import com.cobolscope.parser.model.ProgramCall;
import com.cobolscope.parser.token.Token;
import com.cobolscope.parser.token.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Extracts {@code CALL} statements. {@code CALL "PROG"} is a static call to PROG,
 * {@code CALL WS-PROG} a dynamic call through the data item WS-PROG. Parameters are the
 * identifiers after USING up to the end of the CALL's source line. A period does not end the
 * list, so identifiers of a later statement on the same line are collected too.
 */
public class ProgramCallPass implements ExtractionPass {
    
    private static final Logger logger = LoggerFactory.getLogger(ProgramCallPass.class);
    
    @Override
    public void extract(List<Token> tokens, CobolProgram.Builder program) {
        int count = 0;
        for (int i = 0; i < tokens.size(); i++) {
            Token call = tokens.get(i);
            if (!call.isKeyword("CALL")) {
                continue;
            }
            
            Token targetToken = TokenScan.at(tokens, i + 1);
            if (targetToken == null) {
                continue;
            }
            
            String target;
            boolean dynamic;
            if (targetToken.is(TokenType.LITERAL)) {
                target = targetToken.getText();
                dynamic = false;
            } else if (targetToken.is(TokenType.IDENTIFIER)) {
                target = targetToken.getUpperText();
                dynamic = true;
            } else {
                continue;
            }
            
            program.call(new ProgramCall(target, dynamic, readParameters(tokens, i + 2, call),
                    TokenScan.locationOf(call)));
            count++;
        }
        logger.debug("Calls in {}: {}", program.getName(), count);
    }
    
    private List<String> readParameters(List<Token> tokens, int from, Token call) {
        List<String> parameters = new ArrayList<>();
        boolean usingFound = false;
        
        for (int j = from; j < tokens.size() && TokenScan.sameLine(tokens.get(j), call); j++) {
            Token token = tokens.get(j);
            if (token.isKeyword("USING")) {
                usingFound = true;
            } else if (usingFound && token.is(TokenType.IDENTIFIER)) {
                parameters.add(token.getUpperText());
            }
        }
        return parameters;
    }
}
