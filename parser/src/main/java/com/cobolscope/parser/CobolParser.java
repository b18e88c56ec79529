package com.cobolscope.parser;

import com.cobolscope.parser.extract.CopybookMapPass;
import com.cobolscope.parser.extract.EmbeddedResourcePass;
import com.cobolscope.parser.extract.ExtractionPass;
import com.cobolscope.parser.extract.FileReferencePass;
import com.cobolscope.parser.extract.ProgramCallPass;
import com.cobolscope.parser.extract.ScopeTreePass;
import com.cobolscope.parser.model.CobolProgram;
import com.cobolscope.parser.model.Division;
import com.cobolscope.parser.token.CobolTokenizer;
import com.cobolscope.parser.token.Token;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.io.IOUtils;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Parses fixed-format COBOL source files into {@link CobolProgram}s.
 * The source is tokenized once, then each extraction pass scans the same token list: scope
 * tree and data items, file references, program calls, embedded resources, copybooks and maps.
 * The text of every PROCEDURE paragraph is then cut from the source by its line range.
 * The program is named after the file's base name.
 */
public class CobolParser implements SourceParser {
    
    private static final Logger logger = LoggerFactory.getLogger(CobolParser.class);
    
    private static final Set<String> EXTENSIONS = Set.of("cbl", "cob", "cobol");
    
    private final CobolTokenizer tokenizer;
    private final List<ExtractionPass> passes;
    private final ParagraphSourceReader paragraphSourceReader = new ParagraphSourceReader();
    
    public CobolParser() {
        this(new CobolTokenizer(), List.of(
                new ScopeTreePass(),
                new FileReferencePass(),
                new ProgramCallPass(),
                new EmbeddedResourcePass(),
                new CopybookMapPass()));
    }
    
    public CobolParser(CobolTokenizer tokenizer, List<ExtractionPass> passes) {
        this.tokenizer = Objects.requireNonNull(tokenizer, "Tokenizer cannot be null");
        this.passes = List.copyOf(passes);
    }
    
    @Override
    public boolean canParse(Path filePath) {
        Path fileName = filePath.getFileName();
        if (fileName == null) {
            return false;
        }
        String extension = FilenameUtils.getExtension(fileName.toString()).toLowerCase(Locale.ROOT);
        return EXTENSIONS.contains(extension);
    }
    
    @Override
    public CobolProgram parse(Path filePath) throws SourceReadException {
        logger.debug("Parsing COBOL file: {}", filePath);
        
        String source = readSource(filePath);
        String programName = FilenameUtils.getBaseName(filePath.getFileName().toString());
        
        return parseSource(programName, filePath.toString(), source);
    }
    
    /**
     * Parse source text that has already been read
     */
    public CobolProgram parseSource(String programName, String sourcePath, String source) {
        if (StringUtils.isBlank(source)) {
            logger.warn("Source of {} is empty", programName);
        }
        List<Token> tokens = tokenizer.tokenize(source);
        CobolProgram.Builder program = CobolProgram.builder(programName, sourcePath);
        
        for (ExtractionPass pass : passes) {
            logger.trace("Running {} on {}", pass.getName(), programName);
            pass.extract(tokens, program);
        }
        program.getDivision(Division.PROCEDURE)
                .map(procedure -> paragraphSourceReader.read(procedure, source))
                .ifPresent(sources -> sources.forEach(program::paragraphSource));
        
        CobolProgram result = program.build();
        logger.debug("Parsed {} from {} tokens: {}", programName, tokens.size(), result);
        return result;
    }
    
    /**
     * Reads the file as UTF-8; malformed bytes are replaced rather than rejected
     */
    private String readSource(Path filePath) throws SourceReadException {
        try (InputStream in = Files.newInputStream(filePath)) {
            return IOUtils.toString(in, StandardCharsets.UTF_8);
        } catch (IOException e) {
            logger.debug("Error reading file {}: {}", filePath, e.getMessage());
            throw new SourceReadException(filePath, e);
        }
    }
}
