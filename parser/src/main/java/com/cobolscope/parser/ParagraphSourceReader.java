package com.cobolscope.parser;

import com.cobolscope.parser.model.Division;
import com.cobolscope.parser.model.Paragraph;
import com.cobolscope.parser.model.Section;
import org.apache.commons.lang3.StringUtils;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Cuts the source text of each paragraph out of a division. A paragraph's text is its lines
 * from header to last line with columns 1-6 removed. Comment lines and blank lines are left
 * out and trailing whitespace is trimmed.
 */
public class ParagraphSourceReader {
    
    private static final int SEQUENCE_AREA_WIDTH = 6;
    private static final Pattern LINE_BREAK = Pattern.compile("\\R");
    
    /**
     * @return paragraph name to text, in source order; a repeated name keeps its last paragraph
     */
    public Map<String, String> read(Division division, String source) {
        Map<String, String> texts = new LinkedHashMap<>();
        if (StringUtils.isEmpty(source)) {
            return texts;
        }
        
        String[] lines = LINE_BREAK.split(source);
        for (Section section : division.getSections().values()) {
            for (Paragraph paragraph : section.getParagraphs().values()) {
                texts.put(paragraph.getName(), textOf(paragraph, lines));
            }
        }
        return texts;
    }
    
    private String textOf(Paragraph paragraph, String[] lines) {
        int from = Math.max(paragraph.getStartLine() - 1, 0);
        int to = Math.min(paragraph.getEndLine(), lines.length);
        List<String> kept = IntStream.range(from, to)
                .mapToObj(i -> lines[i])
                .filter(line -> !isComment(line))
                .map(line -> line.length() > SEQUENCE_AREA_WIDTH ? line.substring(SEQUENCE_AREA_WIDTH) : "")
                .map(String::stripTrailing)
                .filter(StringUtils::isNotBlank)
                .collect(Collectors.toList());
        return String.join("\n", kept);
    }
    
    private static boolean isComment(String line) {
        if (line.length() <= SEQUENCE_AREA_WIDTH) {
            return false;
        }
        char indicator = line.charAt(SEQUENCE_AREA_WIDTH);
        return indicator == '*' || indicator == '/';
    }
}
