package com.drivekb.ingest;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Removes the noise left behind by PDF-to-text conversion of the manual: page numbers, running
 * headers and footers, vertical-text line breaks, decoration-only lines and irregular spacing.
 */
public class TextPreprocessor {
    private static final Pattern PAGE_NUMBER = Pattern.compile("[・･\\-]\\d+[・･\\-]");
    private static final Pattern VERTICAL_BREAK = Pattern.compile("([ァ-ヶー一-龯a-zA-Z])\\n([ァ-ヶー一-龯a-zA-Z])\\n");
    private static final Pattern BLANK_LINES = Pattern.compile("\\n{3,}");
    private static final Pattern SYMBOL_ONLY_LINE = Pattern.compile("^[\\s\\u3000・･●○■□▲△▼▽◆◇★☆※→←↑↓｜|＊*＝=－\\-＿_]+$");
    private static final Pattern SPECIAL_SPACE = Pattern.compile("[\\u3000\\t]");
    private static final Pattern MULTI_SPACE = Pattern.compile(" {2,}");
    private static final Pattern HEADING_PIPE = Pattern.compile("(?m)^\\| ");

    private final List<Pattern> removePatterns;

    public TextPreprocessor(List<String> removePatterns) {
        this.removePatterns = removePatterns.stream().map(Pattern::compile).toList();
    }

    public String preprocess(String text) {
        String processed = text.replace("\r\n", "\n").replace('\r', '\n');
        processed = PAGE_NUMBER.matcher(processed).replaceAll("");
        for (Pattern pattern : removePatterns) {
            processed = pattern.matcher(processed).replaceAll("");
        }
        processed = VERTICAL_BREAK.matcher(processed).replaceAll("$1$2");
        processed = BLANK_LINES.matcher(processed).replaceAll("\n\n");
        processed = Arrays.stream(processed.split("\n", -1))
                .map(String::strip)
                .filter(line -> line.isEmpty() || !SYMBOL_ONLY_LINE.matcher(line).matches())
                .collect(Collectors.joining("\n"));
        processed = SPECIAL_SPACE.matcher(processed).replaceAll(" ");
        processed = MULTI_SPACE.matcher(processed).replaceAll(" ");
        processed = HEADING_PIPE.matcher(processed).replaceAll("");
        return processed.strip();
    }
}
