package com.drivekb.ingest;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits text into the token units used to measure chunk size. A run of non-CJK letters and digits
 * is one token; every other non-whitespace code point (each kana or kanji, each punctuation mark)
 * is a token of its own. Whitespace only separates tokens.
 */
public class TextSegmenter {

    public List<TokenSpan> segment(String text) {
        List<TokenSpan> spans = new ArrayList<>();
        int i = 0;
        int length = text.length();
        while (i < length) {
            int codePoint = text.codePointAt(i);
            int width = Character.charCount(codePoint);
            if (Character.isWhitespace(codePoint) || Character.isSpaceChar(codePoint)) {
                i += width;
                continue;
            }
            if (CjkCharacters.isWordPart(codePoint)) {
                int start = i;
                i += width;
                while (i < length) {
                    int next = text.codePointAt(i);
                    if (!CjkCharacters.isWordPart(next)) {
                        break;
                    }
                    i += Character.charCount(next);
                }
                spans.add(new TokenSpan(start, i));
                continue;
            }
            spans.add(new TokenSpan(i, i + width));
            i += width;
        }
        return spans;
    }

    public int countTokens(String text) {
        return segment(text).size();
    }
}
