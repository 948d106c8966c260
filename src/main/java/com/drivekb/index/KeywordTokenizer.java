package com.drivekb.index;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import com.drivekb.ingest.CjkCharacters;

/**
 * Term extraction shared by index build and query. Text is NFKC-normalised and lower-cased;
 * runs of non-CJK letters and digits become one term each, runs of CJK characters become
 * overlapping character bigrams (a single character stays a unigram). Punctuation, including
 * CJK marks such as {@code ・}, is dropped.
 */
public class KeywordTokenizer {

    public List<String> tokenize(String text) {
        List<String> terms = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return terms;
        }
        String normalized = Normalizer.normalize(text, Normalizer.Form.NFKC).toLowerCase(Locale.ROOT);

        StringBuilder word = new StringBuilder();
        List<String> cjkRun = new ArrayList<>();
        int i = 0;
        while (i < normalized.length()) {
            int codePoint = normalized.codePointAt(i);
            i += Character.charCount(codePoint);
            if (CjkCharacters.isCjk(codePoint) && Character.isLetterOrDigit(codePoint)) {
                flushWord(word, terms);
                cjkRun.add(new String(Character.toChars(codePoint)));
            } else if (Character.isLetterOrDigit(codePoint)) {
                flushCjk(cjkRun, terms);
                word.appendCodePoint(codePoint);
            } else {
                flushWord(word, terms);
                flushCjk(cjkRun, terms);
            }
        }
        flushWord(word, terms);
        flushCjk(cjkRun, terms);
        return terms;
    }

    private static void flushWord(StringBuilder word, List<String> terms) {
        if (word.length() > 0) {
            terms.add(word.toString());
            word.setLength(0);
        }
    }

    private static void flushCjk(List<String> run, List<String> terms) {
        if (run.size() == 1) {
            terms.add(run.get(0));
        } else {
            for (int i = 0; i + 1 < run.size(); i++) {
                terms.add(run.get(i) + run.get(i + 1));
            }
        }
        run.clear();
    }
}
