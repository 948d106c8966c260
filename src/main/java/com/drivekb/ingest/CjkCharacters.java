package com.drivekb.ingest;

import java.util.Set;

/**
 * Classifies code points of scripts written without spaces between words. Such characters are
 * segmented one at a time for chunking and as bigrams for keyword indexing.
 */
public final class CjkCharacters {
    private static final Set<Character.UnicodeBlock> BLOCKS = Set.of(
            Character.UnicodeBlock.HIRAGANA,
            Character.UnicodeBlock.KATAKANA,
            Character.UnicodeBlock.KATAKANA_PHONETIC_EXTENSIONS,
            Character.UnicodeBlock.CJK_UNIFIED_IDEOGRAPHS,
            Character.UnicodeBlock.CJK_UNIFIED_IDEOGRAPHS_EXTENSION_A,
            Character.UnicodeBlock.CJK_UNIFIED_IDEOGRAPHS_EXTENSION_B,
            Character.UnicodeBlock.CJK_COMPATIBILITY_IDEOGRAPHS,
            Character.UnicodeBlock.HANGUL_SYLLABLES);

    private CjkCharacters() {
    }

    public static boolean isCjk(int codePoint) {
        Character.UnicodeBlock block = Character.UnicodeBlock.of(codePoint);
        if (block == Character.UnicodeBlock.HALFWIDTH_AND_FULLWIDTH_FORMS) {
            // fullwidth Latin letters and digits behave like ASCII words
            return !Character.isLetterOrDigit(codePoint) || codePoint >= 0xFF66;
        }
        if (block == Character.UnicodeBlock.CJK_SYMBOLS_AND_PUNCTUATION) {
            // iteration and closing marks such as 々 and 〆 are part of words
            return Character.isLetter(codePoint);
        }
        return block != null && BLOCKS.contains(block);
    }

    /**
     * True when the code point extends a space-delimited word (Latin letters, digits, and so on).
     */
    public static boolean isWordPart(int codePoint) {
        return Character.isLetterOrDigit(codePoint) && !isCjk(codePoint);
    }
}
