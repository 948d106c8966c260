package com.drivekb.retrieval;

import java.util.List;

/**
 * Renders ranked chunks as the reference block handed to the completion call.
 */
public final class ContextFormatter {
    static final String NO_RESULTS = "関連する情報が見つかりませんでした。";

    private ContextFormatter() {
    }

    public static String format(List<RankedChunk> chunks) {
        if (chunks.isEmpty()) {
            return NO_RESULTS;
        }
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < chunks.size(); i++) {
            if (i > 0) {
                builder.append("\n\n");
            }
            builder.append("【参考情報 ").append(i + 1).append("】\n").append(chunks.get(i).text());
        }
        return builder.toString();
    }

    public static String format(RetrievalResult result) {
        return format(result.chunks());
    }
}
