package com.textforge.formatter.core;

/**
 * Size and count statistics of one formatting call. Sizes are UTF-8 byte lengths.
 */
public record FormatStats(
        int inputSize,
        int outputSize,
        double compressionRatio,
        int lineCount,
        int statementCount,
        int elementCount,
        int errorCount,
        int warningCount,
        long processingTimeMs) {

    public static int lineCount(String text) {
        if (text.isEmpty()) {
            return 0;
        }
        int lines = 1;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                lines++;
            }
        }
        return lines;
    }
}
