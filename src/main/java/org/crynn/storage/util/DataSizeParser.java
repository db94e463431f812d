package org.crynn.storage.util;

/**
 * Parses human-friendly sizes like "64MiB", "10GB", "4*1024".
 * <p>
 * Internally reuses {@link DataSizeExpressionEvaluator} which understands KB/MB/GB/TB and '*'.
 */
public final class DataSizeParser {
    private DataSizeParser() {}

    public static long parseBytes(String expr) {
        if (expr == null || expr.isBlank()) {
            throw new IllegalArgumentException("size expression is blank");
        }
        String s = expr.trim();
        // IEC spellings map onto the evaluator's binary units.
        s = s.replace("KiB", "KB").replace("MiB", "MB").replace("GiB", "GB").replace("TiB", "TB");
        long v = DataSizeExpressionEvaluator.evaluate(s);
        if (v <= 0L) {
            throw new IllegalArgumentException("size out of range: " + expr);
        }
        return v;
    }
}
