package org.crynn.storage.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Evaluates storage budget expressions such as {@code 100MB}, {@code 1.5GB} or {@code 4*1024}.
 * <p>
 * Units are binary (KB = 1024). Tokens are multiplied together; {@code L} suffixes are accepted
 * so values copied from Java constants still parse.
 */
public final class DataSizeExpressionEvaluator {

    private static final Pattern TOKEN = Pattern.compile("\\d+\\.\\d*|\\d+|\\*|L|B|KB|MB|GB|TB");

    private DataSizeExpressionEvaluator() {}

    public static long evaluate(String expression) {
        List<String> tokens = tokenize(expression);
        BigDecimal result = BigDecimal.ONE;
        for (String token : tokens) {
            switch (token) {
                case "*", "L", "B" -> { }
                case "KB" -> result = result.multiply(BigDecimal.valueOf(1024L));
                case "MB" -> result = result.multiply(BigDecimal.valueOf(1024L * 1024L));
                case "GB" -> result = result.multiply(BigDecimal.valueOf(1024L * 1024L * 1024L));
                case "TB" -> result = result.multiply(BigDecimal.valueOf(1024L * 1024L * 1024L * 1024L));
                default -> {
                    if (!token.matches("\\d+\\.\\d*|\\d+")) {
                        throw new NumberFormatException("Invalid token: " + token);
                    }
                    result = result.multiply(new BigDecimal(token));
                }
            }
        }
        return result.setScale(0, RoundingMode.FLOOR).longValue();
    }

    public static List<String> tokenize(String expression) {
        if (expression == null || expression.trim().isEmpty()) {
            throw new NumberFormatException("Empty or null expression: " + expression);
        }
        String s = expression.replaceAll("\\s+", "").toUpperCase();

        List<String> tokens = new ArrayList<>();
        Matcher matcher = TOKEN.matcher(s);
        while (matcher.find()) {
            tokens.add(matcher.group());
        }
        // Anything the pattern skipped is an unknown unit or operator.
        if (!String.join("", tokens).equals(s)) {
            throw new NumberFormatException("Invalid input: " + expression);
        }
        return tokens;
    }
}
