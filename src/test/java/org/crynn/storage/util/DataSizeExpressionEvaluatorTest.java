package org.crynn.storage.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DataSizeExpressionEvaluatorTest {

    @Test
    void testEvaluate() {
        assertEquals(1024L, DataSizeExpressionEvaluator.evaluate("1KB"));
        assertEquals(1048576L, DataSizeExpressionEvaluator.evaluate("1MB"));
        assertEquals(1073741824L, DataSizeExpressionEvaluator.evaluate("1GB"));
        assertEquals(1099511627776L, DataSizeExpressionEvaluator.evaluate("1TB"));
        assertEquals(10737418240L, DataSizeExpressionEvaluator.evaluate("1024*1024*1024*10"));
        assertEquals(1572864L, DataSizeExpressionEvaluator.evaluate("1.5MB"));
        assertEquals(2048L, DataSizeExpressionEvaluator.evaluate("2048L"));
    }

    @Test
    void testEvaluateWithSpacesAndLowerCase() {
        assertEquals(1024L, DataSizeExpressionEvaluator.evaluate(" 1 KB "));
        assertEquals(1048576L, DataSizeExpressionEvaluator.evaluate("1mb"));
    }

    @Test
    void testTokenize() {
        assertEquals(List.of("4", "*", "1024", "KB"), DataSizeExpressionEvaluator.tokenize("4 * 1024KB"));
    }

    @Test
    void testEvaluateInvalidInput() {
        assertThrows(NumberFormatException.class, () -> DataSizeExpressionEvaluator.evaluate("ABC"));
        assertThrows(NumberFormatException.class, () -> DataSizeExpressionEvaluator.evaluate("1PB"));
        assertThrows(NumberFormatException.class, () -> DataSizeExpressionEvaluator.evaluate(""));
    }
}
