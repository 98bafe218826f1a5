package org.muma.respkv.utils;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class NumberUtilsTest {

    private static long parse(String s) {
        return NumberUtils.parseLong(s.getBytes(StandardCharsets.US_ASCII));
    }

    @Test
    void testCanonicalIntegers() {
        assertEquals(0, parse("0"));
        assertEquals(42, parse("42"));
        assertEquals(-5, parse("-5"));
        assertEquals(Long.MAX_VALUE, parse("9223372036854775807"));
        assertEquals(Long.MIN_VALUE, parse("-9223372036854775808"));
    }

    @Test
    void testNonCanonicalFormsRejected() {
        for (String s : new String[]{"007", "00", "-0", "-007", "+1", " 1", "1 ", "-", "", "1a", "1.0"}) {
            assertThrows(NumberFormatException.class, () -> parse(s), s);
        }
        assertThrows(NumberFormatException.class, () -> NumberUtils.parseLong(null));
    }

    @Test
    void testOverflowRejected() {
        assertThrows(NumberFormatException.class, () -> parse("9223372036854775808"));
        assertThrows(NumberFormatException.class, () -> parse("-9223372036854775809"));
        assertThrows(NumberFormatException.class, () -> parse("123456789012345678901"));
    }
}
