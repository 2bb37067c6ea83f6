package org.lexicos.utils;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SymbolsTest {

    @Test
    @DisplayName("代理对合并为一个符号")
    void testCodePoints() {
        assertArrayEquals(new int[]{'a', 0x1D11E, 0x72D0}, Symbols.of("a𝄞狐"));
        assertEquals(0, Symbols.of("").length);
    }

    @Test
    @DisplayName("按码点区间还原字符串")
    void testToString() {
        int[] symbols = Symbols.of("x𝄞yz");
        assertEquals("𝄞y", Symbols.toString(symbols, 1, 3));
        assertEquals("", Symbols.toString(symbols, 2, 2));
        assertEquals("𝄞", Symbols.toString(0x1D11E));
    }

    @Test
    @DisplayName("null 词应抛出 NullPointerException")
    void testNull() {
        assertThrows(NullPointerException.class, () -> Symbols.of(null));
    }
}
