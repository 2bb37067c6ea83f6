package org.lexicos.utils;

import java.util.Objects;

/**
 * 词与符号序列之间的转换。一个符号就是一个 Unicode 码点。
 */
public final class Symbols {

    private Symbols() {
    }

    /**
     * 把一个词拆分为码点数组，代理对合并为一个符号。
     * @param word 词，不能为 null。
     * @return 码点数组。
     */
    public static int[] of(String word) {
        Objects.requireNonNull(word, "Word cannot be null");
        return word.codePoints().toArray();
    }

    /**
     * 把码点数组中 [from, to) 的部分拼接为字符串。
     */
    public static String toString(int[] symbols, int from, int to) {
        return new String(symbols, from, to - from);
    }

    /**
     * 单个符号的文本形式。
     */
    public static String toString(int symbol) {
        return Character.toString(symbol);
    }
}
