package org.lexicos.automata.models;

import java.util.List;

/**
 * 词典：一组词（码点序列）的集合。
 */
public interface Lexicon {

    /**
     * 向词典添加一个词。
     * @return 如果词是新加入的则返回 true，已存在则返回 false。
     */
    boolean insert(String word);

    /**
     * 从词典删除一个词。
     * @return 如果词存在并被删除则返回 true。
     */
    boolean delete(String word);

    boolean contains(String word);

    /**
     * 返回所有以 phrase[offset:] 的前缀形式出现的词（按从短到长）。
     * @param phrase 要扫描的短语。
     * @param offset 起始位置，以码点计；越界时返回空列表。
     */
    List<String> words(String phrase, int offset);

    /**
     * 返回所有以 prefix 开头的词，包括 prefix 本身（如果它是一个词）。
     */
    List<String> lookup(String prefix);

    int size();

    default boolean isEmpty() {
        return size() == 0;
    }

    /**
     * 用类似正则表达式的语法显示词典，例如 {@code (x$|yz$)}。
     */
    @Override
    String toString();
}
