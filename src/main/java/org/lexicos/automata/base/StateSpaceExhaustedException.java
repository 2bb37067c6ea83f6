package org.lexicos.automata.base;

/**
 * 状态编号耗尽时抛出。
 * 这是不可恢复的错误：继续运行只会破坏自动机，因此库内部从不捕获它。
 */
public class StateSpaceExhaustedException extends IllegalStateException {

    public StateSpaceExhaustedException(String message) {
        super(message);
    }
}
