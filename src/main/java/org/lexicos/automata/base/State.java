package org.lexicos.automata.base;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 代表词典自动机（DFA）中的一个状态。
 * <p>
 * 状态要么是<b>开放</b>的（正在被当前写操作构造，只属于这次操作，可以修改），
 * 要么是<b>已注册</b>的（进入 {@link Register} 之后不可变，可能被多个父状态共享）。
 * 修改已注册的状态必须先 {@link #copyOf(State)} 得到一个新的开放状态。
 * <p>
 * 迁移按插入顺序保存，渲染时按此顺序输出。
 */
public final class State {

    private static final Logger logger = LoggerFactory.getLogger(State.class);

    @Getter
    private boolean finalState;

    private final Map<Integer, State> transitions;

    @Getter
    private boolean registered;

    private State(boolean finalState, Map<Integer, State> transitions) {
        this.finalState = finalState;
        this.transitions = transitions;
        logger.trace("创建了一个State: {}", this);
    }

    /**
     * 创建一个新的开放状态，没有迁移。
     * @param finalState 是否为终止状态。
     * @return 新的 State 实例。
     */
    public static State create(boolean finalState) {
        return new State(finalState, new LinkedHashMap<>());
    }

    /**
     * 浅拷贝一个状态：终止标记和迁移（目标状态共享，不复制）。
     * 拷贝总是开放的，无论原状态是否已注册。
     * @param state 要拷贝的状态。
     * @return 新的开放状态。
     */
    public static State copyOf(State state) {
        return new State(state.finalState, new LinkedHashMap<>(state.transitions));
    }

    /**
     * 沿标记为 symbol 的迁移走一步。
     * @param symbol 迁移标签（码点）。
     * @return 目标状态，如果不存在则返回 null。
     */
    public State next(int symbol) {
        return transitions.get(symbol);
    }

    /**
     * 获取迁移的不可修改视图，按插入顺序迭代。
     * @return Map<Integer, State>，从符号到目标状态。
     */
    public Map<Integer, State> getTransitions() {
        return Collections.unmodifiableMap(transitions);
    }

    public Collection<State> targets() {
        return Collections.unmodifiableCollection(transitions.values());
    }

    public boolean hasTransitions() {
        return !transitions.isEmpty();
    }

    public int transitionCount() {
        return transitions.size();
    }

    /**
     * 没有出边的非终止状态是死胡同，删除时必须剪掉。
     */
    public boolean isDeadEnd() {
        return !finalState && transitions.isEmpty();
    }

    public void setFinalState(boolean finalState) {
        checkOpen();
        this.finalState = finalState;
    }

    /**
     * 添加迁移，或把已有的迁移改指向新的目标（保持其原来的位置）。
     * @param symbol 迁移标签。
     * @param target 目标状态。
     */
    public void setTransition(int symbol, State target) {
        checkOpen();
        if (target == null) {
            throw new NullPointerException("Transition target cannot be null.");
        }
        transitions.put(symbol, target);
    }

    public void removeTransition(int symbol) {
        checkOpen();
        transitions.remove(symbol);
    }

    /**
     * 由 {@link Register} 调用，之后状态不可再修改。
     */
    void markRegistered() {
        registered = true;
    }

    private void checkOpen() {
        if (registered) {
            throw new IllegalStateException("State " + this + " is registered and cannot be modified; copy it first.");
        }
    }

    // 使用默认的 equals/hashCode（引用相等）：两个结构相同的状态由 Signature 判等。

    @Override
    public String toString() {
        return "S" + Integer.toHexString(System.identityHashCode(this)) + (finalState ? "$" : "") + (registered ? "" : "*");
    }
}
