package org.lexicos.automata.table;

import lombok.Getter;
import org.lexicos.automata.base.StateSpaceExhaustedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.BitSet;
import java.util.HashMap;
import java.util.Map;
import java.util.OptionalInt;

/**
 * 基于哈希表的扁平迁移存储：以 (状态 ID, 标签) 为键，目标状态 ID 为值。
 * <p>
 * 只做存储，不做最小化。状态数量有上限（容量），超出时抛出 {@link StateSpaceExhaustedException}。
 * 此类不是线程安全的。
 */
public final class TransitionTable {

    private static final Logger logger = LoggerFactory.getLogger(TransitionTable.class);

    @Getter
    private final int capacity;

    private final Map<Long, Integer> transitions = new HashMap<>();
    private final BitSet finalStates = new BitSet();

    private int stateCount;

    /**
     * 创建一个容量为 {@link Integer#MAX_VALUE} 的迁移表。
     */
    public TransitionTable() {
        this(Integer.MAX_VALUE);
    }

    /**
     * @param capacity 最多可创建的状态数，必须为正数。
     */
    public TransitionTable(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive, got " + capacity);
        }
        this.capacity = capacity;
        logger.debug("创建 TransitionTable，容量 {}", capacity);
    }

    /**
     * 分配下一个状态 ID（从 0 开始）。
     * @return 新状态的 ID。
     * @throws StateSpaceExhaustedException 如果容量已用完。
     */
    public int createState() {
        if (stateCount == capacity) {
            throw new StateSpaceExhaustedException("ran out of states (capacity " + capacity + ")");
        }
        return stateCount++;
    }

    /**
     * 添加一条迁移，已存在时覆盖目标。
     */
    public void addTransition(int source, int label, int target) {
        checkState(source);
        checkState(target);
        transitions.put(key(source, label), target);
    }

    /**
     * 沿标记为 label 的迁移走一步。
     * @return 目标状态 ID；没有该迁移时为空。
     */
    public OptionalInt walk(int source, int label) {
        Integer target = transitions.get(key(source, label));
        return target == null ? OptionalInt.empty() : OptionalInt.of(target);
    }

    public void setFinal(int state, boolean finalState) {
        checkState(state);
        finalStates.set(state, finalState);
    }

    public boolean isFinal(int state) {
        return state >= 0 && finalStates.get(state);
    }

    public int stateCount() {
        return stateCount;
    }

    public int transitionCount() {
        return transitions.size();
    }

    // 高 32 位为状态，低 32 位为标签
    private static long key(int state, int label) {
        return ((long) state << 32) | (label & 0xFFFFFFFFL);
    }

    private void checkState(int state) {
        if (state < 0 || state >= stateCount) {
            throw new IllegalArgumentException("Unknown state " + state);
        }
    }
}
