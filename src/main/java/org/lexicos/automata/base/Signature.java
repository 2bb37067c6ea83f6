package org.lexicos.automata.base;

import java.util.Arrays;
import java.util.Map;
import java.util.TreeMap;

/**
 * 状态的规范签名：(终止标记, 按符号排序的 (符号, 子状态) 列表)。
 * <p>
 * 子状态按引用比较。子状态都已注册（规范化），所以引用相同即右语言相同，
 * 计算签名只需要看直接的出边，不需要遍历整个子图。
 * 此类是不可变的。
 */
public final class Signature {

    private final boolean finalState;
    private final int[] labels;
    private final State[] targets;

    private final int hashCode;

    private Signature(boolean finalState, int[] labels, State[] targets) {
        this.finalState = finalState;
        this.labels = labels;
        this.targets = targets;
        int hash = 31 * Boolean.hashCode(finalState) + Arrays.hashCode(labels);
        for (State target : targets) {
            hash = 31 * hash + System.identityHashCode(target);
        }
        this.hashCode = hash;
    }

    /**
     * 计算一个状态的签名。
     * @param state 要计算的状态，其所有子状态必须已注册。
     * @return 签名。
     * @throws IllegalStateException 如果某个子状态仍是开放的。
     */
    public static Signature of(State state) {
        Map<Integer, State> sorted = new TreeMap<>(state.getTransitions());
        int[] labels = new int[sorted.size()];
        State[] targets = new State[sorted.size()];
        int i = 0;
        for (Map.Entry<Integer, State> entry : sorted.entrySet()) {
            State target = entry.getValue();
            if (!target.isRegistered()) {
                throw new IllegalStateException("Child " + target + " of " + state + " is not registered.");
            }
            labels[i] = entry.getKey();
            targets[i] = target;
            i++;
        }
        return new Signature(state.isFinalState(), labels, targets);
    }

    private static boolean referenceEquals(State[] a1, State[] a2) {
        if (a1.length != a2.length) {
            return false;
        }
        for (int i = 0; i < a1.length; i++) {
            if (a1[i] != a2[i]) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Signature that = (Signature) o;
        return finalState == that.finalState &&
                Arrays.equals(labels, that.labels) &&
                referenceEquals(targets, that.targets);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(finalState ? "[$" : "[");
        for (int i = 0; i < labels.length; i++) {
            if (i > 0 || finalState) {
                sb.append(", ");
            }
            sb.appendCodePoint(labels[i]).append("->").append(targets[i]);
        }
        return sb.append(']').toString();
    }
}
