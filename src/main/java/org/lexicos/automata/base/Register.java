package org.lexicos.automata.base;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 状态等价登记表：从 {@link Signature} 到唯一的规范 {@link State}。
 * <p>
 * 每次结构修改后，沿修改路径自底向上调用 {@link #replaceOrRegister(State)}，
 * 保证签名相同的状态只有一个实例（最小性）。
 * 登记表属于某一个自动机实例，不是全局单例；它不是线程安全的，由自动机的写锁保护。
 */
public final class Register {

    private static final Logger logger = LoggerFactory.getLogger(Register.class);

    private final Map<Signature, State> states = new HashMap<>();

    /** 最多可登记的状态数 */
    @Getter
    private final int capacity;

    /**
     * 创建一个容量为 {@link Integer#MAX_VALUE} 的登记表。
     */
    public Register() {
        this(Integer.MAX_VALUE);
    }

    /**
     * @param capacity 最多可登记的状态数，必须为正数。
     */
    public Register(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive, got " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * 如果登记表中已有等价状态，返回它（调用者用它替换 state）；否则登记 state 并返回它本身。
     * 已注册的状态原样返回。
     * @param state 开放状态，其子状态必须都已注册。
     * @return 规范状态。
     * @throws StateSpaceExhaustedException 如果需要登记新状态而登记表已满。
     */
    public State replaceOrRegister(State state) {
        if (state.isRegistered()) {
            return state;
        }
        Signature signature = Signature.of(state);
        State canonical = states.get(signature);
        if (canonical != null) {
            logger.debug("{} 等价于已登记的 {}，签名 {}", state, canonical, signature);
            return canonical;
        }
        if (states.size() == capacity) {
            throw new StateSpaceExhaustedException("ran out of states (capacity " + capacity + ")");
        }
        states.put(signature, state);
        state.markRegistered();
        logger.debug("登记了 {}，签名 {}", state, signature);
        return state;
    }

    /**
     * 查找与给定签名对应的规范状态。
     * @param signature 签名。
     * @return 规范状态，如果不存在则返回 null。
     */
    public State lookup(Signature signature) {
        return states.get(signature);
    }

    /**
     * 删除所有从 root 不可达的登记项。
     * @param root 当前的根状态（根本身从不登记）。
     * @return 删除的登记项数量。
     */
    public int retainReachable(State root) {
        Set<State> reachable = reachableFrom(root);
        int before = states.size();
        states.values().removeIf(state -> !reachable.contains(state));
        int removed = before - states.size();
        logger.info("登记表清理：删除 {} 项，保留 {} 项", removed, states.size());
        return removed;
    }

    public int size() {
        return states.size();
    }

    /**
     * 计算从 root 可达的所有状态（包括 root），按引用区分。
     */
    public static Set<State> reachableFrom(State root) {
        Set<State> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<State> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            State state = stack.pop();
            if (visited.add(state)) {
                for (State target : state.targets()) {
                    stack.push(target);
                }
            }
        }
        return visited;
    }

    @Override
    public String toString() {
        return "Register{" + states.size() + " states}";
    }
}
