package org.lexicos.automata.models;

import org.apache.commons.lang3.tuple.Pair;
import org.lexicos.automata.base.Register;
import org.lexicos.automata.base.State;
import org.lexicos.utils.Symbols;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.TreeMap;

/**
 * 以最小无环确定有限自动机（DFA）实现的词典。
 * <p>
 * 每次插入或删除都沿公共前缀向下走，复制（写时复制）路径上被改动的状态，
 * 然后自底向上对每个改动的状态执行 replace-or-register，使自动机在每次操作后保持最小。
 * 已注册的状态从不就地修改，根状态每次写操作都会复制，新根通过一次 volatile 赋值发布，
 * 因此读者总是看到一个一致的快照。
 * <p>
 * 写操作之间互斥（synchronized），读操作不加锁。
 */
public final class StateGraphLexicon implements Lexicon {

    private static final Logger logger = LoggerFactory.getLogger(StateGraphLexicon.class);

    // 登记表项数少于此值时不自动清理
    private static final int MIN_SWEEP_THRESHOLD = 1024;

    private final Register register;

    // 根从不登记：登记它会让整个自动机与另一个根共享
    private volatile State root = State.create(false);

    private volatile int size;

    // 上次清理后登记表的项数
    private int liveAfterSweep;

    /**
     * 创建一个空词典，最多可登记 {@link Integer#MAX_VALUE} 个状态。
     */
    public StateGraphLexicon() {
        this(Integer.MAX_VALUE);
    }

    /**
     * 创建一个空词典。
     * @param capacity 最多可登记的状态数；用完时写操作抛出
     *                 {@link org.lexicos.automata.base.StateSpaceExhaustedException}，词典保持原样。
     */
    public StateGraphLexicon(int capacity) {
        this.register = new Register(capacity);
    }

    /**
     * 创建一个空词典。
     * @return 新的 StateGraphLexicon 实例。
     */
    public static StateGraphLexicon create() {
        return new StateGraphLexicon();
    }

    @Override
    public synchronized boolean insert(String word) {
        State reached = walk(root, word);
        if (reached != null && reached.isFinalState()) {
            logger.debug("插入 '{}'：已存在", word);
            return false;
        }

        int[] symbols = Symbols.of(word);
        List<State> path = commonPrefix(root, symbols);
        int consumed = path.size() - 1;
        State divergence = path.get(consumed);

        State changed = State.copyOf(divergence);
        if (consumed == symbols.length) {
            changed.setFinalState(true);
        } else {
            changed.setTransition(symbols[consumed], addSuffix(symbols, consumed + 1));
        }
        rebuild(path, symbols, changed, consumed);
        size++;
        compactIfNeeded();
        logger.debug("插入 '{}'：公共前缀长度 {}，登记表 {} 项", word, consumed, register.size());
        return true;
    }

    @Override
    public synchronized boolean delete(String word) {
        int[] symbols = Symbols.of(word);
        List<State> path = commonPrefix(root, symbols);
        int consumed = path.size() - 1;

        if (consumed < symbols.length || !path.get(consumed).isFinalState()) {
            logger.debug("删除 '{}'：不存在", word);
            return false;
        }

        State changed = State.copyOf(path.get(consumed));
        changed.setFinalState(false);
        rebuild(path, symbols, changed, consumed);
        size--;
        compactIfNeeded();
        logger.debug("删除 '{}'：登记表 {} 项", word, register.size());
        return true;
    }

    @Override
    public boolean contains(String word) {
        State state = walk(root, word);
        return state != null && state.isFinalState();
    }

    @Override
    public List<String> words(String phrase, int offset) {
        int[] symbols = Symbols.of(phrase);
        if (offset < 0 || offset >= symbols.length) {
            logger.debug("扫描 '{}'：偏移 {} 越界", phrase, offset);
            return Collections.emptyList();
        }
        List<String> found = new ArrayList<>();
        State state = root;
        for (int i = offset; i < symbols.length; i++) {
            state = state.next(symbols[i]);
            if (state == null) {
                break;
            }
            if (state.isFinalState()) {
                found.add(Symbols.toString(symbols, offset, i + 1));
            }
        }
        return found;
    }

    @Override
    public List<String> lookup(String prefix) {
        int[] symbols = Symbols.of(prefix);
        State start = root;
        for (int symbol : symbols) {
            start = start.next(symbol);
            if (start == null) {
                return Collections.emptyList();
            }
        }

        // 先序深度优先，子状态按符号升序出栈，结果按码点字典序排列
        List<String> found = new ArrayList<>();
        Deque<Pair<State, String>> stack = new ArrayDeque<>();
        stack.push(Pair.of(start, prefix));
        while (!stack.isEmpty()) {
            Pair<State, String> entry = stack.pop();
            State state = entry.getLeft();
            if (state.isFinalState()) {
                found.add(entry.getRight());
            }
            NavigableMap<Integer, State> sorted = new TreeMap<>(state.getTransitions());
            for (Map.Entry<Integer, State> transition : sorted.descendingMap().entrySet()) {
                stack.push(Pair.of(transition.getValue(), entry.getRight() + Symbols.toString(transition.getKey())));
            }
        }
        return found;
    }

    @Override
    public int size() {
        return size;
    }

    /**
     * 从根可达的不同状态数量（包括根）。
     */
    public int stateCount() {
        return Register.reachableFrom(root).size();
    }

    /**
     * 登记表中的项数，包括已不可达但尚未清理的状态。
     */
    public int registerSize() {
        return register.size();
    }

    /**
     * 清理登记表中从当前根不可达的状态。
     * @return 删除的登记项数量。
     */
    public synchronized int compact() {
        int removed = register.retainReachable(root);
        liveAfterSweep = register.size();
        return removed;
    }

    /**
     * 登记表增长到上次清理后的两倍（至少 {@link #MIN_SWEEP_THRESHOLD}）或达到容量时清理一次，
     * 清理的代价由期间的插入和删除分摊。
     */
    private void compactIfNeeded() {
        long threshold = Math.min(register.getCapacity(), 2L * Math.max(liveAfterSweep, MIN_SWEEP_THRESHOLD));
        if (register.size() >= threshold) {
            compact();
        }
    }

    State root() {
        return root;
    }

    @Override
    public String toString() {
        return render(root);
    }

    /**
     * 沿 word 的码点从 root 向下走，不分配数组。
     * @return 消费完整个 word 后到达的状态；路径不存在时返回 null。
     */
    private static State walk(State root, String word) {
        Objects.requireNonNull(word, "Word cannot be null");
        State state = root;
        for (int i = 0; i < word.length() && state != null; ) {
            int symbol = word.codePointAt(i);
            state = state.next(symbol);
            i += Character.charCount(symbol);
        }
        return state;
    }

    /**
     * 公共前缀遍历：从 root 出发，沿着与 symbols 匹配的迁移尽可能向下走。
     * @return 经过的状态，第一个是 root；长度减一即已消费的符号数。
     */
    private static List<State> commonPrefix(State root, int[] symbols) {
        List<State> path = new ArrayList<>(symbols.length + 1);
        State state = root;
        path.add(state);
        for (int symbol : symbols) {
            state = state.next(symbol);
            if (state == null) {
                break;
            }
            path.add(state);
        }
        return path;
    }

    /**
     * 为 symbols[from:] 建立一条线性后缀链，自底向上登记。
     * @return 链的头部，即消费 symbols[from - 1] 后到达的状态。
     */
    private State addSuffix(int[] symbols, int from) {
        State state = register.replaceOrRegister(State.create(true));
        for (int i = symbols.length - 1; i >= from; i--) {
            State parent = State.create(false);
            parent.setTransition(symbols[i], state);
            state = register.replaceOrRegister(parent);
        }
        return state;
    }

    /**
     * 从深度 depth 的已修改状态沿路径回到根：剪掉死胡同，对其余状态执行 replace-or-register，
     * 把每个父状态复制后改指向规范状态，最后发布新根。
     * @param path    修改前的路径，path.get(0) 是旧根。
     * @param symbols 路径上的符号。
     * @param changed path.get(depth) 的开放副本（已修改）。
     * @param depth   changed 所在的深度。
     */
    private void rebuild(List<State> path, int[] symbols, State changed, int depth) {
        State state = changed;
        for (int i = depth; i > 0; i--) {
            State parent = State.copyOf(path.get(i - 1));
            if (state.isDeadEnd()) {
                parent.removeTransition(symbols[i - 1]);
            } else {
                parent.setTransition(symbols[i - 1], register.replaceOrRegister(state));
            }
            state = parent;
        }
        root = state;
    }

    /**
     * 渲染从 top 出发的子图。没有出边的状态渲染为空串；
     * 每条迁移渲染为 符号 + (目标是终止状态时加 "$") + 目标的渲染；
     * 只有一条迁移时直接输出，多条时用 "|" 连接并加括号。迁移按插入顺序输出。
     * <p>
     * 用显式栈做后序遍历，共享状态只渲染一次。
     */
    static String render(State top) {
        Map<State, String> rendered = new IdentityHashMap<>();
        Deque<State> stack = new ArrayDeque<>();
        stack.push(top);
        while (!stack.isEmpty()) {
            State state = stack.peek();
            if (rendered.containsKey(state)) {
                stack.pop();
                continue;
            }
            boolean ready = true;
            for (State target : state.targets()) {
                if (!rendered.containsKey(target)) {
                    stack.push(target);
                    ready = false;
                }
            }
            if (ready) {
                stack.pop();
                rendered.put(state, renderTransitions(state, rendered));
            }
        }
        return rendered.get(top);
    }

    private static String renderTransitions(State state, Map<State, String> rendered) {
        if (!state.hasTransitions()) {
            return "";
        }
        List<String> parts = new ArrayList<>(state.transitionCount());
        for (Map.Entry<Integer, State> transition : state.getTransitions().entrySet()) {
            State target = transition.getValue();
            parts.add(Symbols.toString(transition.getKey())
                    + (target.isFinalState() ? "$" : "")
                    + rendered.get(target));
        }
        if (parts.size() == 1) {
            return parts.get(0);
        }
        return "(" + String.join("|", parts) + ")";
    }
}
