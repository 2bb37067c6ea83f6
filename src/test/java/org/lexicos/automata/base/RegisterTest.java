package org.lexicos.automata.base;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RegisterTest {

    private Register register;
    private State leaf;

    @BeforeEach
    void setUp() {
        register = new Register();
        leaf = register.replaceOrRegister(State.create(true));
    }

    private State open(boolean finalState, String labels) {
        State state = State.create(finalState);
        labels.codePoints().forEach(symbol -> state.setTransition(symbol, leaf));
        return state;
    }

    @Nested
    @DisplayName("签名 (Signature)")
    class SignatureTests {

        @Test
        @DisplayName("签名与迁移插入顺序无关")
        void testOrderIndependent() {
            assertEquals(Signature.of(open(false, "ab")), Signature.of(open(false, "ba")));
            assertEquals(Signature.of(open(false, "ab")).hashCode(), Signature.of(open(false, "ba")).hashCode());
        }

        @Test
        @DisplayName("终止标记、标签或目标不同时签名不同")
        void testDistinguishes() {
            State other = register.replaceOrRegister(open(false, "z"));
            State viaOther = State.create(false);
            viaOther.setTransition('a', other);

            assertAll(
                    () -> assertNotEquals(Signature.of(open(false, "ab")), Signature.of(open(true, "ab"))),
                    () -> assertNotEquals(Signature.of(open(false, "ab")), Signature.of(open(false, "ac"))),
                    () -> assertNotEquals(Signature.of(open(false, "a")), Signature.of(viaOther))
            );
        }

        @Test
        @DisplayName("子状态未注册时不能计算签名")
        void testOpenChildRejected() {
            State parent = State.create(false);
            parent.setTransition('a', State.create(true));
            assertThrows(IllegalStateException.class, () -> Signature.of(parent));
            assertThrows(IllegalStateException.class, () -> register.replaceOrRegister(parent));
        }
    }

    @Nested
    @DisplayName("替换或登记 (Replace or register)")
    class ReplaceOrRegisterTests {

        @Test
        @DisplayName("等价状态被替换为先登记的实例")
        void testReplacesEquivalent() {
            State first = open(false, "xy");
            State second = open(false, "yx");

            assertSame(first, register.replaceOrRegister(first));
            assertSame(first, register.replaceOrRegister(second));
            assertAll(
                    () -> assertTrue(first.isRegistered()),
                    () -> assertFalse(second.isRegistered()),
                    () -> assertEquals(2, register.size()),
                    () -> assertSame(first, register.lookup(Signature.of(second)))
            );
        }

        @Test
        @DisplayName("登记表满时应抛出 StateSpaceExhaustedException，已登记的状态仍可复用")
        void testCapacity() {
            Register small = new Register(2);
            State smallLeaf = small.replaceOrRegister(State.create(true));
            State inner = State.create(false);
            inner.setTransition('a', smallLeaf);
            small.replaceOrRegister(inner);

            State third = State.create(false);
            third.setTransition('b', smallLeaf);
            assertThrows(StateSpaceExhaustedException.class, () -> small.replaceOrRegister(third));
            assertAll(
                    () -> assertFalse(third.isRegistered()),
                    () -> assertEquals(2, small.size()),
                    () -> assertSame(smallLeaf, small.replaceOrRegister(State.create(true))),
                    () -> assertThrows(IllegalArgumentException.class, () -> new Register(0))
            );
        }

        @Test
        @DisplayName("已注册的状态原样返回")
        void testRegisteredReturnedAsIs() {
            assertSame(leaf, register.replaceOrRegister(leaf));
            assertEquals(1, register.size());
        }

        @Test
        @DisplayName("清理只保留从根可达的状态")
        void testRetainReachable() {
            State kept = register.replaceOrRegister(open(false, "a"));
            register.replaceOrRegister(open(true, "b"));
            State root = State.create(false);
            root.setTransition('k', kept);

            assertEquals(3, register.size());
            assertEquals(1, register.retainReachable(root));
            assertAll(
                    () -> assertEquals(2, register.size()),
                    () -> assertSame(kept, register.lookup(Signature.of(kept))),
                    () -> assertSame(leaf, register.lookup(Signature.of(leaf))),
                    () -> assertNull(register.lookup(Signature.of(open(true, "b"))))
            );
        }

        @Test
        @DisplayName("可达状态集合按引用计算，共享状态只算一次")
        void testReachableFrom() {
            State shared = register.replaceOrRegister(open(false, "a"));
            State root = State.create(false);
            root.setTransition('x', shared);
            root.setTransition('y', shared);

            assertEquals(3, Register.reachableFrom(root).size());
        }
    }
}
