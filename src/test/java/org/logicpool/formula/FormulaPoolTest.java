package org.logicpool.formula;

import org.logicpool.core.Variable;
import org.logicpool.core.VariableType;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FormulaPoolTest {

    private static Variable a, b, c;

    private FormulaPool pool;

    @BeforeAll
    static void setUp() {
        a = Variable.createNewVariable("a", VariableType.BOOL);
        b = Variable.createNewVariable("b", VariableType.BOOL);
        c = Variable.createNewVariable("c", VariableType.BOOL);
    }

    @BeforeEach
    void newPool() {
        pool = new FormulaPool(PoolConfig.of(false, 16, true));
    }

    @Nested
    @DisplayName("常量与 ID (Constants and ids)")
    class ConstantTests {

        @Test
        @DisplayName("TRUE 的 ID 为 1，FALSE 的 ID 为 2，互为否定")
        void testConstants() {
            Formula t = pool.trueFormula();
            Formula f = pool.falseFormula();

            assertAll("TRUE/FALSE",
                    () -> assertEquals(1, t.getId()),
                    () -> assertEquals(2, f.getId()),
                    () -> assertTrue(t.isTrue()),
                    () -> assertTrue(f.isFalse()),
                    () -> assertEquals(f, t.negation()),
                    () -> assertEquals(t, f.negation()),
                    () -> assertEquals(-1, pool.getUsageCount(t), "常量不计数"),
                    () -> assertEquals(1, pool.size(), "新池中只有 TRUE")
            );
        }

        @Test
        @DisplayName("公式与其否定获得相邻的 ID，否定是对合的")
        void testNegationAdjacencyAndInvolution() {
            Formula p = pool.newBoolean(a);
            Formula notP = pool.newNot(p);

            assertAll("Negation pair",
                    () -> assertEquals(3, p.getId(), "第一个发布的公式 ID 为 3"),
                    () -> assertEquals(p.getId() + 1, notP.getId()),
                    () -> assertEquals(FormulaType.NOT, notP.getType()),
                    () -> assertEquals(p, notP.negation()),
                    () -> assertEquals(p, pool.newNot(notP)),
                    () -> assertTrue(pool.formulasInverse(p, notP)),
                    () -> assertFalse(pool.formulasInverse(p, p)),
                    () -> assertEquals("(not a)", notP.toString())
            );
        }
    }

    @Nested
    @DisplayName("结构共享 (Structural sharing)")
    class SharingTests {

        @Test
        @DisplayName("相同形状只发布一次，操作数顺序无关")
        void testSameShapeSameNode() {
            Formula p = pool.newBoolean(a);
            Formula q = pool.newBoolean(b);
            Formula pq = pool.newAnd(p, q);
            Formula qp = pool.newAnd(q, p);

            assertAll("Sharing",
                    () -> assertSame(pq.getContent(), qp.getContent()),
                    () -> assertEquals(pq, qp),
                    () -> assertEquals(pq.hashCode(), qp.hashCode()),
                    () -> assertSame(p.getContent(), pool.newBoolean(a).getContent()),
                    () -> assertEquals(4, pool.size(), "TRUE, a, b, (and a b)")
            );
        }

        @Test
        @DisplayName("同一变量的原子在不同调用中得到同一节点")
        void testPayloadEquality() {
            Formula or1 = pool.newOr(pool.newBoolean(a), pool.newBoolean(c));
            Formula or2 = pool.newOr(pool.newBoolean(c), pool.newBoolean(a));
            assertSame(or1.getContent(), or2.getContent());
        }
    }

    @Nested
    @DisplayName("生命周期 (Lifecycle)")
    class LifecycleTests {

        @Test
        @DisplayName("父节点钉住子公式，释放最后一个句柄后级联删除")
        void testCascadingRelease() {
            Formula p = pool.newBoolean(a);
            Formula q = pool.newBoolean(b);
            Formula and = pool.newAnd(p, q);

            assertEquals(2, pool.getUsageCount(p), "句柄 + 父节点");
            p.close();
            q.close();
            assertAll("Children survive while the parent is alive",
                    () -> assertEquals(4, pool.size()),
                    () -> assertEquals(1, pool.getUsageCount(and))
            );

            and.close();
            assertEquals(1, pool.size(), "只剩 TRUE");
        }

        @Test
        @DisplayName("否定句柄计在基公式上")
        void testNegationSharesCount() {
            Formula p = pool.newBoolean(a);
            Formula notP = p.negation();

            assertEquals(2, pool.getUsageCount(notP));
            p.close();
            assertEquals(2, pool.size(), "否定句柄仍然持有该对");
            notP.close();
            assertEquals(1, pool.size());
        }

        @Test
        @DisplayName("close 是幂等的，copy 登记独立的使用")
        void testCloseIdempotentAndCopy() {
            Formula p = pool.newBoolean(a);
            Formula copy = p.copy();

            p.close();
            p.close();
            assertAll("Copy keeps the node alive",
                    () -> assertTrue(p.isReleased()),
                    () -> assertEquals(1, pool.getUsageCount(copy)),
                    () -> assertEquals(2, pool.size())
            );
            copy.close();
            assertEquals(1, pool.size());
        }

        @Test
        @DisplayName("n 个句柄全部释放后节点被删除")
        void testManyHandles() {
            List<Formula> handles = new ArrayList<>();
            for (int i = 0; i < 5; i++) {
                handles.add(pool.newOr(pool.newBoolean(a), pool.newBoolean(b)));
            }
            // 临时的 a、b 句柄没有关闭，只释放 or 的句柄
            assertEquals(5, pool.getUsageCount(handles.get(0)));
            handles.forEach(Formula::close);
            pool.forEach(f -> assertNotEquals(FormulaType.OR, f.getType()));
        }

        @Test
        @DisplayName("删除后同一形状重新发布为新的 ID")
        void testRepublishAfterDeletion() {
            Formula p = pool.newBoolean(a);
            int oldId = p.getId();
            p.close();

            Formula again = pool.newBoolean(a);
            assertNotEquals(oldId, again.getId());
        }

        @Test
        @DisplayName("深层公式的级联删除不会耗尽栈")
        void testDeepChainRelease() {
            Formula current = pool.newBoolean(a);
            for (int i = 0; i < 20000; i++) {
                Formula v = pool.newBoolean(Variable.createNewVariable("v" + i, VariableType.BOOL));
                Formula next = pool.newImplies(current, v);
                current.close();
                v.close();
                current = next;
            }
            current.close();
            assertEquals(1, pool.size());
        }
    }

    @Nested
    @DisplayName("Tseitin 变量 (Tseitin variables)")
    class TseitinTests {

        @Test
        @DisplayName("没有映射时 getTseitinVar 返回 TRUE，且不分配")
        void testGetWithoutMapping() {
            Formula p = pool.newBoolean(a);
            int before = pool.size();

            assertAll("No allocation",
                    () -> assertTrue(pool.getTseitinVar(p).isTrue()),
                    () -> assertEquals(before, pool.size())
            );
        }

        @Test
        @DisplayName("createTseitinVar 是幂等的，占位变量继承难度")
        void testCreateIdempotent() {
            Formula and = pool.newAnd(pool.newBoolean(a), pool.newBoolean(b));
            Formula t1 = pool.createTseitinVar(and);
            Formula t2 = pool.createTseitinVar(and);

            assertAll("Idempotent",
                    () -> assertEquals(t1, t2),
                    () -> assertEquals(t1, pool.getTseitinVar(and)),
                    () -> assertEquals(FormulaType.BOOL, t1.getType()),
                    () -> assertEquals(and.getDifficulty(), t1.getDifficulty()),
                    () -> assertEquals(2.0, t1.getDifficulty())
            );
        }

        @Test
        @DisplayName("占位变量仍被使用时，公式不被回收；占位变量释放后两者一起回收")
        void testTseitinPinning() {
            Formula p = pool.newBoolean(a);
            Formula q = pool.newBoolean(b);
            Formula and = pool.newAnd(p, q);
            Formula t = pool.createTseitinVar(and);
            assertEquals(5, pool.size());

            p.close();
            q.close();
            and.close();
            assertEquals(5, pool.size(), "(and a b) 仍被 Tseitin 映射占用");

            t.close();
            assertEquals(1, pool.size());
        }

        @Test
        @DisplayName("公式仍被使用时，占位变量不被回收")
        void testPlaceholderPinnedByFormula() {
            Formula p = pool.newBoolean(a);
            Formula t = pool.createTseitinVar(p);
            int placeholderId = t.getId();
            t.close();

            Formula again = pool.getTseitinVar(p);
            assertAll("Placeholder survives",
                    () -> assertEquals(placeholderId, again.getId()),
                    () -> assertEquals(3, pool.size())
            );
        }

        @Test
        @DisplayName("公式释放后仍被映射保留，通过占位变量删除映射后公式被回收")
        void testRemoveAfterFormulaReleased() {
            Formula p = pool.newBoolean(a);
            Formula q = pool.newBoolean(b);
            Formula and = pool.newAnd(p, q);
            Formula t = pool.createTseitinVar(and);
            int andId = and.getId();

            p.close();
            q.close();
            and.close();
            assertEquals(5, pool.size(), "映射仍然存在");

            assertTrue(pool.removeTseitinVar(t));
            List<Integer> ids = new ArrayList<>();
            pool.forEach(f -> ids.add(f.getId()));
            assertAll("Formula collected, placeholder kept",
                    () -> assertEquals(2, pool.size(), "TRUE 和仍有句柄的占位变量"),
                    () -> assertFalse(ids.contains(andId)),
                    () -> assertTrue(ids.contains(t.getId())),
                    () -> assertFalse(pool.removeTseitinVar(t))
            );

            t.close();
            assertEquals(1, pool.size());
        }

        @Test
        @DisplayName("removeTseitinVar 删除映射并回收不再使用的一侧")
        void testRemove() {
            Formula p = pool.newBoolean(a);
            Formula t = pool.createTseitinVar(p);
            t.close();
            assertEquals(3, pool.size());

            assertTrue(pool.removeTseitinVar(p));
            assertAll("Mapping removed",
                    () -> assertEquals(2, pool.size()),
                    () -> assertTrue(pool.getTseitinVar(p).isTrue()),
                    () -> assertFalse(pool.removeTseitinVar(p))
            );
        }
    }

    @Nested
    @DisplayName("诊断 (Diagnostics)")
    class DiagnosticsTests {

        @Test
        @DisplayName("forEach 按 ID 访问每个公式的两个极性，不改变使用次数")
        void testForEach() {
            Formula p = pool.newBoolean(a);
            List<Integer> ids = new ArrayList<>();

            pool.forEach(f -> ids.add(f.getId()));
            assertAll("Visit order",
                    () -> assertEquals(List.of(1, 2, p.getId(), p.getId() + 1), ids),
                    () -> assertEquals(1, pool.getUsageCount(p))
            );
        }

        @Test
        @DisplayName("dump 列出公式和 Tseitin 映射")
        void testDump() {
            Formula p = pool.newBoolean(a);
            Formula t = pool.createTseitinVar(p);
            String dump = pool.dump();

            assertAll("Dump content",
                    () -> assertTrue(dump.startsWith("Formula pool contains:")),
                    () -> assertTrue(dump.contains(p.getId() + " [usages=1]: a")),
                    () -> assertTrue(dump.contains("Tseitin variables:")),
                    () -> assertTrue(dump.contains("id " + p.getId() + "  ->  " + t.getId()))
            );
            pool.print();
        }
    }

    @Nested
    @DisplayName("契约违反 (Contract violations)")
    class ContractTests {

        @Test
        @DisplayName("已释放的句柄不能再使用")
        void testReleasedHandle() {
            Formula p = pool.newBoolean(a);
            p.close();
            assertAll("Released handle",
                    () -> assertThrows(IllegalStateException.class, () -> pool.newNot(p)),
                    () -> assertThrows(IllegalStateException.class, p::copy),
                    () -> assertThrows(IllegalStateException.class, p::negation)
            );
        }

        @Test
        @DisplayName("多释放一次是状态错误")
        void testOverRelease() {
            Formula p = pool.newBoolean(a);
            FormulaContent content = p.getContent();
            p.close();
            assertThrows(IllegalStateException.class, () -> pool.release(content));
        }

        @Test
        @DisplayName("来自另一个池的公式被拒绝")
        void testForeignPool() {
            FormulaPool other = new FormulaPool(PoolConfig.of(false, 16, true));
            Formula foreign = other.newBoolean(a);
            assertThrows(IllegalArgumentException.class, () -> pool.newNot(foreign));
        }

        @Test
        @DisplayName("非布尔变量不能作为 BOOL 公式")
        void testNonBooleanVariable() {
            Variable x = Variable.createNewVariable("x", VariableType.INT);
            assertThrows(IllegalArgumentException.class, () -> pool.newBoolean(x));
        }
    }
}
