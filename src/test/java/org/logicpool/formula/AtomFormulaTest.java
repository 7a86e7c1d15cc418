package org.logicpool.formula;

import org.logicpool.core.Variable;
import org.logicpool.core.VariableType;
import org.logicpool.expressions.RelationType;
import org.logicpool.expressions.arith.ArithConstraint;
import org.logicpool.expressions.arith.LinearExpression;
import org.logicpool.expressions.arith.VariableAssignment;
import org.logicpool.expressions.arith.VariableComparison;
import org.logicpool.expressions.bitvector.BVConstraint;
import org.logicpool.expressions.bitvector.BVRelation;
import org.logicpool.expressions.bitvector.BVTerm;
import org.logicpool.expressions.pseudobool.PBConstraint;
import org.logicpool.expressions.uninterpreted.UTerm;
import org.logicpool.utils.Rational;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AtomFormulaTest {

    private static Variable x, y, bv, u1, u2, b1, b2;

    private FormulaPool pool;

    @BeforeAll
    static void setUp() {
        x = Variable.createNewVariable("x", VariableType.REAL);
        y = Variable.createNewVariable("y", VariableType.REAL);
        bv = Variable.createNewVariable("v", VariableType.BITVECTOR);
        u1 = Variable.createNewVariable("u1", VariableType.UNINTERPRETED);
        u2 = Variable.createNewVariable("u2", VariableType.UNINTERPRETED);
        b1 = Variable.createNewVariable("b1", VariableType.BOOL);
        b2 = Variable.createNewVariable("b2", VariableType.BOOL);
    }

    @BeforeEach
    void newPool() {
        pool = new FormulaPool(PoolConfig.of(true, 64, true));
    }

    @Nested
    @DisplayName("算术约束 (Arithmetic constraints)")
    class ArithTests {

        @Test
        @DisplayName("约束与其否定共享一对节点，较小的一侧是基公式")
        void testBasePolarity() {
            ArithConstraint lt = ArithConstraint.of(LinearExpression.of(x), LinearExpression.of(y), RelationType.LT);
            Formula ltFormula = pool.newConstraint(lt);
            Formula geFormula = pool.newConstraint(lt.negation());

            assertAll("Base polarity",
                    () -> assertEquals(ltFormula.negation(), geFormula),
                    () -> assertTrue(ltFormula.getContent().isBase(), "LT 小于 GE"),
                    () -> assertFalse(geFormula.getContent().isBase()),
                    () -> assertEquals(FormulaType.CONSTRAINT, geFormula.getType(), "否定仍是约束，而不是 NOT 节点"),
                    () -> assertEquals(lt.negation(), geFormula.getContent().getAtom()),
                    () -> assertEquals(ltFormula.getId() + 1, geFormula.getId()),
                    () -> assertEquals(2, pool.size())
            );
        }

        @Test
        @DisplayName("先构造非基极性时，基公式仍然获得较小的 ID")
        void testNonBaseFirst() {
            ArithConstraint ge = ArithConstraint.of(LinearExpression.of(x), RelationType.GE);
            Formula geFormula = pool.newConstraint(ge);
            Formula ltFormula = pool.newConstraint(ge.negation());

            assertAll("Ids",
                    () -> assertFalse(geFormula.getContent().isBase()),
                    () -> assertEquals(geFormula.getId() - 1, ltFormula.getId()),
                    () -> assertEquals(2, pool.getUsageCount(ltFormula), "两个句柄都计在基公式上")
            );
        }

        @Test
        @DisplayName("常量约束折叠为 TRUE/FALSE")
        void testFolding() {
            ArithConstraint trueConstraint = ArithConstraint.of(LinearExpression.of(3), LinearExpression.of(5), RelationType.LT);
            ArithConstraint falseConstraint = ArithConstraint.of(LinearExpression.of(3), RelationType.EQ);

            assertAll("Folding",
                    () -> assertTrue(pool.newConstraint(trueConstraint).isTrue()),
                    () -> assertTrue(pool.newConstraint(falseConstraint).isFalse()),
                    () -> assertEquals(1, pool.size())
            );
        }

        @Test
        @DisplayName("关闭化简时常量约束也作为原子存储")
        void testNoFolding() {
            FormulaPool plain = new FormulaPool(PoolConfig.of(false, 16, false));
            ArithConstraint trueConstraint = ArithConstraint.of(LinearExpression.of(-1), RelationType.LT);
            Formula atom = plain.newConstraint(trueConstraint);

            assertAll("No folding",
                    () -> assertEquals(FormulaType.CONSTRAINT, atom.getType()),
                    () -> assertEquals(2, plain.size())
            );
        }

        @Test
        @DisplayName("变量比较和变量赋值也按基极性存储")
        void testVariableAtoms() {
            VariableComparison cmp = VariableComparison.of(x, RelationType.LE, Rational.valueOf(2));
            VariableAssignment assign = VariableAssignment.of(y, Rational.valueOf(1, 2));
            Formula cmpFormula = pool.newVariableComparison(cmp);
            Formula assignFormula = pool.newVariableAssignment(assign);

            assertAll("Variable atoms",
                    () -> assertEquals(cmpFormula.negation(), pool.newVariableComparison(cmp.negation())),
                    () -> assertTrue(cmpFormula.getContent().isBase()),
                    () -> assertEquals(FormulaType.VARASSIGN, assignFormula.getType()),
                    () -> assertTrue(assignFormula.getContent().isBase(), "未取反的赋值较小"),
                    () -> assertEquals("y !-> 1/2", assignFormula.negation().toString())
            );
        }

        @Test
        @DisplayName("原子参与连接词的化简")
        void testAtomsInConnectives() {
            Formula atom = pool.newConstraint(ArithConstraint.of(LinearExpression.of(x), RelationType.GT));
            Formula negated = pool.newConstraint(ArithConstraint.of(LinearExpression.of(x), RelationType.LE));

            assertAll("Connectives over atoms",
                    () -> assertTrue(pool.newAnd(atom, negated).isFalse()),
                    () -> assertTrue(pool.newOr(atom, negated).isTrue())
            );
        }

        @Test
        @DisplayName("以原子的非基极性为条件的 ITE 交换分支后与基极性共享节点")
        void testIteOverNegatedAtom() {
            Formula lt = pool.newConstraint(ArithConstraint.of(LinearExpression.of(x), RelationType.LT));
            Formula ge = pool.newConstraint(ArithConstraint.of(LinearExpression.of(x), RelationType.GE));
            Formula p = pool.newBoolean(b1);
            Formula q = pool.newBoolean(b2);
            Formula ite = pool.newIte(ge, p, q);

            assertAll("Ite over atoms",
                    () -> assertEquals(FormulaType.CONSTRAINT, ge.getType()),
                    () -> assertFalse(ge.getContent().isBase()),
                    () -> assertEquals(pool.newIte(lt, q, p), ite),
                    () -> assertSame(lt.getContent(), ite.getContent().getSubformulas().get(0), "条件取基极性")
            );
        }
    }

    @Nested
    @DisplayName("其他理论 (Other theories)")
    class OtherTheoryTests {

        @Test
        @DisplayName("位向量约束")
        void testBitVector() {
            BVTerm v = BVTerm.variable(bv, 8);
            BVConstraint eq = BVConstraint.of(v, BVRelation.EQ, BVTerm.constant(3, 8));
            Formula eqFormula = pool.newBitVector(eq);

            assertAll("Bit vectors",
                    () -> assertEquals(eqFormula.negation(), pool.newBitVector(eq.negation())),
                    () -> assertEquals(eqFormula, pool.newBitVector(BVConstraint.of(BVTerm.constant(3, 8), BVRelation.EQ, v))),
                    () -> assertTrue(pool.newBitVector(BVConstraint.of(v, BVRelation.UGE, BVTerm.constant(0, 8))).isTrue()),
                    () -> assertTrue(pool.newBitVector(BVConstraint.of(v, BVRelation.UGT, BVTerm.constant(255, 8))).isFalse())
            );
        }

        @Test
        @DisplayName("未解释等式：否定为不等式，自等式折叠")
        void testUninterpretedEquality() {
            UTerm t1 = UTerm.variable(u1);
            UTerm t2 = UTerm.variable(u2);
            Formula eq = pool.newUEquality(t1, t2, false);
            Formula neq = pool.newUEquality(t2, t1, true);

            assertAll("Uninterpreted",
                    () -> assertEquals(eq.negation(), neq),
                    () -> assertTrue(eq.getContent().isBase()),
                    () -> assertEquals("(!= u1 u2)", neq.toString()),
                    () -> assertTrue(pool.newUEquality(t1, t1, false).isTrue()),
                    () -> assertTrue(pool.newUEquality(t1, t1, true).isFalse())
            );
        }

        @Test
        @DisplayName("伪布尔约束")
        void testPseudoBoolean() {
            PBConstraint atMostOne = PBConstraint.of(Map.of(b1, 1, b2, 1), RelationType.LE, 1);
            Formula formula = pool.newPseudoBoolean(atMostOne);

            assertAll("Pseudo boolean",
                    () -> assertEquals(FormulaType.PBCONSTRAINT, formula.getType()),
                    () -> assertEquals(formula.negation(), pool.newPseudoBoolean(atMostOne.negation())),
                    () -> assertTrue(pool.newPseudoBoolean(PBConstraint.of(Map.of(b1, 1, b2, 1), RelationType.LE, 2)).isTrue()),
                    () -> assertTrue(pool.newPseudoBoolean(PBConstraint.of(Map.of(b1, 1), RelationType.GT, 1)).isFalse())
            );
        }
    }
}
