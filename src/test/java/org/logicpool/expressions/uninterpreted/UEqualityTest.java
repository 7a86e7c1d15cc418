package org.logicpool.expressions.uninterpreted;

import org.logicpool.core.Variable;
import org.logicpool.core.VariableType;
import org.logicpool.expressions.Consistency;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class UEqualityTest {

    private static Variable u, v;

    @BeforeAll
    static void setUp() {
        u = Variable.createNewVariable("u", VariableType.UNINTERPRETED);
        v = Variable.createNewVariable("v", VariableType.UNINTERPRETED);
    }

    @Test
    @DisplayName("操作数被排序，否定切换等号与不等号")
    void testOrderingAndNegation() {
        UTerm fu = UTerm.apply("f", List.of(u));
        UEquality eq = UEquality.of(fu, UTerm.variable(v), false);

        assertAll("Equality",
                () -> assertEquals(eq, UEquality.of(UTerm.variable(v), fu, false)),
                () -> assertEquals(UTerm.variable(v), eq.getLhs(), "变量排在函数应用之前"),
                () -> assertTrue(eq.negation().isNegated()),
                () -> assertEquals("(= v f(u))", eq.toString()),
                () -> assertTrue(eq.compareTo(eq.negation()) < 0),
                () -> assertEquals(Consistency.UNDETERMINED, eq.isConsistent())
        );
    }

    @Test
    @DisplayName("项与自身的等式恒真，不等式恒假")
    void testReflexive() {
        UTerm fu = UTerm.apply("f", List.of(u));
        assertAll("Reflexive",
                () -> assertTrue(UEquality.of(fu, UTerm.apply("f", List.of(u)), false).isAlwaysConsistent()),
                () -> assertTrue(UEquality.of(fu, fu, true).isAlwaysInconsistent())
        );
    }

    @Test
    @DisplayName("项只接受未解释变量")
    void testWrongSort() {
        Variable x = Variable.createNewVariable("x", VariableType.INT);
        assertAll("Sorts",
                () -> assertThrows(IllegalArgumentException.class, () -> UTerm.variable(x)),
                () -> assertThrows(IllegalArgumentException.class, () -> UTerm.apply("g", List.of(x)))
        );
    }
}
