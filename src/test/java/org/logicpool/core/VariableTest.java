package org.logicpool.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class VariableTest {

    @Test
    @DisplayName("变量按 ID 比较，同名变量互不相等")
    void testIdentity() {
        Variable first = Variable.createNewVariable("x", VariableType.INT);
        Variable second = Variable.createNewVariable("x", VariableType.INT);

        assertAll("Identity",
                () -> assertNotEquals(first, second),
                () -> assertTrue(first.compareTo(second) < 0),
                () -> assertEquals("x", first.toString()),
                () -> assertTrue(first.getType().isArithmetic())
        );
    }

    @Test
    @DisplayName("新的布尔变量带有唯一名称")
    void testFreshBoolean() {
        Variable t1 = Variable.freshBooleanVariable();
        Variable t2 = Variable.freshBooleanVariable();

        assertAll("Fresh",
                () -> assertEquals(VariableType.BOOL, t1.getType()),
                () -> assertNotEquals(t1.getName(), t2.getName()),
                () -> assertTrue(t1.getName().startsWith("_t"))
        );
    }

    @Test
    @DisplayName("空名称被拒绝")
    void testEmptyName() {
        assertThrows(IllegalArgumentException.class, () -> Variable.createNewVariable("", VariableType.BOOL));
    }
}
