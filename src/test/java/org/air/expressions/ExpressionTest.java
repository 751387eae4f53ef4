package org.air.expressions;

import org.air.core.Ident;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.air.expressions.Expression.*;
import static org.junit.jupiter.api.Assertions.*;

class ExpressionTest {

    @Nested
    @DisplayName("文本形式 (Printing)")
    class PrintingTests {

        @Test
        @DisplayName("常量与负整数")
        void testConstants() {
            assertAll("Constant syntax",
                    () -> assertEquals("true", Constant.TRUE.toString()),
                    () -> assertEquals("42", Constant.of(42).toString()),
                    () -> assertEquals("(- 7)", Constant.of(-7).toString()),
                    () -> assertEquals("123456789012345678901234567890",
                            Constant.of(new BigInteger("123456789012345678901234567890")).toString())
            );
        }

        @Test
        @DisplayName("复合表达式按前缀形式打印")
        void testCompound() {
            Expression e = implies(and(gt(var("x"), num(3)), not(var("p"))), eq(add(var("x"), num(1)), apply("f", var("y"))));
            assertEquals("(=> (and (> x 3) (not p)) (= (+ x 1) (f y)))", e.toString());
        }

        @Test
        @DisplayName("空的 and 与带标签断言")
        void testEmptyAndLabeled() {
            assertEquals("(and)", and().toString());
            assertEquals("(! (>= x 0) :named \"l1\")", LabeledAssertion.of("l1", ge(var("x"), num(0))).toString());
        }
    }

    @Nested
    @DisplayName("相等性与结构共享 (Equality and Sharing)")
    class EqualityTests {

        @Test
        @DisplayName("结构相同的表达式相等")
        void testStructuralEquality() {
            Expression e1 = add(var("x"), mul(var("y"), num(2)));
            Expression e2 = add(var("x"), mul(var("y"), num(2)));
            assertEquals(e1, e2);
            assertEquals(e1.hashCode(), e2.hashCode());
            assertNotEquals(e1, add(var("x"), mul(var("y"), num(3))));
        }

        @Test
        @DisplayName("不同运算符不相等")
        void testDifferentOperators() {
            assertNotEquals(le(var("x"), num(1)), lt(var("x"), num(1)));
            assertNotEquals(and(var("p"), var("q")), or(var("p"), var("q")));
        }

        @Test
        @DisplayName("子节点未变化时 withChildren 返回同一实例")
        void testWithChildren_Unchanged_ReturnsThis() {
            Expression e = sub(var("x"), num(1));
            assertSame(e, e.withChildren(e.getChildren()));

            Expression changed = e.withChildren(List.of(Variable.of(Ident.of("z")), num(1)));
            assertNotSame(e, changed);
            assertEquals(sub(var("z"), num(1)), changed);
        }

        @Test
        @DisplayName("子节点数量不一致应抛出异常")
        void testWithChildren_WrongArity() {
            Expression e = le(var("x"), num(1));
            assertThrows(IllegalArgumentException.class, () -> e.withChildren(List.of(var("x"))));
        }
    }
}
