package org.air.core;

import org.air.expressions.Expression;
import org.air.statements.Assert;
import org.air.statements.Assign;
import org.air.statements.Assume;
import org.air.statements.Block;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ModelPrintingTest {

    @Nested
    @DisplayName("标识符 (Identifiers)")
    class IdentTests {

        @Test
        @DisplayName("同名标识符应是同一个实例")
        void testIdent_SameName_ShouldBeInterned() {
            assertSame(Ident.of("x"), Ident.of("x"));
            assertNotEquals(Ident.of("x"), Ident.of("y"));
        }

        @Test
        @DisplayName("标识符按名字排序")
        void testIdent_OrderingByName() {
            assertTrue(Ident.of("a").compareTo(Ident.of("b")) < 0);
            assertEquals(0, Ident.of("a").compareTo(Ident.of("a")));
        }
    }

    @Nested
    @DisplayName("声明与命令的文本形式 (Declaration and Command Syntax)")
    class DeclarationTests {

        @Test
        @DisplayName("各种声明应按 S 表达式打印")
        void testDeclaration_ToString() {
            assertAll("Declaration syntax",
                    () -> assertEquals("(declare-sort T)", Declaration.sort("T").toString()),
                    () -> assertEquals("(declare-const x Int)", Declaration.constant("x", AirSort.INT).toString()),
                    () -> assertEquals("(declare-var b Bool)", Declaration.var("b", AirSort.BOOL).toString()),
                    () -> assertEquals("(declare-fun f (Int T) Bool)",
                            Declaration.function("f", List.of(AirSort.INT, AirSort.named("T")), AirSort.BOOL).toString()),
                    () -> assertEquals("(axiom (> x 0))",
                            Declaration.axiom(Expression.gt(Expression.var("x"), Expression.num(0))).toString())
            );
        }

        @Test
        @DisplayName("命令应按 S 表达式打印")
        void testCommand_ToString() {
            Query query = Query.of(List.of(Declaration.var("x", AirSort.INT)),
                    Block.of(Assign.of("x", Expression.num(1)), Assert.of("a", Expression.bool(true))));

            assertAll("Command syntax",
                    () -> assertEquals("(push)", Command.PUSH.toString()),
                    () -> assertEquals("(pop)", Command.POP.toString()),
                    () -> assertEquals("(set-option :rlimit 10)", Command.setOption("rlimit", "10").toString()),
                    () -> assertEquals("(declare-sort T)", Command.global(Declaration.sort("T")).toString()),
                    () -> assertEquals("(check-valid (declare-var x Int) (block (assign x 1) (assert \"a\" true)))",
                            Command.checkValid(query).toString())
            );
        }

        @Test
        @DisplayName("结构相同的查询应相等")
        void testQuery_StructuralEquality() {
            Query q1 = Query.of(Assume.of(Expression.var("p")));
            Query q2 = Query.of(List.of(), Assume.of(Expression.var("p")));
            assertEquals(q1, q2);
            assertEquals(q1.hashCode(), q2.hashCode());
        }
    }

    @Nested
    @DisplayName("检查结果 (Validity Results)")
    class ValidityResultTests {

        @Test
        @DisplayName("Invalid 结果保留标签顺序，模型按名字排序")
        void testInvalid_LabelsOrderedAndModelSorted() {
            ValidityResult result = ValidityResult.invalid(List.of("b", "a"), Map.of("y", "2", "x", "1"));

            assertAll("Invalid result",
                    () -> assertTrue(result.isInvalid()),
                    () -> assertFalse(result.isValid()),
                    () -> assertEquals(List.of("b", "a"), result.getFailingLabels()),
                    () -> assertEquals(List.of("x", "y"), List.copyOf(result.getModel().keySet())),
                    () -> assertEquals("Invalid(b, a) {x=1, y=2}", result.toString())
            );
        }

        @Test
        @DisplayName("Valid 与 SolverError 的文本形式")
        void testValidAndSolverError_ToString() {
            assertEquals("Valid", ValidityResult.valid().toString());
            ValidityResult error = ValidityResult.solverError("canceled");
            assertTrue(error.isSolverError());
            assertEquals("canceled", error.getReason());
            assertEquals("SolverError(canceled)", error.toString());
        }
    }
}
