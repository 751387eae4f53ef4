package org.air.visitor;

import org.air.core.Ident;
import org.air.expressions.Expression;
import org.air.expressions.Variable;
import org.air.statements.Assert;
import org.air.statements.Assign;
import org.air.statements.Assume;
import org.air.statements.Block;
import org.air.statements.Statement;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.air.expressions.Expression.*;
import static org.junit.jupiter.api.Assertions.*;

class TreeRewriterTest {

    @Nested
    @DisplayName("表达式重写 (Expression Rewriting)")
    class ExpressionTests {

        @Test
        @DisplayName("应按后序、从左到右访问节点")
        void testRewrite_VisitsPostOrder() {
            Expression e = add(var("x"), mul(var("y"), num(2)));
            List<String> visited = new ArrayList<>();

            TreeRewriter.rewrite(e, node -> {
                visited.add(node.toString());
                return node;
            });

            assertEquals(List.of("x", "y", "2", "(* y 2)", "(+ x (* y 2))"), visited);
        }

        @Test
        @DisplayName("父节点看到的是已重写的子节点")
        void testRewrite_ParentSeesRewrittenChildren() {
            Expression e = add(var("x"), num(1));
            List<Expression> seenByRoot = new ArrayList<>();

            Expression result = TreeRewriter.rewrite(e, node -> {
                if (node.equals(var("x"))) {
                    return var("z");
                }
                if (node.getKind() == Expression.Kind.MULTI) {
                    seenByRoot.addAll(node.getChildren());
                }
                return node;
            });

            assertEquals(add(var("z"), num(1)), result);
            assertEquals(List.of(var("z"), num(1)), seenByRoot);
        }

        @Test
        @DisplayName("未改变的子树应被共享，恒等重写返回原实例")
        void testRewrite_SharesUnchangedSubtrees() {
            Expression untouched = mul(var("y"), num(2));
            Expression e = add(var("x"), untouched);

            Expression result = TreeRewriter.rewrite(e,
                    node -> node.equals(var("x")) ? Variable.of(Ident.of("w")) : node);

            assertSame(untouched, result.getChildren().get(1));
            assertSame(e, TreeRewriter.rewrite(e, node -> node));
        }
    }

    @Nested
    @DisplayName("语句重写 (Statement Rewriting)")
    class StatementTests {

        @Test
        @DisplayName("语句也按后序访问，block 在其子语句之后")
        void testRewrite_StatementsPostOrder() {
            Statement inner = Block.of(Assert.of("a", var("p")));
            Statement outer = Block.of(Assume.of(var("q")), inner);
            List<Statement.Kind> visited = new ArrayList<>();

            TreeRewriter.rewrite(outer, s -> {
                visited.add(s.getKind());
                return s;
            });

            assertEquals(List.of(Statement.Kind.ASSUME, Statement.Kind.ASSERT,
                    Statement.Kind.BLOCK, Statement.Kind.BLOCK), visited);
        }

        @Test
        @DisplayName("rewriteExpressions 应改写嵌套 block 中的所有表达式")
        void testRewriteExpressions_ReachesNestedBlocks() {
            Statement stmt = Block.of(
                    Assign.of("x", add(var("x"), num(1))),
                    Block.of(Assert.of("a", gt(var("x"), num(0)))));

            Statement result = TreeRewriter.rewriteExpressions(stmt,
                    node -> node.equals(var("x")) ? var("y") : node);

            Statement expected = Block.of(
                    Assign.of("x", add(var("y"), num(1))),
                    Block.of(Assert.of("a", gt(var("y"), num(0)))));
            assertEquals(expected, result);
        }
    }
}
