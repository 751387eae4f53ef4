package org.air.visitor;

import org.air.expressions.Expression;
import org.air.statements.LeafStatement;
import org.air.statements.Statement;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * 表达式树与语句树的通用自底向上重写工具。
 * 后序遍历：一个节点的所有子节点都先被重写，然后重建后的父节点才交给回调。
 * 兄弟节点之间按从左到右的顺序处理，但调用方不应依赖这一点。
 * 未被回调改变的子树保持结构共享。
 */
public final class TreeRewriter {

    private TreeRewriter() {
    }

    /**
     * 后序重写表达式树。
     * @param expr 根表达式。
     * @param f 对每个节点调用一次的变换，入参的子节点已经被重写。
     * @return 重写后的根表达式。
     */
    public static Expression rewrite(Expression expr, UnaryOperator<Expression> f) {
        List<Expression> children = expr.getChildren();
        if (children.isEmpty()) {
            return f.apply(expr);
        }
        List<Expression> rewritten = new ArrayList<>(children.size());
        for (Expression child : children) {
            rewritten.add(rewrite(child, f));
        }
        return f.apply(expr.withChildren(rewritten));
    }

    /**
     * 后序重写语句树。block 的所有子语句先被重写，然后 block 本身交给回调。
     * @param stmt 根语句。
     * @param f 对每条语句调用一次的变换。
     * @return 重写后的根语句。
     */
    public static Statement rewrite(Statement stmt, UnaryOperator<Statement> f) {
        List<Statement> children = stmt.getStatements();
        if (children.isEmpty()) {
            return f.apply(stmt);
        }
        List<Statement> rewritten = new ArrayList<>(children.size());
        for (Statement child : children) {
            rewritten.add(rewrite(child, f));
        }
        return f.apply(stmt.withStatements(rewritten));
    }

    /**
     * 对语句树中出现的每个表达式做后序重写，语句结构保持不变。
     * @param stmt 根语句。
     * @param f 表达式变换。
     * @return 重写后的语句。
     */
    public static Statement rewriteExpressions(Statement stmt, UnaryOperator<Expression> f) {
        return rewrite(stmt, s -> {
            if (s instanceof LeafStatement) {
                LeafStatement leaf = (LeafStatement) s;
                return leaf.withExpression(rewrite(leaf.getExpression(), f));
            }
            return s;
        });
    }
}
