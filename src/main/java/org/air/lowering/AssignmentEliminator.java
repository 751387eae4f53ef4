package org.air.lowering;

import org.air.core.AirSort;
import org.air.core.AirUsageException;
import org.air.core.Declaration;
import org.air.core.Ident;
import org.air.core.Query;
import org.air.expressions.Application;
import org.air.expressions.Expression;
import org.air.expressions.Variable;
import org.air.statements.Assert;
import org.air.statements.Assign;
import org.air.statements.Assume;
import org.air.statements.Block;
import org.air.statements.Statement;
import org.air.visitor.TreeRewriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * 赋值消除：把可变变量语义改写成静态重命名，即手工构造 SSA。
 * <p>
 * 每个 declare-var 声明的变量 x 维护一个当前代 (generation)，从 0 开始，
 * 第 n 代对应常量 x@n。assign x := e 先把 e 中的变量替换为各自的当前代，
 * 再为 x 分配新的一代 k，并替换为 assume (= x@k e')。
 * 进入 block 时保存当前代映射，离开时恢复，因此块内的重命名不会泄漏到块后的语句。
 * 代号计数器本身单调递增，块外和块内分配的名字不会冲突。
 * 已被查询引用、局部声明或调用方保留的名字不会被分配，遇到时跳过该代号。
 * <p>
 * 输出的语句树不含 assign，与输入顺序语义等价。此类是纯函数式的，不持有跨查询状态。
 */
public final class AssignmentEliminator {

    private static final Logger logger = LoggerFactory.getLogger(AssignmentEliminator.class);

    public static final String GENERATION_SEPARATOR = "@";

    // 变量 -> 排序，保持声明顺序
    private final Map<Ident, AirSort> mutableVariables = new LinkedHashMap<>();
    // 变量 -> 下一个可分配的代号，单调递增，不随 block 恢复
    private final Map<Ident, Integer> nextGeneration = new HashMap<>();
    // 变量 -> 当前代号，进入 block 时保存，离开时恢复
    private Map<Ident, Integer> currentGeneration = new HashMap<>();
    // 赋值产生的新一代常量声明，按分配顺序
    private final List<Declaration> freshDeclarations = new ArrayList<>();
    // 查询中已出现的值名字，代号名不能与之重复
    private final Set<Ident> takenNames = new HashSet<>();
    private final Predicate<Ident> reserved;

    private AssignmentEliminator(Predicate<Ident> reserved) {
        this.reserved = reserved;
    }

    /**
     * 对查询做赋值消除。
     * @param query 原始查询。
     * @return 不含 assign、不含 declare-var 的等价查询。
     * @throws AirUsageException 如果对未用 declare-var 声明的名字赋值。
     */
    public static Query lowerQuery(Query query) {
        return lowerQuery(query, name -> false);
    }

    /**
     * 对查询做赋值消除，分配的代号名避开 reserved 接受的名字 (例如已可见的全局声明)。
     * @param query 原始查询。
     * @param reserved 调用方占用的名字。
     * @return 不含 assign、不含 declare-var 的等价查询。
     */
    public static Query lowerQuery(Query query, Predicate<Ident> reserved) {
        AssignmentEliminator eliminator = new AssignmentEliminator(Objects.requireNonNull(reserved, "reserved cannot be null"));
        eliminator.collectTakenNames(query);
        List<Declaration> declarations = new ArrayList<>();
        for (Declaration decl : query.getLocalDeclarations()) {
            if (decl.getKind() == Declaration.Kind.VAR) {
                Ident name = decl.getName();
                if (eliminator.mutableVariables.containsKey(name)) {
                    logger.error("AssignmentEliminator: 可变变量 {} 被重复声明", name);
                    throw new AirUsageException("duplicate declare-var: " + name);
                }
                eliminator.mutableVariables.put(name, decl.getSort());
                int initial = eliminator.freeGeneration(name, 0);
                eliminator.nextGeneration.put(name, initial + 1);
                eliminator.currentGeneration.put(name, initial);
                declarations.add(Declaration.constant(generationName(name, initial), decl.getSort()));
            } else {
                declarations.add(decl);
            }
        }
        // 局部公理看到的是每个变量的第 0 代
        for (int i = 0; i < declarations.size(); i++) {
            Declaration decl = declarations.get(i);
            if (decl.getKind() == Declaration.Kind.AXIOM) {
                declarations.set(i, decl.withAxiom(eliminator.rename(decl.getAxiom())));
            }
        }

        Statement lowered = eliminator.lowerStatement(query.getAssertion());
        declarations.addAll(eliminator.freshDeclarations);
        logger.debug("AssignmentEliminator: {} 个可变变量，新分配 {} 代",
                eliminator.mutableVariables.size(), eliminator.freshDeclarations.size());
        return Query.of(declarations, lowered);
    }

    /**
     * @return 变量 x 第 n 代对应的常量名 x@n。
     */
    public static Ident generationName(Ident variable, int generation) {
        return Ident.of(variable.getName() + GENERATION_SEPARATOR + generation);
    }

    private Statement lowerStatement(Statement stmt) {
        return switch (stmt.getKind()) {
            case ASSUME -> Assume.of(rename(((Assume) stmt).getExpression()));
            case ASSERT -> {
                Assert assertion = (Assert) stmt;
                yield Assert.of(assertion.getLabel(), rename(assertion.getExpression()));
            }
            case ASSIGN -> lowerAssign((Assign) stmt);
            case BLOCK -> {
                Map<Ident, Integer> saved = new HashMap<>(currentGeneration);
                List<Statement> lowered = new ArrayList<>();
                for (Statement child : stmt.getStatements()) {
                    lowered.add(lowerStatement(child));
                }
                currentGeneration = saved;
                yield Block.of(lowered);
            }
        };
    }

    private Statement lowerAssign(Assign assign) {
        Ident variable = assign.getVariable();
        AirSort sort = mutableVariables.get(variable);
        if (sort == null) {
            logger.error("AssignmentEliminator: 对非可变变量 {} 赋值", variable);
            throw new AirUsageException("assignment to undeclared or immutable variable: " + variable);
        }
        // 右侧必须在分配新一代之前重命名
        Expression value = rename(assign.getExpression());
        int generation = freeGeneration(variable, nextGeneration.get(variable));
        nextGeneration.put(variable, generation + 1);
        currentGeneration.put(variable, generation);
        Ident fresh = generationName(variable, generation);
        freshDeclarations.add(Declaration.constant(fresh, sort));
        logger.debug("AssignmentEliminator: {} := {} 分配新一代 {}", variable, value, fresh);
        return Assume.of(Expression.eq(Variable.of(fresh), value));
    }

    private void collectTakenNames(Query query) {
        for (Declaration decl : query.getLocalDeclarations()) {
            if (decl.getKind() == Declaration.Kind.AXIOM) {
                collectReferences(decl.getAxiom());
            } else if (decl.getKind() != Declaration.Kind.SORT) {
                takenNames.add(decl.getName());
            }
        }
        TreeRewriter.rewriteExpressions(query.getAssertion(), node -> {
            collectReferences(node);
            return node;
        });
    }

    private void collectReferences(Expression expr) {
        TreeRewriter.rewrite(expr, node -> {
            if (node.getKind() == Expression.Kind.VARIABLE) {
                takenNames.add(((Variable) node).getName());
            } else if (node.getKind() == Expression.Kind.APPLY) {
                takenNames.add(((Application) node).getFunction());
            }
            return node;
        });
    }

    /**
     * @return 从 from 开始第一个名字未被占用的代号。
     */
    private int freeGeneration(Ident variable, int from) {
        int generation = from;
        while (takenNames.contains(generationName(variable, generation))
                || reserved.test(generationName(variable, generation))) {
            logger.debug("AssignmentEliminator: {} 已被占用，跳过", generationName(variable, generation));
            generation++;
        }
        return generation;
    }

    private Expression rename(Expression expr) {
        return TreeRewriter.rewrite(expr, node -> {
            if (node.getKind() != Expression.Kind.VARIABLE) {
                return node;
            }
            Ident name = ((Variable) node).getName();
            Integer generation = currentGeneration.get(name);
            return generation == null ? node : Variable.of(generationName(name, generation));
        });
    }
}
