package org.air.lowering;

import org.air.core.AirUsageException;
import org.air.core.Query;
import org.air.expressions.Expression;
import org.air.expressions.LabeledAssertion;
import org.air.statements.Assert;
import org.air.statements.Assume;
import org.air.statements.Block;
import org.air.statements.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 控制流展平：把不含 assign 的 assume/assert/block 树改写成一组带标签的蕴含式。
 * <p>
 * 从左到右遍历，维护按出现顺序累积的假设前提。
 * assume e 把前提 P 扩展为 (and P e)；assert l e 产生 l: (=> P e)，并同样把 e 并入前提，
 * 即检查通过的断言可作为后续代码的事实。
 * 前提是左嵌套的合取，相邻断言共享同一个前缀子树，总大小随语句数线性增长。
 * 进入嵌套 block 时继承外层前提；块内新增的假设在离开时是否保留由 {@link AssumptionScoping} 决定。
 * <p>
 * 输出查询的语句是一个扁平 block，其中每条 assert 都是自包含的蕴含式。
 */
public final class BlockFlattener {

    private static final Logger logger = LoggerFactory.getLogger(BlockFlattener.class);

    private final AssumptionScoping scoping;
    private final Set<String> labels = new HashSet<>();
    private final List<Statement> implications = new ArrayList<>();

    private BlockFlattener(AssumptionScoping scoping) {
        this.scoping = scoping;
    }

    /**
     * 展平查询。
     * @param query 已经过 AssignmentEliminator 的查询。
     * @return 语句为扁平 assert 块的查询，声明保持不变。
     * @throws AirUsageException 如果查询内有重复标签，或仍含 assign。
     */
    public static Query lowerQuery(Query query) {
        return lowerQuery(query, AssumptionScoping.SEQUENTIAL);
    }

    /**
     * 按指定的假设作用域规则展平查询。
     */
    public static Query lowerQuery(Query query, AssumptionScoping scoping) {
        BlockFlattener flattener = new BlockFlattener(Objects.requireNonNull(scoping, "scoping cannot be null"));
        flattener.flatten(query.getAssertion(), null);
        logger.debug("BlockFlattener: 生成 {} 个带标签的蕴含式", flattener.implications.size());
        return Query.of(query.getLocalDeclarations(), Block.of(flattener.implications));
    }

    /**
     * 取出展平后查询中的带标签蕴含式，保持查询顺序。
     * @param flattened lowerQuery 的输出。
     * @return 每条 assert 对应一个 LabeledAssertion。
     */
    public static List<LabeledAssertion> labeledImplications(Query flattened) {
        List<LabeledAssertion> result = new ArrayList<>();
        for (Statement stmt : flattened.getAssertion().getStatements()) {
            if (stmt.getKind() != Statement.Kind.ASSERT) {
                throw new IllegalArgumentException("查询尚未展平: " + stmt);
            }
            Assert assertion = (Assert) stmt;
            result.add(LabeledAssertion.of(assertion.getLabel(), assertion.getExpression()));
        }
        return result;
    }

    /**
     * @param premise 当前累积的前提，null 表示还没有任何假设。
     * @return 处理完该语句后的前提。
     */
    private Expression flatten(Statement stmt, Expression premise) {
        switch (stmt.getKind()) {
            case ASSUME:
                return conjoin(premise, ((Assume) stmt).getExpression());
            case ASSERT:
                Assert assertion = (Assert) stmt;
                if (!labels.add(assertion.getLabel())) {
                    logger.error("BlockFlattener: 查询内标签 {} 重复", assertion.getLabel());
                    throw new AirUsageException("duplicate assertion label: " + assertion.getLabel());
                }
                Expression goal = assertion.getExpression();
                Expression implication = premise == null ? goal : Expression.implies(premise, goal);
                implications.add(Assert.of(assertion.getLabel(), implication));
                return conjoin(premise, goal);
            case ASSIGN:
                logger.error("BlockFlattener: 遇到未消除的赋值 {}", stmt);
                throw new AirUsageException("assign must be eliminated before flattening: " + stmt);
            case BLOCK:
                Expression inner = premise;
                for (Statement child : stmt.getStatements()) {
                    inner = flatten(child, inner);
                }
                return scoping == AssumptionScoping.LEXICAL ? premise : inner;
            default:
                throw new IllegalStateException("未知的语句种类: " + stmt.getKind());
        }
    }

    private static Expression conjoin(Expression premise, Expression fact) {
        return premise == null ? fact : Expression.and(premise, fact);
    }
}
