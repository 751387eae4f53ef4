package org.air.symbolic;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.Model;
import com.microsoft.z3.Params;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Sort;
import com.microsoft.z3.Status;
import com.microsoft.z3.Z3Exception;
import lombok.Getter;
import org.air.core.AirSort;
import org.air.core.AirUsageException;
import org.air.core.Declaration;
import org.air.core.Ident;
import org.air.core.Query;
import org.air.core.ValidityResult;
import org.air.expressions.LabeledAssertion;
import org.air.expressions.ToZ3Expr;
import org.air.log.AirLog;
import org.air.lowering.BlockFlattener;
import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 对 Z3 求解器的唯一访问点。持有 Context、Solver 和符号表，
 * 把每次真正发给求解器的内容以 SMT-LIB 文本写入 smt 日志 (先写日志，再调用求解器)。
 * 单线程使用；不同会话各自持有独立的 Z3Oracle。
 */
@Getter
public class Z3Oracle implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(Z3Oracle.class);

    private final Context context;
    private final Solver solver;
    private final Z3SymbolTable symbols;
    private final AirLog smtLog;

    public Z3Oracle(AirLog smtLog) {
        this.smtLog = Objects.requireNonNull(smtLog, "smt log cannot be null");
        this.context = new Context(Map.of("model", "true"));
        this.solver = context.mkSolver();
        this.symbols = new Z3SymbolTable(context);
        logger.debug("Z3Oracle 初始化完成");
    }

    // --- 作用域 ---

    public void push() {
        smtLog.raw("(push)");
        solver.push();
        symbols.pushFrame();
    }

    public void pop() {
        smtLog.raw("(pop)");
        solver.pop();
        symbols.popFrame();
    }

    // --- 参数 ---

    /**
     * 检查求解器是否接受一个参数：名字必须是已知参数，值的种类必须与参数匹配。
     * 不修改求解器，也不写 smt 日志。
     * @throws AirUsageException 如果 Z3 拒绝该参数。
     */
    public void checkParameter(SolverOptions.OptionValue option) {
        try {
            solver.getParameterDescriptions().validate(toParams(option));
        } catch (Z3Exception e) {
            logger.error("Z3Oracle: 求解器不接受参数 {}", option, e);
            throw new AirUsageException("invalid solver option " + option + ": " + e.getMessage(), e);
        }
    }

    /**
     * 设置一个求解器参数。选项应已由 SolverOptions 解析展开，并通过 checkParameter。
     */
    public void setParameter(SolverOptions.OptionValue option) {
        smtLog.raw("(set-option :" + option.getName() + " " + option.renderValue() + ")");
        solver.setParameters(toParams(option));
        logger.debug("Z3Oracle: 设置参数 {}", option);
    }

    private Params toParams(SolverOptions.OptionValue option) {
        Params params = context.mkParams();
        switch (option.getType()) {
            case BOOL -> params.add(option.getName(), option.isBoolValue());
            // Z3 把 int 按无符号解释
            case UINT -> params.add(option.getName(), (int) option.getUintValue());
            case DOUBLE -> params.add(option.getName(), option.getDoubleValue());
        }
        return params;
    }

    // --- 声明 ---

    /**
     * 在当前作用域中声明一个排序、常量、函数，或断言一条公理。
     * declare-var 必须在此之前被 AssignmentEliminator 消除。
     */
    public void addDeclaration(Declaration decl) {
        switch (decl.getKind()) {
            case SORT -> {
                smtLog.raw("(declare-sort " + decl.getName() + " 0)");
                symbols.declareSort(decl.getName());
            }
            case CONST -> {
                smtLog.raw("(declare-const " + decl.getName() + " " + smtSort(decl.getSort()) + ")");
                symbols.declareConst(decl.getName(), decl.getSort());
            }
            case FUN -> {
                smtLog.raw("(declare-fun " + decl.getName() + " (" +
                        decl.getParameterSorts().stream().map(this::smtSort).collect(Collectors.joining(" ")) +
                        ") " + smtSort(decl.getSort()) + ")");
                symbols.declareFunction(decl.getName(), decl.getParameterSorts(), decl.getSort());
            }
            case AXIOM -> {
                BoolExpr axiom = translate(decl.getAxiom(), decl);
                smtLog.raw("(assert " + axiom + ")");
                solver.add(axiom);
            }
            case VAR -> {
                logger.error("Z3Oracle: declare-var {} 不能直接交给求解器", decl.getName());
                throw new AirUsageException("declare-var is only allowed inside a query: " + decl.getName());
            }
        }
    }

    // --- 查询 ---

    /**
     * 检查已展平查询的有效性。
     * 在一个临时作用域中声明查询的局部符号，断言目标蕴含式的否定并检查可满足性：
     * unsat 为 Valid，sat 为 Invalid，unknown 为 SolverError。临时作用域总会被弹出。
     *
     * @param flattened 经过两个 lowering pass 的查询。
     * @param strategy 合并查询或逐标签查询。
     * @param reportModel Invalid 时是否附带局部常量的赋值。
     * @param rlimit 资源上限，0 表示不限。
     * @return 查询结果。
     */
    public ValidityResult checkValid(Query flattened, CheckStrategy strategy, boolean reportModel, long rlimit) {
        List<LabeledAssertion> labeled = BlockFlattener.labeledImplications(flattened);
        push();
        try {
            for (Declaration decl : flattened.getLocalDeclarations()) {
                addDeclaration(decl);
            }
            List<Pair<String, BoolExpr>> goals = new ArrayList<>();
            for (LabeledAssertion assertion : labeled) {
                goals.add(Pair.of(assertion.getLabel(), translate(assertion, assertion)));
            }
            if (goals.isEmpty()) {
                logger.debug("Z3Oracle: 查询中没有断言，直接返回 Valid");
                return ValidityResult.valid();
            }
            setParameter(SolverOptions.OptionValue.ofUint(SolverOptions.RLIMIT, rlimit));
            Map<Ident, Expr> locals = new LinkedHashMap<>(symbols.currentFrameConstants());
            return switch (strategy) {
                case COMBINED -> checkCombined(goals, locals, reportModel);
                case PER_LABEL -> checkPerLabel(goals, locals, reportModel);
            };
        } finally {
            pop();
        }
    }

    private ValidityResult checkCombined(List<Pair<String, BoolExpr>> goals, Map<Ident, Expr> locals,
                                         boolean reportModel) {
        BoolExpr[] all = goals.stream().map(Pair::getValue).toArray(BoolExpr[]::new);
        BoolExpr negated = context.mkNot(context.mkAnd(all));
        smtLog.raw("(assert " + negated + ")");
        solver.add(negated);
        Status status = check();
        switch (status) {
            case UNSATISFIABLE:
                return ValidityResult.valid();
            case SATISFIABLE:
                Model model = solver.getModel();
                List<String> failing = new ArrayList<>();
                for (Pair<String, BoolExpr> goal : goals) {
                    if (!model.eval(goal.getValue(), true).isTrue()) {
                        failing.add(goal.getKey());
                    }
                }
                logger.debug("Z3Oracle: 失败的标签 {}", failing);
                return ValidityResult.invalid(failing, reportModel ? valuation(model, locals) : Map.of());
            default:
                return unknown();
        }
    }

    private ValidityResult checkPerLabel(List<Pair<String, BoolExpr>> goals, Map<Ident, Expr> locals,
                                         boolean reportModel) {
        List<String> failing = new ArrayList<>();
        Map<String, String> firstModel = null;
        for (Pair<String, BoolExpr> goal : goals) {
            smtLog.comment("label " + goal.getKey());
            smtLog.raw("(push)");
            solver.push();
            try {
                BoolExpr negated = context.mkNot(goal.getValue());
                smtLog.raw("(assert " + negated + ")");
                solver.add(negated);
                Status status = check();
                if (status == Status.SATISFIABLE) {
                    failing.add(goal.getKey());
                    if (firstModel == null) {
                        firstModel = reportModel ? valuation(solver.getModel(), locals) : Map.of();
                    }
                } else if (status == Status.UNKNOWN) {
                    return unknown();
                }
            } finally {
                smtLog.raw("(pop)");
                solver.pop();
            }
        }
        if (failing.isEmpty()) {
            return ValidityResult.valid();
        }
        return ValidityResult.invalid(failing, firstModel);
    }

    private Status check() {
        smtLog.raw("(check-sat)");
        Status status = solver.check();
        logger.debug("Z3Oracle: check-sat 返回 {}", status);
        return status;
    }

    private ValidityResult unknown() {
        String reason = solver.getReasonUnknown();
        logger.warn("Z3Oracle: 求解器未给出确定答案: {}", reason);
        return ValidityResult.solverError(reason == null ? "unknown" : reason);
    }

    private Map<String, String> valuation(Model model, Map<Ident, Expr> locals) {
        smtLog.raw("(get-model)");
        Map<String, String> values = new LinkedHashMap<>();
        for (Map.Entry<Ident, Expr> entry : locals.entrySet()) {
            values.put(entry.getKey().getName(), model.eval(entry.getValue(), true).toString());
        }
        return values;
    }

    /**
     * 把一个 AIR 布尔表达式翻译为 Z3 表达式。
     * Z3 在排序不匹配等非良类型输入上抛出 Z3Exception，这里转为 AirUsageException；
     * 其余阶段的 Z3Exception 原样传播。
     */
    private BoolExpr translate(ToZ3Expr expr, Object source) {
        Expr z3;
        try {
            z3 = expr.toZ3Expr(context, symbols);
        } catch (Z3Exception e) {
            logger.error("Z3Oracle: Z3 拒绝了输入 {}", source, e);
            throw new AirUsageException("ill-sorted input: " + source + ": " + e.getMessage(), e);
        }
        if (z3 instanceof BoolExpr) {
            return (BoolExpr) z3;
        }
        logger.error("Z3Oracle: 期望布尔表达式: {}", source);
        throw new AirUsageException("expected a boolean expression: " + source);
    }

    private String smtSort(AirSort sort) {
        Sort z3Sort = symbols.toZ3Sort(sort);
        return z3Sort.toString();
    }

    @Override
    public void close() {
        context.close();
        logger.debug("Z3Oracle: Context 已关闭");
    }
}
