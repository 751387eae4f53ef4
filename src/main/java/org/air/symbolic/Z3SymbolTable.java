package org.air.symbolic;

import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.FuncDecl;
import com.microsoft.z3.Sort;
import lombok.Getter;
import org.air.core.AirSort;
import org.air.core.AirUsageException;
import org.air.core.Declaration;
import org.air.core.Ident;
import org.air.core.Query;
import org.air.expressions.Application;
import org.air.expressions.Expression;
import org.air.expressions.Variable;
import org.air.visitor.TreeRewriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 负责管理 AIR 标识符到 Z3 排序、常量和函数的映射。
 * 映射按作用域分帧保存：每次 push 新开一帧，pop 时整帧丢弃，
 * 因此作用域内声明的排序和常量在离开作用域后不可见。
 * 排序和值 (常量、函数) 分属两个命名空间；同一命名空间内可见的名字不能重复声明。
 */
public class Z3SymbolTable {

    private static final Logger logger = LoggerFactory.getLogger(Z3SymbolTable.class);

    @Getter
    private final Context ctx;
    private final Deque<Frame> frames = new ArrayDeque<>();

    private static final class Frame {
        private final Map<Ident, Sort> sorts = new LinkedHashMap<>();
        private final Map<Ident, Expr> constants = new LinkedHashMap<>();
        private final Map<Ident, FuncDecl> functions = new LinkedHashMap<>();
    }

    /**
     * 构造函数。创建最外层的基础帧。
     * @param ctx Z3 Context 实例。
     */
    public Z3SymbolTable(Context ctx) {
        this.ctx = Objects.requireNonNull(ctx, "Z3 Context cannot be null.");
        this.frames.push(new Frame());
    }

    public void pushFrame() {
        frames.push(new Frame());
        logger.debug("Z3SymbolTable: push，当前帧数 {}", frames.size());
    }

    public void popFrame() {
        if (frames.size() <= 1) {
            throw new IllegalStateException("Z3SymbolTable: 不能弹出基础帧");
        }
        frames.pop();
        logger.debug("Z3SymbolTable: pop，当前帧数 {}", frames.size());
    }

    public int getDepth() {
        return frames.size() - 1;
    }

    // --- 声明 ---

    public Sort declareSort(Ident name) {
        if (isSortVisible(name)) {
            logger.error("Z3SymbolTable: 排序 {} 已声明", name);
            throw new AirUsageException("sort already declared: " + name);
        }
        Sort sort = ctx.mkUninterpretedSort(name.getName());
        frames.peek().sorts.put(name, sort);
        logger.debug("创建 Z3 排序: {}", name);
        return sort;
    }

    public Expr declareConst(Ident name, AirSort sort) {
        requireFreshValueName(name);
        Expr constant = ctx.mkConst(name.getName(), toZ3Sort(sort));
        frames.peek().constants.put(name, constant);
        logger.debug("创建 Z3 常量: {} : {}", name, sort);
        return constant;
    }

    public FuncDecl declareFunction(Ident name, List<AirSort> parameterSorts, AirSort resultSort) {
        requireFreshValueName(name);
        Sort[] domain = parameterSorts.stream().map(this::toZ3Sort).toArray(Sort[]::new);
        FuncDecl function = ctx.mkFuncDecl(name.getName(), domain, toZ3Sort(resultSort));
        frames.peek().functions.put(name, function);
        logger.debug("创建 Z3 函数: {} : {} -> {}", name, parameterSorts, resultSort);
        return function;
    }

    // --- 查找 ---

    public Sort toZ3Sort(AirSort sort) {
        return switch (sort.getKind()) {
            case BOOL -> ctx.mkBoolSort();
            case INT -> ctx.mkIntSort();
            case NAMED -> lookupSort(sort.getName());
        };
    }

    public Sort lookupSort(Ident name) {
        for (Frame frame : frames) {
            Sort sort = frame.sorts.get(name);
            if (sort != null) {
                return sort;
            }
        }
        logger.error("Z3SymbolTable: 无法解析排序 {}", name);
        throw new AirUsageException("unresolved sort: " + name);
    }

    public Expr lookupConst(Ident name) {
        for (Frame frame : frames) {
            Expr constant = frame.constants.get(name);
            if (constant != null) {
                return constant;
            }
        }
        logger.error("Z3SymbolTable: 无法解析常量 {}", name);
        throw new AirUsageException("unresolved identifier: " + name);
    }

    public FuncDecl lookupFunction(Ident name) {
        for (Frame frame : frames) {
            FuncDecl function = frame.functions.get(name);
            if (function != null) {
                return function;
            }
        }
        logger.error("Z3SymbolTable: 无法解析函数 {}", name);
        throw new AirUsageException("unresolved function: " + name);
    }

    /**
     * @return 当前最内层帧声明的常量，按声明顺序。
     */
    public Map<Ident, Expr> currentFrameConstants() {
        return Collections.unmodifiableMap(frames.peek().constants);
    }

    public boolean isSortVisible(Ident name) {
        return frames.stream().anyMatch(f -> f.sorts.containsKey(name));
    }

    public boolean isConstVisible(Ident name) {
        return frames.stream().anyMatch(f -> f.constants.containsKey(name));
    }

    public boolean isFunctionVisible(Ident name) {
        return frames.stream().anyMatch(f -> f.functions.containsKey(name));
    }

    // --- 解析检查 ---

    /**
     * 在不触碰求解器的前提下检查一条全局声明能否被解析。
     * @throws AirUsageException 如果引用了不可见的名字，或重复声明可见的名字。
     */
    public void checkResolved(Declaration declaration) {
        new ResolutionScope().declare(declaration);
    }

    /**
     * 在不触碰求解器的前提下检查查询中的每个标识符都能解析到可见声明或查询局部声明。
     * @throws AirUsageException 如果存在无法解析或重复声明的名字。
     */
    public void checkResolved(Query query) {
        ResolutionScope scope = new ResolutionScope();
        for (Declaration decl : query.getLocalDeclarations()) {
            scope.declare(decl);
        }
        TreeRewriter.rewriteExpressions(query.getAssertion(), e -> {
            scope.checkExpression(e);
            return e;
        });
    }

    private void requireFreshValueName(Ident name) {
        if (isConstVisible(name) || isFunctionVisible(name)) {
            logger.error("Z3SymbolTable: 名字 {} 已声明", name);
            throw new AirUsageException("identifier already declared: " + name);
        }
    }

    /**
     * 在当前可见符号之上叠加一层尚未提交给求解器的局部声明。
     */
    private final class ResolutionScope {
        private final Set<Ident> sorts = new HashSet<>();
        private final Set<Ident> constants = new HashSet<>();
        private final Set<Ident> functions = new HashSet<>();

        void declare(Declaration decl) {
            switch (decl.getKind()) {
                case SORT:
                    if (isSortVisible(decl.getName()) || !sorts.add(decl.getName())) {
                        logger.error("Z3SymbolTable: 排序 {} 已声明", decl.getName());
                        throw new AirUsageException("sort already declared: " + decl.getName());
                    }
                    break;
                case CONST:
                case VAR:
                    checkSort(decl.getSort());
                    declareValue(decl.getName(), constants);
                    break;
                case FUN:
                    decl.getParameterSorts().forEach(this::checkSort);
                    checkSort(decl.getSort());
                    declareValue(decl.getName(), functions);
                    break;
                case AXIOM:
                    TreeRewriter.rewrite(decl.getAxiom(), e -> {
                        checkExpression(e);
                        return e;
                    });
                    break;
                default:
                    throw new IllegalStateException("未知的声明种类: " + decl.getKind());
            }
        }

        private void declareValue(Ident name, Set<Ident> target) {
            if (isConstVisible(name) || isFunctionVisible(name)
                    || constants.contains(name) || functions.contains(name)) {
                logger.error("Z3SymbolTable: 名字 {} 已声明", name);
                throw new AirUsageException("identifier already declared: " + name);
            }
            target.add(name);
        }

        void checkSort(AirSort sort) {
            if (sort.isNamed() && !sorts.contains(sort.getName()) && !isSortVisible(sort.getName())) {
                logger.error("Z3SymbolTable: 无法解析排序 {}", sort.getName());
                throw new AirUsageException("unresolved sort: " + sort.getName());
            }
        }

        void checkExpression(Expression e) {
            if (e.getKind() == Expression.Kind.VARIABLE) {
                Ident name = ((Variable) e).getName();
                if (!constants.contains(name) && !isConstVisible(name)) {
                    logger.error("Z3SymbolTable: 无法解析标识符 {}", name);
                    throw new AirUsageException("unresolved identifier: " + name);
                }
            } else if (e.getKind() == Expression.Kind.APPLY) {
                Ident name = ((Application) e).getFunction();
                if (!functions.contains(name) && !isFunctionVisible(name)) {
                    logger.error("Z3SymbolTable: 无法解析函数 {}", name);
                    throw new AirUsageException("unresolved function: " + name);
                }
            }
        }
    }
}
