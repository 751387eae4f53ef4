package org.air.symbolic;

import lombok.Getter;
import org.air.core.AirUsageException;
import org.air.core.Command;
import org.air.core.Declaration;
import org.air.core.Query;
import org.air.core.ValidityResult;
import org.air.log.AirLog;
import org.air.lowering.AssignmentEliminator;
import org.air.lowering.BlockFlattener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 求解器会话：拥有增量求解器状态，运行两个 lowering pass，提交查询并解释答案。
 * <p>
 * 会话是一个以打开作用域数 N 为状态的状态机 (初始 0)。每个操作先写入日志，再作用于会话，
 * 顺序与应用顺序一致。保存两份并行的 AIR 日志：initial 记录 lowering 之前提交的命令流，
 * final 记录 lowering 之后真正送往求解器的命令流；另有 smt 日志记录发给 Z3 的 SMT-LIB 文本。
 * <p>
 * 会话不是线程安全的；每个会话驱动自己的 Z3 Context，不同会话之间不共享可变状态。
 */
public final class SolverSession implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(SolverSession.class);

    @Getter
    private final SessionConfig config;
    private final Z3Oracle oracle;
    @Getter
    private final AirLog initialLog;
    @Getter
    private final AirLog finalLog;
    @Getter
    private final AirLog smtLog;

    @Getter
    private int scopeDepth;
    @Getter
    private long rlimit;
    private boolean closed;

    private SolverSession(SessionConfig config) {
        this.config = config;
        this.initialLog = new AirLog("air-initial", config.getInitialLogWriter());
        this.finalLog = new AirLog("air-final", config.getFinalLogWriter());
        this.smtLog = new AirLog("smt", config.getSmtLogWriter());
        this.oracle = new Z3Oracle(smtLog);
        this.scopeDepth = 0;
        this.rlimit = 0;
    }

    /**
     * 打开一个新会话。
     * 如果配置要求，先应用 air_recommended_options，然后记录初始资源上限。
     * @param config 会话配置。
     * @return 已打开的会话，用完后必须 close()。
     */
    public static SolverSession open(SessionConfig config) {
        Objects.requireNonNull(config, "Session config cannot be null");
        SolverSession session = new SolverSession(config);
        if (config.isRecommendedOptions()) {
            session.setOption(SolverOptions.RECOMMENDED_OPTIONS, "true");
        }
        session.setOption(SolverOptions.RLIMIT, Long.toString(config.getRlimit()));
        logger.info("SolverSession 已打开: strategy={}, rlimit={}", config.getCheckStrategy(), config.getRlimit());
        return session;
    }

    public static SolverSession open() {
        return open(SessionConfig.loadDefault());
    }

    // --- 命令 ---

    /**
     * 执行一条命令。非 check-valid 命令成功时返回 Valid。
     */
    public ValidityResult command(Command command) {
        Objects.requireNonNull(command, "Command cannot be null");
        switch (command.getKind()) {
            case PUSH:
                push();
                return ValidityResult.valid();
            case POP:
                pop();
                return ValidityResult.valid();
            case SET_OPTION:
                setOption(command.getOptionName(), command.getOptionValue());
                return ValidityResult.valid();
            case GLOBAL:
                global(command.getDeclaration());
                return ValidityResult.valid();
            case CHECK_VALID:
                return checkValid(command.getQuery());
            default:
                throw new IllegalStateException("未知的命令种类: " + command.getKind());
        }
    }

    /**
     * 按程序顺序执行一串命令。
     * @return 每条命令对应一个结果。
     */
    public List<ValidityResult> runAll(List<Command> commands) {
        List<ValidityResult> results = new ArrayList<>(commands.size());
        for (Command command : commands) {
            results.add(command(command));
        }
        return results;
    }

    public void push() {
        ensureOpen();
        initialLog.logPush();
        finalLog.logPush();
        oracle.push();
        scopeDepth++;
        logger.info("SolverSession: push，作用域深度 {}", scopeDepth);
    }

    public void pop() {
        ensureOpen();
        if (scopeDepth == 0) {
            logger.error("SolverSession: 没有可弹出的作用域");
            throw new AirUsageException("pop without matching push");
        }
        initialLog.logPop();
        finalLog.logPop();
        oracle.pop();
        scopeDepth--;
        logger.info("SolverSession: pop，作用域深度 {}", scopeDepth);
    }

    /**
     * 设置求解器选项。rlimit 更新会话的资源上限计数器，在每次检查前生效；
     * air_recommended_options=true 按固定顺序展开为一组参数，每个参数单独记录。
     * @throws AirUsageException 如果值无法解析，或求解器不认识该参数及其值的种类；此时会话状态不变。
     */
    public void setOption(String name, String value) {
        ensureOpen();
        SolverOptions.OptionValue parsed = SolverOptions.parse(name, value);
        if (SolverOptions.RLIMIT.equals(parsed.getName())) {
            initialLog.logSetOption(SolverOptions.RLIMIT, parsed.renderValue());
            finalLog.logSetOption(SolverOptions.RLIMIT, parsed.renderValue());
            rlimit = parsed.getUintValue();
            logger.debug("SolverSession: 资源上限设为 {}", rlimit);
            return;
        }
        List<SolverOptions.OptionValue> expanded = SolverOptions.expand(parsed);
        // 全部通过检查之后才写日志、改参数
        for (SolverOptions.OptionValue option : expanded) {
            oracle.checkParameter(option);
        }
        for (SolverOptions.OptionValue option : expanded) {
            initialLog.logSetOption(option.getName(), option.renderValue());
            finalLog.logSetOption(option.getName(), option.renderValue());
            oracle.setParameter(option);
        }
    }

    /**
     * 注册一条在当前作用域内对之后所有查询都可见的声明。
     * 声明随其所在作用域的 pop 一起失效。
     * @throws AirUsageException 对 declare-var，或引用了无法解析的名字。
     */
    public void global(Declaration declaration) {
        ensureOpen();
        Objects.requireNonNull(declaration, "Declaration cannot be null");
        if (declaration.getKind() == Declaration.Kind.VAR) {
            logger.error("SolverSession: declare-var {} 只能出现在查询中", declaration.getName());
            throw new AirUsageException("declare-var is only allowed inside a query: " + declaration.getName());
        }
        oracle.getSymbols().checkResolved(declaration);
        initialLog.logDeclaration(declaration);
        finalLog.logDeclaration(declaration);
        oracle.addDeclaration(declaration);
    }

    /**
     * 检查查询中所有可达断言是否由累积的假设推出。
     * lowering 或名字解析失败时抛出异常，此时不会写入任何反映求解器交互的日志记录。
     * @return Valid、Invalid 或 SolverError。
     */
    public ValidityResult checkValid(Query query) {
        ensureOpen();
        Objects.requireNonNull(query, "Query cannot be null");
        initialLog.logQuery(query);
        Z3SymbolTable symbols = oracle.getSymbols();
        Query eliminated = AssignmentEliminator.lowerQuery(query,
                name -> symbols.isConstVisible(name) || symbols.isFunctionVisible(name));
        Query flattened = BlockFlattener.lowerQuery(eliminated, config.getAssumptionScoping());
        symbols.checkResolved(flattened);
        finalLog.logQuery(flattened);

        ValidityResult result = oracle.checkValid(flattened, config.getCheckStrategy(), config.isReportModel(), rlimit);
        if (result.isSolverError()) {
            logger.warn("SolverSession: check-valid 未得到确定答案: {}", result.getReason());
        } else {
            logger.info("SolverSession: check-valid 结果 {}", result);
        }
        return result;
    }

    // --- 日志注释 ---

    public void comment(String text) {
        ensureOpen();
        initialLog.comment(text);
        finalLog.comment(text);
        smtLog.comment(text);
    }

    public void blankLine() {
        ensureOpen();
        initialLog.blankLine();
        finalLog.blankLine();
        smtLog.blankLine();
    }

    // --- 生命周期 ---

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        oracle.close();
        logger.info("SolverSession 已关闭");
    }

    private void ensureOpen() {
        if (closed) {
            logger.error("SolverSession: 会话已关闭");
            throw new AirUsageException("session is closed");
        }
    }
}
