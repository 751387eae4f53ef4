package org.air.log;

import org.air.core.Command;
import org.air.core.Declaration;
import org.air.core.Query;
import org.air.core.ValidityResult;
import org.air.symbolic.SolverSession;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 有序、可重放的会话操作记录。
 * <p>
 * 每条影响会话的操作在真正作用于会话之前写入，顺序与应用顺序一致。
 * 文本格式是类 S 表达式，";;" 开头为注释，空行原样保留。
 * 记录同时保存在内存中；如果提供了 Writer，也会逐条写出并 flush。
 */
public final class AirLog {

    private static final Logger logger = LoggerFactory.getLogger(AirLog.class);

    private static final String COMMENT_MARKER = ";;";
    private static final String INDENT = "    ";

    private final String name;
    // 为 null 时只保留内存记录
    private final Writer writer;
    private final List<LogEntry> entries = new ArrayList<>();

    public AirLog(String name, Writer writer) {
        this.name = name;
        this.writer = writer;
    }

    public static AirLog inMemory(String name) {
        return new AirLog(name, null);
    }

    public String getName() {
        return name;
    }

    // --- 记录操作 ---

    public void logPush() {
        append(LogEntry.command(Command.PUSH, Command.PUSH.toString()));
    }

    public void logPop() {
        append(LogEntry.command(Command.POP, Command.POP.toString()));
    }

    public void logSetOption(String option, String value) {
        Command command = Command.setOption(option, value);
        append(LogEntry.command(command, command.toString()));
    }

    public void logDeclaration(Declaration declaration) {
        Command command = Command.global(declaration);
        append(LogEntry.command(command, command.toString()));
    }

    public void logQuery(Query query) {
        append(LogEntry.command(Command.checkValid(query), formatQuery(query)));
    }

    /**
     * 单行或多行注释，每行以 ";; " 开头。
     */
    public void comment(String text) {
        String[] lines = StringUtils.splitPreserveAllTokens(Objects.toString(text, ""), '\n');
        if (lines.length == 0) {
            lines = new String[]{""};
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                sb.append('\n');
            }
            sb.append(COMMENT_MARKER).append(' ').append(lines[i]);
        }
        append(LogEntry.comment(sb.toString()));
    }

    public void blankLine() {
        append(LogEntry.blank());
    }

    /**
     * 原样写入一行，不可重放。用于发给求解器的 SMT-LIB 文本。
     */
    public void raw(String text) {
        append(LogEntry.raw(text));
    }

    // --- 读取与重放 ---

    public List<LogEntry> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    /**
     * @return 完整的日志文本，每条记录一行 (多行记录原样展开)。
     */
    public String render() {
        StringBuilder sb = new StringBuilder();
        for (LogEntry entry : entries) {
            sb.append(entry.getText()).append('\n');
        }
        return sb.toString();
    }

    /**
     * 按记录顺序把所有命令重新应用到另一个会话上，注释和空行也一并转发。
     * 对 lowering 之前的日志重放，会得到与原会话完全相同的求解器交互序列。
     * @param session 目标会话。
     * @return 每条命令对应一个结果。
     */
    public List<ValidityResult> replay(SolverSession session) {
        List<ValidityResult> results = new ArrayList<>();
        for (LogEntry entry : new ArrayList<>(entries)) {
            switch (entry.getKind()) {
                case COMMAND -> results.add(session.command(entry.getCommand()));
                case COMMENT -> session.comment(uncomment(entry.getText()));
                case BLANK -> session.blankLine();
                case RAW -> logger.debug("AirLog.replay: 跳过不可重放的记录 {}", entry.getText());
            }
        }
        logger.info("AirLog.replay: 日志 {} 重放了 {} 条命令", name, results.size());
        return results;
    }

    private void append(LogEntry entry) {
        entries.add(entry);
        if (writer == null) {
            return;
        }
        try {
            writer.write(entry.getText());
            writer.write('\n');
            writer.flush();
        } catch (IOException e) {
            logger.error("AirLog: 写入日志 {} 失败", name, e);
            throw new UncheckedIOException("failed to write log " + name, e);
        }
    }

    private static String uncomment(String rendered) {
        return Arrays.stream(StringUtils.splitPreserveAllTokens(rendered, '\n'))
                .map(line -> StringUtils.removeStart(line, COMMENT_MARKER + " "))
                .collect(Collectors.joining("\n"));
    }

    private static String formatQuery(Query query) {
        StringBuilder sb = new StringBuilder("(check-valid\n");
        for (Declaration decl : query.getLocalDeclarations()) {
            sb.append(INDENT).append(decl).append('\n');
        }
        sb.append(INDENT).append(query.getAssertion()).append('\n');
        sb.append(')');
        return sb.toString();
    }
}
