package org.air.log;

import lombok.Getter;
import org.air.core.Command;

import java.util.Objects;

/**
 * 结构化日志中的一条记录。
 * COMMAND 记录保留原始 Command 以便重放；其余记录只有文本。
 */
@Getter
public final class LogEntry {

    public enum Kind {
        COMMAND,
        COMMENT,
        BLANK,
        RAW
    }

    private final Kind kind;
    private final String text;
    // 仅 COMMAND 非空
    private final Command command;

    private LogEntry(Kind kind, String text, Command command) {
        this.kind = kind;
        this.text = Objects.requireNonNull(text, "Log text cannot be null");
        this.command = command;
    }

    public static LogEntry command(Command command, String text) {
        return new LogEntry(Kind.COMMAND, text, Objects.requireNonNull(command, "command cannot be null"));
    }

    public static LogEntry comment(String text) {
        return new LogEntry(Kind.COMMENT, text, null);
    }

    public static LogEntry blank() {
        return new LogEntry(Kind.BLANK, "", null);
    }

    public static LogEntry raw(String text) {
        return new LogEntry(Kind.RAW, text, null);
    }

    @Override
    public String toString() {
        return text;
    }
}
