package org.air.core;

/**
 * 命令序列本身不合法时抛出 (UsageError)。
 * 例如：不匹配的 pop、对非可变变量赋值、查询内重复的断言标签、无法解析的标识符。
 * 此异常对整个运行是致命的，会话不会尝试恢复。
 */
public class AirUsageException extends RuntimeException {

    public AirUsageException(String message) {
        super(message);
    }

    public AirUsageException(String message, Throwable cause) {
        super(message, cause);
    }
}
