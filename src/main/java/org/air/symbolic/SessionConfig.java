package org.air.symbolic;

import lombok.Builder;
import lombok.Getter;
import org.air.core.AirUsageException;
import org.air.lowering.AssumptionScoping;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.Locale;
import java.util.Properties;

/**
 * 会话配置。通过 builder 构造，或从 air.properties 读取。
 */
@Getter
@Builder
public final class SessionConfig {

    private static final Logger logger = LoggerFactory.getLogger(SessionConfig.class);

    public static final String DEFAULT_RESOURCE = "air.properties";

    public static final String KEY_RLIMIT = "air.rlimit";
    public static final String KEY_RECOMMENDED_OPTIONS = "air.recommended-options";
    public static final String KEY_CHECK_STRATEGY = "air.check-strategy";
    public static final String KEY_REPORT_MODEL = "air.report-model";
    public static final String KEY_ASSUMPTION_SCOPING = "air.assumption-scoping";

    /** 初始资源上限，0 表示不限。 */
    @Builder.Default
    private final long rlimit = 0;

    /** 打开会话时是否应用 air_recommended_options。 */
    @Builder.Default
    private final boolean recommendedOptions = true;

    @Builder.Default
    private final CheckStrategy checkStrategy = CheckStrategy.COMBINED;

    /** Invalid 结果是否附带查询局部常量的赋值。 */
    @Builder.Default
    private final boolean reportModel = true;

    @Builder.Default
    private final AssumptionScoping assumptionScoping = AssumptionScoping.SEQUENTIAL;

    // 以下 Writer 可为 null，此时日志只保存在内存中
    private final Writer initialLogWriter;
    private final Writer finalLogWriter;
    private final Writer smtLogWriter;

    public static SessionConfig defaults() {
        return SessionConfig.builder().build();
    }

    /**
     * 从 Properties 读取配置，缺失的键使用默认值。
     * @throws AirUsageException 如果某个值格式不正确。
     */
    public static SessionConfig fromProperties(Properties properties) {
        SessionConfigBuilder builder = SessionConfig.builder();
        String rlimit = properties.getProperty(KEY_RLIMIT);
        if (rlimit != null) {
            builder.rlimit(SolverOptions.parse(SolverOptions.RLIMIT, rlimit).getUintValue());
        }
        String recommended = properties.getProperty(KEY_RECOMMENDED_OPTIONS);
        if (recommended != null) {
            builder.recommendedOptions(parseBoolean(KEY_RECOMMENDED_OPTIONS, recommended));
        }
        String strategy = properties.getProperty(KEY_CHECK_STRATEGY);
        if (strategy != null) {
            builder.checkStrategy(parseEnum(CheckStrategy.class, KEY_CHECK_STRATEGY, strategy));
        }
        String scoping = properties.getProperty(KEY_ASSUMPTION_SCOPING);
        if (scoping != null) {
            builder.assumptionScoping(parseEnum(AssumptionScoping.class, KEY_ASSUMPTION_SCOPING, scoping));
        }
        String reportModel = properties.getProperty(KEY_REPORT_MODEL);
        if (reportModel != null) {
            builder.reportModel(parseBoolean(KEY_REPORT_MODEL, reportModel));
        }
        return builder.build();
    }

    /**
     * 读取类路径上的 air.properties；不存在时返回默认配置。
     */
    public static SessionConfig loadDefault() {
        try (InputStream in = SessionConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                logger.debug("SessionConfig: 类路径上没有 {}，使用默认配置", DEFAULT_RESOURCE);
                return defaults();
            }
            Properties properties = new Properties();
            properties.load(in);
            logger.info("SessionConfig: 从 {} 读取配置", DEFAULT_RESOURCE);
            return fromProperties(properties);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read " + DEFAULT_RESOURCE, e);
        }
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String key, String value) {
        try {
            return Enum.valueOf(type, StringUtils.replaceChars(value.trim(), '-', '_').toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            logger.error("SessionConfig: {} 的值 '{}' 无法识别", key, value);
            throw new AirUsageException("unknown value for " + key + ": " + value, e);
        }
    }

    private static boolean parseBoolean(String key, String value) {
        String text = value.trim();
        if ("true".equalsIgnoreCase(text)) {
            return true;
        }
        if ("false".equalsIgnoreCase(text)) {
            return false;
        }
        logger.error("SessionConfig: {} 的值 '{}' 不是布尔值", key, value);
        throw new AirUsageException(key + " must be true or false: " + value);
    }
}
