package org.air.symbolic;

import lombok.Getter;
import org.air.core.AirUsageException;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * set-option 的解析与展开。
 * 值 "true"/"false" 解析为布尔值，含小数点的解析为浮点数，其余解析为 32 位无符号整数。
 * 解析在任何日志写入和求解器参数修改之前完成，非法值不会留下部分修改。
 */
public final class SolverOptions {

    private static final Logger logger = LoggerFactory.getLogger(SolverOptions.class);

    public static final String RECOMMENDED_OPTIONS = "air_recommended_options";
    public static final String RLIMIT = "rlimit";

    private static final long MAX_UNSIGNED = 0xFFFFFFFFL;

    public enum ValueType {
        BOOL,
        UINT,
        DOUBLE
    }

    /**
     * 一个已解析的选项值。此类是不可变的。
     */
    @Getter
    public static final class OptionValue {
        private final String name;
        private final ValueType type;
        private final boolean boolValue;
        private final long uintValue;
        private final double doubleValue;

        private OptionValue(String name, ValueType type, boolean boolValue, long uintValue, double doubleValue) {
            this.name = name;
            this.type = type;
            this.boolValue = boolValue;
            this.uintValue = uintValue;
            this.doubleValue = doubleValue;
        }

        public static OptionValue ofBool(String name, boolean value) {
            return new OptionValue(name, ValueType.BOOL, value, 0, 0.0);
        }

        public static OptionValue ofUint(String name, long value) {
            if (value < 0 || value > MAX_UNSIGNED) {
                throw new AirUsageException("option " + name + " out of unsigned 32-bit range: " + value);
            }
            return new OptionValue(name, ValueType.UINT, false, value, 0.0);
        }

        public static OptionValue ofDouble(String name, double value) {
            return new OptionValue(name, ValueType.DOUBLE, false, 0, value);
        }

        /**
         * @return 写入日志时使用的值文本。浮点数总是带小数点。
         */
        public String renderValue() {
            return switch (type) {
                case BOOL -> Boolean.toString(boolValue);
                case UINT -> Long.toString(uintValue);
                case DOUBLE -> {
                    String s = Double.toString(doubleValue);
                    yield s.contains(".") ? s : s + ".0";
                }
            };
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (o == null || getClass() != o.getClass()) {
                return false;
            }
            OptionValue that = (OptionValue) o;
            return boolValue == that.boolValue && uintValue == that.uintValue
                    && Double.compare(doubleValue, that.doubleValue) == 0
                    && name.equals(that.name) && type == that.type;
        }

        @Override
        public int hashCode() {
            return Objects.hash(name, type, boolValue, uintValue, doubleValue);
        }

        @Override
        public String toString() {
            return name + "=" + renderValue();
        }
    }

    private SolverOptions() {
    }

    /**
     * 解析一个选项。
     * @param name 选项名。
     * @param value 选项值文本。
     * @return 解析后的选项。
     * @throws AirUsageException 如果值无法解析，或 rlimit 的值不是无符号整数。
     */
    public static OptionValue parse(String name, String value) {
        if (StringUtils.isBlank(name)) {
            throw new AirUsageException("option name cannot be blank");
        }
        String text = StringUtils.trimToEmpty(value);
        OptionValue parsed;
        if ("true".equals(text)) {
            parsed = OptionValue.ofBool(name, true);
        } else if ("false".equals(text)) {
            parsed = OptionValue.ofBool(name, false);
        } else if (text.contains(".")) {
            try {
                parsed = OptionValue.ofDouble(name, Double.parseDouble(text));
            } catch (NumberFormatException e) {
                logger.error("SolverOptions: 无法解析选项 {} 的值 '{}'", name, value);
                throw new AirUsageException("could not parse option value " + value + " for " + name, e);
            }
        } else {
            if (!StringUtils.isNumeric(text)) {
                logger.error("SolverOptions: 无法解析选项 {} 的值 '{}'", name, value);
                throw new AirUsageException("could not parse option value " + value + " for " + name);
            }
            try {
                parsed = OptionValue.ofUint(name, Long.parseLong(text));
            } catch (NumberFormatException e) {
                logger.error("SolverOptions: 选项 {} 的值 '{}' 超出范围", name, value);
                throw new AirUsageException("option value out of range: " + value, e);
            }
        }
        if (RLIMIT.equals(name) && parsed.getType() != ValueType.UINT) {
            logger.error("SolverOptions: rlimit 必须是无符号整数，实际为 '{}'", value);
            throw new AirUsageException("rlimit must be an unsigned integer: " + value);
        }
        if (RECOMMENDED_OPTIONS.equals(name) && parsed.getType() != ValueType.BOOL) {
            logger.error("SolverOptions: {} 必须是布尔值，实际为 '{}'", RECOMMENDED_OPTIONS, value);
            throw new AirUsageException(RECOMMENDED_OPTIONS + " must be a boolean: " + value);
        }
        return parsed;
    }

    /**
     * air_recommended_options 展开后的参数，顺序固定。
     */
    public static List<OptionValue> recommendedBundle() {
        return List.of(
                OptionValue.ofBool("auto_config", false),
                OptionValue.ofBool("smt.mbqi", false),
                OptionValue.ofUint("smt.case_split", 3),
                OptionValue.ofDouble("smt.qi.eager_threshold", 100.0),
                OptionValue.ofBool("smt.delay_units", true),
                OptionValue.ofUint("smt.arith.solver", 2),
                OptionValue.ofBool("smt.arith.nl", false)
        );
    }

    /**
     * 把一个选项展开成实际交给求解器的参数列表。
     * air_recommended_options=true 展开为 recommendedBundle()，=false 不产生任何参数，
     * 其余选项原样返回。
     */
    public static List<OptionValue> expand(OptionValue option) {
        if (RECOMMENDED_OPTIONS.equals(option.getName())) {
            return option.isBoolValue() ? recommendedBundle() : List.of();
        }
        return List.of(option);
    }
}
