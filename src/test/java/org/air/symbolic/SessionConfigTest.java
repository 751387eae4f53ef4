package org.air.symbolic;

import org.air.core.AirUsageException;
import org.air.lowering.AssumptionScoping;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class SessionConfigTest {

    @Test
    @DisplayName("默认配置")
    void testDefaults() {
        SessionConfig config = SessionConfig.defaults();

        assertAll("Defaults",
                () -> assertEquals(0, config.getRlimit()),
                () -> assertTrue(config.isRecommendedOptions()),
                () -> assertEquals(CheckStrategy.COMBINED, config.getCheckStrategy()),
                () -> assertTrue(config.isReportModel()),
                () -> assertEquals(AssumptionScoping.SEQUENTIAL, config.getAssumptionScoping()),
                () -> assertNull(config.getInitialLogWriter())
        );
    }

    @Test
    @DisplayName("从 Properties 读取所有键")
    void testFromProperties() {
        Properties properties = new Properties();
        properties.setProperty(SessionConfig.KEY_RLIMIT, "5000");
        properties.setProperty(SessionConfig.KEY_RECOMMENDED_OPTIONS, "false");
        properties.setProperty(SessionConfig.KEY_CHECK_STRATEGY, "per-label");
        properties.setProperty(SessionConfig.KEY_REPORT_MODEL, "FALSE");
        properties.setProperty(SessionConfig.KEY_ASSUMPTION_SCOPING, "lexical");

        SessionConfig config = SessionConfig.fromProperties(properties);

        assertAll("Properties",
                () -> assertEquals(5000, config.getRlimit()),
                () -> assertFalse(config.isRecommendedOptions()),
                () -> assertEquals(CheckStrategy.PER_LABEL, config.getCheckStrategy()),
                () -> assertFalse(config.isReportModel()),
                () -> assertEquals(AssumptionScoping.LEXICAL, config.getAssumptionScoping())
        );
    }

    @Test
    @DisplayName("格式错误的值应抛出 AirUsageException")
    void testMalformedValues() {
        Properties badRlimit = new Properties();
        badRlimit.setProperty(SessionConfig.KEY_RLIMIT, "lots");
        Properties badStrategy = new Properties();
        badStrategy.setProperty(SessionConfig.KEY_CHECK_STRATEGY, "sometimes");
        Properties badBoolean = new Properties();
        badBoolean.setProperty(SessionConfig.KEY_REPORT_MODEL, "yes");

        assertAll("Malformed configuration",
                () -> assertThrows(AirUsageException.class, () -> SessionConfig.fromProperties(badRlimit)),
                () -> assertThrows(AirUsageException.class, () -> SessionConfig.fromProperties(badStrategy)),
                () -> assertThrows(AirUsageException.class, () -> SessionConfig.fromProperties(badBoolean))
        );
    }

    @Test
    @DisplayName("类路径上的 air.properties 使用默认值")
    void testLoadDefault() {
        SessionConfig config = SessionConfig.loadDefault();
        assertEquals(CheckStrategy.COMBINED, config.getCheckStrategy());
        assertEquals(AssumptionScoping.SEQUENTIAL, config.getAssumptionScoping());
    }
}
