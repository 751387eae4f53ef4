package org.air.symbolic;

import org.air.core.AirUsageException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class SolverOptionsTest {

    @Nested
    @DisplayName("解析 (Parsing)")
    class ParseTests {

        @Test
        @DisplayName("布尔、整数和浮点值")
        void testParseValueTypes() {
            SolverOptions.OptionValue b = SolverOptions.parse("smt.mbqi", "false");
            SolverOptions.OptionValue u = SolverOptions.parse("smt.case_split", "3");
            SolverOptions.OptionValue d = SolverOptions.parse("smt.qi.eager_threshold", "100.5");

            assertAll("Option value types",
                    () -> assertEquals(SolverOptions.ValueType.BOOL, b.getType()),
                    () -> assertFalse(b.isBoolValue()),
                    () -> assertEquals(SolverOptions.ValueType.UINT, u.getType()),
                    () -> assertEquals(3, u.getUintValue()),
                    () -> assertEquals(SolverOptions.ValueType.DOUBLE, d.getType()),
                    () -> assertEquals(100.5, d.getDoubleValue())
            );
        }

        @Test
        @DisplayName("浮点值渲染时总带小数点")
        void testDoubleRendering() {
            assertEquals("100.0", SolverOptions.OptionValue.ofDouble("x", 100).renderValue());
            assertEquals("0.25", SolverOptions.parse("x", "0.25").renderValue());
        }

        @Test
        @DisplayName("rlimit 必须是无符号整数")
        void testRlimitMustBeUnsigned() {
            assertAll("Malformed rlimit",
                    () -> assertThrows(AirUsageException.class, () -> SolverOptions.parse("rlimit", "-1")),
                    () -> assertThrows(AirUsageException.class, () -> SolverOptions.parse("rlimit", "abc")),
                    () -> assertThrows(AirUsageException.class, () -> SolverOptions.parse("rlimit", "1.5")),
                    () -> assertThrows(AirUsageException.class, () -> SolverOptions.parse("rlimit", "true")),
                    () -> assertThrows(AirUsageException.class, () -> SolverOptions.parse("rlimit", "4294967296"))
            );
            assertEquals(4294967295L, SolverOptions.parse("rlimit", "4294967295").getUintValue());
        }

        @Test
        @DisplayName("air_recommended_options 必须是布尔值")
        void testRecommendedMustBeBoolean() {
            assertThrows(AirUsageException.class, () -> SolverOptions.parse(SolverOptions.RECOMMENDED_OPTIONS, "1"));
        }

        @Test
        @DisplayName("空选项名应抛出异常")
        void testBlankName() {
            assertThrows(AirUsageException.class, () -> SolverOptions.parse(" ", "true"));
        }
    }

    @Nested
    @DisplayName("展开 (Expansion)")
    class ExpandTests {

        @Test
        @DisplayName("推荐选项按固定顺序展开")
        void testRecommendedBundleOrder() {
            List<String> rendered = SolverOptions.expand(SolverOptions.parse(SolverOptions.RECOMMENDED_OPTIONS, "true"))
                    .stream().map(SolverOptions.OptionValue::toString).collect(Collectors.toList());

            assertEquals(List.of(
                    "auto_config=false",
                    "smt.mbqi=false",
                    "smt.case_split=3",
                    "smt.qi.eager_threshold=100.0",
                    "smt.delay_units=true",
                    "smt.arith.solver=2",
                    "smt.arith.nl=false"), rendered);
        }

        @Test
        @DisplayName("air_recommended_options=false 不产生任何参数")
        void testRecommendedFalseIsNoOp() {
            assertTrue(SolverOptions.expand(SolverOptions.parse(SolverOptions.RECOMMENDED_OPTIONS, "false")).isEmpty());
        }

        @Test
        @DisplayName("普通选项原样返回")
        void testOtherOptionsPassThrough() {
            SolverOptions.OptionValue option = SolverOptions.parse("smt.mbqi", "true");
            assertEquals(List.of(option), SolverOptions.expand(option));
        }
    }
}
