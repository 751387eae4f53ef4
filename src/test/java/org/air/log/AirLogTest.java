package org.air.log;

import org.air.core.AirSort;
import org.air.core.Command;
import org.air.core.Declaration;
import org.air.core.Query;
import org.air.statements.Assert;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.List;

import static org.air.expressions.Expression.*;
import static org.junit.jupiter.api.Assertions.*;

class AirLogTest {

    private AirLog log;

    @BeforeEach
    void setUp() {
        log = AirLog.inMemory("test");
    }

    @Nested
    @DisplayName("记录格式 (Record Format)")
    class FormatTests {

        @Test
        @DisplayName("命令记录按顺序渲染")
        void testCommands() {
            log.logPush();
            log.logSetOption("rlimit", "100");
            log.logDeclaration(Declaration.sort("T"));
            log.logPop();

            assertEquals("(push)\n(set-option :rlimit 100)\n(declare-sort T)\n(pop)\n", log.render());
        }

        @Test
        @DisplayName("查询记录为多行，声明和语句各占一行")
        void testQueryFormat() {
            Query query = Query.of(List.of(Declaration.constant("x", AirSort.INT)),
                    Assert.of("a", gt(var("x"), num(0))));

            log.logQuery(query);

            assertAll("Query record",
                    () -> assertEquals("(check-valid\n    (declare-const x Int)\n    (assert \"a\" (> x 0))\n)\n",
                            log.render()),
                    () -> assertEquals(Command.checkValid(query), log.getEntries().get(0).getCommand())
            );
        }

        @Test
        @DisplayName("多行注释的每一行都带注释标记，空行原样保留")
        void testCommentsAndBlankLines() {
            log.comment("first\nsecond");
            log.blankLine();
            log.raw("(check-sat)");

            assertAll("Comments",
                    () -> assertEquals(";; first\n;; second\n\n(check-sat)\n", log.render()),
                    () -> assertEquals(LogEntry.Kind.COMMENT, log.getEntries().get(0).getKind()),
                    () -> assertEquals(LogEntry.Kind.BLANK, log.getEntries().get(1).getKind()),
                    () -> assertEquals(LogEntry.Kind.RAW, log.getEntries().get(2).getKind()),
                    () -> assertNull(log.getEntries().get(2).getCommand())
            );
        }

        @Test
        @DisplayName("记录列表对外不可修改")
        void testEntriesUnmodifiable() {
            log.logPush();
            assertThrows(UnsupportedOperationException.class, () -> log.getEntries().clear());
        }
    }

    @Nested
    @DisplayName("写出 (Writer Output)")
    class WriterTests {

        @Test
        @DisplayName("Writer 收到的文本与内存中的渲染一致")
        void testWriterMirrorsEntries() {
            StringWriter out = new StringWriter();
            AirLog written = new AirLog("file", out);

            written.logPush();
            written.comment("note");
            written.logPop();

            assertEquals(written.render(), out.toString());
        }

        @Test
        @DisplayName("写出失败应抛出 UncheckedIOException")
        void testWriterFailure() {
            Writer broken = new Writer() {
                @Override
                public void write(char[] cbuf, int off, int len) throws IOException {
                    throw new IOException("disk full");
                }

                @Override
                public void flush() {
                }

                @Override
                public void close() {
                }
            };
            AirLog failing = new AirLog("broken", broken);

            assertThrows(UncheckedIOException.class, failing::logPush);
        }
    }
}
