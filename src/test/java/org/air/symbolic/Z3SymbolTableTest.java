package org.air.symbolic;

import com.microsoft.z3.Context;
import org.air.core.AirSort;
import org.air.core.AirUsageException;
import org.air.core.Declaration;
import org.air.core.Ident;
import org.air.core.Query;
import org.air.statements.Assert;
import org.junit.jupiter.api.*;

import java.util.List;

import static org.air.expressions.Expression.*;
import static org.junit.jupiter.api.Assertions.*;

class Z3SymbolTableTest {

    private Context ctx;
    private Z3SymbolTable symbols;

    @BeforeEach
    void setUp() {
        ctx = new Context();
        symbols = new Z3SymbolTable(ctx);
    }

    @AfterEach
    void tearDown() {
        ctx.close();
    }

    @Test
    @DisplayName("帧内声明在 popFrame 之后不可见")
    void testFramesScopeDeclarations() {
        symbols.declareConst(Ident.of("g"), AirSort.INT);
        symbols.pushFrame();
        symbols.declareSort(Ident.of("T"));
        symbols.declareConst(Ident.of("t"), AirSort.named("T"));

        assertAll("Inside frame",
                () -> assertEquals(1, symbols.getDepth()),
                () -> assertTrue(symbols.isConstVisible(Ident.of("g"))),
                () -> assertTrue(symbols.isSortVisible(Ident.of("T"))),
                () -> assertEquals(List.of(Ident.of("t")), List.copyOf(symbols.currentFrameConstants().keySet()))
        );

        symbols.popFrame();

        assertAll("After pop",
                () -> assertFalse(symbols.isSortVisible(Ident.of("T"))),
                () -> assertFalse(symbols.isConstVisible(Ident.of("t"))),
                () -> assertThrows(AirUsageException.class, () -> symbols.lookupConst(Ident.of("t")))
        );
    }

    @Test
    @DisplayName("基础帧不能弹出")
    void testCannotPopBaseFrame() {
        assertThrows(IllegalStateException.class, () -> symbols.popFrame());
    }

    @Test
    @DisplayName("常量和函数共享命名空间，排序单独命名")
    void testNamespaces() {
        symbols.declareConst(Ident.of("f"), AirSort.INT);
        assertThrows(AirUsageException.class,
                () -> symbols.declareFunction(Ident.of("f"), List.of(AirSort.INT), AirSort.INT));
        assertDoesNotThrow(() -> symbols.declareSort(Ident.of("f")));
    }

    @Test
    @DisplayName("checkResolved 使用查询局部声明，且不修改符号表")
    void testCheckResolvedQuery() {
        Query ok = Query.of(List.of(Declaration.constant("x", AirSort.INT)), Assert.of("a", gt(var("x"), num(0))));
        Query missing = Query.of(Assert.of("a", gt(var("x"), num(0))));
        Query badSort = Query.of(List.of(Declaration.constant("x", AirSort.named("U"))), Assert.of("a", bool(true)));
        Query badFunction = Query.of(Assert.of("a", eq(apply("h"), num(0))));

        assertAll("Resolution",
                () -> assertDoesNotThrow(() -> symbols.checkResolved(ok)),
                () -> assertFalse(symbols.isConstVisible(Ident.of("x"))),
                () -> assertThrows(AirUsageException.class, () -> symbols.checkResolved(missing)),
                () -> assertThrows(AirUsageException.class, () -> symbols.checkResolved(badSort)),
                () -> assertThrows(AirUsageException.class, () -> symbols.checkResolved(badFunction))
        );
    }
}
