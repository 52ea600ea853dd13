import static com.tinyscript.script.ast.Ast.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.tinyscript.script.RunResult;
import com.tinyscript.script.TinyScript;
import com.tinyscript.script.ast.Statement.Stmt;
import com.tinyscript.script.runtime.ScriptError;

public class ControlFlowTest {

    private final List<String> printed = new ArrayList<>();

    private RunResult run(Stmt... main) {
        TinyScript tiny = new TinyScript();
        tiny.setOutput(printed::add);
        return tiny.run(program(clazz("Test", function("main", params(), main))));
    }

    @Test
    void whileLoop_withBreak() {
        RunResult r = run(
                let("i", num(0)),
                whileLoop(bool(true),
                        ifThen(ge(var("i"), num(5)), breakLoop()),
                        expr(assign("i", add(var("i"), num(1))))),
                ret(var("i")));

        assertTrue(r.ok(), String.valueOf(r));
        assertEquals(5L, r.value().asLong());
    }

    @Test
    void forRange_isInclusive() {
        RunResult r = run(
                let("sum", num(0)),
                forRange("i", num(1), num(10), null,
                        expr(assign("sum", add(var("sum"), var("i"))))),
                ret(var("sum")));

        assertEquals(55L, r.value().asLong());
    }

    @Test
    void forRange_negativeStepCountsDown() {
        RunResult r = run(
                forRange("i", num(3), num(0), num(-1), print(var("i"))),
                ret());

        assertTrue(r.ok(), String.valueOf(r));
        assertEquals(Arrays.asList("3", "2", "1", "0"), printed);
        assertTrue(r.value().isNull());
    }

    @Test
    void forRange_emptyWhenStartPastEnd() {
        RunResult r = run(
                forRange("i", num(5), num(1), null, print(var("i"))),
                ret(num(0)));

        assertTrue(r.ok());
        assertTrue(printed.isEmpty());
    }

    @Test
    void forRange_stepPastLongRangeEndsLoop() {
        RunResult r = run(
                let("n", num(0)),
                forRange("i", num(Long.MAX_VALUE - 1), num(Long.MAX_VALUE), num(2),
                        expr(assign("n", add(var("n"), num(1))))),
                forRange("j", num(Long.MIN_VALUE + 1), num(Long.MIN_VALUE), num(-2),
                        expr(assign("n", add(var("n"), num(1))))),
                ret(var("n")));

        assertTrue(r.ok(), String.valueOf(r));
        assertEquals(2L, r.value().asLong());
    }

    @Test
    void forRange_fractionalStep() {
        RunResult r = run(
                let("n", num(0)),
                forRange("x", num(0), num(1), num(0.25),
                        expr(assign("n", add(var("n"), num(1))))),
                ret(var("n")));

        assertEquals(5L, r.value().asLong());
    }

    @Test
    void forRange_zeroStep_isTypeMismatch() {
        RunResult r = run(forRange("i", num(0), num(3), num(0), print(var("i"))));

        assertEquals(ScriptError.Kind.TYPE_MISMATCH, r.failure().kind());
        assertTrue(printed.isEmpty());
    }

    @Test
    void forRange_loopVariableNotVisibleAfterLoop() {
        RunResult r = run(
                forRange("i", num(0), num(1), null, print(var("i"))),
                ret(var("i")));

        assertEquals(ScriptError.Kind.UNBOUND_NAME, r.failure().kind());
    }

    @Test
    void forEach_overListAndDictKeys() {
        RunResult r = run(
                forEach("x", list(num(1), str("two"), bool(false)), print(var("x"))),
                forEach("k", dict(entry("b", num(1)), entry("a", num(2))), print(var("k"))),
                ret());

        assertTrue(r.ok(), String.valueOf(r));
        assertEquals(Arrays.asList("1", "two", "false", "b", "a"), printed);
    }

    @Test
    void forEach_iteratesSnapshotWhileBodyAppends() {
        RunResult r = run(
                let("l", list(num(1), num(2))),
                let("n", num(2)),
                forEach("x", var("l"),
                        expr(setIndex(var("l"), var("n"), var("x"))),
                        expr(assign("n", add(var("n"), num(1))))),
                ret(var("l")));

        assertTrue(r.ok(), String.valueOf(r));
        assertEquals("[1, 2, 1, 2]", r.value().display());
    }

    @Test
    void forEach_overNumber_isTypeMismatch() {
        RunResult r = run(forEach("x", num(3), print(var("x"))));
        assertEquals(ScriptError.Kind.TYPE_MISMATCH, r.failure().kind());
    }

    @Test
    void ifElse_takesBranchByTruthiness() {
        RunResult r = run(
                ifElse(num(0), stmts(print(str("zero is truthy"))), stmts(print(str("zero is falsy")))),
                ifElse(nil(), stmts(print(str("null is truthy"))), stmts(print(str("null is falsy")))),
                ret());

        assertTrue(r.ok());
        assertEquals(Arrays.asList("zero is truthy", "null is falsy"), printed);
    }

    @Test
    void blockScope_shadowsAndRestores() {
        RunResult r = run(
                let("x", num(1)),
                block(let("x", num(2)), print(var("x"))),
                ret(var("x")));

        assertEquals(1L, r.value().asLong());
        assertEquals(Collections.singletonList("2"), printed);
    }

    @Test
    void redeclareInSameScope_isRedefinition() {
        RunResult r = run(let("x", num(1)), let("x", num(2)));
        assertEquals(ScriptError.Kind.REDEFINITION, r.failure().kind());
    }

    @Test
    void logicalOperators_returnDecidingOperand() {
        RunResult r = run(
                print(or(nil(), str("fallback"))),
                print(and(num(0), str("rhs"))),
                print(and(bool(false), call("undefinedFn"))),
                print(not(num(0))),
                ret());

        assertTrue(r.ok(), String.valueOf(r));
        assertEquals(Arrays.asList("fallback", "rhs", "false", "false"), printed);
    }

    @Test
    void failedAssert_stopsFollowingStatements() {
        RunResult r = run(
                print(str("before")),
                assertThat(bool(false)),
                print(str("after")));

        assertEquals(1, r.exitStatus());
        assertEquals(Collections.singletonList("before"), printed);
    }

    @Test
    void passingAssert_isNoOp() {
        RunResult r = run(
                assertThat(bool(true)),
                assertThat(num(0)),
                assertThat(str("")),
                ret(num(1)));

        assertTrue(r.ok(), String.valueOf(r));
        assertEquals(1L, r.value().asLong());
    }

    @Test
    void printOutput_usesDisplayForm() {
        run(print(dict(entry("name", str("tiny")), entry("tags", list(str("a"))))), ret());

        assertEquals(Collections.singletonList("{name: \"tiny\", tags: [\"a\"]}"), printed);
    }

    @Test
    void breakOutsideLoop_isInternalError() {
        TinyScript tiny = new TinyScript();
        assertThrows(IllegalStateException.class,
                () -> tiny.run(program(clazz("Test", function("main", params(), breakLoop())))));
    }
}
