import static com.tinyscript.script.ast.Ast.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tinyscript.protocol.FailureJson;
import com.tinyscript.script.RunResult;
import com.tinyscript.script.TinyScript;
import com.tinyscript.script.ast.Expr;
import com.tinyscript.script.ast.Program;
import com.tinyscript.script.ast.SourceLocation;
import com.tinyscript.script.ast.Statement;
import com.tinyscript.script.ast.Statement.Stmt;
import com.tinyscript.script.runtime.AssertionFailure;
import com.tinyscript.script.runtime.ScriptError;

public class AssertionReporterTest {

    private static final ObjectMapper om = new ObjectMapper();

    private static Program mainOnly(Stmt... body) {
        return program(clazz("Test", function("main", params(), body)));
    }

    private static AssertionFailure failAssert(Stmt... body) {
        RunResult r = new TinyScript().run(mainOnly(body));
        assertFalse(r.ok(), "expected the run to fail");
        assertTrue(r.failure() instanceof AssertionFailure, String.valueOf(r));
        return (AssertionFailure) r.failure();
    }

    @Test
    void sourceText_renderedFromTreeWhenNotGiven() {
        AssertionFailure af = failAssert(
                let("a", num(1)),
                assertThat(eq(add(var("a"), num(1)), num(3))));

        assertEquals("(a + 1) == 3", af.sourceText());
        assertEquals("Assertion failed: (a + 1) == 3", af.getMessage());
    }

    @Test
    void sourceText_givenByProducerWins() {
        AssertionFailure af = failAssert(assertThat(bool(false), "ready && !done"));
        assertEquals("ready && !done", af.sourceText());
    }

    @Test
    void valueSnapshot_isTheFalsyValue() {
        assertTrue(failAssert(assertThat(nil())).valueSnapshot().isNull());

        AssertionFailure af = failAssert(assertThat(and(num(1), bool(false))));
        assertTrue(af.valueSnapshot().isBoolean());
        assertFalse(af.valueSnapshot().booleanValue());
    }

    @Test
    void location_isTheAssertStatement() {
        Stmt located = new Statement.AssertStmt(
                lt(num(2), num(1)), null, new SourceLocation(12, 5));

        AssertionFailure af = failAssert(located);

        assertEquals(new SourceLocation(12, 5), af.location());
        assertEquals("ASSERTION_FAILURE at line 12:5: Assertion failed: 2 < 1", af.describe());
    }

    @Test
    void runtimeError_locatedAtInnermostStatement() {
        Stmt outer = new Statement.ExprStmt(
                new Expr.Call("boom", Collections.<Expr.ExprInterface>emptyList(), new SourceLocation(3, 9)),
                new SourceLocation(3, 1));
        Stmt inner = new Statement.ReturnStmt(div(num(1), num(0)), SourceLocation.at(7));

        Program p = program(clazz("Test",
                function("main", params(), outer),
                function("boom", params(), inner)));

        RunResult r = new TinyScript().run(p);

        assertEquals(ScriptError.Kind.DIVISION_BY_ZERO, r.failure().kind());
        assertEquals(7, r.failure().location().line);
        assertEquals(2, r.exitStatus());
        assertEquals("Test.boom (called at line 3:9)", r.failure().scriptTrace().get(0));
        assertEquals("Test.main", r.failure().scriptTrace().get(1));
    }

    @Test
    void failureReporter_calledOnceWithEntryPoint() {
        List<String> entries = new ArrayList<>();
        List<ScriptError> failures = new ArrayList<>();

        TinyScript tiny = new TinyScript();
        tiny.setFailureReporter((failure, entry) -> {
            failures.add(failure);
            entries.add(entry);
        });

        tiny.run(mainOnly(ret(num(1))));
        assertTrue(failures.isEmpty(), "no report on success");

        RunResult r = tiny.run(mainOnly(assertThat(bool(false))));

        assertEquals(1, failures.size());
        assertSame(r.failure(), failures.get(0));
        assertEquals(Collections.singletonList("Test.main"), entries);
    }

    @Test
    void failureJson_describesAssertion() throws Exception {
        List<String> sink = new ArrayList<>();
        TinyScript tiny = new TinyScript();
        tiny.setFailureReporter(FailureJson.reporter(sink::add));

        Stmt located = new Statement.AssertStmt(le(var("n"), num(55)), "n <= 55", SourceLocation.at(4));
        Program p = program(clazz("Test",
                function("main", params(), let("n", num(56)), located)));
        tiny.run(p);

        assertEquals(1, sink.size());
        JsonNode doc = om.readTree(sink.get(0));
        assertEquals("ASSERTION_FAILURE", doc.get("kind").asText());
        assertEquals(1, doc.get("exitStatus").asInt());
        assertEquals(4, doc.get("line").asInt());
        assertFalse(doc.has("column"));
        assertEquals("n <= 55", doc.get("expression").asText());
        assertFalse(doc.get("value").asBoolean(true));
        assertEquals("Test.main", doc.get("trace").get(0).asText());
        assertEquals("Test.main", doc.get("entry").asText());
    }

    @Test
    void failureJson_plainErrorHasNoAssertionFields() throws Exception {
        RunResult r = new TinyScript().run(mainOnly(ret(var("ghost"))));

        JsonNode doc = om.readTree(FailureJson.toJsonString(r.failure()));

        assertEquals("UNBOUND_NAME", doc.get("kind").asText());
        assertEquals(2, doc.get("exitStatus").asInt());
        assertTrue(doc.get("message").asText().contains("ghost"));
        assertFalse(doc.has("expression"));
        assertFalse(doc.has("value"));
        assertFalse(doc.has("line"));
    }

    @Test
    void depthLimit_isStackOverflow() {
        TinyScript tiny = new TinyScript();
        tiny.setMaxCallDepth(50);

        RunResult r = tiny.run(mainOnly(ret(call("main"))));

        assertEquals(ScriptError.Kind.STACK_OVERFLOW, r.failure().kind());
        assertEquals(3, r.exitStatus());
        assertEquals(50, r.failure().scriptTrace().size());
    }

    @Test
    void defaultDepthLimit_stopsUnboundedRecursion() {
        Program p = program(clazz("Test",
                function("main", params(), ret(call("down", num(0)))),
                function("down", params("n"), ret(call("down", add(var("n"), num(1)))))));

        RunResult r = new TinyScript().run(p);

        assertEquals(ScriptError.Kind.STACK_OVERFLOW, r.failure().kind());
        assertEquals(TinyScript.DEFAULT_MAX_CALL_DEPTH, r.failure().scriptTrace().size());
    }

    @Test
    void hostStackExhaustion_isStackOverflow() {
        TinyScript tiny = new TinyScript();
        tiny.setMaxCallDepth(Integer.MAX_VALUE);
        Program p = program(clazz("Test",
                function("main", params(), ret(call("down", num(0)))),
                function("down", params("n"), ret(call("down", add(var("n"), num(1)))))));

        RunResult r = tiny.run(p);

        assertFalse(r.ok());
        assertEquals(ScriptError.Kind.STACK_OVERFLOW, r.failure().kind());
        assertEquals(3, r.exitStatus());
        assertTrue(r.failure().getCause() instanceof StackOverflowError, String.valueOf(r.failure().getCause()));

        ScriptError thrown = assertThrows(ScriptError.class,
                () -> tiny.invoke(p, "Test", "main", Collections.emptyList()));
        assertEquals(ScriptError.Kind.STACK_OVERFLOW, thrown.kind());
    }

    @Test
    void recursionWithinLimit_succeeds() {
        Program p = program(clazz("Test",
                function("main", params(), ret(call("count", num(200)))),
                function("count", params("n"),
                        ifThen(eq(var("n"), num(0)), ret(num(0))),
                        ret(add(num(1), call("count", sub(var("n"), num(1))))))));

        RunResult r = new TinyScript().run(p);

        assertTrue(r.ok(), String.valueOf(r));
        assertEquals(200L, r.value().asLong());
    }

    @Test
    void maxCallDepth_mustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new TinyScript().setMaxCallDepth(0));
    }

    @Test
    void invoke_throwsInsteadOfReporting() {
        List<String> sink = new ArrayList<>();
        TinyScript tiny = new TinyScript();
        tiny.setFailureReporter(FailureJson.reporter(sink::add));

        ScriptError ex = assertThrows(ScriptError.class,
                () -> tiny.invoke(mainOnly(assertThat(bool(false))), "Test", "main", null));

        assertEquals(ScriptError.Kind.ASSERTION_FAILURE, ex.kind());
        assertTrue(sink.isEmpty());
    }
}
