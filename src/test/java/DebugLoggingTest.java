import static com.tinyscript.script.ast.Ast.*;
import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.tinyscript.debug.Debug;
import com.tinyscript.debug.DebugLevel;
import com.tinyscript.script.TinyScript;
import com.tinyscript.script.ast.Program;

public class DebugLoggingTest {

    private final List<String> records = new ArrayList<>();

    @BeforeEach
    @AfterEach
    void resetSink() {
        Debug.get().setSink(null);
        Debug.get().setLevel(null);
    }

    private void capture() {
        Debug.get().setSink((level, tag, message, error) -> records.add(level + " " + tag + ": " + message));
    }

    private static Program boxProgram() {
        return program(
                clazz("Box", function("constructor", params())),
                clazz("Test", function("main", params(),
                        let("b", newInstance("Box")),
                        ret(num(7)))));
    }

    @Test
    void successfulRun_logsStartAndReturn() {
        capture();
        new TinyScript().run(boxProgram());

        assertTrue(records.contains("INFO TinyScript: run Test.main"), records.toString());
        assertTrue(records.contains("INFO TinyScript: Test.main returned 7"), records.toString());
        assertTrue(records.contains("DEBUG ClassRegistry: registered class Box with 1 methods and 0 fields"), records.toString());
        assertTrue(records.contains("TRACE Interpreter: new Box Box{}"), records.toString());
    }

    @Test
    void failedRun_logsWarning() {
        capture();
        new TinyScript().run(program(clazz("Test", function("main", params(), assertThat(bool(false))))));

        String warn = null;
        for (String r : records) {
            if (r.startsWith("WARN ")) warn = r;
        }
        assertNotNull(warn, records.toString());
        assertTrue(warn.contains("Test.main failed: ASSERTION_FAILURE"), warn);
    }

    @Test
    void levelThreshold_dropsLowerRecords() {
        capture();
        Debug.get().setLevel(DebugLevel.WARN);

        new TinyScript().run(boxProgram());
        assertTrue(records.isEmpty(), records.toString());
        assertFalse(Debug.get().isEnabled(DebugLevel.INFO));
        assertTrue(Debug.get().isEnabled(DebugLevel.ERROR));

        new TinyScript().run(program(clazz("Test", function("main", params(), ret(var("missing"))))));
        assertEquals(1, records.size(), records.toString());
        assertTrue(records.get(0).startsWith("WARN TinyScript: Test.main failed: UNBOUND_NAME"));
    }

    @Test
    void defaultSink_isSilentNoOp() {
        Debug.get().setSink(null);
        assertDoesNotThrow(() -> Debug.get().e("Test", "dropped", new RuntimeException("x")));
        assertNotNull(Debug.get().getSink());
        assertFalse(Debug.get().isEnabled(DebugLevel.ERROR), "nothing is enabled without a sink");
        assertEquals(DebugLevel.TRACE, Debug.get().getLevel());
    }

    @Test
    void printingSink_writesLevelAndTag() {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(buf, true, StandardCharsets.UTF_8);
        Debug.get().setSink(Debug.printing(out));

        Debug.get().log(DebugLevel.INFO, "Host", "hello", null);

        assertEquals("[INFO][Host] hello", buf.toString(StandardCharsets.UTF_8).trim());
    }

    @Test
    void useSysOut_routesToStandardOutput() {
        PrintStream original = System.out;
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        try {
            System.setOut(new PrintStream(buf, true, StandardCharsets.UTF_8));
            Debug.useSysOut();
            Debug.get().w("Host", "careful");
        } finally {
            System.setOut(original);
        }

        assertTrue(buf.toString(StandardCharsets.UTF_8).contains("[WARN][Host] careful"));
    }
}
