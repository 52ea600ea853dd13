import static com.tinyscript.script.ast.Ast.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.tinyscript.debug.Debug;
import com.tinyscript.debug.DebugLevel;
import com.tinyscript.script.RunResult;
import com.tinyscript.script.TinyScript;

/** Runs in its own fork: nothing here installs a sink, so Debug is in its startup state. */
public class DebugDefaultsTest {

    @Test
    void startupState_hasNoOpSink() {
        assertNotNull(Debug.get().getSink());
        assertFalse(Debug.get().isEnabled(DebugLevel.ERROR));
        assertEquals(DebugLevel.TRACE, Debug.get().getLevel());
        assertDoesNotThrow(() -> Debug.get().i("Host", "dropped"));
    }

    @Test
    void runWithoutSink_reportsResult() {
        List<String> printed = new ArrayList<>();
        TinyScript tiny = new TinyScript();
        tiny.setOutput(printed::add);

        RunResult r = tiny.run(program(
                clazz("Box", function("constructor", params())),
                clazz("Test", function("main", params(),
                        let("b", newInstance("Box")),
                        print(str("hi")),
                        ret(num(3))))));

        assertTrue(r.ok(), String.valueOf(r));
        assertEquals(3L, r.value().asLong());
        assertEquals(Collections.singletonList("hi"), printed);
    }

    @Test
    void failingRunWithoutSink_isStructuredFailure() {
        RunResult r = new TinyScript().run(program(clazz("Test", function("main", params(), ret(call("main"))))));

        assertFalse(r.ok());
        assertEquals(3, r.exitStatus());
    }
}
