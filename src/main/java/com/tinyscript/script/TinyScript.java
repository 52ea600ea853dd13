package com.tinyscript.script;

import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;

import com.tinyscript.debug.Debug;
import com.tinyscript.debug.DebugLevel;
import com.tinyscript.script.ast.Program;
import com.tinyscript.script.runtime.Interpreter;
import com.tinyscript.script.runtime.ScriptError;
import com.tinyscript.script.runtime.Value;

/**
 * Host entry point.
 *
 * Every run builds a fresh interpreter (class registry and global scope),
 * loads the program and calls the entry method like {@code Test.main()}:
 * on the class, with no instance and no arguments.
 *
 * ERROR CONTRACT:
 *  - run(...) never throws a ScriptError. The failure goes to the
 *    registered FailureReporter (if any) and comes back inside RunResult.
 *  - invoke(...) throws the ScriptError to the caller.
 *  - A JVM StackOverflowError is converted to a STACK_OVERFLOW ScriptError in both.
 *  - Malformed trees the external parser should have rejected (a break outside
 *    any loop) are host bugs, not script failures: both throw IllegalStateException.
 *
 * Not thread-safe; one engine may run many programs one after another.
 */
public class TinyScript {
    private static final String TAG = "TinyScript";

    public static final int DEFAULT_MAX_CALL_DEPTH = 256;
    public static final String DEFAULT_ENTRY_CLASS = "Test";
    public static final String DEFAULT_ENTRY_METHOD = "main";

    /** Hook used to surface run failures to the host (test harness, CLI, ...). */
    public interface FailureReporter {
        void report(ScriptError failure, String entryPoint);
    }

    private int maxCallDepth = DEFAULT_MAX_CALL_DEPTH;
    private String entryClass = DEFAULT_ENTRY_CLASS;
    private String entryMethod = DEFAULT_ENTRY_METHOD;
    private Consumer<String> output = System.out::println;
    private FailureReporter failureReporter;

    public void setMaxCallDepth(int depth) {
        if (depth < 1) throw new IllegalArgumentException("maxCallDepth must be >= 1, got " + depth);
        this.maxCallDepth = depth;
    }

    public int getMaxCallDepth() { return maxCallDepth; }

    public void setEntryPoint(String className, String methodName) {
        if (className == null || className.trim().isEmpty()) throw new IllegalArgumentException("entry class must not be empty");
        if (methodName == null || methodName.trim().isEmpty()) throw new IllegalArgumentException("entry method must not be empty");
        this.entryClass = className.trim();
        this.entryMethod = methodName.trim();
    }

    public String getEntryPoint() { return entryClass + "." + entryMethod; }

    /** Where {@code print} writes, one call per line. Null restores stdout. */
    public void setOutput(Consumer<String> output) {
        this.output = (output == null) ? System.out::println : output;
    }

    public void setFailureReporter(FailureReporter reporter) { this.failureReporter = reporter; }

    // ===================== RUN =====================

    public RunResult run(Program program) {
        return run(program, entryClass, entryMethod);
    }

    public RunResult run(Program program, String className, String methodName) {
        String entry = className + "." + methodName;
        try {
            Value out = invoke(program, className, methodName, Collections.emptyList());
            return RunResult.success(out);
        } catch (ScriptError e) {
            Debug.get().w(TAG, entry + " failed: " + e.describe());
            if (failureReporter != null) failureReporter.report(e, entry);
            return RunResult.failure(e);
        }
    }

    /** Runs {@code className.methodName(args)} against a freshly loaded program and returns its value. */
    public Value invoke(Program program, String className, String methodName, List<Value> args) {
        if (program == null) throw new IllegalArgumentException("program must not be null");
        if (className == null || methodName == null) throw new IllegalArgumentException("entry point must not be null");

        String entry = className + "." + methodName;
        Interpreter interpreter = new Interpreter(maxCallDepth, output);
        Debug.get().i(TAG, "run " + entry);

        try {
            interpreter.load(program);
            Value out = interpreter.callStatic(className, methodName, (args == null) ? Collections.emptyList() : args);
            if (Debug.get().isEnabled(DebugLevel.INFO)) Debug.get().i(TAG, entry + " returned " + out.display());
            return out;
        } catch (StackOverflowError so) {
            throw new ScriptError(ScriptError.Kind.STACK_OVERFLOW,
                    "Host call stack exhausted while running " + entry, so);
        }
    }
}
