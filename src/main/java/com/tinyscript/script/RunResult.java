package com.tinyscript.script;

import com.tinyscript.script.runtime.ScriptError;
import com.tinyscript.script.runtime.Value;

/** Outcome of one run: the entry point's return value, or the failure that ended it. */
public class RunResult {
    public static final int EXIT_OK = 0;

    private final Value value;
    private final ScriptError failure;

    private RunResult(Value value, ScriptError failure) {
        this.value = value;
        this.failure = failure;
    }

    public static RunResult success(Value value) {
        return new RunResult(value == null ? Value.nil() : value, null);
    }

    public static RunResult failure(ScriptError failure) {
        return new RunResult(null, failure);
    }

    public boolean ok() { return failure == null; }

    /** Return value of the entry point; null when the run failed. */
    public Value value() { return value; }

    /** The failure; null when the run succeeded. */
    public ScriptError failure() { return failure; }

    /** 0 success, 1 assertion failure, 2 runtime error, 3 stack overflow. */
    public int exitStatus() {
        return (failure == null) ? EXIT_OK : failure.exitStatus();
    }

    @Override
    public String toString() {
        return ok() ? ("ok: " + value.display()) : ("failed: " + failure.describe());
    }
}
