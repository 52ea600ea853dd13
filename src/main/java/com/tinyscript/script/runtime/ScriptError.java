package com.tinyscript.script.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.tinyscript.script.ast.SourceLocation;

/**
 * Every failure raised while evaluating a program.
 *
 * The evaluator attaches the innermost known statement location and one
 * script trace frame per call it unwinds; it never catches one to recover.
 */
public class ScriptError extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public enum Kind {
        ASSERTION_FAILURE(1),
        UNBOUND_NAME(2),
        KEY_NOT_FOUND(2),
        MEMBER_NOT_FOUND(2),
        ARITY(2),
        REDEFINITION(2),
        STACK_OVERFLOW(3),
        TYPE_MISMATCH(2),
        INDEX_OUT_OF_RANGE(2),
        DIVISION_BY_ZERO(2),
        NUMERIC_OVERFLOW(2);

        /** Process exit status a host should use for a run ending with this kind. */
        public final int exitStatus;

        Kind(int exitStatus) { this.exitStatus = exitStatus; }
    }

    private final Kind kind;
    private SourceLocation location = SourceLocation.UNKNOWN;
    private final List<String> scriptTrace = new ArrayList<>();

    public ScriptError(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ScriptError(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind kind() { return kind; }

    public SourceLocation location() { return location; }

    public int exitStatus() { return kind.exitStatus; }

    /** Script frames, innermost first, e.g. {@code "Fibonacci.fib (called at line 12)"}. */
    public List<String> scriptTrace() {
        return Collections.unmodifiableList(scriptTrace);
    }

    /** Records the location unless a known one is already attached. */
    public ScriptError locate(SourceLocation where) {
        if (!location.isKnown() && where != null && where.isKnown()) {
            location = where;
        }
        return this;
    }

    public void addTraceFrame(String frame) {
        scriptTrace.add(frame);
    }

    /** One line summary: kind, location when known, message. */
    public String describe() {
        StringBuilder sb = new StringBuilder(kind.name());
        if (location.isKnown()) sb.append(" at ").append(location);
        sb.append(": ").append(getMessage());
        return sb.toString();
    }

    // -------------------------
    // Factories
    // -------------------------

    public static ScriptError unboundName(String name) {
        return new ScriptError(Kind.UNBOUND_NAME, "Undefined name: " + name);
    }

    public static ScriptError keyNotFound(String key) {
        return new ScriptError(Kind.KEY_NOT_FOUND, "Key not found: " + key);
    }

    public static ScriptError memberNotFound(String owner, String member) {
        return new ScriptError(Kind.MEMBER_NOT_FOUND, "No member '" + member + "' on " + owner);
    }

    public static ScriptError arity(String function, int expected, int got) {
        return new ScriptError(Kind.ARITY, function + "() expects " + expected + " arguments, got " + got);
    }

    public static ScriptError redefinition(String what) {
        return new ScriptError(Kind.REDEFINITION, "Already defined: " + what);
    }

    public static ScriptError typeMismatch(String message) {
        return new ScriptError(Kind.TYPE_MISMATCH, message);
    }

    public static ScriptError indexOutOfRange(long index, int size) {
        return new ScriptError(Kind.INDEX_OUT_OF_RANGE, "Index " + index + " out of range for size " + size);
    }
}
