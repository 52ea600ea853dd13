package com.tinyscript.script.runtime;

/**
 * A function value: a declared function, optionally bound to the instance
 * it was read from. Calling a bound reference makes that instance {@code self}.
 */
public final class FunctionRef {
    private final ScriptFunction function;
    private final Value self; // null when unbound

    private FunctionRef(ScriptFunction function, Value self) {
        this.function = function;
        this.self = self;
    }

    public static FunctionRef unbound(ScriptFunction function) {
        return new FunctionRef(function, null);
    }

    public static FunctionRef bound(ScriptFunction function, Value self) {
        return new FunctionRef(function, self);
    }

    public ScriptFunction function() { return function; }

    public Value self() { return self; }

    public boolean isBound() { return self != null; }

    /** Same declaration and same receiver instance. */
    public boolean sameAs(FunctionRef other) {
        if (function != other.function) return false;
        if (self == null || other.self == null) return self == other.self;
        return self.value == other.self.value;
    }

    @Override
    public String toString() {
        return function.qualifiedName() + (isBound() ? " (bound)" : "");
    }
}
