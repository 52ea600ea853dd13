package com.tinyscript.script.runtime;

import com.tinyscript.script.ast.SourceLocation;

/** One active invocation: what runs, its dispatch mode (with or without self) and where it was called from. */
public class CallFrame {
    final String functionName;
    final ScriptClass owner; // null for free functions
    final Value self;        // null for class-qualified and free calls
    final SourceLocation callSite;

    CallFrame(String functionName, ScriptClass owner, Value self, SourceLocation callSite) {
        this.functionName = functionName;
        this.owner = owner;
        this.self = self;
        this.callSite = (callSite == null) ? SourceLocation.UNKNOWN : callSite;
    }

    String describe() {
        return callSite.isKnown() ? (functionName + " (called at " + callSite + ")") : functionName;
    }
}
