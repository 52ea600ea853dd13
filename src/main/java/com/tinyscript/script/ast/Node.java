package com.tinyscript.script.ast;

/** Common base of every tree node: carries the position used in diagnostics. */
public abstract class Node {
    public final SourceLocation location;

    protected Node(SourceLocation location) {
        this.location = (location == null) ? SourceLocation.UNKNOWN : location;
    }

    public SourceLocation location() {
        return location;
    }
}
