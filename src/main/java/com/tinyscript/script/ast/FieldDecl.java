package com.tinyscript.script.ast;

/** Class member variable, initialised per instance at construction. */
public final class FieldDecl extends Node {
    public final String name;
    public final Expr.ExprInterface initializer;

    public FieldDecl(String name, Expr.ExprInterface initializer, SourceLocation location) {
        super(location);
        this.name = name;
        this.initializer = initializer;
    }
}
