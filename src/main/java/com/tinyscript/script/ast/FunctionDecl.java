package com.tinyscript.script.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.tinyscript.script.ast.Statement.Stmt;

/** A named function: either a class method or a free function. */
public final class FunctionDecl extends Node {
    public final String name;
    public final List<String> params;
    public final List<Stmt> body;

    public FunctionDecl(String name, List<String> params, List<Stmt> body, SourceLocation location) {
        super(location);
        this.name = name;
        this.params = (params == null) ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(params));
        this.body = Statement.freeze(body);
    }
}
