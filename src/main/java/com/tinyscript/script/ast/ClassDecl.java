package com.tinyscript.script.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class ClassDecl extends Node {
    public final String name;
    public final List<FieldDecl> fields;
    public final List<FunctionDecl> methods;

    public ClassDecl(String name, List<FieldDecl> fields, List<FunctionDecl> methods, SourceLocation location) {
        super(location);
        this.name = name;
        this.fields = (fields == null) ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(fields));
        this.methods = (methods == null) ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(methods));
    }
}
