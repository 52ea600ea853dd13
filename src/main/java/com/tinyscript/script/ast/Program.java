package com.tinyscript.script.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Already-parsed program handed to the runtime: ordered class declarations
 * plus optional free functions.
 */
public final class Program {
    public final List<ClassDecl> classes;
    public final List<FunctionDecl> functions;

    public Program(List<ClassDecl> classes, List<FunctionDecl> functions) {
        this.classes = (classes == null) ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(classes));
        this.functions = (functions == null) ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(functions));
    }

    public Program(List<ClassDecl> classes) {
        this(classes, null);
    }
}
