package com.tinyscript.script.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.tinyscript.script.ast.ClassDecl;
import com.tinyscript.script.ast.FieldDecl;
import com.tinyscript.script.ast.FunctionDecl;

/**
 * A declared class: ordered field declarations and its method table.
 * Built once when the program is loaded and never modified afterwards.
 */
public final class ScriptClass {
    public static final String CONSTRUCTOR = "constructor";

    private final String name;
    private final List<FieldDecl> fields;
    private final Map<String, ScriptFunction> methods;

    public ScriptClass(ClassDecl decl) {
        this.name = decl.name;

        List<String> seenFields = new ArrayList<>();
        for (FieldDecl f : decl.fields) {
            if (seenFields.contains(f.name)) {
                throw ScriptError.redefinition("field " + decl.name + "." + f.name).locate(f.location());
            }
            seenFields.add(f.name);
        }
        this.fields = Collections.unmodifiableList(new ArrayList<>(decl.fields));

        Map<String, ScriptFunction> table = new LinkedHashMap<>();
        for (FunctionDecl fn : decl.methods) {
            if (table.containsKey(fn.name)) {
                throw ScriptError.redefinition("method " + decl.name + "." + fn.name).locate(fn.location());
            }
            table.put(fn.name, new ScriptFunction(fn, this));
        }
        this.methods = Collections.unmodifiableMap(table);
    }

    public String name() { return name; }

    public List<FieldDecl> fields() { return fields; }

    public Map<String, ScriptFunction> methods() { return methods; }

    /** @return the method, or null when the class does not declare it */
    public ScriptFunction findMethod(String methodName) {
        return methods.get(methodName);
    }

    public ScriptFunction constructor() {
        return methods.get(CONSTRUCTOR);
    }

    @Override
    public String toString() {
        return "class " + name;
    }
}
