package com.tinyscript.script.runtime;

import java.util.LinkedHashMap;
import java.util.Map;

import com.tinyscript.debug.Debug;
import com.tinyscript.script.ast.ClassDecl;

/** Class name to class lookup for one run. Rebuilt for every run. */
public final class ClassRegistry {
    private static final String TAG = "ClassRegistry";

    private final Map<String, ScriptClass> classes = new LinkedHashMap<>();

    public ScriptClass register(ClassDecl decl) {
        if (classes.containsKey(decl.name)) {
            throw ScriptError.redefinition("class " + decl.name).locate(decl.location());
        }
        ScriptClass cls = new ScriptClass(decl);
        classes.put(cls.name(), cls);
        Debug.get().d(TAG, "registered class " + cls.name() + " with " + cls.methods().size()
                + " methods and " + cls.fields().size() + " fields");
        return cls;
    }

    public ScriptClass require(String name) {
        ScriptClass cls = classes.get(name);
        if (cls == null) throw ScriptError.unboundName("class " + name);
        return cls;
    }

    public boolean contains(String name) {
        return classes.containsKey(name);
    }
}
