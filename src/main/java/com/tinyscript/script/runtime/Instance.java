package com.tinyscript.script.runtime;

import java.util.LinkedHashMap;
import java.util.Map;

/** An object created by {@code new}: its class plus its own field table. */
public final class Instance {
    private final ScriptClass scriptClass;

    // Insertion ordered; declared fields come first, in declaration order.
    private final Map<String, Value> fields = new LinkedHashMap<>();

    public Instance(ScriptClass scriptClass) {
        this.scriptClass = scriptClass;
    }

    public ScriptClass scriptClass() { return scriptClass; }

    public Map<String, Value> fields() { return fields; }

    public boolean hasField(String name) { return fields.containsKey(name); }

    public Value getField(String name) { return fields.get(name); }

    public void setField(String name, Value value) { fields.put(name, value); }

    @Override
    public String toString() {
        return scriptClass.name() + " instance";
    }
}
