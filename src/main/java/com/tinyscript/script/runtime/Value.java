package com.tinyscript.script.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runtime value. LIST, DICT and INSTANCE wrap shared mutable storage;
 * every other type is immutable.
 *
 * NUMBER holds a {@link Long} for integers and a {@link Double} otherwise.
 */
public final class Value {
    public enum Type { NULL, BOOL, NUMBER, STRING, LIST, DICT, INSTANCE, FUNCTION, CLASS }

    private static final Value NIL = new Value(Type.NULL, null);
    private static final Value TRUE = new Value(Type.BOOL, Boolean.TRUE);
    private static final Value FALSE = new Value(Type.BOOL, Boolean.FALSE);

    public final Type type;
    public final Object value;

    private Value(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static Value nil() { return NIL; }
    public static Value bool(boolean b) { return b ? TRUE : FALSE; }
    public static Value number(long n) { return new Value(Type.NUMBER, n); }
    public static Value number(double d) { return new Value(Type.NUMBER, d); }
    public static Value string(String s) { return new Value(Type.STRING, s); }
    public static Value list(List<Value> items) { return new Value(Type.LIST, items); }
    public static Value list() { return list(new ArrayList<>()); }
    public static Value dict(Map<String, Value> entries) { return new Value(Type.DICT, entries); }
    public static Value dict() { return dict(new LinkedHashMap<>()); }
    public static Value instance(Instance inst) { return new Value(Type.INSTANCE, inst); }
    public static Value function(FunctionRef ref) { return new Value(Type.FUNCTION, ref); }
    public static Value clazz(ScriptClass cls) { return new Value(Type.CLASS, cls); }

    public boolean isNull() { return type == Type.NULL; }

    public boolean isInteger() { return type == Type.NUMBER && value instanceof Long; }

    // -------------------------
    // Accessors
    // -------------------------

    public boolean asBool() {
        expect(Type.BOOL);
        return (Boolean) value;
    }

    public Number asNumber() {
        expect(Type.NUMBER);
        return (Number) value;
    }

    public long asLong() {
        expect(Type.NUMBER);
        if (!(value instanceof Long)) {
            throw ScriptError.typeMismatch("Expected integer, got " + display());
        }
        return (Long) value;
    }

    public double asDouble() {
        return asNumber().doubleValue();
    }

    public String asString() {
        expect(Type.STRING);
        return (String) value;
    }

    @SuppressWarnings("unchecked")
    public List<Value> asList() {
        expect(Type.LIST);
        return (List<Value>) value;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Value> asDict() {
        expect(Type.DICT);
        return (Map<String, Value>) value;
    }

    public Instance asInstance() {
        expect(Type.INSTANCE);
        return (Instance) value;
    }

    public FunctionRef asFunction() {
        expect(Type.FUNCTION);
        return (FunctionRef) value;
    }

    public ScriptClass asClass() {
        expect(Type.CLASS);
        return (ScriptClass) value;
    }

    private void expect(Type wanted) {
        if (type != wanted) {
            throw ScriptError.typeMismatch("Expected " + typeName(wanted) + ", got " + typeName(type));
        }
    }

    public static String typeName(Type t) {
        return t.name().toLowerCase();
    }

    public String typeName() {
        return typeName(type);
    }

    // -------------------------
    // Semantics
    // -------------------------

    /** Only false and null are falsy. */
    public boolean isTruthy() {
        if (type == Type.NULL) return false;
        if (type == Type.BOOL) return (Boolean) value;
        return true;
    }

    public static boolean isEqual(Value a, Value b) {
        if (a.type != b.type) return false;

        switch (a.type) {
            case NULL:
                return true;
            case BOOL:
                return a.value.equals(b.value);
            case NUMBER:
                if (a.isInteger() && b.isInteger()) return ((Long) a.value).longValue() == ((Long) b.value).longValue();
                return a.asDouble() == b.asDouble();
            case STRING:
                return a.value.equals(b.value);
            case FUNCTION:
                return a.asFunction().sameAs(b.asFunction());
            case LIST:
            case DICT:
            case INSTANCE:
            case CLASS:
                return a.value == b.value;
            default:
                return false;
        }
    }

    // -------------------------
    // Display
    // -------------------------

    /** Text used by print, concatenation and diagnostics. Strings are raw at the top level. */
    public String display() {
        if (type == Type.STRING) return (String) value;
        StringBuilder sb = new StringBuilder();
        render(this, sb, Collections.newSetFromMap(new IdentityHashMap<>()));
        return sb.toString();
    }

    @Override
    public String toString() {
        return display();
    }

    private static void render(Value v, StringBuilder sb, Set<Object> open) {
        switch (v.type) {
            case NULL:
                sb.append("null");
                return;
            case BOOL:
            case NUMBER:
                sb.append(v.value);
                return;
            case STRING:
                sb.append('"').append((String) v.value).append('"');
                return;
            case FUNCTION:
                sb.append("<fn ").append(v.asFunction().function().qualifiedName()).append('>');
                return;
            case CLASS:
                sb.append("<class ").append(v.asClass().name()).append('>');
                return;
            case LIST: {
                if (!open.add(v.value)) {
                    sb.append("[...]");
                    return;
                }
                sb.append('[');
                boolean first = true;
                for (Value item : v.asList()) {
                    if (!first) sb.append(", ");
                    first = false;
                    render(item, sb, open);
                }
                sb.append(']');
                open.remove(v.value);
                return;
            }
            case DICT:
                renderEntries("", v.value, v.asDict(), sb, open);
                return;
            case INSTANCE: {
                Instance inst = v.asInstance();
                renderEntries(inst.scriptClass().name(), inst, inst.fields(), sb, open);
                return;
            }
            default:
                sb.append(v.type);
        }
    }

    private static void renderEntries(String prefix, Object identity, Map<String, Value> entries,
                                      StringBuilder sb, Set<Object> open) {
        sb.append(prefix);
        if (!open.add(identity)) {
            sb.append("{...}");
            return;
        }
        sb.append('{');
        boolean first = true;
        for (Map.Entry<String, Value> e : entries.entrySet()) {
            if (!first) sb.append(", ");
            first = false;
            sb.append(e.getKey()).append(": ");
            render(e.getValue(), sb, open);
        }
        sb.append('}');
        open.remove(identity);
    }
}
