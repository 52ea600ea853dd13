package com.tinyscript.script.runtime;

import java.util.List;
import java.util.Map;

/**
 * Member and index access over containers, plus chained paths.
 *
 * A path is walked left to right. Every intermediate segment must already
 * exist and hold a dict or instance; nothing is created on the way.
 */
public final class PathAccess {

    private PathAccess() {}

    // -------------------------
    // Single member
    // -------------------------

    /**
     * Reads {@code receiver.name}.
     * Dict: the entry. Instance: a field, else a method bound to the instance.
     * Class: the unbound method.
     */
    public static Value getMember(Value receiver, String name) {
        switch (receiver.type) {
            case DICT: {
                Map<String, Value> m = receiver.asDict();
                if (!m.containsKey(name)) throw ScriptError.keyNotFound(name);
                return m.get(name);
            }
            case INSTANCE: {
                Instance inst = receiver.asInstance();
                if (inst.hasField(name)) return inst.getField(name);
                ScriptFunction method = inst.scriptClass().findMethod(name);
                if (method != null) return Value.function(FunctionRef.bound(method, receiver));
                throw ScriptError.memberNotFound(inst.scriptClass().name() + " instance", name);
            }
            case CLASS: {
                ScriptClass cls = receiver.asClass();
                ScriptFunction method = cls.findMethod(name);
                if (method != null) return Value.function(FunctionRef.unbound(method));
                throw ScriptError.memberNotFound("class " + cls.name(), name);
            }
            default:
                throw ScriptError.typeMismatch("Cannot read member '" + name + "' of " + receiver.typeName());
        }
    }

    /** Writes {@code receiver.name = value}; creates or overwrites. Instance writes always land in the field table. */
    public static Value setMember(Value receiver, String name, Value value) {
        switch (receiver.type) {
            case DICT:
                receiver.asDict().put(name, value);
                return value;
            case INSTANCE:
                receiver.asInstance().setField(name, value);
                return value;
            default:
                throw ScriptError.typeMismatch("Cannot set member '" + name + "' on " + receiver.typeName());
        }
    }

    // -------------------------
    // Chained paths
    // -------------------------

    /** {@code root.k1...kn}. */
    public static Value read(Value root, List<String> keys) {
        Value cur = root;
        for (String key : keys) {
            requireContainer(cur, key);
            cur = getMember(cur, key);
        }
        return cur;
    }

    /** {@code root.k1...kn = value}. Needs at least one key. */
    public static Value write(Value root, List<String> keys, Value value) {
        if (keys.isEmpty()) throw new IllegalArgumentException("Path write needs at least one key");
        Value container = read(root, keys.subList(0, keys.size() - 1));
        return setMember(container, keys.get(keys.size() - 1), value);
    }

    private static void requireContainer(Value v, String key) {
        if (v.type != Value.Type.DICT && v.type != Value.Type.INSTANCE && v.type != Value.Type.CLASS) {
            throw ScriptError.typeMismatch("Cannot read member '" + key + "' of " + v.typeName());
        }
    }

    // -------------------------
    // Index access
    // -------------------------

    public static Value getIndex(Value target, Value index) {
        switch (target.type) {
            case LIST: {
                List<Value> list = target.asList();
                int i = listIndex(index, list.size(), false);
                return list.get(i);
            }
            case DICT: {
                String key = dictKey(index);
                Map<String, Value> m = target.asDict();
                if (!m.containsKey(key)) throw ScriptError.keyNotFound(key);
                return m.get(key);
            }
            default:
                throw ScriptError.typeMismatch("Indexing not supported on type: " + target.typeName());
        }
    }

    /** List writes accept {@code 0 <= i <= size}; {@code i == size} appends. */
    public static Value setIndex(Value target, Value index, Value value) {
        switch (target.type) {
            case LIST: {
                List<Value> list = target.asList();
                int i = listIndex(index, list.size(), true);
                if (i == list.size()) list.add(value);
                else list.set(i, value);
                return value;
            }
            case DICT:
                target.asDict().put(dictKey(index), value);
                return value;
            default:
                throw ScriptError.typeMismatch("Index assignment not supported on type: " + target.typeName());
        }
    }

    private static int listIndex(Value index, int size, boolean allowAppend) {
        if (!index.isInteger()) {
            throw ScriptError.typeMismatch("List index must be an integer, got " + index.typeName());
        }
        long i = index.asLong();
        long limit = allowAppend ? size : size - 1L;
        if (i < 0 || i > limit) throw ScriptError.indexOutOfRange(i, size);
        return (int) i;
    }

    private static String dictKey(Value index) {
        if (index.type != Value.Type.STRING) {
            throw ScriptError.typeMismatch("Dict index must be a string key, got " + index.typeName());
        }
        return index.asString();
    }
}
