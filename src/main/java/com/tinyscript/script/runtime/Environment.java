package com.tinyscript.script.runtime;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Chained variable scopes.
 *
 * The root environment is the global scope. Every call frame is a child of
 * the root and owns a LIFO of block scopes; lookups walk the blocks of this
 * frame innermost first and then the parent chain.
 */
public class Environment {

    public final Environment parent;

    // LIFO of block scopes for THIS frame; the last element is the frame's root scope.
    private final Deque<Map<String, Value>> scopes = new ArrayDeque<>();

    /** Creates a global (root) environment. */
    public Environment() {
        this.parent = null;
        scopes.push(new LinkedHashMap<>());
    }

    private Environment(Environment parent) {
        this.parent = parent;
        scopes.push(new LinkedHashMap<>());
    }

    /** A call frame whose parent is this environment. */
    public Environment childScope() {
        return new Environment(this);
    }

    public boolean isRoot() {
        return parent == null;
    }

    /** Walks to the global environment. */
    public Environment root() {
        Environment e = this;
        while (e.parent != null) e = e.parent;
        return e;
    }

    // -------------------------
    // Block-scoping (LIFO)
    // -------------------------
    public void pushBlock() {
        scopes.push(new LinkedHashMap<>());
    }

    public void popBlock() {
        if (scopes.size() <= 1) {
            throw new IllegalStateException("Cannot pop root scope of environment frame");
        }
        scopes.pop();
    }

    public int blockDepth() {
        return scopes.size();
    }

    private Map<String, Value> topScope() {
        Map<String, Value> top = scopes.peek();
        if (top == null) throw new IllegalStateException("Environment scope stack is empty");
        return top;
    }

    // -------------------------
    // Vars API
    // -------------------------
    public void define(String name, Value value) {
        Map<String, Value> top = topScope();
        if (top.containsKey(name)) {
            throw ScriptError.redefinition("variable " + name);
        }
        top.put(name, value);
    }

    public Value get(String name) {
        for (Map<String, Value> s : scopes) {
            if (s.containsKey(name)) return s.get(name);
        }
        if (parent != null) return parent.get(name);
        throw ScriptError.unboundName(name);
    }

    public boolean exists(String name) {
        for (Map<String, Value> s : scopes) {
            if (s.containsKey(name)) return true;
        }
        return parent != null && parent.exists(name);
    }

    public void assign(String name, Value value) {
        for (Map<String, Value> s : scopes) {
            if (s.containsKey(name)) {
                s.put(name, value);
                return;
            }
        }
        if (parent != null) {
            parent.assign(name, value);
            return;
        }
        throw ScriptError.unboundName(name);
    }

    public boolean existsInCurrentScope(String name) {
        Map<String, Value> top = scopes.peek();
        return top != null && top.containsKey(name);
    }

    /** Merged view of this frame only, outer blocks first so inner ones shadow. */
    public Map<String, Value> frameBindings() {
        List<Map<String, Value>> bottomToTop = new ArrayList<>(scopes);
        Collections.reverse(bottomToTop);

        Map<String, Value> out = new LinkedHashMap<>();
        for (Map<String, Value> s : bottomToTop) out.putAll(s);
        return out;
    }
}
