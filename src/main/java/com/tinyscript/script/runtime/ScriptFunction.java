package com.tinyscript.script.runtime;

import java.util.List;

import com.tinyscript.script.ast.FunctionDecl;
import com.tinyscript.script.ast.SourceLocation;
import com.tinyscript.script.ast.Statement.Stmt;
import com.tinyscript.script.runtime.Interpreter.BreakSignal;
import com.tinyscript.script.runtime.Interpreter.ReturnSignal;

/** A declared function: a class method (owner set) or a free function (owner null). */
public final class ScriptFunction {
    public static final String SELF = "self";

    final String name;
    final List<String> params;
    final List<Stmt> body;
    private final ScriptClass owner;
    private final SourceLocation location;

    ScriptFunction(FunctionDecl decl, ScriptClass owner) {
        this.name = decl.name;
        this.params = decl.params;
        this.body = decl.body;
        this.owner = owner;
        this.location = decl.location();
    }

    /** Builds a free function, one that belongs to no class. */
    public static ScriptFunction free(FunctionDecl decl) {
        return new ScriptFunction(decl, null);
    }

    public String name() { return name; }

    public ScriptClass owner() { return owner; }

    public SourceLocation location() { return location; }

    public String qualifiedName() {
        return (owner == null) ? name : owner.name() + "." + name;
    }

    /**
     * Runs the body in a fresh frame whose parent is the global scope.
     * {@code self} is bound only when the dispatch mode supplies a receiver.
     */
    Value call(Interpreter interpreter, Value self, List<Value> args) {
        if (args.size() != params.size()) {
            throw ScriptError.arity(qualifiedName(), params.size(), args.size());
        }

        Environment previous = interpreter.env;
        interpreter.env = interpreter.globals().childScope();

        try {
            if (self != null) interpreter.env.define(SELF, self);
            for (int i = 0; i < params.size(); i++) {
                interpreter.env.define(params.get(i), args.get(i));
            }

            try {
                for (Stmt s : body) interpreter.execute(s);
            } catch (ReturnSignal rs) {
                return rs.value;
            } catch (BreakSignal bs) {
                throw new IllegalStateException("'break' outside of a loop in " + qualifiedName());
            }

            return Value.nil();
        } finally {
            interpreter.env = previous;
        }
    }

    @Override
    public String toString() {
        return qualifiedName() + "(" + String.join(", ", params) + ")";
    }
}
