package com.tinyscript.script.runtime;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import com.tinyscript.debug.Debug;
import com.tinyscript.debug.DebugLevel;
import com.tinyscript.protocol.ValueJson;
import com.tinyscript.script.ast.ClassDecl;
import com.tinyscript.script.ast.Expr.Assign;
import com.tinyscript.script.ast.Expr.Binary;
import com.tinyscript.script.ast.Expr.Call;
import com.tinyscript.script.ast.Expr.ExprInterface;
import com.tinyscript.script.ast.Expr.ExprVisitor;
import com.tinyscript.script.ast.Expr.GetExpr;
import com.tinyscript.script.ast.Expr.IndexExpr;
import com.tinyscript.script.ast.Expr.ListLiteral;
import com.tinyscript.script.ast.Expr.Literal;
import com.tinyscript.script.ast.Expr.Logical;
import com.tinyscript.script.ast.Expr.LogicalOp;
import com.tinyscript.script.ast.Expr.MapLiteral;
import com.tinyscript.script.ast.Expr.MethodCallExpr;
import com.tinyscript.script.ast.Expr.NewExpr;
import com.tinyscript.script.ast.Expr.SetExpr;
import com.tinyscript.script.ast.Expr.SetIndexExpr;
import com.tinyscript.script.ast.Expr.Unary;
import com.tinyscript.script.ast.Expr.Variable;
import com.tinyscript.script.ast.FieldDecl;
import com.tinyscript.script.ast.FunctionDecl;
import com.tinyscript.script.ast.Program;
import com.tinyscript.script.ast.SourceLocation;
import com.tinyscript.script.ast.SourceRenderer;
import com.tinyscript.script.ast.Statement.AssertStmt;
import com.tinyscript.script.ast.Statement.Block;
import com.tinyscript.script.ast.Statement.BreakStmt;
import com.tinyscript.script.ast.Statement.ExprStmt;
import com.tinyscript.script.ast.Statement.ForEach;
import com.tinyscript.script.ast.Statement.ForRange;
import com.tinyscript.script.ast.Statement.If;
import com.tinyscript.script.ast.Statement.PrintStmt;
import com.tinyscript.script.ast.Statement.ReturnStmt;
import com.tinyscript.script.ast.Statement.Stmt;
import com.tinyscript.script.ast.Statement.StmtVisitor;
import com.tinyscript.script.ast.Statement.VarStmt;
import com.tinyscript.script.ast.Statement.While;

/**
 * Tree-walking evaluator for one run.
 *
 * Owns the global scope, the class registry and the call stack. A fresh
 * interpreter is built for every run, so nothing leaks between runs.
 */
public class Interpreter implements ExprVisitor<Value>, StmtVisitor {
    private static final String TAG = "Interpreter";

    Environment env;
    private final Environment globals;
    private final ClassRegistry classes = new ClassRegistry();
    private final Deque<CallFrame> callStack = new ArrayDeque<>();
    private final int maxDepth;
    private final Consumer<String> output;

    public Interpreter(int maxDepth, Consumer<String> output) {
        if (maxDepth < 1) throw new IllegalArgumentException("maxDepth must be >= 1");
        this.globals = new Environment();
        this.env = globals;
        this.maxDepth = maxDepth;
        this.output = output;
    }

    public Environment globals() { return globals; }

    // -------------------------
    // Loading and host calls
    // -------------------------

    /** Registers every class and free function of the program as a global. */
    public void load(Program program) {
        for (ClassDecl decl : program.classes) {
            ScriptClass cls = classes.register(decl);
            defineGlobal(decl.name, Value.clazz(cls), decl.location());
        }
        for (FunctionDecl fn : program.functions) {
            defineGlobal(fn.name, Value.function(FunctionRef.unbound(ScriptFunction.free(fn))), fn.location());
        }
        Debug.get().d(TAG, "loaded " + program.classes.size() + " classes, "
                + program.functions.size() + " free functions");
    }

    private void defineGlobal(String name, Value value, SourceLocation where) {
        if (globals.existsInCurrentScope(name)) {
            throw ScriptError.redefinition("global " + name).locate(where);
        }
        globals.define(name, value);
    }

    /** {@code ClassName.method(args)}: no instance, no self. Used for the entry point. */
    public Value callStatic(String className, String methodName, List<Value> args) {
        ScriptClass cls = classes.require(className);
        ScriptFunction fn = cls.findMethod(methodName);
        if (fn == null) throw ScriptError.memberNotFound("class " + className, methodName);
        return invoke(fn, null, args, SourceLocation.UNKNOWN);
    }

    /** Calls a function value, with self when it is bound. */
    public Value callFunction(FunctionRef ref, List<Value> args, SourceLocation callSite) {
        return invoke(ref.function(), ref.self(), args, callSite);
    }

    /**
     * {@code new ClassName(args)}: fields are initialised in declaration order
     * with self bound, then the constructor runs if the class declares one.
     */
    public Value construct(String className, List<Value> args, SourceLocation callSite) {
        ScriptClass cls = classes.require(className);
        ScriptFunction ctor = cls.constructor();
        if (ctor == null && !args.isEmpty()) {
            throw ScriptError.arity(className + "." + ScriptClass.CONSTRUCTOR, 0, args.size());
        }

        Value self = Value.instance(new Instance(cls));
        initializeFields(cls, self, callSite);
        if (ctor != null) invoke(ctor, self, args, callSite);

        if (Debug.get().isEnabled(DebugLevel.TRACE)) Debug.get().t(TAG, "new " + className + " " + self.display());
        return self;
    }

    Value invoke(ScriptFunction fn, Value self, List<Value> args, SourceLocation callSite) {
        CallFrame frame = pushFrame(fn.qualifiedName(), fn.owner(), self, callSite);
        try {
            return fn.call(this, self, args);
        } catch (ScriptError e) {
            e.addTraceFrame(frame.describe());
            throw e;
        } finally {
            callStack.pop();
        }
    }

    private void initializeFields(ScriptClass cls, Value self, SourceLocation callSite) {
        if (cls.fields().isEmpty()) return;

        CallFrame frame = pushFrame(cls.name() + ".<fields>", cls, self, callSite);
        Environment previous = env;
        env = globals.childScope();
        try {
            env.define(ScriptFunction.SELF, self);
            Instance inst = self.asInstance();
            for (FieldDecl field : cls.fields()) {
                Value v;
                try {
                    v = (field.initializer == null) ? Value.nil() : eval(field.initializer);
                } catch (ScriptError e) {
                    throw e.locate(field.location());
                }
                inst.setField(field.name, v);
            }
        } catch (ScriptError e) {
            e.addTraceFrame(frame.describe());
            throw e;
        } finally {
            env = previous;
            callStack.pop();
        }
    }

    private CallFrame pushFrame(String name, ScriptClass owner, Value self, SourceLocation callSite) {
        if (callStack.size() >= maxDepth) {
            throw new ScriptError(ScriptError.Kind.STACK_OVERFLOW,
                    "Max call depth exceeded (" + maxDepth + ") calling " + name);
        }
        CallFrame frame = new CallFrame(name, owner, self, callSite);
        callStack.push(frame);
        return frame;
    }

    // -------------------------
    // Statements
    // -------------------------

    public Value eval(ExprInterface expr) { return expr.accept(this); }

    /** Runs one statement and tags any failure with its location, unless a deeper one is already known. */
    public void execute(Stmt stmt) {
        try {
            stmt.accept(this);
        } catch (ScriptError e) {
            throw e.locate(stmt.location());
        }
    }

    private void executeBlock(List<Stmt> statements) {
        env.pushBlock();
        try {
            for (Stmt s : statements) execute(s);
        } finally {
            env.popBlock();
        }
    }

    @Override
    public void visitExprStmt(ExprStmt stmt) { eval(stmt.expression); }

    @Override
    public void visitVarStmt(VarStmt stmt) {
        Value value = (stmt.initializer == null) ? Value.nil() : eval(stmt.initializer);
        env.define(stmt.name, value);
    }

    @Override
    public void visitBlockStmt(Block stmt) {
        executeBlock(stmt.statements);
    }

    @Override
    public void visitIfStmt(If stmt) {
        if (eval(stmt.condition).isTruthy()) executeBlock(stmt.thenBranch);
        else if (stmt.elseBranch != null) executeBlock(stmt.elseBranch);
    }

    @Override
    public void visitWhileStmt(While stmt) {
        while (eval(stmt.condition).isTruthy()) {
            try {
                executeBlock(stmt.body);
            } catch (BreakSignal bs) {
                break;
            }
        }
    }

    @Override
    public void visitForRangeStmt(ForRange stmt) {
        Value from = eval(stmt.from);
        Value to = eval(stmt.to);
        Value step = (stmt.step == null) ? Value.number(1L) : eval(stmt.step);
        requireNumber("for range start", from);
        requireNumber("for range end", to);
        requireNumber("for range step", step);
        if (step.asDouble() == 0.0) throw ScriptError.typeMismatch("for range step must not be 0");

        if (from.isInteger() && to.isInteger() && step.isInteger()) {
            long end = to.asLong();
            long by = step.asLong();
            for (long i = from.asLong(); by > 0 ? i <= end : i >= end; ) {
                if (!iterate(stmt.variable, Value.number(i), stmt.body)) return;
                if (i == end) return;
                try {
                    i = Math.addExact(i, by);
                } catch (ArithmeticException pastLongRange) {
                    // next value lies beyond Long range, so also beyond end
                    return;
                }
            }
            return;
        }

        double end = to.asDouble();
        double by = step.asDouble();
        for (double i = from.asDouble(); by > 0 ? i <= end : i >= end; i += by) {
            if (!iterate(stmt.variable, Value.number(i), stmt.body)) return;
        }
    }

    @Override
    public void visitForEachStmt(ForEach stmt) {
        Value iterable = eval(stmt.iterable);
        List<Value> items;
        switch (iterable.type) {
            case LIST:
                items = new ArrayList<>(iterable.asList());
                break;
            case DICT:
                items = new ArrayList<>();
                for (String key : iterable.asDict().keySet()) items.add(Value.string(key));
                break;
            default:
                throw ScriptError.typeMismatch("Cannot iterate over " + iterable.typeName());
        }

        for (Value item : items) {
            if (!iterate(stmt.variable, item, stmt.body)) return;
        }
    }

    /** One loop pass with the loop variable bound in its own block. @return false after break */
    private boolean iterate(String variable, Value current, List<Stmt> body) {
        env.pushBlock();
        try {
            env.define(variable, current);
            for (Stmt s : body) execute(s);
            return true;
        } catch (BreakSignal bs) {
            return false;
        } finally {
            env.popBlock();
        }
    }

    @Override
    public void visitReturnStmt(ReturnStmt stmt) {
        throw new ReturnSignal(stmt.value == null ? Value.nil() : eval(stmt.value));
    }

    @Override
    public void visitBreakStmt(BreakStmt stmt) {
        throw new BreakSignal();
    }

    @Override
    public void visitAssertStmt(AssertStmt stmt) {
        Value v = eval(stmt.expression);
        if (v.isTruthy()) return;

        String text = (stmt.sourceText != null) ? stmt.sourceText : SourceRenderer.render(stmt.expression);
        throw new AssertionFailure(text, ValueJson.toJson(v)).locate(stmt.location());
    }

    @Override
    public void visitPrintStmt(PrintStmt stmt) {
        output.accept(eval(stmt.expression).display());
    }

    // -------------------------
    // Expressions
    // -------------------------

    @Override
    public Value visitLiteralExpr(Literal expr) {
        Object v = expr.value;
        if (v == null) return Value.nil();
        if (v instanceof Boolean) return Value.bool((Boolean) v);
        if (v instanceof Long) return Value.number((Long) v);
        if (v instanceof Double) return Value.number((Double) v);
        return Value.string((String) v);
    }

    @Override
    public Value visitListLiteralExpr(ListLiteral expr) {
        return Value.list(evalAll(expr.items));
    }

    @Override
    public Value visitMapLiteralExpr(MapLiteral expr) {
        Map<String, Value> out = new LinkedHashMap<>();
        for (MapLiteral.Entry e : expr.entries) {
            if (out.containsKey(e.key)) throw ScriptError.redefinition("dict key " + e.key);
            out.put(e.key, eval(e.value));
        }
        return Value.dict(out);
    }

    @Override
    public Value visitVariableExpr(Variable expr) {
        return env.get(expr.name);
    }

    @Override
    public Value visitAssignExpr(Assign expr) {
        Value value = eval(expr.value);
        env.assign(expr.name, value);
        return value;
    }

    @Override
    public Value visitUnaryExpr(Unary expr) {
        Value right = eval(expr.right);
        switch (expr.operator) {
            case NOT:
                return Value.bool(!right.isTruthy());
            case NEGATE:
                return Arithmetic.negate(right);
            default:
                throw new IllegalStateException("Unhandled unary operator: " + expr.operator);
        }
    }

    @Override
    public Value visitBinaryExpr(Binary expr) {
        Value left = eval(expr.left);
        Value right = eval(expr.right);
        return Arithmetic.binary(expr.operator, left, right);
    }

    /** Short-circuits and yields the deciding operand, not a coerced bool. */
    @Override
    public Value visitLogicalExpr(Logical expr) {
        Value left = eval(expr.left);
        if (expr.operator == LogicalOp.OR) {
            if (left.isTruthy()) return left;
        } else {
            if (!left.isTruthy()) return left;
        }
        return eval(expr.right);
    }

    /**
     * Bare {@code m(args)}. Inside a method the enclosing class's table wins,
     * carrying over the current self (if any). Otherwise {@code m} must name a
     * function value in scope.
     */
    @Override
    public Value visitCallExpr(Call expr) {
        CallFrame frame = callStack.peek();
        if (frame != null && frame.owner != null) {
            ScriptFunction sibling = frame.owner.findMethod(expr.name);
            if (sibling != null) {
                return invoke(sibling, frame.self, evalAll(expr.arguments), expr.location());
            }
        }

        Value callee = env.get(expr.name);
        if (callee.type != Value.Type.FUNCTION) {
            throw ScriptError.typeMismatch("'" + expr.name + "' is not a function, got " + callee.typeName());
        }
        return callFunction(callee.asFunction(), evalAll(expr.arguments), expr.location());
    }

    /**
     * {@code receiver.m(args)} on an instance (field function, else class method
     * with self), a class (method without self) or a dict (entry holding a function).
     */
    @Override
    public Value visitMethodCallExpr(MethodCallExpr expr) {
        Value recv = eval(expr.receiver);
        String name = expr.method;

        switch (recv.type) {
            case INSTANCE: {
                Instance inst = recv.asInstance();
                if (inst.hasField(name)) {
                    return callFunction(requireFunction(inst.getField(name), name), evalAll(expr.arguments), expr.location());
                }
                ScriptFunction method = inst.scriptClass().findMethod(name);
                if (method == null) throw ScriptError.memberNotFound(inst.scriptClass().name() + " instance", name);
                return invoke(method, recv, evalAll(expr.arguments), expr.location());
            }
            case CLASS: {
                ScriptClass cls = recv.asClass();
                ScriptFunction method = cls.findMethod(name);
                if (method == null) throw ScriptError.memberNotFound("class " + cls.name(), name);
                return invoke(method, null, evalAll(expr.arguments), expr.location());
            }
            case DICT: {
                Value entry = PathAccess.getMember(recv, name);
                return callFunction(requireFunction(entry, name), evalAll(expr.arguments), expr.location());
            }
            default:
                throw ScriptError.typeMismatch("Cannot call method '" + name + "' on " + recv.typeName());
        }
    }

    @Override
    public Value visitNewExpr(NewExpr expr) {
        if (!classes.contains(expr.className)) throw ScriptError.unboundName("class " + expr.className);
        return construct(expr.className, evalAll(expr.args), expr.location());
    }

    @Override
    public Value visitGetExpr(GetExpr expr) {
        return PathAccess.getMember(eval(expr.receiver), expr.name);
    }

    @Override
    public Value visitSetExpr(SetExpr expr) {
        Value recv = eval(expr.receiver);
        Value value = eval(expr.value);
        return PathAccess.setMember(recv, expr.name, value);
    }

    @Override
    public Value visitIndexExpr(IndexExpr expr) {
        Value target = eval(expr.target);
        Value index = eval(expr.index);
        return PathAccess.getIndex(target, index);
    }

    @Override
    public Value visitSetIndexExpr(SetIndexExpr expr) {
        Value target = eval(expr.target);
        Value index = eval(expr.index);
        Value value = eval(expr.value);
        return PathAccess.setIndex(target, index, value);
    }

    // -------------------------
    // Helpers
    // -------------------------

    private List<Value> evalAll(List<ExprInterface> exprs) {
        List<Value> out = new ArrayList<>(exprs.size());
        for (ExprInterface e : exprs) out.add(eval(e));
        return out;
    }

    private static FunctionRef requireFunction(Value v, String name) {
        if (v.type != Value.Type.FUNCTION) {
            throw ScriptError.typeMismatch("'" + name + "' is not a function, got " + v.typeName());
        }
        return v.asFunction();
    }

    private static void requireNumber(String what, Value v) {
        if (v.type != Value.Type.NUMBER) {
            throw ScriptError.typeMismatch(what + " must be a number, got " + v.typeName());
        }
    }

    public static final class ReturnSignal extends RuntimeException {
        private static final long serialVersionUID = 1L;
        final transient Value value;
        ReturnSignal(Value value) { super(null, null, false, false); this.value = value; }
    }

    public static final class BreakSignal extends RuntimeException {
        private static final long serialVersionUID = 1L;
        BreakSignal() { super(null, null, false, false); }
    }
}
