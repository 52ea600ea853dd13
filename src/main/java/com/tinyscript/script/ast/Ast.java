package com.tinyscript.script.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.tinyscript.script.ast.Expr.BinaryOp;
import com.tinyscript.script.ast.Expr.ExprInterface;
import com.tinyscript.script.ast.Expr.LogicalOp;
import com.tinyscript.script.ast.Expr.UnaryOp;
import com.tinyscript.script.ast.Statement.Stmt;

/**
 * Static factory for assembling program trees in Java.
 *
 * Nodes built here carry {@link SourceLocation#UNKNOWN}. Dotted paths
 * ("d.a.b") expand to a variable followed by member accesses.
 */
public final class Ast {

    private static final SourceLocation NOWHERE = SourceLocation.UNKNOWN;

    private Ast() {}

    // -------------------------
    // Declarations
    // -------------------------

    public static Program program(ClassDecl... classes) {
        return new Program(Arrays.asList(classes));
    }

    public static Program program(List<ClassDecl> classes, List<FunctionDecl> functions) {
        return new Program(classes, functions);
    }

    public static ClassDecl clazz(String name, FunctionDecl... methods) {
        return new ClassDecl(name, Collections.emptyList(), Arrays.asList(methods), NOWHERE);
    }

    public static ClassDecl clazz(String name, List<FieldDecl> fields, FunctionDecl... methods) {
        return new ClassDecl(name, fields, Arrays.asList(methods), NOWHERE);
    }

    public static FieldDecl field(String name, ExprInterface initializer) {
        return new FieldDecl(name, initializer, NOWHERE);
    }

    public static FunctionDecl function(String name, List<String> params, Stmt... body) {
        return new FunctionDecl(name, params, Arrays.asList(body), NOWHERE);
    }

    public static List<String> params(String... names) {
        return Arrays.asList(names);
    }

    // -------------------------
    // Statements
    // -------------------------

    public static Stmt let(String name, ExprInterface initializer) {
        return new Statement.VarStmt(name, initializer, NOWHERE);
    }

    public static Stmt expr(ExprInterface expression) {
        return new Statement.ExprStmt(expression, NOWHERE);
    }

    public static Stmt assertThat(ExprInterface expression) {
        return new Statement.AssertStmt(expression, null, NOWHERE);
    }

    public static Stmt assertThat(ExprInterface expression, String sourceText) {
        return new Statement.AssertStmt(expression, sourceText, NOWHERE);
    }

    public static Stmt block(Stmt... statements) {
        return new Statement.Block(Arrays.asList(statements), NOWHERE);
    }

    public static Stmt ifThen(ExprInterface condition, Stmt... thenBranch) {
        return new Statement.If(condition, Arrays.asList(thenBranch), null, NOWHERE);
    }

    public static Stmt ifElse(ExprInterface condition, List<Stmt> thenBranch, List<Stmt> elseBranch) {
        return new Statement.If(condition, thenBranch, elseBranch, NOWHERE);
    }

    public static Stmt whileLoop(ExprInterface condition, Stmt... body) {
        return new Statement.While(condition, Arrays.asList(body), NOWHERE);
    }

    public static Stmt forRange(String variable, ExprInterface from, ExprInterface to, ExprInterface step, Stmt... body) {
        return new Statement.ForRange(variable, from, to, step, Arrays.asList(body), NOWHERE);
    }

    public static Stmt forEach(String variable, ExprInterface iterable, Stmt... body) {
        return new Statement.ForEach(variable, iterable, Arrays.asList(body), NOWHERE);
    }

    public static Stmt ret(ExprInterface value) {
        return new Statement.ReturnStmt(value, NOWHERE);
    }

    public static Stmt ret() {
        return new Statement.ReturnStmt(null, NOWHERE);
    }

    public static Stmt breakLoop() {
        return new Statement.BreakStmt(NOWHERE);
    }

    public static Stmt print(ExprInterface expression) {
        return new Statement.PrintStmt(expression, NOWHERE);
    }

    public static List<Stmt> stmts(Stmt... statements) {
        return Arrays.asList(statements);
    }

    // -------------------------
    // Literals
    // -------------------------

    public static ExprInterface nil() { return new Expr.Literal(null, NOWHERE); }
    public static ExprInterface bool(boolean b) { return new Expr.Literal(b, NOWHERE); }
    public static ExprInterface num(long n) { return new Expr.Literal(n, NOWHERE); }
    public static ExprInterface num(double d) { return new Expr.Literal(d, NOWHERE); }
    public static ExprInterface str(String s) { return new Expr.Literal(s, NOWHERE); }

    public static ExprInterface list(ExprInterface... items) {
        return new Expr.ListLiteral(Arrays.asList(items), NOWHERE);
    }

    public static ExprInterface dict(Expr.MapLiteral.Entry... entries) {
        return new Expr.MapLiteral(Arrays.asList(entries), NOWHERE);
    }

    public static Expr.MapLiteral.Entry entry(String key, ExprInterface value) {
        return new Expr.MapLiteral.Entry(key, value);
    }

    // -------------------------
    // Names and paths
    // -------------------------

    public static ExprInterface var(String name) {
        return new Expr.Variable(name, NOWHERE);
    }

    public static ExprInterface self() {
        return var("self");
    }

    public static ExprInterface assign(String name, ExprInterface value) {
        return new Expr.Assign(name, value, NOWHERE);
    }

    /** {@code path("d.a.b")} reads member b of member a of variable d. */
    public static ExprInterface path(String dotted) {
        List<String> parts = split(dotted);
        ExprInterface expr = var(parts.get(0));
        return get(expr, parts.subList(1, parts.size()));
    }

    /** {@code get(e, "a.b")} reads member b of member a of e. */
    public static ExprInterface get(ExprInterface receiver, String dotted) {
        return get(receiver, split(dotted));
    }

    /** {@code assignPath("d.a.b", v)} writes v into member b of d.a. */
    public static ExprInterface assignPath(String dotted, ExprInterface value) {
        List<String> parts = split(dotted);
        if (parts.size() < 2) {
            throw new IllegalArgumentException("Member assignment needs at least one '.': " + dotted);
        }
        ExprInterface receiver = get(var(parts.get(0)), parts.subList(1, parts.size() - 1));
        return new Expr.SetExpr(receiver, parts.get(parts.size() - 1), value, NOWHERE);
    }

    public static ExprInterface set(ExprInterface receiver, String name, ExprInterface value) {
        return new Expr.SetExpr(receiver, name, value, NOWHERE);
    }

    public static ExprInterface index(ExprInterface target, ExprInterface index) {
        return new Expr.IndexExpr(target, index, NOWHERE);
    }

    public static ExprInterface setIndex(ExprInterface target, ExprInterface index, ExprInterface value) {
        return new Expr.SetIndexExpr(target, index, value, NOWHERE);
    }

    private static ExprInterface get(ExprInterface receiver, List<String> names) {
        ExprInterface expr = receiver;
        for (String name : names) expr = new Expr.GetExpr(expr, name, NOWHERE);
        return expr;
    }

    private static List<String> split(String dotted) {
        List<String> parts = new ArrayList<>(Arrays.asList(dotted.split("\\.")));
        for (String p : parts) {
            if (p.isEmpty()) throw new IllegalArgumentException("Empty segment in path: " + dotted);
        }
        return parts;
    }

    // -------------------------
    // Operators
    // -------------------------

    public static ExprInterface binary(ExprInterface left, BinaryOp op, ExprInterface right) {
        return new Expr.Binary(left, op, right, NOWHERE);
    }

    public static ExprInterface add(ExprInterface l, ExprInterface r) { return binary(l, BinaryOp.ADD, r); }
    public static ExprInterface sub(ExprInterface l, ExprInterface r) { return binary(l, BinaryOp.SUB, r); }
    public static ExprInterface mul(ExprInterface l, ExprInterface r) { return binary(l, BinaryOp.MUL, r); }
    public static ExprInterface div(ExprInterface l, ExprInterface r) { return binary(l, BinaryOp.DIV, r); }
    public static ExprInterface mod(ExprInterface l, ExprInterface r) { return binary(l, BinaryOp.MOD, r); }
    public static ExprInterface pow(ExprInterface l, ExprInterface r) { return binary(l, BinaryOp.POW, r); }
    public static ExprInterface eq(ExprInterface l, ExprInterface r) { return binary(l, BinaryOp.EQ, r); }
    public static ExprInterface ne(ExprInterface l, ExprInterface r) { return binary(l, BinaryOp.NE, r); }
    public static ExprInterface lt(ExprInterface l, ExprInterface r) { return binary(l, BinaryOp.LT, r); }
    public static ExprInterface le(ExprInterface l, ExprInterface r) { return binary(l, BinaryOp.LE, r); }
    public static ExprInterface gt(ExprInterface l, ExprInterface r) { return binary(l, BinaryOp.GT, r); }
    public static ExprInterface ge(ExprInterface l, ExprInterface r) { return binary(l, BinaryOp.GE, r); }

    public static ExprInterface and(ExprInterface l, ExprInterface r) {
        return new Expr.Logical(l, LogicalOp.AND, r, NOWHERE);
    }

    public static ExprInterface or(ExprInterface l, ExprInterface r) {
        return new Expr.Logical(l, LogicalOp.OR, r, NOWHERE);
    }

    public static ExprInterface neg(ExprInterface e) {
        return new Expr.Unary(UnaryOp.NEGATE, e, NOWHERE);
    }

    public static ExprInterface not(ExprInterface e) {
        return new Expr.Unary(UnaryOp.NOT, e, NOWHERE);
    }

    // -------------------------
    // Calls
    // -------------------------

    public static ExprInterface call(String name, ExprInterface... args) {
        return new Expr.Call(name, Arrays.asList(args), NOWHERE);
    }

    public static ExprInterface invoke(ExprInterface receiver, String method, ExprInterface... args) {
        return new Expr.MethodCallExpr(receiver, method, Arrays.asList(args), NOWHERE);
    }

    public static ExprInterface newInstance(String className, ExprInterface... args) {
        return new Expr.NewExpr(className, Arrays.asList(args), NOWHERE);
    }
}
