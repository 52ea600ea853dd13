package com.tinyscript.script.ast;

import java.util.List;

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
import com.tinyscript.script.ast.Expr.MapLiteral;
import com.tinyscript.script.ast.Expr.MethodCallExpr;
import com.tinyscript.script.ast.Expr.NewExpr;
import com.tinyscript.script.ast.Expr.SetExpr;
import com.tinyscript.script.ast.Expr.SetIndexExpr;
import com.tinyscript.script.ast.Expr.Unary;
import com.tinyscript.script.ast.Expr.Variable;

/**
 * Renders an expression tree back to script syntax. Used for assertion
 * diagnostics when the producer of the tree did not keep the source text.
 * Binary and logical operands are parenthesised only when they are
 * themselves operator expressions.
 */
public final class SourceRenderer implements ExprVisitor<String> {

    private static final SourceRenderer INSTANCE = new SourceRenderer();

    private SourceRenderer() {}

    public static String render(ExprInterface expr) {
        return (expr == null) ? "" : expr.accept(INSTANCE);
    }

    @Override
    public String visitLiteralExpr(Literal expr) {
        Object v = expr.value;
        if (v == null) return "null";
        if (v instanceof String) return '"' + escape((String) v) + '"';
        return v.toString();
    }

    @Override
    public String visitListLiteralExpr(ListLiteral expr) {
        return "[" + joinArgs(expr.items) + "]";
    }

    @Override
    public String visitMapLiteralExpr(MapLiteral expr) {
        StringBuilder sb = new StringBuilder("{");
        for (int i = 0; i < expr.entries.size(); i++) {
            if (i > 0) sb.append(", ");
            MapLiteral.Entry e = expr.entries.get(i);
            sb.append('"').append(escape(e.key)).append("\": ").append(render(e.value));
        }
        return sb.append('}').toString();
    }

    @Override
    public String visitVariableExpr(Variable expr) {
        return expr.name;
    }

    @Override
    public String visitAssignExpr(Assign expr) {
        return expr.name + " = " + render(expr.value);
    }

    @Override
    public String visitUnaryExpr(Unary expr) {
        return expr.operator.symbol + operand(expr.right);
    }

    @Override
    public String visitBinaryExpr(Binary expr) {
        return operand(expr.left) + " " + expr.operator.symbol + " " + operand(expr.right);
    }

    @Override
    public String visitLogicalExpr(Logical expr) {
        return operand(expr.left) + " " + expr.operator.symbol + " " + operand(expr.right);
    }

    @Override
    public String visitCallExpr(Call expr) {
        return expr.name + "(" + joinArgs(expr.arguments) + ")";
    }

    @Override
    public String visitMethodCallExpr(MethodCallExpr expr) {
        return operand(expr.receiver) + "." + expr.method + "(" + joinArgs(expr.arguments) + ")";
    }

    @Override
    public String visitNewExpr(NewExpr expr) {
        return "new " + expr.className + "(" + joinArgs(expr.args) + ")";
    }

    @Override
    public String visitGetExpr(GetExpr expr) {
        return operand(expr.receiver) + "." + expr.name;
    }

    @Override
    public String visitSetExpr(SetExpr expr) {
        return operand(expr.receiver) + "." + expr.name + " = " + render(expr.value);
    }

    @Override
    public String visitIndexExpr(IndexExpr expr) {
        return operand(expr.target) + "[" + render(expr.index) + "]";
    }

    @Override
    public String visitSetIndexExpr(SetIndexExpr expr) {
        return operand(expr.target) + "[" + render(expr.index) + "] = " + render(expr.value);
    }

    private String operand(ExprInterface e) {
        String s = render(e);
        if (e instanceof Binary || e instanceof Logical || e instanceof Assign) return "(" + s + ")";
        return s;
    }

    private String joinArgs(List<ExprInterface> args) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < args.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(render(args.get(i)));
        }
        return sb.toString();
    }

    private static String escape(String s) {
        return s.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
