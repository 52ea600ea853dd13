package com.tinyscript.protocol;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tinyscript.script.ast.ClassDecl;
import com.tinyscript.script.ast.Expr;
import com.tinyscript.script.ast.Expr.ExprInterface;
import com.tinyscript.script.ast.FieldDecl;
import com.tinyscript.script.ast.FunctionDecl;
import com.tinyscript.script.ast.Program;
import com.tinyscript.script.ast.SourceLocation;
import com.tinyscript.script.ast.Statement;
import com.tinyscript.script.ast.Statement.Stmt;

/**
 * Decodes the JSON rendering of an already-parsed program.
 *
 * <pre>
 * {"classes":   [{"name": "Test", "fields": [{"name": "x", "init": EXPR}],
 *                 "methods": [{"name": "main", "params": [], "body": [STMT...]}]}],
 *  "functions": [{"name": "helper", "params": ["a"], "body": [STMT...]}]}
 * </pre>
 *
 * Statements carry {@code "stmt"}, expressions carry {@code "expr"}; any node
 * may carry {@code "line"} and {@code "column"}. A malformed document fails
 * with IllegalArgumentException naming the path of the offending node.
 */
public final class ProgramJson {

    private static final ObjectMapper om = new ObjectMapper();

    private ProgramJson() {}

    public static Program decode(String json) {
        JsonNode root;
        try {
            root = om.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Program is not valid JSON: " + e.getOriginalMessage(), e);
        }
        return decode(root);
    }

    public static Program decode(InputStream in) throws IOException {
        return decode(om.readTree(in));
    }

    public static Program decode(JsonNode root) {
        if (root == null || !root.isObject()) throw new IllegalArgumentException("Program must be a JSON object");

        List<ClassDecl> classes = new ArrayList<>();
        JsonNode cs = optionalArray(root, "classes", "$");
        for (int i = 0; i < cs.size(); i++) classes.add(classDecl(cs.get(i), "$.classes[" + i + "]"));

        List<FunctionDecl> functions = new ArrayList<>();
        JsonNode fs = optionalArray(root, "functions", "$");
        for (int i = 0; i < fs.size(); i++) functions.add(function(fs.get(i), "$.functions[" + i + "]"));

        return new Program(classes, functions);
    }

    // -------------------------
    // Declarations
    // -------------------------

    private static ClassDecl classDecl(JsonNode n, String path) {
        requireObject(n, path);
        String name = text(n, "name", path);

        List<FieldDecl> fields = new ArrayList<>();
        JsonNode fs = optionalArray(n, "fields", path);
        for (int i = 0; i < fs.size(); i++) {
            String fp = path + ".fields[" + i + "]";
            JsonNode f = fs.get(i);
            requireObject(f, fp);
            ExprInterface init = f.has("init") ? expr(f.get("init"), fp + ".init") : null;
            fields.add(new FieldDecl(text(f, "name", fp), init, location(f)));
        }

        List<FunctionDecl> methods = new ArrayList<>();
        JsonNode ms = optionalArray(n, "methods", path);
        for (int i = 0; i < ms.size(); i++) methods.add(function(ms.get(i), path + ".methods[" + i + "]"));

        return new ClassDecl(name, fields, methods, location(n));
    }

    private static FunctionDecl function(JsonNode n, String path) {
        requireObject(n, path);
        List<String> params = new ArrayList<>();
        JsonNode ps = optionalArray(n, "params", path);
        for (int i = 0; i < ps.size(); i++) {
            JsonNode p = ps.get(i);
            if (!p.isTextual()) throw new IllegalArgumentException(path + ".params[" + i + "] must be a string");
            params.add(p.textValue());
        }
        return new FunctionDecl(text(n, "name", path), params, body(n, "body", path), location(n));
    }

    // -------------------------
    // Statements
    // -------------------------

    private static List<Stmt> body(JsonNode n, String field, String path) {
        JsonNode arr = n.get(field);
        if (arr == null || !arr.isArray()) throw new IllegalArgumentException(path + "." + field + " must be an array");
        List<Stmt> out = new ArrayList<>(arr.size());
        for (int i = 0; i < arr.size(); i++) out.add(stmt(arr.get(i), path + "." + field + "[" + i + "]"));
        return out;
    }

    private static Stmt stmt(JsonNode n, String path) {
        requireObject(n, path);
        String kind = text(n, "stmt", path);
        SourceLocation loc = location(n);

        switch (kind) {
            case "var":
                return new Statement.VarStmt(text(n, "name", path),
                        n.has("init") ? expr(n.get("init"), path + ".init") : null, loc);
            case "expr":
                return new Statement.ExprStmt(child(n, "value", path), loc);
            case "block":
                return new Statement.Block(body(n, "body", path), loc);
            case "assert": {
                JsonNode src = n.get("source");
                return new Statement.AssertStmt(child(n, "value", path),
                        (src == null || src.isNull()) ? null : src.asText(), loc);
            }
            case "if":
                return new Statement.If(child(n, "cond", path), body(n, "then", path),
                        n.has("else") ? body(n, "else", path) : null, loc);
            case "while":
                return new Statement.While(child(n, "cond", path), body(n, "body", path), loc);
            case "for":
                return new Statement.ForRange(text(n, "var", path), child(n, "from", path), child(n, "to", path),
                        n.has("step") ? child(n, "step", path) : null, body(n, "body", path), loc);
            case "foreach":
                return new Statement.ForEach(text(n, "var", path), child(n, "in", path), body(n, "body", path), loc);
            case "return":
                return new Statement.ReturnStmt(n.has("value") ? child(n, "value", path) : null, loc);
            case "break":
                return new Statement.BreakStmt(loc);
            case "print":
                return new Statement.PrintStmt(child(n, "value", path), loc);
            default:
                throw new IllegalArgumentException("Unknown statement '" + kind + "' at " + path);
        }
    }

    // -------------------------
    // Expressions
    // -------------------------

    private static ExprInterface child(JsonNode n, String field, String path) {
        JsonNode c = n.get(field);
        if (c == null) throw new IllegalArgumentException("Missing '" + field + "' at " + path);
        return expr(c, path + "." + field);
    }

    private static List<ExprInterface> args(JsonNode n, String field, String path) {
        JsonNode arr = optionalArray(n, field, path);
        List<ExprInterface> out = new ArrayList<>(arr.size());
        for (int i = 0; i < arr.size(); i++) out.add(expr(arr.get(i), path + "." + field + "[" + i + "]"));
        return out;
    }

    private static ExprInterface expr(JsonNode n, String path) {
        requireObject(n, path);
        String kind = text(n, "expr", path);
        SourceLocation loc = location(n);

        switch (kind) {
            case "literal":
                return new Expr.Literal(literal(n.get("value"), path), loc);
            case "list":
                return new Expr.ListLiteral(args(n, "items", path), loc);
            case "dict": {
                List<Expr.MapLiteral.Entry> entries = new ArrayList<>();
                JsonNode es = optionalArray(n, "entries", path);
                for (int i = 0; i < es.size(); i++) {
                    String ep = path + ".entries[" + i + "]";
                    JsonNode e = es.get(i);
                    requireObject(e, ep);
                    entries.add(new Expr.MapLiteral.Entry(text(e, "key", ep), child(e, "value", ep)));
                }
                return new Expr.MapLiteral(entries, loc);
            }
            case "var":
                return new Expr.Variable(text(n, "name", path), loc);
            case "assign":
                return new Expr.Assign(text(n, "name", path), child(n, "value", path), loc);
            case "get":
                return new Expr.GetExpr(child(n, "target", path), text(n, "name", path), loc);
            case "set":
                return new Expr.SetExpr(child(n, "target", path), text(n, "name", path), child(n, "value", path), loc);
            case "index":
                return new Expr.IndexExpr(child(n, "target", path), child(n, "index", path), loc);
            case "setIndex":
                return new Expr.SetIndexExpr(child(n, "target", path), child(n, "index", path),
                        child(n, "value", path), loc);
            case "unary":
                return new Expr.Unary(unaryOp(n, path), child(n, "operand", path), loc);
            case "binary":
                return new Expr.Binary(child(n, "left", path), binaryOp(n, path), child(n, "right", path), loc);
            case "logical":
                return new Expr.Logical(child(n, "left", path), logicalOp(n, path), child(n, "right", path), loc);
            case "call":
                return new Expr.Call(text(n, "name", path), args(n, "args", path), loc);
            case "method":
                return new Expr.MethodCallExpr(child(n, "target", path), text(n, "name", path), args(n, "args", path), loc);
            case "new":
                return new Expr.NewExpr(text(n, "class", path), args(n, "args", path), loc);
            default:
                throw new IllegalArgumentException("Unknown expression '" + kind + "' at " + path);
        }
    }

    private static Expr.UnaryOp unaryOp(JsonNode n, String path) {
        try {
            return Expr.UnaryOp.fromSymbol(text(n, "op", path));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(e.getMessage() + " at " + path, e);
        }
    }

    private static Expr.BinaryOp binaryOp(JsonNode n, String path) {
        try {
            return Expr.BinaryOp.fromSymbol(text(n, "op", path));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(e.getMessage() + " at " + path, e);
        }
    }

    private static Expr.LogicalOp logicalOp(JsonNode n, String path) {
        try {
            return Expr.LogicalOp.fromSymbol(text(n, "op", path));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(e.getMessage() + " at " + path, e);
        }
    }

    private static Object literal(JsonNode v, String path) {
        if (v == null || v.isNull()) return null;
        if (v.isBoolean()) return v.booleanValue();
        if (v.isIntegralNumber() && v.canConvertToLong()) return v.longValue();
        if (v.isNumber()) return v.doubleValue();
        if (v.isTextual()) return v.textValue();
        throw new IllegalArgumentException("Literal must be null, bool, number or string at " + path);
    }

    // -------------------------
    // Helpers
    // -------------------------

    private static void requireObject(JsonNode n, String path) {
        if (n == null || !n.isObject()) throw new IllegalArgumentException("Expected an object at " + path);
    }

    private static String text(JsonNode n, String field, String path) {
        JsonNode v = n.get(field);
        if (v == null || !v.isTextual() || v.textValue().isEmpty()) {
            throw new IllegalArgumentException("Missing or empty '" + field + "' at " + path);
        }
        return v.textValue();
    }

    private static JsonNode optionalArray(JsonNode n, String field, String path) {
        JsonNode v = n.get(field);
        if (v == null || v.isNull()) return om.createArrayNode();
        if (!v.isArray()) throw new IllegalArgumentException(path + "." + field + " must be an array");
        return v;
    }

    private static SourceLocation location(JsonNode n) {
        int line = n.path("line").asInt(0);
        int column = n.path("column").asInt(0);
        return (line > 0) ? new SourceLocation(line, column) : SourceLocation.UNKNOWN;
    }
}
