package com.tinyscript.script.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class Expr {

    public interface ExprInterface {
        <R> R accept(ExprVisitor<R> visitor);
        SourceLocation location();
    }

    public interface ExprVisitor<R> {
        R visitLiteralExpr(Literal expr);
        R visitListLiteralExpr(ListLiteral expr);
        R visitMapLiteralExpr(MapLiteral expr);
        R visitVariableExpr(Variable expr);
        R visitAssignExpr(Assign expr);
        R visitUnaryExpr(Unary expr);
        R visitBinaryExpr(Binary expr);
        R visitLogicalExpr(Logical expr);
        R visitCallExpr(Call expr);
        R visitMethodCallExpr(MethodCallExpr expr);
        R visitNewExpr(NewExpr expr);
        R visitGetExpr(GetExpr expr);
        R visitSetExpr(SetExpr expr);
        R visitIndexExpr(IndexExpr expr);
        R visitSetIndexExpr(SetIndexExpr expr);
    }

    // -------------------------
    // Operators
    // -------------------------

    public enum BinaryOp {
        ADD("+"), SUB("-"), MUL("*"), DIV("/"), MOD("%"), POW("^"),
        EQ("=="), NE("!="), LT("<"), LE("<="), GT(">"), GE(">=");

        public final String symbol;

        BinaryOp(String symbol) { this.symbol = symbol; }

        public static BinaryOp fromSymbol(String symbol) {
            for (BinaryOp op : values()) {
                if (op.symbol.equals(symbol)) return op;
            }
            throw new IllegalArgumentException("Unknown binary operator: " + symbol);
        }
    }

    public enum LogicalOp {
        AND("&&"), OR("||");

        public final String symbol;

        LogicalOp(String symbol) { this.symbol = symbol; }

        public static LogicalOp fromSymbol(String symbol) {
            for (LogicalOp op : values()) {
                if (op.symbol.equals(symbol)) return op;
            }
            throw new IllegalArgumentException("Unknown logical operator: " + symbol);
        }
    }

    public enum UnaryOp {
        NEGATE("-"), NOT("!");

        public final String symbol;

        UnaryOp(String symbol) { this.symbol = symbol; }

        public static UnaryOp fromSymbol(String symbol) {
            for (UnaryOp op : values()) {
                if (op.symbol.equals(symbol)) return op;
            }
            throw new IllegalArgumentException("Unknown unary operator: " + symbol);
        }
    }

    // -------------------------
    // Literals
    // -------------------------

    /** Scalar literal: null, Boolean, Long, Double or String. */
    public static final class Literal extends Node implements ExprInterface {
        public final Object value;

        public Literal(Object value, SourceLocation location) {
            super(location);
            if (value != null && !(value instanceof Boolean) && !(value instanceof Long)
                    && !(value instanceof Double) && !(value instanceof String)) {
                throw new IllegalArgumentException("Unsupported literal type: " + value.getClass().getName());
            }
            this.value = value;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLiteralExpr(this);
        }
    }

    public static final class ListLiteral extends Node implements ExprInterface {
        public final List<ExprInterface> items;

        public ListLiteral(List<ExprInterface> items, SourceLocation location) {
            super(location);
            this.items = (items == null) ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(items));
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitListLiteralExpr(this);
        }
    }

    /** Dict literal. Entries keep source order; duplicates are rejected at evaluation. */
    public static final class MapLiteral extends Node implements ExprInterface {
        public final List<Entry> entries;

        public MapLiteral(List<Entry> entries, SourceLocation location) {
            super(location);
            this.entries = (entries == null) ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(entries));
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitMapLiteralExpr(this);
        }

        public static final class Entry {
            public final String key;
            public final ExprInterface value;

            public Entry(String key, ExprInterface value) {
                this.key = key;
                this.value = value;
            }
        }
    }

    // -------------------------
    // Variables
    // -------------------------

    public static final class Variable extends Node implements ExprInterface {
        public final String name;

        public Variable(String name, SourceLocation location) {
            super(location);
            this.name = name;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitVariableExpr(this);
        }
    }

    public static final class Assign extends Node implements ExprInterface {
        public final String name;
        public final ExprInterface value;

        public Assign(String name, ExprInterface value, SourceLocation location) {
            super(location);
            this.name = name;
            this.value = value;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitAssignExpr(this);
        }
    }

    // -------------------------
    // Operators
    // -------------------------

    public static final class Unary extends Node implements ExprInterface {
        public final UnaryOp operator;
        public final ExprInterface right;

        public Unary(UnaryOp operator, ExprInterface right, SourceLocation location) {
            super(location);
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitUnaryExpr(this);
        }
    }

    public static final class Binary extends Node implements ExprInterface {
        public final ExprInterface left;
        public final BinaryOp operator;
        public final ExprInterface right;

        public Binary(ExprInterface left, BinaryOp operator, ExprInterface right, SourceLocation location) {
            super(location);
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBinaryExpr(this);
        }
    }

    public static final class Logical extends Node implements ExprInterface {
        public final ExprInterface left;
        public final LogicalOp operator;
        public final ExprInterface right;

        public Logical(ExprInterface left, LogicalOp operator, ExprInterface right, SourceLocation location) {
            super(location);
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLogicalExpr(this);
        }
    }

    // -------------------------
    // Calls
    // -------------------------

    /** Bare call: {@code name(args)}. */
    public static final class Call extends Node implements ExprInterface {
        public final String name;
        public final List<ExprInterface> arguments;

        public Call(String name, List<ExprInterface> arguments, SourceLocation location) {
            super(location);
            this.name = name;
            this.arguments = (arguments == null) ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(arguments));
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitCallExpr(this);
        }
    }

    /** Qualified call: {@code receiver.method(args)}; receiver may be an instance, a class name or a dict. */
    public static final class MethodCallExpr extends Node implements ExprInterface {
        public final ExprInterface receiver;
        public final String method;
        public final List<ExprInterface> arguments;

        public MethodCallExpr(ExprInterface receiver, String method, List<ExprInterface> arguments, SourceLocation location) {
            super(location);
            this.receiver = receiver;
            this.method = method;
            this.arguments = (arguments == null) ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(arguments));
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitMethodCallExpr(this);
        }
    }

    public static final class NewExpr extends Node implements ExprInterface {
        public final String className;
        public final List<ExprInterface> args;

        public NewExpr(String className, List<ExprInterface> args, SourceLocation location) {
            super(location);
            this.className = className;
            this.args = (args == null) ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(args));
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitNewExpr(this);
        }
    }

    // -------------------------
    // Member and index access
    // -------------------------

    public static final class GetExpr extends Node implements ExprInterface {
        public final ExprInterface receiver;
        public final String name;

        public GetExpr(ExprInterface receiver, String name, SourceLocation location) {
            super(location);
            this.receiver = receiver;
            this.name = name;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitGetExpr(this);
        }
    }

    public static final class SetExpr extends Node implements ExprInterface {
        public final ExprInterface receiver;
        public final String name;
        public final ExprInterface value;

        public SetExpr(ExprInterface receiver, String name, ExprInterface value, SourceLocation location) {
            super(location);
            this.receiver = receiver;
            this.name = name;
            this.value = value;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitSetExpr(this);
        }
    }

    public static final class IndexExpr extends Node implements ExprInterface {
        public final ExprInterface target;
        public final ExprInterface index;

        public IndexExpr(ExprInterface target, ExprInterface index, SourceLocation location) {
            super(location);
            this.target = target;
            this.index = index;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitIndexExpr(this);
        }
    }

    public static final class SetIndexExpr extends Node implements ExprInterface {
        public final ExprInterface target;
        public final ExprInterface index;
        public final ExprInterface value;

        public SetIndexExpr(ExprInterface target, ExprInterface index, ExprInterface value, SourceLocation location) {
            super(location);
            this.target = target;
            this.index = index;
            this.value = value;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitSetIndexExpr(this);
        }
    }
}
