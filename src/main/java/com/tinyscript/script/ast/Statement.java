package com.tinyscript.script.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class Statement {

    public interface Stmt {
        void accept(StmtVisitor visitor);
        SourceLocation location();
    }

    public interface StmtVisitor {
        void visitExprStmt(ExprStmt stmt);
        void visitVarStmt(VarStmt stmt);
        void visitBlockStmt(Block stmt);
        void visitIfStmt(If stmt);
        void visitWhileStmt(While stmt);
        void visitForRangeStmt(ForRange stmt);
        void visitForEachStmt(ForEach stmt);
        void visitReturnStmt(ReturnStmt stmt);
        void visitBreakStmt(BreakStmt stmt);
        void visitAssertStmt(AssertStmt stmt);
        void visitPrintStmt(PrintStmt stmt);
    }

    static List<Stmt> freeze(List<Stmt> body) {
        return (body == null) ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(body));
    }

    public static final class ExprStmt extends Node implements Stmt {
        public final Expr.ExprInterface expression;

        public ExprStmt(Expr.ExprInterface expression, SourceLocation location) {
            super(location);
            this.expression = expression;
        }

        public void accept(StmtVisitor visitor) { visitor.visitExprStmt(this); }
    }

    public static final class VarStmt extends Node implements Stmt {
        public final String name;
        public final Expr.ExprInterface initializer;

        public VarStmt(String name, Expr.ExprInterface initializer, SourceLocation location) {
            super(location);
            this.name = name;
            this.initializer = initializer;
        }

        public void accept(StmtVisitor visitor) { visitor.visitVarStmt(this); }
    }

    public static final class Block extends Node implements Stmt {
        public final List<Stmt> statements;

        public Block(List<Stmt> statements, SourceLocation location) {
            super(location);
            this.statements = freeze(statements);
        }

        public void accept(StmtVisitor visitor) { visitor.visitBlockStmt(this); }
    }

    public static final class If extends Node implements Stmt {
        public final Expr.ExprInterface condition;
        public final List<Stmt> thenBranch;
        public final List<Stmt> elseBranch; // null when there is no else

        public If(Expr.ExprInterface condition, List<Stmt> thenBranch, List<Stmt> elseBranch, SourceLocation location) {
            super(location);
            this.condition = condition;
            this.thenBranch = freeze(thenBranch);
            this.elseBranch = (elseBranch == null) ? null : freeze(elseBranch);
        }

        public void accept(StmtVisitor visitor) { visitor.visitIfStmt(this); }
    }

    public static final class While extends Node implements Stmt {
        public final Expr.ExprInterface condition;
        public final List<Stmt> body;

        public While(Expr.ExprInterface condition, List<Stmt> body, SourceLocation location) {
            super(location);
            this.condition = condition;
            this.body = freeze(body);
        }

        public void accept(StmtVisitor visitor) { visitor.visitWhileStmt(this); }
    }

    /** {@code for i = from to to step step { body }}, upper bound inclusive. */
    public static final class ForRange extends Node implements Stmt {
        public final String variable;
        public final Expr.ExprInterface from;
        public final Expr.ExprInterface to;
        public final Expr.ExprInterface step; // may be null
        public final List<Stmt> body;

        public ForRange(String variable, Expr.ExprInterface from, Expr.ExprInterface to, Expr.ExprInterface step,
                        List<Stmt> body, SourceLocation location) {
            super(location);
            this.variable = variable;
            this.from = from;
            this.to = to;
            this.step = step;
            this.body = freeze(body);
        }

        public void accept(StmtVisitor visitor) { visitor.visitForRangeStmt(this); }
    }

    /** {@code for item in iterable { body }} over list items or dict keys. */
    public static final class ForEach extends Node implements Stmt {
        public final String variable;
        public final Expr.ExprInterface iterable;
        public final List<Stmt> body;

        public ForEach(String variable, Expr.ExprInterface iterable, List<Stmt> body, SourceLocation location) {
            super(location);
            this.variable = variable;
            this.iterable = iterable;
            this.body = freeze(body);
        }

        public void accept(StmtVisitor visitor) { visitor.visitForEachStmt(this); }
    }

    public static final class ReturnStmt extends Node implements Stmt {
        public final Expr.ExprInterface value; // may be null

        public ReturnStmt(Expr.ExprInterface value, SourceLocation location) {
            super(location);
            this.value = value;
        }

        public void accept(StmtVisitor visitor) { visitor.visitReturnStmt(this); }
    }

    public static final class BreakStmt extends Node implements Stmt {
        public BreakStmt(SourceLocation location) { super(location); }

        public void accept(StmtVisitor visitor) { visitor.visitBreakStmt(this); }
    }

    public static final class AssertStmt extends Node implements Stmt {
        public final Expr.ExprInterface expression;
        /** Literal source text of the asserted expression; may be null if the producer did not keep it. */
        public final String sourceText;

        public AssertStmt(Expr.ExprInterface expression, String sourceText, SourceLocation location) {
            super(location);
            this.expression = expression;
            this.sourceText = sourceText;
        }

        public void accept(StmtVisitor visitor) { visitor.visitAssertStmt(this); }
    }

    public static final class PrintStmt extends Node implements Stmt {
        public final Expr.ExprInterface expression;

        public PrintStmt(Expr.ExprInterface expression, SourceLocation location) {
            super(location);
            this.expression = expression;
        }

        public void accept(StmtVisitor visitor) { visitor.visitPrintStmt(this); }
    }
}
