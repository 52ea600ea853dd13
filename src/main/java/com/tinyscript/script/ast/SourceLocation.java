package com.tinyscript.script.ast;

import java.util.Objects;

/** Line/column position of a tree node in the source the external parser read. */
public final class SourceLocation {

    public static final SourceLocation UNKNOWN = new SourceLocation(0, 0);

    public final int line;
    public final int column;

    public SourceLocation(int line, int column) {
        this.line = line;
        this.column = column;
    }

    public static SourceLocation at(int line) {
        return new SourceLocation(line, 0);
    }

    public boolean isKnown() {
        return line > 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceLocation)) return false;
        SourceLocation that = (SourceLocation) o;
        return line == that.line && column == that.column;
    }

    @Override
    public int hashCode() {
        return Objects.hash(line, column);
    }

    @Override
    public String toString() {
        if (!isKnown()) return "<unknown>";
        return column > 0 ? ("line " + line + ":" + column) : ("line " + line);
    }
}
