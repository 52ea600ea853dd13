package com.tinyscript.script.runtime;

import java.util.ArrayList;
import java.util.List;

import com.tinyscript.script.ast.Expr.BinaryOp;

/**
 * Operator semantics over {@link Value}s.
 *
 * Two integers stay integral and fail with NUMERIC_OVERFLOW instead of
 * wrapping. Any double operand switches to IEEE arithmetic. Integer
 * division yields an integer only when it is exact.
 */
public final class Arithmetic {

    private Arithmetic() {}

    public static Value binary(BinaryOp op, Value left, Value right) {
        switch (op) {
            case ADD: return add(left, right);
            case SUB: return subtract(left, right);
            case MUL: return multiply(left, right);
            case DIV: return divide(left, right);
            case MOD: return modulo(left, right);
            case POW: return power(left, right);
            case EQ:  return Value.bool(Value.isEqual(left, right));
            case NE:  return Value.bool(!Value.isEqual(left, right));
            case LT:  return Value.bool(compare(op, left, right) < 0);
            case LE:  return Value.bool(compare(op, left, right) <= 0);
            case GT:  return Value.bool(compare(op, left, right) > 0);
            case GE:  return Value.bool(compare(op, left, right) >= 0);
            default:
                throw new IllegalStateException("Unhandled operator: " + op);
        }
    }

    public static Value negate(Value operand) {
        requireNumber("-", operand);
        if (operand.isInteger()) {
            try {
                return Value.number(Math.negateExact(operand.asLong()));
            } catch (ArithmeticException e) {
                throw overflow("-", e);
            }
        }
        return Value.number(-operand.asDouble());
    }

    public static Value add(Value left, Value right) {
        if (left.type == Value.Type.NUMBER && right.type == Value.Type.NUMBER) {
            if (left.isInteger() && right.isInteger()) {
                try {
                    return Value.number(Math.addExact(left.asLong(), right.asLong()));
                } catch (ArithmeticException e) {
                    throw overflow("+", e);
                }
            }
            return Value.number(left.asDouble() + right.asDouble());
        }

        if (left.type == Value.Type.STRING || right.type == Value.Type.STRING) {
            return Value.string(left.display() + right.display());
        }

        if (left.type == Value.Type.LIST && right.type == Value.Type.LIST) {
            List<Value> joined = new ArrayList<>(left.asList());
            joined.addAll(right.asList());
            return Value.list(joined);
        }

        throw unsupported("+", left, right);
    }

    public static Value subtract(Value left, Value right) {
        requireNumbers("-", left, right);
        if (left.isInteger() && right.isInteger()) {
            try {
                return Value.number(Math.subtractExact(left.asLong(), right.asLong()));
            } catch (ArithmeticException e) {
                throw overflow("-", e);
            }
        }
        return Value.number(left.asDouble() - right.asDouble());
    }

    public static Value multiply(Value left, Value right) {
        requireNumbers("*", left, right);
        if (left.isInteger() && right.isInteger()) {
            try {
                return Value.number(Math.multiplyExact(left.asLong(), right.asLong()));
            } catch (ArithmeticException e) {
                throw overflow("*", e);
            }
        }
        return Value.number(left.asDouble() * right.asDouble());
    }

    public static Value divide(Value left, Value right) {
        requireNumbers("/", left, right);
        if (left.isInteger() && right.isInteger()) {
            long a = left.asLong();
            long b = right.asLong();
            if (b == 0) throw new ScriptError(ScriptError.Kind.DIVISION_BY_ZERO, "Division by zero");
            if (a == Long.MIN_VALUE && b == -1) {
                throw new ScriptError(ScriptError.Kind.NUMERIC_OVERFLOW, "Integer overflow in '/'");
            }
            if (a % b == 0) return Value.number(a / b);
            return Value.number((double) a / (double) b);
        }
        return Value.number(left.asDouble() / right.asDouble());
    }

    public static Value modulo(Value left, Value right) {
        requireNumbers("%", left, right);
        if (left.isInteger() && right.isInteger()) {
            long b = right.asLong();
            if (b == 0) throw new ScriptError(ScriptError.Kind.DIVISION_BY_ZERO, "Modulo by zero");
            return Value.number(left.asLong() % b);
        }
        return Value.number(left.asDouble() % right.asDouble());
    }

    public static Value power(Value left, Value right) {
        requireNumbers("^", left, right);
        if (left.isInteger() && right.isInteger() && right.asLong() >= 0) {
            long base = left.asLong();
            long exp = right.asLong();
            long result = 1;
            try {
                while (exp > 0) {
                    if ((exp & 1) == 1) result = Math.multiplyExact(result, base);
                    exp >>= 1;
                    if (exp > 0) base = Math.multiplyExact(base, base);
                }
            } catch (ArithmeticException e) {
                throw overflow("^", e);
            }
            return Value.number(result);
        }
        return Value.number(Math.pow(left.asDouble(), right.asDouble()));
    }

    /**
     * Orders two numbers or two strings.
     * A NaN operand makes every ordering comparison false.
     */
    static int compare(BinaryOp op, Value left, Value right) {
        if (left.type == Value.Type.NUMBER && right.type == Value.Type.NUMBER) {
            if (left.isInteger() && right.isInteger()) {
                return Long.compare(left.asLong(), right.asLong());
            }
            double a = left.asDouble();
            double b = right.asDouble();
            if (Double.isNaN(a) || Double.isNaN(b)) return nanOrdering(op);
            if (a < b) return -1;
            if (a > b) return 1;
            return 0;
        }
        if (left.type == Value.Type.STRING && right.type == Value.Type.STRING) {
            return left.asString().compareTo(right.asString());
        }
        throw unsupported(op.symbol, left, right);
    }

    // A result for which the requested comparison evaluates to false.
    private static int nanOrdering(BinaryOp op) {
        return (op == BinaryOp.LT || op == BinaryOp.LE) ? 1 : -1;
    }

    private static void requireNumber(String op, Value v) {
        if (v.type != Value.Type.NUMBER) {
            throw ScriptError.typeMismatch("Operator '" + op + "' expects a number, got " + v.typeName());
        }
    }

    private static void requireNumbers(String op, Value a, Value b) {
        if (a.type != Value.Type.NUMBER || b.type != Value.Type.NUMBER) {
            throw unsupported(op, a, b);
        }
    }

    private static ScriptError unsupported(String op, Value a, Value b) {
        return ScriptError.typeMismatch("Unsupported operand types for '" + op + "': "
                + a.typeName() + ", " + b.typeName());
    }

    private static ScriptError overflow(String op, ArithmeticException cause) {
        return new ScriptError(ScriptError.Kind.NUMERIC_OVERFLOW, "Integer overflow in '" + op + "'", cause);
    }
}
