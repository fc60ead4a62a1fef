package com.ciro.jwebtemplate.expr;

import com.ciro.jwebtemplate.exception.EvaluationException;

/** Binary and unary operator semantics for {@link SimpleExpressionEvaluator}. */
final class Operators {

    private Operators() {}

    static boolean looseEquals(Object a, Object b) {
        if (a == null || b == null) return a == b;
        if (a instanceof Number && b instanceof Number) {
            return ((Number) a).doubleValue() == ((Number) b).doubleValue();
        }
        if (a instanceof Number || b instanceof Number) {
            // "1" == 1
            double x = TemplateValues.toNumber(a);
            double y = TemplateValues.toNumber(b);
            return !Double.isNaN(x) && x == y;
        }
        if (a instanceof Boolean || b instanceof Boolean) {
            return TemplateValues.isTruthy(a) == TemplateValues.isTruthy(b);
        }
        return a.equals(b) || TemplateValues.toText(a).equals(TemplateValues.toText(b));
    }

    static boolean compare(String op, Object a, Object b) {
        int c;
        if (a instanceof String sa && b instanceof String sb) {
            c = sa.compareTo(sb);
        } else {
            double x = TemplateValues.toNumber(a);
            double y = TemplateValues.toNumber(b);
            if (Double.isNaN(x) || Double.isNaN(y)) return false;
            c = Double.compare(x, y);
        }
        switch (op) {
            case "<":
                return c < 0;
            case "<=":
                return c <= 0;
            case ">":
                return c > 0;
            case ">=":
                return c >= 0;
            default:
                throw new EvaluationException("Unknown comparison " + op);
        }
    }

    static Object plus(Object a, Object b) {
        if (a instanceof String || b instanceof String) {
            return TemplateValues.toText(a) + TemplateValues.toText(b);
        }
        return arithmetic('+', a, b);
    }

    static Object arithmetic(char op, Object a, Object b) {
        if (TemplateValues.isIntegral(a) && TemplateValues.isIntegral(b) && op != '/') {
            long x = ((Number) a).longValue();
            long y = ((Number) b).longValue();
            switch (op) {
                case '+':
                    return narrow(x + y);
                case '-':
                    return narrow(x - y);
                case '*':
                    return narrow(x * y);
                case '%':
                    if (y == 0) return Double.NaN;
                    return narrow(x % y);
                default:
                    break;
            }
        }
        double x = TemplateValues.toNumber(a);
        double y = TemplateValues.toNumber(b);
        double r;
        switch (op) {
            case '+':
                r = x + y;
                break;
            case '-':
                r = x - y;
                break;
            case '*':
                r = x * y;
                break;
            case '/':
                r = x / y;
                break;
            case '%':
                r = x % y;
                break;
            default:
                throw new EvaluationException("Unknown operator " + op);
        }
        return r;
    }

    static Object negate(Object a) {
        if (TemplateValues.isIntegral(a)) return narrow(-((Number) a).longValue());
        return -TemplateValues.toNumber(a);
    }

    private static Object narrow(long l) {
        return l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE ? (Object) (int) l : (Object) l;
    }
}
