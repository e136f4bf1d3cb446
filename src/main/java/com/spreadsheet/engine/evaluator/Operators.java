package com.spreadsheet.engine.evaluator;

import com.spreadsheet.engine.formula.BinaryOperator;
import com.spreadsheet.engine.formula.UnaryOperator;
import com.spreadsheet.engine.models.CellValue;
import com.spreadsheet.engine.models.ErrorType;

/**
 * Operator semantics and value coercion.
 * Nothing here throws: type mismatches, division by zero and overflow all
 * come back as error values so they can propagate to dependents.
 */
public final class Operators {

    private static final double EPSILON = 1e-10;

    private Operators() {
    }

    public static CellValue applyUnary(UnaryOperator operator, CellValue operand) {
        if (operand.isError()) {
            return operand;
        }
        Double n = toNumber(operand);
        if (n == null) {
            return CellValue.error(ErrorType.VALUE_ERROR, "Cannot apply " + operator + " to " + operand);
        }
        return operator == UnaryOperator.NEGATE ? CellValue.number(-n) : CellValue.number(n / 100.0);
    }

    public static CellValue applyBinary(BinaryOperator operator, CellValue left, CellValue right) {
        // errors propagate, left operand first
        if (left.isError()) {
            return left;
        }
        if (right.isError()) {
            return right;
        }
        switch (operator) {
            case ADD:
            case SUBTRACT:
            case MULTIPLY:
            case DIVIDE:
            case POWER:
                return arithmetic(operator, left, right);
            case CONCAT:
                return concat(left, right);
            case EQUAL:
                return CellValue.bool(valuesEqual(left, right));
            case NOT_EQUAL:
                return CellValue.bool(!valuesEqual(left, right));
            default:
                return compare(operator, left, right);
        }
    }

    private static CellValue arithmetic(BinaryOperator operator, CellValue left, CellValue right) {
        Double a = toNumber(left);
        Double b = toNumber(right);
        if (a == null || b == null) {
            return CellValue.error(ErrorType.VALUE_ERROR, "Cannot apply " + operator.getSymbol()
                    + " to " + left.toDisplayString() + " and " + right.toDisplayString());
        }
        double result;
        switch (operator) {
            case ADD:
                result = a + b;
                break;
            case SUBTRACT:
                result = a - b;
                break;
            case MULTIPLY:
                result = a * b;
                break;
            case DIVIDE:
                if (b == 0.0) {
                    return CellValue.error(ErrorType.DIVIDE_BY_ZERO);
                }
                result = a / b;
                break;
            default:
                result = Math.pow(a, b);
                break;
        }
        if (Double.isNaN(result) || Double.isInfinite(result)) {
            return CellValue.error(ErrorType.NUM_ERROR);
        }
        return CellValue.number(result);
    }

    private static CellValue concat(CellValue left, CellValue right) {
        String a = toText(left);
        String b = toText(right);
        if (a == null || b == null) {
            return CellValue.error(ErrorType.VALUE_ERROR, "Cannot concatenate arrays");
        }
        return CellValue.string(a + b);
    }

    private static CellValue compare(BinaryOperator operator, CellValue left, CellValue right) {
        Integer order = compareValues(left, right);
        if (order == null) {
            return CellValue.error(ErrorType.VALUE_ERROR, "Cannot compare " + left + " and " + right);
        }
        switch (operator) {
            case LESS_THAN:
                return CellValue.bool(order < 0);
            case LESS_THAN_OR_EQUAL:
                return CellValue.bool(order <= 0);
            case GREATER_THAN:
                return CellValue.bool(order > 0);
            default:
                return CellValue.bool(order >= 0);
        }
    }

    /**
     * Equality as the = operator sees it: numbers within 1e-10, strings ignoring case.
     * Empty equals 0, "" and FALSE.
     */
    public static boolean valuesEqual(CellValue left, CellValue right) {
        if (left.isEmpty() || right.isEmpty()) {
            CellValue other = left.isEmpty() ? right : left;
            switch (other.getKind()) {
                case EMPTY:
                    return true;
                case NUMBER:
                    return other.getNumber() == 0.0;
                case STRING:
                    return other.getString().isEmpty();
                case BOOLEAN:
                    return !other.getBoolean();
                default:
                    return false;
            }
        }
        if (left.getKind() != right.getKind()) {
            return false;
        }
        switch (left.getKind()) {
            case NUMBER:
                return Math.abs(left.getNumber() - right.getNumber()) < EPSILON;
            case STRING:
                return left.getString().equalsIgnoreCase(right.getString());
            default:
                return left.equals(right);
        }
    }

    /**
     * Ordering used by the comparison operators.
     * Same kinds compare naturally; Empty sorts first; mixed kinds compare as
     * numbers when both coerce, otherwise as text.
     *
     * @return negative/zero/positive, or null when the values cannot be ordered
     */
    static Integer compareValues(CellValue left, CellValue right) {
        if (left.isArray() || right.isArray()) {
            return null;
        }
        if (left.isEmpty() && right.isEmpty()) {
            return 0;
        }
        if (left.isEmpty()) {
            return -1;
        }
        if (right.isEmpty()) {
            return 1;
        }
        if (left.getKind() == right.getKind()) {
            switch (left.getKind()) {
                case NUMBER:
                    return Double.compare(left.getNumber(), right.getNumber());
                case STRING:
                    return Integer.signum(left.getString().compareToIgnoreCase(right.getString()));
                default:
                    return Boolean.compare(left.getBoolean(), right.getBoolean());
            }
        }
        Double a = toNumber(left);
        Double b = toNumber(right);
        if (a != null && b != null) {
            return Double.compare(a, b);
        }
        return Integer.signum(toText(left).compareToIgnoreCase(toText(right)));
    }

    /**
     * Numeric view of a value: booleans are 1/0, numeric text parses, Empty is 0.
     *
     * @return the number, or null if the value does not coerce
     */
    public static Double toNumber(CellValue value) {
        switch (value.getKind()) {
            case NUMBER:
                return value.getNumber();
            case BOOLEAN:
                return value.getBoolean() ? 1.0 : 0.0;
            case EMPTY:
                return 0.0;
            case STRING:
                return parseNumber(value.getString());
            default:
                return null;
        }
    }

    /**
     * Boolean view of a value: numbers are true when non-zero, "TRUE"/"FALSE" text converts,
     * Empty is false.
     *
     * @return the boolean, or null if the value does not coerce
     */
    public static Boolean toBoolean(CellValue value) {
        switch (value.getKind()) {
            case BOOLEAN:
                return value.getBoolean();
            case NUMBER:
                return value.getNumber() != 0.0;
            case EMPTY:
                return false;
            case STRING:
                String text = value.getString().trim();
                if ("TRUE".equalsIgnoreCase(text)) {
                    return true;
                }
                if ("FALSE".equalsIgnoreCase(text)) {
                    return false;
                }
                return null;
            default:
                return null;
        }
    }

    /**
     * Text view of a value, as the &amp; operator sees it.
     *
     * @return the text, or null for arrays
     */
    public static String toText(CellValue value) {
        if (value.isArray()) {
            return null;
        }
        return value.toDisplayString();
    }

    /**
     * Strict decimal parse: optional sign, digits with an optional fraction, optional exponent.
     * Rejects the extras Double.parseDouble allows ("NaN", "1d", hex).
     */
    public static Double parseNumber(String text) {
        String s = text.trim();
        if (s.isEmpty()) {
            return null;
        }
        int i = 0;
        if (s.charAt(i) == '+' || s.charAt(i) == '-') {
            i++;
        }
        int digits = 0;
        while (i < s.length() && isAsciiDigit(s.charAt(i))) {
            i++;
            digits++;
        }
        if (i < s.length() && s.charAt(i) == '.') {
            i++;
            while (i < s.length() && isAsciiDigit(s.charAt(i))) {
                i++;
                digits++;
            }
        }
        if (digits == 0) {
            return null;
        }
        if (i < s.length() && (s.charAt(i) == 'e' || s.charAt(i) == 'E')) {
            i++;
            if (i < s.length() && (s.charAt(i) == '+' || s.charAt(i) == '-')) {
                i++;
            }
            int expDigits = 0;
            while (i < s.length() && isAsciiDigit(s.charAt(i))) {
                i++;
                expDigits++;
            }
            if (expDigits == 0) {
                return null;
            }
        }
        if (i != s.length()) {
            return null;
        }
        double value = Double.parseDouble(s);
        return Double.isInfinite(value) ? null : value;
    }

    // 0-9 only; other Unicode digits are plain text
    private static boolean isAsciiDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
