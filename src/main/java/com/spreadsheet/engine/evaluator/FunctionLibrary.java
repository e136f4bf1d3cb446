package com.spreadsheet.engine.evaluator;

import com.spreadsheet.engine.models.CellValue;
import com.spreadsheet.engine.models.ErrorType;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.DoubleUnaryOperator;
import java.util.function.Function;

/**
 * Registry of the functions formulas can call, keyed by uppercase name.
 * Comes with a small set of built-ins; more can be registered at any time.
 */
public class FunctionLibrary {

    private final Map<String, SpreadsheetFunction> functions = new ConcurrentHashMap<>();

    public FunctionLibrary() {
        registerMathFunctions();
        registerTextFunctions();
        registerLogicalFunctions();
    }

    public void register(String name, SpreadsheetFunction function) {
        functions.put(name.toUpperCase(), function);
    }

    public boolean contains(String name) {
        return functions.containsKey(name.toUpperCase());
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(new TreeSet<>(functions.keySet()));
    }

    /**
     * Calls a function by name.
     *
     * @return the result, or a #NAME? error value if no such function is registered
     */
    public CellValue call(String name, List<CellValue> args) {
        SpreadsheetFunction function = functions.get(name.toUpperCase());
        if (function == null) {
            return CellValue.error(ErrorType.NAME_ERROR, "Unknown function: " + name);
        }
        return function.apply(args);
    }

    // ----------------------------------------------------------------
    // Built-ins
    // ----------------------------------------------------------------

    private void registerMathFunctions() {
        register("SUM", args -> {
            CellValue error = firstError(args);
            if (error != null) {
                return error;
            }
            double sum = 0;
            for (double n : numbers(args)) {
                sum += n;
            }
            return CellValue.number(sum);
        });

        register("AVERAGE", args -> {
            CellValue error = firstError(args);
            if (error != null) {
                return error;
            }
            List<Double> numbers = numbers(args);
            if (numbers.isEmpty()) {
                return CellValue.error(ErrorType.DIVIDE_BY_ZERO, "AVERAGE of no numbers");
            }
            double sum = 0;
            for (double n : numbers) {
                sum += n;
            }
            return CellValue.number(sum / numbers.size());
        });

        register("MIN", args -> extreme(args, true));
        register("MAX", args -> extreme(args, false));

        register("COUNT", args -> {
            // COUNT ignores errors instead of propagating them
            int count = 0;
            for (CellValue value : flatten(args)) {
                if (value.isNumber()) {
                    count++;
                }
            }
            return CellValue.number(count);
        });

        register("ROUND", args -> {
            if (args.size() != 2) {
                return arity("ROUND", "2");
            }
            CellValue error = firstError(args);
            if (error != null) {
                return error;
            }
            Double value = Operators.toNumber(args.get(0));
            Double digits = Operators.toNumber(args.get(1));
            if (value == null || digits == null) {
                return CellValue.error(ErrorType.VALUE_ERROR, "ROUND expects numbers");
            }
            BigDecimal rounded = BigDecimal.valueOf(value).setScale(digits.intValue(), RoundingMode.HALF_UP);
            return CellValue.number(rounded.doubleValue());
        });

        register("ABS", args -> unaryNumeric("ABS", args, Math::abs));

        register("SQRT", args -> {
            if (args.size() != 1) {
                return arity("SQRT", "1");
            }
            CellValue arg = args.get(0);
            if (arg.isError()) {
                return arg;
            }
            Double n = Operators.toNumber(arg);
            if (n == null) {
                return CellValue.error(ErrorType.VALUE_ERROR, "SQRT expects a number");
            }
            if (n < 0) {
                return CellValue.error(ErrorType.NUM_ERROR, "SQRT of a negative number");
            }
            return CellValue.number(Math.sqrt(n));
        });
    }

    private void registerTextFunctions() {
        register("CONCATENATE", args -> {
            CellValue error = firstError(args);
            if (error != null) {
                return error;
            }
            StringBuilder sb = new StringBuilder();
            for (CellValue value : flatten(args)) {
                sb.append(value.toDisplayString());
            }
            return CellValue.string(sb.toString());
        });

        register("LEN", args -> unaryText("LEN", args, s -> CellValue.number(s.length())));
        register("UPPER", args -> unaryText("UPPER", args, s -> CellValue.string(s.toUpperCase())));
        register("LOWER", args -> unaryText("LOWER", args, s -> CellValue.string(s.toLowerCase())));
        register("TRIM", args -> unaryText("TRIM", args,
                s -> CellValue.string(s.trim().replaceAll("\\s+", " "))));
    }

    private void registerLogicalFunctions() {
        register("IF", args -> {
            if (args.size() < 2 || args.size() > 3) {
                return arity("IF", "2 or 3");
            }
            CellValue condition = args.get(0);
            if (condition.isError()) {
                return condition;
            }
            Boolean test = Operators.toBoolean(condition);
            if (test == null) {
                return CellValue.error(ErrorType.VALUE_ERROR, "IF condition is not a boolean");
            }
            if (test) {
                return args.get(1);
            }
            return args.size() == 3 ? args.get(2) : CellValue.FALSE;
        });

        register("AND", args -> logical("AND", args, true));
        register("OR", args -> logical("OR", args, false));

        register("NOT", args -> {
            if (args.size() != 1) {
                return arity("NOT", "1");
            }
            if (args.get(0).isError()) {
                return args.get(0);
            }
            Boolean b = Operators.toBoolean(args.get(0));
            if (b == null) {
                return CellValue.error(ErrorType.VALUE_ERROR, "NOT expects a boolean");
            }
            return CellValue.bool(!b);
        });

        register("IFERROR", args -> {
            if (args.size() != 2) {
                return arity("IFERROR", "2");
            }
            return args.get(0).isError() ? args.get(1) : args.get(0);
        });

        register("ISERROR", args -> {
            if (args.size() != 1) {
                return arity("ISERROR", "1");
            }
            return CellValue.bool(args.get(0).isError());
        });

        register("ISBLANK", args -> {
            if (args.size() != 1) {
                return arity("ISBLANK", "1");
            }
            return CellValue.bool(args.get(0).isEmpty());
        });
    }

    // ----------------------------------------------------------------
    // Helpers
    // ----------------------------------------------------------------

    private static CellValue extreme(List<CellValue> args, boolean min) {
        CellValue error = firstError(args);
        if (error != null) {
            return error;
        }
        List<Double> numbers = numbers(args);
        if (numbers.isEmpty()) {
            return CellValue.number(0);
        }
        double result = numbers.get(0);
        for (double n : numbers) {
            result = min ? Math.min(result, n) : Math.max(result, n);
        }
        return CellValue.number(result);
    }

    private static CellValue logical(String name, List<CellValue> args, boolean all) {
        if (args.isEmpty()) {
            return arity(name, "at least 1");
        }
        CellValue error = firstError(args);
        if (error != null) {
            return error;
        }
        boolean seen = false;
        boolean result = all;
        for (CellValue value : flatten(args)) {
            if (value.isEmpty()) {
                continue;
            }
            Boolean b = Operators.toBoolean(value);
            if (b == null) {
                if (value.isString()) {
                    continue;
                }
                return CellValue.error(ErrorType.VALUE_ERROR, name + " expects booleans");
            }
            seen = true;
            result = all ? result && b : result || b;
        }
        if (!seen) {
            return CellValue.error(ErrorType.VALUE_ERROR, name + " found no logical values");
        }
        return CellValue.bool(result);
    }

    private static CellValue unaryNumeric(String name, List<CellValue> args,
                                          DoubleUnaryOperator op) {
        if (args.size() != 1) {
            return arity(name, "1");
        }
        CellValue arg = args.get(0);
        if (arg.isError()) {
            return arg;
        }
        Double n = Operators.toNumber(arg);
        if (n == null) {
            return CellValue.error(ErrorType.VALUE_ERROR, name + " expects a number");
        }
        return CellValue.number(op.applyAsDouble(n));
    }

    private static CellValue unaryText(String name, List<CellValue> args,
                                       Function<String, CellValue> op) {
        if (args.size() != 1) {
            return arity(name, "1");
        }
        CellValue arg = args.get(0);
        if (arg.isError()) {
            return arg;
        }
        String text = Operators.toText(arg);
        if (text == null) {
            return CellValue.error(ErrorType.VALUE_ERROR, name + " expects a single value");
        }
        return op.apply(text);
    }

    private static CellValue arity(String name, String expected) {
        return CellValue.error(ErrorType.INVALID_ARGUMENTS, name + " expects " + expected + " argument(s)");
    }

    /**
     * First error among the arguments, looking inside arrays.
     */
    static CellValue firstError(List<CellValue> args) {
        for (CellValue value : flatten(args)) {
            if (value.isError()) {
                return value;
            }
        }
        return null;
    }

    static List<CellValue> flatten(List<CellValue> args) {
        List<CellValue> result = new ArrayList<>();
        for (CellValue arg : args) {
            if (arg.isArray()) {
                result.addAll(flatten(arg.getArray()));
            } else {
                result.add(arg);
            }
        }
        return result;
    }

    /**
     * Numbers for aggregate functions. Values typed directly as arguments coerce
     * (SUM(TRUE, "2")), while text and booleans inside ranges are skipped.
     */
    static List<Double> numbers(List<CellValue> args) {
        List<Double> result = new ArrayList<>();
        for (CellValue arg : args) {
            if (arg.isArray()) {
                for (CellValue value : flatten(arg.getArray())) {
                    if (value.isNumber()) {
                        result.add(value.getNumber());
                    }
                }
            } else if (!arg.isEmpty()) {
                Double n = Operators.toNumber(arg);
                if (n != null) {
                    result.add(n);
                }
            }
        }
        return result;
    }
}
