package com.spreadsheet.engine.fill;

import com.spreadsheet.engine.exceptions.InvalidOperationException;
import com.spreadsheet.engine.models.CellValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 1, 2, 3 -> 4, 5, 6.
 */
public class LinearPatternDetector implements PatternDetector {

    static final double TOLERANCE = 1e-10;

    @Override
    public PatternType.Kind getKind() {
        return PatternType.Kind.LINEAR;
    }

    @Override
    public int getPriority() {
        return 80;
    }

    @Override
    public boolean canHandle(List<CellValue> values) {
        return numbers(values).size() >= 2;
    }

    @Override
    public Optional<PatternType> detect(List<CellValue> values) {
        List<Double> numbers = numbers(values);
        if (numbers.size() < 2) {
            return Optional.empty();
        }
        double slope = numbers.get(1) - numbers.get(0);
        for (int i = 2; i < numbers.size(); i++) {
            if (Math.abs((numbers.get(i) - numbers.get(i - 1)) - slope) >= TOLERANCE) {
                return Optional.empty();
            }
        }
        return Optional.of(PatternType.linear(slope));
    }

    @Override
    public List<CellValue> generate(List<CellValue> source, PatternType pattern, int count) {
        double current = lastNumber(source);
        List<CellValue> result = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            current += pattern.getParameter();
            result.add(CellValue.number(current));
        }
        return result;
    }

    static List<Double> numbers(List<CellValue> values) {
        List<Double> result = new ArrayList<>();
        for (CellValue value : values) {
            if (value.isNumber()) {
                result.add(value.getNumber());
            }
        }
        return result;
    }

    static double lastNumber(List<CellValue> source) {
        for (int i = source.size() - 1; i >= 0; i--) {
            if (source.get(i).isNumber()) {
                return source.get(i).getNumber();
            }
        }
        throw new InvalidOperationException("No numeric value found in fill source");
    }
}
