package com.spreadsheet.engine.fill;

import com.spreadsheet.engine.models.CellValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 2, 4, 8 -> 16, 32. Zeros never form a series.
 */
public class ExponentialPatternDetector implements PatternDetector {

    @Override
    public PatternType.Kind getKind() {
        return PatternType.Kind.EXPONENTIAL;
    }

    @Override
    public int getPriority() {
        return 70;
    }

    @Override
    public boolean canHandle(List<CellValue> values) {
        return nonZero(values).size() >= 2;
    }

    @Override
    public Optional<PatternType> detect(List<CellValue> values) {
        List<Double> numbers = LinearPatternDetector.numbers(values);
        if (numbers.size() < 2 || numbers.contains(0.0)) {
            return Optional.empty();
        }
        double rate = numbers.get(1) / numbers.get(0);
        for (int i = 2; i < numbers.size(); i++) {
            if (Math.abs(numbers.get(i) / numbers.get(i - 1) - rate) >= LinearPatternDetector.TOLERANCE) {
                return Optional.empty();
            }
        }
        if (Math.abs(rate - 1.0) < LinearPatternDetector.TOLERANCE) {
            return Optional.empty();
        }
        return Optional.of(PatternType.exponential(rate));
    }

    @Override
    public List<CellValue> generate(List<CellValue> source, PatternType pattern, int count) {
        double current = LinearPatternDetector.lastNumber(source);
        List<CellValue> result = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            current *= pattern.getParameter();
            result.add(CellValue.number(current));
        }
        return result;
    }

    private static List<Double> nonZero(List<CellValue> values) {
        List<Double> result = new ArrayList<>();
        for (double n : LinearPatternDetector.numbers(values)) {
            if (n != 0.0) {
                result.add(n);
            }
        }
        return result;
    }
}
