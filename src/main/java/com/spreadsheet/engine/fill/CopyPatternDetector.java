package com.spreadsheet.engine.fill;

import com.spreadsheet.engine.models.CellValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Fallback: repeats the source values in order.
 */
public class CopyPatternDetector implements PatternDetector {

    @Override
    public PatternType.Kind getKind() {
        return PatternType.Kind.COPY;
    }

    @Override
    public int getPriority() {
        return 0;
    }

    @Override
    public boolean canHandle(List<CellValue> values) {
        return !values.isEmpty();
    }

    @Override
    public Optional<PatternType> detect(List<CellValue> values) {
        return Optional.of(PatternType.copy());
    }

    @Override
    public List<CellValue> generate(List<CellValue> source, PatternType pattern, int count) {
        List<CellValue> result = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            result.add(source.get(i % source.size()));
        }
        return result;
    }
}
