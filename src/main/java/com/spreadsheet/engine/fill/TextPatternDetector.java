package com.spreadsheet.engine.fill;

import com.spreadsheet.engine.exceptions.InvalidOperationException;
import com.spreadsheet.engine.models.CellValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * "Item 1", "Item 2" -> "Item 3". The prefix and suffix must match across the
 * source; the number keeps its zero padding ("Q007" -> "Q008").
 */
public class TextPatternDetector implements PatternDetector {

    private static final Pattern TEXT_WITH_NUMBER = Pattern.compile("^(.*?)(\\d+)(\\D*)$");

    @Override
    public PatternType.Kind getKind() {
        return PatternType.Kind.TEXT;
    }

    @Override
    public int getPriority() {
        return 50;
    }

    @Override
    public boolean canHandle(List<CellValue> values) {
        int count = 0;
        for (CellValue value : values) {
            if (value.isString()) {
                count++;
            }
        }
        return count >= 2;
    }

    @Override
    public Optional<PatternType> detect(List<CellValue> values) {
        List<Parts> parts = new ArrayList<>();
        for (CellValue value : values) {
            if (!value.isString()) {
                continue;
            }
            Parts p = Parts.of(value.getString());
            if (p == null) {
                return Optional.empty();
            }
            parts.add(p);
        }
        if (parts.size() < 2) {
            return Optional.empty();
        }
        Parts first = parts.get(0);
        long step = parts.get(1).number - first.number;
        if (step == 0) {
            return Optional.empty();
        }
        for (int i = 1; i < parts.size(); i++) {
            Parts p = parts.get(i);
            if (!p.prefix.equals(first.prefix) || !p.suffix.equals(first.suffix)
                    || p.number - parts.get(i - 1).number != step) {
                return Optional.empty();
            }
        }
        return Optional.of(PatternType.text(step));
    }

    @Override
    public List<CellValue> generate(List<CellValue> source, PatternType pattern, int count) {
        for (int i = source.size() - 1; i >= 0; i--) {
            if (!source.get(i).isString()) {
                continue;
            }
            Parts last = Parts.of(source.get(i).getString());
            if (last != null) {
                long step = (long) pattern.getParameter();
                List<CellValue> result = new ArrayList<>(count);
                for (int n = 1; n <= count; n++) {
                    result.add(CellValue.string(last.with(last.number + step * n)));
                }
                return result;
            }
        }
        throw new InvalidOperationException("No numbered text found in fill source");
    }

    private static final class Parts {
        final String prefix;
        final long number;
        final int width;
        final String suffix;

        Parts(String prefix, long number, int width, String suffix) {
            this.prefix = prefix;
            this.number = number;
            this.width = width;
            this.suffix = suffix;
        }

        static Parts of(String text) {
            Matcher m = TEXT_WITH_NUMBER.matcher(text);
            if (!m.matches() || m.group(2).length() > 18) {
                return null;
            }
            return new Parts(m.group(1), Long.parseLong(m.group(2)), m.group(2).length(), m.group(3));
        }

        String with(long n) {
            String digits = Long.toString(Math.abs(n));
            StringBuilder sb = new StringBuilder(prefix);
            if (n < 0) {
                sb.append('-');
            }
            for (int i = digits.length(); i < width; i++) {
                sb.append('0');
            }
            return sb.append(digits).append(suffix).toString();
        }
    }
}
