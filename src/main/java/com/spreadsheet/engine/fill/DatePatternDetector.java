package com.spreadsheet.engine.fill;

import com.spreadsheet.engine.exceptions.InvalidOperationException;
import com.spreadsheet.engine.models.CellValue;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Date strings a constant number of days apart. Generated dates keep the
 * format of the last source value.
 */
public class DatePatternDetector implements PatternDetector {

    private static final List<DateTimeFormatter> FORMATS = Arrays.asList(
            DateTimeFormatter.ofPattern("uuuu-MM-dd").withResolverStyle(ResolverStyle.STRICT),
            DateTimeFormatter.ofPattern("MM/dd/uuuu").withResolverStyle(ResolverStyle.STRICT),
            DateTimeFormatter.ofPattern("uuuu/MM/dd").withResolverStyle(ResolverStyle.STRICT));

    @Override
    public PatternType.Kind getKind() {
        return PatternType.Kind.DATE;
    }

    @Override
    public int getPriority() {
        return 60;
    }

    @Override
    public boolean canHandle(List<CellValue> values) {
        return dates(values).size() >= 2;
    }

    @Override
    public Optional<PatternType> detect(List<CellValue> values) {
        List<LocalDate> dates = dates(values);
        if (dates.size() < 2) {
            return Optional.empty();
        }
        long interval = ChronoUnit.DAYS.between(dates.get(0), dates.get(1));
        if (interval == 0) {
            return Optional.empty();
        }
        for (int i = 2; i < dates.size(); i++) {
            if (ChronoUnit.DAYS.between(dates.get(i - 1), dates.get(i)) != interval) {
                return Optional.empty();
            }
        }
        return Optional.of(PatternType.date(interval));
    }

    @Override
    public List<CellValue> generate(List<CellValue> source, PatternType pattern, int count) {
        for (int i = source.size() - 1; i >= 0; i--) {
            CellValue value = source.get(i);
            if (!value.isString()) {
                continue;
            }
            for (DateTimeFormatter format : FORMATS) {
                LocalDate last = parse(value.getString(), format);
                if (last != null) {
                    long step = (long) pattern.getParameter();
                    List<CellValue> result = new ArrayList<>(count);
                    for (int n = 1; n <= count; n++) {
                        result.add(CellValue.string(last.plusDays(step * n).format(format)));
                    }
                    return result;
                }
            }
        }
        throw new InvalidOperationException("No date found in fill source");
    }

    private static List<LocalDate> dates(List<CellValue> values) {
        List<LocalDate> result = new ArrayList<>();
        for (CellValue value : values) {
            if (value.isString()) {
                LocalDate date = parse(value.getString());
                if (date != null) {
                    result.add(date);
                }
            }
        }
        return result;
    }

    static LocalDate parse(String text) {
        for (DateTimeFormatter format : FORMATS) {
            LocalDate date = parse(text, format);
            if (date != null) {
                return date;
            }
        }
        return null;
    }

    private static LocalDate parse(String text, DateTimeFormatter format) {
        try {
            return LocalDate.parse(text.trim(), format);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
