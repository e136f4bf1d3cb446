package com.spreadsheet.engine.fill;

import java.util.Objects;

/**
 * A fill pattern and its parameter (slope, rate, day increment or text step).
 */
public final class PatternType {

    public enum Kind {
        LINEAR,
        EXPONENTIAL,
        DATE,
        TEXT,
        COPY
    }

    private static final PatternType COPY = new PatternType(Kind.COPY, 0);

    private final Kind kind;
    private final double parameter;

    private PatternType(Kind kind, double parameter) {
        this.kind = kind;
        this.parameter = parameter;
    }

    public static PatternType linear(double slope) {
        return new PatternType(Kind.LINEAR, slope);
    }

    public static PatternType exponential(double rate) {
        return new PatternType(Kind.EXPONENTIAL, rate);
    }

    public static PatternType date(long incrementDays) {
        return new PatternType(Kind.DATE, incrementDays);
    }

    public static PatternType text(long step) {
        return new PatternType(Kind.TEXT, step);
    }

    public static PatternType copy() {
        return COPY;
    }

    public Kind getKind() {
        return kind;
    }

    public double getParameter() {
        return parameter;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PatternType)) {
            return false;
        }
        PatternType that = (PatternType) o;
        return kind == that.kind && Double.compare(parameter, that.parameter) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, parameter);
    }

    @Override
    public String toString() {
        return kind == Kind.COPY ? "Copy" : kind + "(" + parameter + ")";
    }
}
