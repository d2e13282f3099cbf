package com.panwatch.schedule;

import com.panwatch.exception.InvalidScheduleException;
import java.util.BitSet;

/**
 * One parsed cron field, normalised to the set of values it admits.
 * Two fields are equal when they admit the same values.
 */
final class CronField {

    private final String name;
    private final int min;
    private final int max;
    private final BitSet values;

    private CronField(String name, int min, int max, BitSet values) {
        this.name = name;
        this.min = min;
        this.max = max;
        this.values = values;
    }

    static CronField parse(String expression, String name, String text, int min, int max) {
        BitSet values = new BitSet(max + 1);
        for (String part : text.split(",", -1)) {
            if (part.isEmpty()) {
                throw new InvalidScheduleException(expression, "empty list element in " + name);
            }
            parsePart(expression, name, part, min, max, values);
        }
        return new CronField(name, min, max, values);
    }

    static CronField full(String name, int min, int max) {
        BitSet values = new BitSet(max + 1);
        values.set(min, max + 1);
        return new CronField(name, min, max, values);
    }

    private static void parsePart(String expression, String name, String part, int min, int max, BitSet values) {
        int step = 1;
        String range = part;
        int slash = part.indexOf('/');
        if (slash >= 0) {
            range = part.substring(0, slash);
            step = parseNumber(expression, name, part.substring(slash + 1));
            if (step <= 0) {
                throw new InvalidScheduleException(expression, "step must be positive in " + name);
            }
        }

        int from;
        int to;
        if ("*".equals(range)) {
            from = min;
            to = max;
        } else if (range.indexOf('-') > 0) {
            int dash = range.indexOf('-');
            from = parseNumber(expression, name, range.substring(0, dash));
            to = parseNumber(expression, name, range.substring(dash + 1));
            if (from > to) {
                throw new InvalidScheduleException(expression, "reversed range " + range + " in " + name);
            }
        } else {
            from = parseNumber(expression, name, range);
            // "5/15" means 5, 20, 35, 50
            to = slash >= 0 ? max : from;
        }

        if (from < min || to > max) {
            throw new InvalidScheduleException(
                    expression, String.format("%s value out of range [%d-%d]: %s", name, min, max, part));
        }
        for (int v = from; v <= to; v += step) {
            values.set(v);
        }
    }

    private static int parseNumber(String expression, String name, String text) {
        if (text.isEmpty() || !text.chars().allMatch(Character::isDigit)) {
            throw new InvalidScheduleException(expression, "not a number in " + name + ": '" + text + "'");
        }
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException e) {
            throw new InvalidScheduleException(expression, "number too large in " + name + ": " + text);
        }
    }

    /** Folds value {@code from} onto {@code to} (day-of-week 7 is Sunday, same as 0). */
    CronField fold(int from, int to, int newMax) {
        BitSet folded = (BitSet) values.clone();
        if (folded.get(from)) {
            folded.set(to);
        }
        if (folded.length() > newMax + 1) {
            folded.clear(newMax + 1, folded.length());
        }
        return new CronField(name, min, newMax, folded);
    }

    boolean matches(int value) {
        return values.get(value);
    }

    boolean isRestricted() {
        return values.cardinality() != max - min + 1;
    }

    int nextSetAtOrAfter(int value) {
        return value > max ? -1 : values.nextSetBit(value);
    }

    String toExpression() {
        if (!isRestricted()) {
            return "*";
        }
        StringBuilder sb = new StringBuilder();
        int v = values.nextSetBit(min);
        while (v >= 0 && v <= max) {
            int end = v;
            while (end + 1 <= max && values.get(end + 1)) {
                end++;
            }
            if (sb.length() > 0) {
                sb.append(',');
            }
            sb.append(v);
            if (end > v) {
                sb.append('-').append(end);
            }
            v = values.nextSetBit(end + 1);
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CronField other)) {
            return false;
        }
        return min == other.min && max == other.max && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode() * 31 + max;
    }

    @Override
    public String toString() {
        return name + "=" + toExpression();
    }
}
