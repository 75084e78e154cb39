/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.columnar.driver.util;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * @hidden
 * Conversions between {@link Duration} and the duration strings used by the
 * analytics service, e.g. "7s", "1m30s", "10m0s", "1.5ms" or "250µs".
 * Timeouts are sent to the service in this form, and the execution metrics
 * it returns use the same form.
 */
public class DurationUtil {

    private static final long NANOS_PER_MICRO = 1_000L;
    private static final long NANOS_PER_MILLI = 1_000_000L;
    private static final long NANOS_PER_SECOND = 1_000_000_000L;

    private static final Map<String, Long> UNITS = new HashMap<>();
    static {
        UNITS.put("ns", 1L);
        UNITS.put("us", NANOS_PER_MICRO);
        UNITS.put("µs", NANOS_PER_MICRO);
        UNITS.put("μs", NANOS_PER_MICRO);
        UNITS.put("ms", NANOS_PER_MILLI);
        UNITS.put("s", NANOS_PER_SECOND);
        UNITS.put("m", 60 * NANOS_PER_SECOND);
        UNITS.put("h", 3600 * NANOS_PER_SECOND);
    }

    private DurationUtil() {}

    /**
     * Formats a duration. Durations of at least one second are written as
     * hours, minutes and fractional seconds, shorter ones use the largest
     * sub-second unit that keeps the integer part non-zero.
     *
     * @param duration the duration, must be non-null
     *
     * @return the duration string
     */
    public static String format(Duration duration) {
        CheckNull.requireNonNullIAE(duration,
                                    "DurationUtil.format: duration must be " +
                                    "non-null");
        long nanos = duration.toNanos();
        if (nanos == 0) {
            return "0s";
        }
        StringBuilder sb = new StringBuilder();
        if (nanos < 0) {
            sb.append('-');
            /* Long.MIN_VALUE nanos is not reachable from a real timeout */
            nanos = -nanos;
        }

        if (nanos < NANOS_PER_SECOND) {
            if (nanos < NANOS_PER_MICRO) {
                return sb.append(nanos).append("ns").toString();
            }
            if (nanos < NANOS_PER_MILLI) {
                appendFraction(sb, nanos, NANOS_PER_MICRO, 3);
                return sb.append("µs").toString();
            }
            appendFraction(sb, nanos, NANOS_PER_MILLI, 6);
            return sb.append("ms").toString();
        }

        long seconds = nanos / NANOS_PER_SECOND;
        long minutes = seconds / 60;
        long hours = minutes / 60;
        if (hours > 0) {
            sb.append(hours).append('h');
        }
        if (minutes > 0) {
            sb.append(minutes % 60).append('m');
        }
        sb.append(seconds % 60);
        appendFractionDigits(sb, nanos % NANOS_PER_SECOND, 9);
        return sb.append('s').toString();
    }

    /**
     * Parses a duration string such as "1h2m3.5s", "300ms" or "-1.5h".
     * A bare "0" is accepted.
     *
     * @param value the string to parse
     *
     * @return the duration
     *
     * @throws IllegalArgumentException if the string is not a valid
     * duration
     */
    public static Duration parse(String value) {
        CheckNull.requireNonEmptyIAE(value,
                                     "DurationUtil.parse: value must be " +
                                     "non-empty");
        String s = value;
        boolean negative = false;
        if (s.charAt(0) == '-' || s.charAt(0) == '+') {
            negative = s.charAt(0) == '-';
            s = s.substring(1);
        }
        if (s.equals("0")) {
            return Duration.ZERO;
        }
        if (s.isEmpty()) {
            throw invalid(value);
        }

        long total = 0;
        int pos = 0;
        while (pos < s.length()) {
            int numStart = pos;
            while (pos < s.length() &&
                   (Character.isDigit(s.charAt(pos)) || s.charAt(pos) == '.')) {
                pos++;
            }
            String number = s.substring(numStart, pos);
            if (number.isEmpty() || number.equals(".")) {
                throw invalid(value);
            }

            int unitStart = pos;
            while (pos < s.length() &&
                   !Character.isDigit(s.charAt(pos)) && s.charAt(pos) != '.') {
                pos++;
            }
            Long unitNanos = UNITS.get(s.substring(unitStart, pos));
            if (unitNanos == null) {
                throw invalid(value);
            }

            try {
                long part = new BigDecimal(number)
                    .multiply(BigDecimal.valueOf(unitNanos))
                    .longValue();
                total = Math.addExact(total, part);
            } catch (NumberFormatException | ArithmeticException e) {
                throw new IllegalArgumentException(
                    "Invalid duration: " + value, e);
            }
        }
        return Duration.ofNanos(negative ? -total : total);
    }

    private static void appendFraction(StringBuilder sb,
                                       long nanos,
                                       long unit,
                                       int digits) {
        sb.append(nanos / unit);
        appendFractionDigits(sb, nanos % unit, digits);
    }

    /*
     * Appends ".ddd" with trailing zeros removed, nothing if the fraction
     * is zero.
     */
    private static void appendFractionDigits(StringBuilder sb,
                                             long fraction,
                                             int digits) {
        if (fraction == 0) {
            return;
        }
        String frac = String.format("%0" + digits + "d", fraction);
        int end = frac.length();
        while (end > 0 && frac.charAt(end - 1) == '0') {
            end--;
        }
        sb.append('.').append(frac, 0, end);
    }

    private static IllegalArgumentException invalid(String value) {
        return new IllegalArgumentException("Invalid duration: " + value);
    }
}
