package com.acme.reconcile.util;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.Month;
import java.time.format.TextStyle;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Format-tolerant date parser for raw record fields.
 * <p>
 * Numeric dates are read day-first ({@code 05/03/2024} is 5 March) and fall back to
 * month-first only when the day-first reading is impossible. The first date-like token
 * found anywhere in the input is used, so surrounding noise such as
 * {@code "Invoice dated 12 Mar 2024"} is ignored. Anything unrecognisable yields an
 * empty result rather than an exception.
 */
public final class LenientDateParser {

    private static final Pattern YEAR_FIRST =
            Pattern.compile("(?<!\\d)(\\d{4})[-/.](\\d{1,2})[-/.](\\d{1,2})(?!\\d)");
    private static final Pattern COMPACT =
            Pattern.compile("(?<!\\d)(\\d{4})(\\d{2})(\\d{2})(?!\\d)");
    private static final Pattern NUMERIC =
            Pattern.compile("(?<!\\d)(\\d{1,2})[-/.](\\d{1,2})[-/.](\\d{4}|\\d{2})(?!\\d)");
    private static final Pattern DAY_MONTH_NAME =
            Pattern.compile("(?<!\\d)(\\d{1,2})(?:st|nd|rd|th)?[\\s\\-/]+([A-Za-z]{3,9})\\.?,?[\\s\\-/]+(\\d{4}|\\d{2})(?!\\d)");
    private static final Pattern MONTH_NAME_DAY =
            Pattern.compile("([A-Za-z]{3,9})\\.?[\\s\\-/]+(\\d{1,2})(?:st|nd|rd|th)?,?[\\s\\-/]+(\\d{4}|\\d{2})(?!\\d)");

    private LenientDateParser() {
    }

    /**
     * Parses a raw date string.
     *
     * @param raw the raw field value, may be null
     * @return the parsed date, or empty when nothing date-like can be recovered
     */
    public static Optional<LocalDate> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String text = raw.trim();

        Matcher m = YEAR_FIRST.matcher(text);
        if (m.find()) {
            return of(toInt(m.group(1)), toInt(m.group(2)), toInt(m.group(3)));
        }
        m = COMPACT.matcher(text);
        if (m.find()) {
            return of(toInt(m.group(1)), toInt(m.group(2)), toInt(m.group(3)));
        }
        m = NUMERIC.matcher(text);
        if (m.find()) {
            int first = toInt(m.group(1));
            int second = toInt(m.group(2));
            int year = expandYear(m.group(3));
            Optional<LocalDate> dayFirst = of(year, second, first);
            return dayFirst.isPresent() ? dayFirst : of(year, first, second);
        }
        m = DAY_MONTH_NAME.matcher(text);
        while (m.find()) {
            Month month = monthOf(m.group(2));
            if (month != null) {
                return of(expandYear(m.group(3)), month.getValue(), toInt(m.group(1)));
            }
        }
        m = MONTH_NAME_DAY.matcher(text);
        while (m.find()) {
            Month month = monthOf(m.group(1));
            if (month != null) {
                return of(expandYear(m.group(3)), month.getValue(), toInt(m.group(2)));
            }
        }
        return Optional.empty();
    }

    private static Optional<LocalDate> of(int year, int month, int day) {
        try {
            return Optional.of(LocalDate.of(year, month, day));
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }

    private static int toInt(String digits) {
        return Integer.parseInt(digits);
    }

    private static int expandYear(String digits) {
        int year = toInt(digits);
        if (digits.length() == 2) {
            return year < 70 ? 2000 + year : 1900 + year;
        }
        return year;
    }

    private static Month monthOf(String word) {
        String lower = word.toLowerCase(Locale.ROOT);
        for (Month month : Month.values()) {
            String full = month.getDisplayName(TextStyle.FULL, Locale.ENGLISH).toLowerCase(Locale.ROOT);
            if (lower.length() >= 3 && full.startsWith(lower)) {
                return month;
            }
        }
        return null;
    }
}
