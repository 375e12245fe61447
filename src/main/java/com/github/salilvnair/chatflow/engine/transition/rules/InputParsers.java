package com.github.salilvnair.chatflow.engine.transition.rules;

import com.github.salilvnair.chatflow.engine.exception.ValidationException;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

final class InputParsers {

    private static final Set<String> ZERO_WORDS = Set.of("skip", "none", "na", "n/a", "zero");
    private static final Pattern AMOUNT = Pattern.compile("^(?:rs\\.?|inr|₹)?\\s*([0-9][0-9,]*)(?:\\.[0-9]{1,2})?$");
    private static final Pattern PERIOD = Pattern.compile("^(\\d{1,2})[-/ ](\\d{4})$");
    private static final DateTimeFormatter DOB = DateTimeFormatter.ofPattern("dd/MM/uuuu").withResolverStyle(ResolverStyle.STRICT);

    private InputParsers() {
    }

    /** Whole rupees; {@code skip}/{@code none} mean zero. */
    static long amount(String raw) {
        String value = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        if (ZERO_WORDS.contains(value)) {
            return 0L;
        }
        Matcher matcher = AMOUNT.matcher(value);
        if (!matcher.matches()) {
            throw new ValidationException("error.invalid_amount");
        }
        try {
            return Long.parseLong(matcher.group(1).replace(",", ""));
        }
        catch (NumberFormatException e) {
            throw new ValidationException("error.invalid_amount");
        }
    }

    /** {@code MM-YYYY} or {@code MM/YYYY}, normalised to {@code MMYYYY} as used on GST returns. */
    static String period(String raw) {
        Matcher matcher = PERIOD.matcher(raw == null ? "" : raw.trim());
        if (!matcher.matches()) {
            throw new ValidationException("error.invalid_period");
        }
        int month = Integer.parseInt(matcher.group(1));
        int year = Integer.parseInt(matcher.group(2));
        if (month < 1 || month > 12 || year < 2017) {
            throw new ValidationException("error.invalid_period");
        }
        YearMonth period = YearMonth.of(year, month);
        return String.format(Locale.ROOT, "%02d%04d", period.getMonthValue(), period.getYear());
    }

    /** {@code DD/MM/YYYY}, not later than {@code today}. */
    static String dateOfBirth(String raw, LocalDate today) {
        try {
            LocalDate date = LocalDate.parse(raw == null ? "" : raw.trim().replace('-', '/'), DOB);
            if (date.isAfter(today)) {
                throw new ValidationException("error.invalid_date");
            }
            return date.format(DOB);
        }
        catch (DateTimeParseException e) {
            throw new ValidationException("error.invalid_date");
        }
    }

    static String name(String raw) {
        String value = raw == null ? "" : raw.trim().replaceAll("\\s+", " ");
        if (value.length() < 2 || value.length() > 100) {
            throw new ValidationException("error.invalid_name");
        }
        return value;
    }
}
