package com.hostelbooking.inventory.calendar;

import java.util.regex.Pattern;

/**
 * A case-insensitive pattern and the value it yields on a match.
 */
public record PatternRule<T>(Pattern pattern, T value) {

    public static <T> PatternRule<T> of(String regex, T value) {
        return new PatternRule<>(Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE), value);
    }

    public boolean matches(String text) {
        return text != null && pattern.matcher(text).find();
    }
}
