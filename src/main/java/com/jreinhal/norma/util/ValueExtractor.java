package com.jreinhal.norma.util;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls percentages, euro amounts and dates out of Italian legal/fiscal prose.
 */
public final class ValueExtractor {
    public static final Pattern PERCENTAGE = Pattern.compile("\\d+(?:[.,]\\d+)?\\s?%");
    public static final Pattern EURO_AMOUNT = Pattern.compile(
            "(?:€\\s?\\d{1,3}(?:\\.\\d{3})*(?:,\\d+)?|\\d{1,3}(?:\\.\\d{3})*(?:,\\d+)?\\s?(?:€|euro\\b))",
            Pattern.CASE_INSENSITIVE);
    public static final Pattern DATE = Pattern.compile("\\b(?:\\d{1,2}/\\d{1,2}/\\d{4}|\\d{4}-\\d{2}-\\d{2})\\b");
    private static final Pattern PLAIN_NUMBER = Pattern.compile("\\b\\d+(?:[.,]\\d+)?\\b");

    private ValueExtractor() {
    }

    public static List<String> percentages(String text) {
        return find(PERCENTAGE, text);
    }

    public static List<String> amounts(String text) {
        return find(EURO_AMOUNT, text);
    }

    public static List<String> dates(String text) {
        return find(DATE, text);
    }

    /**
     * Percentages first, then amounts, then dates; duplicates removed, insertion order kept.
     */
    public static List<String> all(String text) {
        Set<String> values = new LinkedHashSet<>();
        values.addAll(percentages(text));
        values.addAll(amounts(text));
        values.addAll(dates(text));
        return new ArrayList<>(values);
    }

    public static boolean isPercentage(String value) {
        return value != null && value.contains("%");
    }

    public static boolean isAmount(String value) {
        return value != null && (value.contains("€") || value.toLowerCase().contains("euro"));
    }

    public static boolean isDate(String value) {
        return value != null && DATE.matcher(value).find();
    }

    public static boolean isNumber(String value) {
        return value != null && PLAIN_NUMBER.matcher(value).find();
    }

    /**
     * Normalizes "22 %", "22,0%" and "22%" to the same key for comparisons.
     */
    public static String normalize(String value) {
        if (value == null) {
            return "";
        }
        String compact = value.toLowerCase().replace("euro", "").replace("€", "").replace(" ", "").replace("%", "");
        compact = compact.replace(".", "").replace(',', '.');
        if (compact.endsWith(".0")) {
            compact = compact.substring(0, compact.length() - 2);
        }
        return compact;
    }

    private static List<String> find(Pattern pattern, String text) {
        List<String> found = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return found;
        }
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            String value = matcher.group().trim();
            if (!found.contains(value)) {
                found.add(value);
            }
        }
        return found;
    }
}
