package com.policywatch.ingest.resolve;

import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the date out of the closing clause of orders and proclamations, e.g.
 * "IN WITNESS WHEREOF, I have hereunto set my hand this twenty-first day of January, in the year
 * of our Lord two thousand twenty-five" or "Signed this 5th day of March, A.D., 2024".
 * Day and year may be digits or English words. The last clause in the text wins.
 */
public final class SigningClauseParser {

    private static final String MONTH_NAMES =
            "january|february|march|april|may|june|july|august|september|october|november|december";

    private static final Pattern CLAUSE = Pattern.compile(
            "\\b(?:signed|sealed|witness(?:ed)?|whereof|given|done|affixed)\\b"
                    + "[^.]{0,240}?\\bthis\\s+"
                    + "(\\d{1,2}(?:st|nd|rd|th)?|[a-z]+(?:[\\s-][a-z]+)?)"
                    + "\\s+day\\s+of\\s+(" + MONTH_NAMES + ")\\s*,?\\s*"
                    + "(?:in\\s+the\\s+year\\s+(?:of\\s+our\\s+lord\\s+)?)?"
                    + "(?:a\\.?\\s?d\\.?\\s*,?\\s*)?"
                    + "(\\d{4}|two\\s+thousand(?:\\s+and)?(?:[\\s-]+[a-z]+){0,2})",
            Pattern.CASE_INSENSITIVE);

    private static final Map<String, Integer> UNITS = new HashMap<>();
    private static final Map<String, Integer> TENS = new HashMap<>();
    private static final Map<String, Integer> ORDINAL_UNITS = new HashMap<>();
    private static final Map<String, Integer> ORDINAL_TENS = new HashMap<>();

    static {
        String[] units = {"zero", "one", "two", "three", "four", "five", "six", "seven", "eight", "nine",
                "ten", "eleven", "twelve", "thirteen", "fourteen", "fifteen", "sixteen", "seventeen",
                "eighteen", "nineteen"};
        for (int i = 0; i < units.length; i++) {
            UNITS.put(units[i], i);
        }
        TENS.put("twenty", 20);
        TENS.put("thirty", 30);

        String[] ordinals = {"", "first", "second", "third", "fourth", "fifth", "sixth", "seventh", "eighth",
                "ninth", "tenth", "eleventh", "twelfth", "thirteenth", "fourteenth", "fifteenth",
                "sixteenth", "seventeenth", "eighteenth", "nineteenth"};
        for (int i = 1; i < ordinals.length; i++) {
            ORDINAL_UNITS.put(ordinals[i], i);
        }
        ORDINAL_TENS.put("twentieth", 20);
        ORDINAL_TENS.put("thirtieth", 30);
    }

    private SigningClauseParser() {
    }

    public static Optional<OffsetDateTime> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String normalized = text.replaceAll("\\s+", " ");
        Matcher m = CLAUSE.matcher(normalized);
        Optional<OffsetDateTime> last = Optional.empty();
        while (m.find()) {
            Optional<Integer> day = parseDay(m.group(1));
            Optional<Integer> month = DateParsing.month(m.group(2));
            Optional<Integer> year = parseYear(m.group(3));
            if (day.isPresent() && month.isPresent() && year.isPresent()) {
                Optional<OffsetDateTime> date = DateParsing.ofDate(year.get(), month.get(), day.get());
                if (date.isPresent()) {
                    last = date;
                }
            }
        }
        return last;
    }

    static Optional<Integer> parseDay(String raw) {
        String token = raw.toLowerCase(Locale.ROOT).trim();
        String digits = token.replaceAll("(st|nd|rd|th)$", "");
        if (digits.matches("\\d{1,2}")) {
            return Optional.of(Integer.parseInt(digits));
        }
        String[] parts = token.split("[\\s-]+");
        if (parts.length == 1) {
            Integer v = ORDINAL_UNITS.get(parts[0]);
            return Optional.ofNullable(v != null ? v : ORDINAL_TENS.get(parts[0]));
        }
        if (parts.length == 2 && TENS.containsKey(parts[0]) && ORDINAL_UNITS.containsKey(parts[1])) {
            return Optional.of(TENS.get(parts[0]) + ORDINAL_UNITS.get(parts[1]));
        }
        return Optional.empty();
    }

    static Optional<Integer> parseYear(String raw) {
        String token = raw.toLowerCase(Locale.ROOT).trim();
        if (token.matches("\\d{4}")) {
            return Optional.of(Integer.parseInt(token));
        }
        String[] words = token.split("[\\s-]+");
        if (words.length < 2 || !"two".equals(words[0]) || !"thousand".equals(words[1])) {
            return Optional.empty();
        }
        int year = 2000;
        int i = 2;
        if (i < words.length && "and".equals(words[i])) {
            i++;
        }
        if (i < words.length && TENS.containsKey(words[i])) {
            year += TENS.get(words[i]);
            i++;
            if (i < words.length && UNITS.containsKey(words[i]) && UNITS.get(words[i]) < 10) {
                year += UNITS.get(words[i]);
            }
        } else if (i < words.length && UNITS.containsKey(words[i])) {
            year += UNITS.get(words[i]);
        }
        return Optional.of(year);
    }
}
