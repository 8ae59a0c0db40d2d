package com.policywatch.ingest.summarize;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns shouted headings ("GOVERNOR ANNOUNCES NEW FUNDING") into title case while leaving
 * acronyms alone. Only runs of three or more all-caps words spanning at least twelve characters
 * are touched; the output always has the same length as the input.
 */
final class CapsNormalizer {

    private static final Set<String> ACRONYMS = Set.of(
            "US", "USA", "DHS", "HHS", "EPA", "FBI", "CIA", "NATO", "AI", "FEMA", "DOJ", "IRS");

    private static final Pattern CAPS_RUN = Pattern.compile(
            "\\b[A-Z][A-Z0-9'\\-]*(?:[ /][A-Z][A-Z0-9'\\-]*){2,}\\b");
    private static final Pattern WORD = Pattern.compile("[A-Z][A-Z0-9'\\-]+");

    private CapsNormalizer() {
    }

    static String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        Matcher run = CAPS_RUN.matcher(text);
        StringBuilder out = new StringBuilder(text.length());
        while (run.find()) {
            String chunk = run.group();
            String replacement = chunk.length() >= 12 && hasRealWord(chunk) ? titleCase(chunk) : chunk;
            run.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        run.appendTail(out);
        return out.toString();
    }

    private static boolean hasRealWord(String chunk) {
        Matcher w = WORD.matcher(chunk);
        while (w.find()) {
            if (!ACRONYMS.contains(w.group()) && w.group().length() >= 4) {
                return true;
            }
        }
        return false;
    }

    private static String titleCase(String chunk) {
        Matcher w = WORD.matcher(chunk);
        StringBuilder out = new StringBuilder(chunk.length());
        while (w.find()) {
            String word = w.group();
            String fixed = ACRONYMS.contains(word)
                    ? word
                    : word.charAt(0) + word.substring(1).toLowerCase(Locale.ROOT);
            w.appendReplacement(out, Matcher.quoteReplacement(fixed));
        }
        w.appendTail(out);
        return out.toString();
    }
}
