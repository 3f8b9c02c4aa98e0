package ch.so.arp.rag.router.livedata;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls a location name out of a weather question, e.g. "Paris" from
 * "What's the weather in Paris?".
 */
public class LocationExtractor {

    private static final String END = "\\s*(?:[?!.,;]|$|\\s+(?:today|tomorrow|tonight|now|right now|this week|weather"
            + "|forecast)|\\s+(?:in|and|with)\\b)";

    private static final List<Pattern> PATTERNS = List.of(
            Pattern.compile("(?:weather|temperature|forecast|climate|conditions)(?:\\s+like)?\\s+(?:in|at|for)\\s+"
                    + "(\\p{L}[\\p{L}\\s'-]*?)" + END, Pattern.UNICODE_CHARACTER_CLASS),
            Pattern.compile("\\b(?:in|at|for)\\s+(\\p{L}[\\p{L}\\s'-]*?)" + END, Pattern.UNICODE_CHARACTER_CLASS));

    public Optional<String> extract(String query) {
        if (query == null || query.isBlank()) {
            return Optional.empty();
        }
        String lower = query.toLowerCase(Locale.ROOT).trim();
        for (Pattern pattern : PATTERNS) {
            Matcher matcher = pattern.matcher(lower);
            if (matcher.find()) {
                String location = matcher.group(1).trim();
                if (location.length() > 1) {
                    return Optional.of(titleCase(location));
                }
            }
        }
        return Optional.empty();
    }

    private String titleCase(String value) {
        StringBuilder builder = new StringBuilder(value.length());
        boolean capitalizeNext = true;
        for (char c : value.toCharArray()) {
            if (Character.isWhitespace(c) || c == '-') {
                capitalizeNext = true;
                builder.append(c);
            } else if (capitalizeNext) {
                builder.append(Character.toUpperCase(c));
                capitalizeNext = false;
            } else {
                builder.append(c);
            }
        }
        return builder.toString().replaceAll("\\s+", " ");
    }
}
