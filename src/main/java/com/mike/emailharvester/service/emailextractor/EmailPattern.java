package com.mike.emailharvester.service.emailextractor;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * The one email regex used by every extraction strategy. Matches are lowercased.
 */
public final class EmailPattern {

    private static final Pattern EMAIL_PATTERN =
            Pattern.compile("[a-z0-9._%+-]+@[a-z0-9.-]+\\.[a-z]{2,}", Pattern.CASE_INSENSITIVE);

    private EmailPattern() {
    }

    public static Stream<String> findAll(String text) {
        if (text == null || text.isBlank()) return Stream.empty();

        Matcher matcher = EMAIL_PATTERN.matcher(text);

        Stream.Builder<String> builder = Stream.builder();
        while (matcher.find()) {
            builder.add(matcher.group().toLowerCase(Locale.ROOT));
        }
        return builder.build();
    }

    public static boolean matchesFully(String candidate) {
        return candidate != null && EMAIL_PATTERN.matcher(candidate).matches();
    }
}
