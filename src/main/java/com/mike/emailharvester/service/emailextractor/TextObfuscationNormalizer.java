package com.mike.emailharvester.service.emailextractor;

import lombok.extern.slf4j.Slf4j;
import org.jsoup.parser.Parser;
import org.springframework.stereotype.Component;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Undoes the usual tricks for hiding addresses from scrapers.
 * Every step is best-effort: a step that fails leaves its input as it was.
 */
@Component
@Slf4j
public class TextObfuscationNormalizer {

    private static final Pattern AT_BRACKETS =
            Pattern.compile("(?i)\\s*[\\(\\[\\{<]\\s*at\\s*[\\)\\]\\}>]\\s*");
    private static final Pattern DOT_BRACKETS =
            Pattern.compile("(?i)\\s*[\\(\\[\\{<]\\s*dot\\s*[\\)\\]\\}>]\\s*");
    private static final Pattern AT_SPACES =
            Pattern.compile("(?i)\\s+at\\s+");
    private static final Pattern DOT_SPACES =
            Pattern.compile("(?i)\\s+dot\\s+");

    private static final Pattern NBSP =
            Pattern.compile("(?i)&nbsp;|&#160;|&#x0*a0;|\\u00A0");

    private static final Pattern QUOTED_FRAGMENT =
            Pattern.compile("\"([^\"]*)\"|'([^']*)'");

    private static final Pattern BASE64_TOKEN =
            Pattern.compile("^[A-Za-z0-9+/]+={0,2}$");

    public String normalize(String input) {
        if (input == null || input.isBlank()) return input;

        String s = input;
        s = bestEffort(s, this::replaceAtDotMarkers, "at/dot markers");
        s = bestEffort(s, v -> NBSP.matcher(v).replaceAll(" "), "nbsp");
        s = bestEffort(s, this::percentDecode, "percent decoding");
        s = bestEffort(s, v -> Parser.unescapeEntities(v, false), "html entities");
        return s;
    }

    /**
     * "info" + "@" + 'example.com' -> info@example.com. Fewer than two quoted fragments: unchanged.
     */
    public String deobfuscateConcatenation(String input) {
        if (input == null || input.isBlank()) return input;

        Matcher matcher = QUOTED_FRAGMENT.matcher(input);
        List<String> fragments = new ArrayList<>();
        while (matcher.find()) {
            fragments.add(matcher.group(1) != null ? matcher.group(1) : matcher.group(2));
        }

        if (fragments.size() < 2) return input;
        return String.join("", fragments);
    }

    /**
     * Decoded text, present only when the token is well-formed base64 and the payload contains an '@'.
     */
    public Optional<String> tryDecodeBase64(String token) {
        if (token == null || token.isEmpty() || token.length() % 4 != 0) return Optional.empty();
        if (!BASE64_TOKEN.matcher(token).matches()) return Optional.empty();

        try {
            String decoded = new String(Base64.getDecoder().decode(token), StandardCharsets.UTF_8);
            return decoded.indexOf('@') >= 0 ? Optional.of(decoded) : Optional.empty();
        } catch (IllegalArgumentException ex) {
            log.debug("Base64 decode failed for token '{}'", token, ex);
            return Optional.empty();
        }
    }

    private String replaceAtDotMarkers(String s) {
        s = AT_BRACKETS.matcher(s).replaceAll("@");
        s = DOT_BRACKETS.matcher(s).replaceAll(".");
        s = AT_SPACES.matcher(s).replaceAll("@");
        s = DOT_SPACES.matcher(s).replaceAll(".");
        return s;
    }

    private String percentDecode(String s) {
        if (s.indexOf('%') < 0) return s;
        // URLDecoder is a form decoder, '+' must survive as part of the local part
        return URLDecoder.decode(s.replace("+", "%2B"), StandardCharsets.UTF_8);
    }

    private String bestEffort(String value, UnaryOperator<String> step, String stepName) {
        try {
            String result = step.apply(value);
            return result != null ? result : value;
        } catch (RuntimeException ex) {
            log.debug("Normalization step '{}' skipped for '{}': {}", stepName, value, ex.toString());
            return value;
        }
    }
}
