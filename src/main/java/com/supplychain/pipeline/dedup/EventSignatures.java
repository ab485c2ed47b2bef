package com.supplychain.pipeline.dedup;

import com.supplychain.pipeline.domain.RawEvent;
import lombok.Value;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * The three fingerprints used to recognise an event seen before (SHA-256, hex).
 */
@Value
public class EventSignatures {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}]+");
    private static final int MIN_TOKEN_LENGTH = 4;
    private static final Set<String> STOPWORDS = Set.of(
            "this", "that", "these", "those", "with", "from", "have", "been", "were", "will",
            "would", "could", "should", "their", "there", "they", "which", "about", "after",
            "into", "over", "than", "then", "when", "what", "while", "also", "said", "more");

    String exact;
    String content;
    /** Null when the text has no significant tokens; such events are never fuzzy duplicates. */
    String fuzzy;

    public boolean hasFuzzy() {
        return fuzzy != null;
    }

    public static EventSignatures of(RawEvent event, int fuzzyTokenCount) {
        String title = nullToEmpty(event.getTitle());
        String description = nullToEmpty(event.getDescription());
        String location = nullToEmpty(event.getLocation());

        String exactInput = title + description + location;
        String contentInput = WHITESPACE.matcher((title + " " + description).toLowerCase(Locale.ROOT))
                .replaceAll(" ").trim();
        String fuzzyInput = Arrays.stream(NON_WORD.split((title + " " + description).toLowerCase(Locale.ROOT)))
                .filter(token -> token.length() >= MIN_TOKEN_LENGTH)
                .filter(token -> !STOPWORDS.contains(token))
                .distinct()
                .sorted()
                .limit(fuzzyTokenCount)
                .collect(Collectors.joining(" "));

        return new EventSignatures(sha256(exactInput), sha256(contentInput),
                fuzzyInput.isEmpty() ? null : sha256(fuzzyInput));
    }

    private static String sha256(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
