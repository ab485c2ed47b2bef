package com.supplychain.pipeline.validation;

import com.supplychain.pipeline.config.PipelineProperties;
import com.supplychain.pipeline.domain.RawEvent;
import com.supplychain.pipeline.domain.ValidationResult;
import com.supplychain.pipeline.normalize.LocationCatalog;
import com.supplychain.pipeline.normalize.SectorCatalog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decides whether a raw event is usable and how trustworthy it looks. Every check adds
 * to a quality score in [0,1]; hard problems are errors, soft ones warnings. Pure and
 * never throws, whatever the input.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EventValidator {

    private static final List<String> DOMAIN_KEYWORDS = List.of(
            "supply", "chain", "logistics", "shipping", "port", "manufacturing",
            "disruption", "shortage", "factory", "freight");
    private static final List<String> HIGH_SEVERITY_WORDS = List.of(
            "crisis", "emergency", "critical", "severe", "major", "catastrophic");
    private static final List<String> LOW_SEVERITY_WORDS = List.of(
            "minor", "slight", "limited", "temporary", "brief");

    private static final Pattern SENTENCE_END = Pattern.compile("[.!?](\\s|$)");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern CITY_STATE = Pattern.compile("^[\\p{L} .'-]+,\\s*[A-Z]{2}$");
    private static final Pattern CITY_COUNTRY = Pattern.compile("^[\\p{L} .'-]+,\\s*[\\p{L} .'-]+$");
    private static final Pattern PORT_OR_CANAL = Pattern.compile("(?i)^(port of .+|.+ port|.+ canal)$");
    private static final Pattern URL = Pattern.compile("^https?://[\\w.-]+(:\\d+)?(/\\S*)?$", Pattern.CASE_INSENSITIVE);

    private final PipelineProperties properties;
    private final LocationCatalog locationCatalog;
    private final SectorCatalog sectorCatalog;

    public ValidationResult validate(RawEvent event) {
        PipelineProperties.Validation limits = properties.getValidation();
        ValidationResult.ValidationResultBuilder result = ValidationResult.builder();
        boolean hasErrors = false;
        double score = 0.0;

        String title = event.getTitle();
        String description = event.getDescription();
        String text = (nullToEmpty(title) + " " + nullToEmpty(description)).toLowerCase(Locale.ROOT);

        // title
        if (isBlank(title)) {
            result.error("Missing required field: title");
            hasErrors = true;
        } else {
            String t = title.trim();
            if (t.length() < limits.getTitleMinLength()) {
                result.error("Title too short: " + t.length() + " < " + limits.getTitleMinLength());
                hasErrors = true;
            } else {
                if (t.length() > limits.getTitleMaxLength()) {
                    result.warning("Title longer than " + limits.getTitleMaxLength() + " characters");
                    score += 0.15;
                } else {
                    score += 0.2;
                }
                if (plainCharacterRatio(t) > 0.7) {
                    score += 0.05;
                } else {
                    result.warning("Title contains many unusual characters");
                }
                if (Character.isUpperCase(t.charAt(0))) {
                    score += 0.05;
                }
                if (containsAny(t.toLowerCase(Locale.ROOT), DOMAIN_KEYWORDS)) {
                    score += 0.05;
                }
            }
        }

        // description
        if (isBlank(description)) {
            result.error("Missing required field: description");
            hasErrors = true;
        } else {
            String d = description.trim();
            if (d.length() < limits.getDescriptionMinLength()) {
                result.error("Description too short: " + d.length() + " < " + limits.getDescriptionMinLength());
                hasErrors = true;
            } else {
                if (d.length() > limits.getDescriptionMaxLength()) {
                    result.warning("Description longer than " + limits.getDescriptionMaxLength() + " characters");
                    score += 0.25;
                } else {
                    score += 0.3;
                }
                if (countMatches(SENTENCE_END, d) > 1) {
                    score += 0.1;
                }
                if (WHITESPACE.split(d).length > 10) {
                    score += 0.1;
                }
            }
        }

        // severity
        if (event.getSeverity() == null || isBlank(event.getSeverity().toString())) {
            result.error("Missing required field: severity");
            hasErrors = true;
        } else {
            OptionalDouble parsed = event.numericSeverity();
            if (parsed.isEmpty()) {
                result.error("Severity is not a number: " + event.getSeverity());
                hasErrors = true;
            } else if (parsed.getAsDouble() < 0.0 || parsed.getAsDouble() > 1.0) {
                result.error("Severity out of range [0,1]: " + parsed.getAsDouble());
                hasErrors = true;
            } else {
                score += 0.2;
                double severity = parsed.getAsDouble();
                boolean high = containsAny(text, HIGH_SEVERITY_WORDS);
                boolean low = containsAny(text, LOW_SEVERITY_WORDS);
                if (high && severity < 0.5) {
                    result.warning("Severity " + severity + " looks low for the language used");
                } else if (low && !high && severity > 0.7) {
                    result.warning("Severity " + severity + " looks high for the language used");
                } else {
                    score += 0.1;
                }
            }
        }

        // location
        if (!isBlank(event.getLocation())) {
            String location = event.getLocation().trim();
            score += 0.05;
            if (locationCatalog.isKnown(location) || isStructuredLocation(location)) {
                score += 0.05;
            } else {
                result.warning("Unrecognized location: " + location);
            }
        }

        // sectors
        List<String> sectors = event.getImpactSectors();
        if (sectors != null && !sectors.isEmpty()) {
            long mentioned = sectors.stream().filter(s -> sectorCatalog.isMentioned(s, text)).count();
            score += mentioned > 0 ? 0.15 : 0.1;
            if (mentioned * 2 < sectors.size()) {
                result.warning("Most impact sectors are not mentioned in the text: " + sectors);
            }
        }

        // url
        if (!isBlank(event.getUrl())) {
            String url = event.getUrl().trim();
            if (!URL.matcher(url).matches()) {
                result.warning("Malformed URL: " + url);
            } else if (url.toLowerCase(Locale.ROOT).startsWith("http://")) {
                result.warning("URL is not HTTPS: " + url);
            }
        }

        double quality = Math.max(0.0, Math.min(1.0, score));
        boolean valid = !hasErrors && quality >= limits.getMinimumQualityScore();
        ValidationResult built = result.valid(valid).qualityScore(quality).build();
        log.debug("Validated event title='{}': valid={}, quality={}, errors={}, warnings={}",
                title, valid, quality, built.getErrors().size(), built.getWarnings().size());
        return built;
    }

    private static boolean isStructuredLocation(String location) {
        return CITY_STATE.matcher(location).matches()
                || PORT_OR_CANAL.matcher(location).matches()
                || CITY_COUNTRY.matcher(location).matches();
    }

    private static double plainCharacterRatio(String text) {
        long plain = text.chars().filter(c -> Character.isLetterOrDigit(c) || Character.isWhitespace(c)).count();
        return (double) plain / text.length();
    }

    private static boolean containsAny(String text, List<String> words) {
        return words.stream().anyMatch(text::contains);
    }

    private static int countMatches(Pattern pattern, String text) {
        int count = 0;
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
