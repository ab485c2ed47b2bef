package com.supplychain.pipeline.normalize;

import com.supplychain.pipeline.domain.EventType;
import com.supplychain.pipeline.domain.NormalizationWarning;
import com.supplychain.pipeline.domain.NormalizedEvent;
import com.supplychain.pipeline.domain.RawEvent;
import com.supplychain.pipeline.domain.StandardizedLocation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Brings a validated event into canonical form. Never fails: anything it cannot
 * resolve falls back to a best-effort value and is reported as a warning.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EventNormalizer {

    static final double DEFAULT_SEVERITY = 0.5;

    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\p{Cc}&&[^\\s]]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    /** Any depth of HTML ampersand escaping, undone in one pass. */
    private static final Pattern ESCAPED_AMPERSAND = Pattern.compile("&(?:amp;)+");
    private static final Pattern WITH_ABBREVIATION = Pattern.compile("(?i)(?<![\\p{L}\\p{N}])w/(?=\\s)");
    private static final Pattern APPROX_ABBREVIATION = Pattern.compile("(?i)(?<![\\p{L}\\p{N}])approx\\.");

    private final LocationCatalog locationCatalog;
    private final SectorCatalog sectorCatalog;
    private final TimestampParser timestampParser;

    public NormalizedEvent normalize(RawEvent raw) {
        Set<NormalizationWarning> warnings = EnumSet.noneOf(NormalizationWarning.class);

        String title = cleanText(raw.getTitle());
        String description = cleanText(raw.getDescription());

        StandardizedLocation location = locationCatalog.resolve(raw.getLocation());
        if (!location.isResolved()) {
            warnings.add(NormalizationWarning.LOCATION_UNRESOLVED);
        }

        List<String> rawSectors = raw.getImpactSectors() == null ? List.of() : raw.getImpactSectors();
        Set<String> sectors = new LinkedHashSet<>();
        for (String sector : rawSectors) {
            if (sector == null || sector.isBlank()) {
                continue;
            }
            String canonical = sectorCatalog.lookup(sector).orElse(null);
            if (canonical == null) {
                warnings.add(NormalizationWarning.SECTOR_UNRESOLVED);
                canonical = WHITESPACE.matcher(sector.trim().toLowerCase(Locale.ROOT)).replaceAll(" ");
            }
            sectors.add(canonical);
        }

        Instant timestamp = timestampParser.parse(raw.getPublishedAt()).orElse(null);
        if (timestamp == null) {
            warnings.add(NormalizationWarning.TIMESTAMP_FALLBACK);
            timestamp = Instant.now();
        }

        OptionalDouble severity = raw.numericSeverity();

        if (!warnings.isEmpty()) {
            log.debug("Normalization warnings for title='{}': {}", title, warnings);
        }
        return NormalizedEvent.builder()
                .title(title)
                .description(description)
                .source(raw.getSource() == null ? null : raw.getSource().trim())
                .location(location)
                .impactSectors(List.copyOf(new ArrayList<>(sectors)))
                .eventType(EventType.fromLabel(raw.getEventType()))
                .severity(clamp(severity.orElse(DEFAULT_SEVERITY)))
                .severityExplicit(severity.isPresent())
                .sectorsExplicit(!sectors.isEmpty())
                .timestamp(timestamp)
                .url(raw.getUrl() == null ? null : raw.getUrl().trim())
                .warnings(warnings)
                .build();
    }

    /**
     * Strips control characters, replaces typographic punctuation with ASCII, expands a few
     * abbreviations and collapses whitespace. Applying it twice changes nothing.
     */
    public static String cleanText(String text) {
        if (text == null) {
            return "";
        }
        String cleaned = CONTROL_CHARS.matcher(text).replaceAll("");
        cleaned = cleaned
                .replace('\u2018', '\'')
                .replace('\u2019', '\'')
                .replace('\u201C', '"')
                .replace('\u201D', '"')
                .replace('\u2013', '-')
                .replace('\u2014', '-')
                .replace("\u2026", "...")
                .replace('\u00A0', ' ');
        cleaned = ESCAPED_AMPERSAND.matcher(cleaned).replaceAll("&");
        cleaned = WITH_ABBREVIATION.matcher(cleaned).replaceAll("with");
        cleaned = APPROX_ABBREVIATION.matcher(cleaned).replaceAll("approximately");
        return WHITESPACE.matcher(cleaned).replaceAll(" ").trim();
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
