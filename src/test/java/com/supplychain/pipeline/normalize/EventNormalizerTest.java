package com.supplychain.pipeline.normalize;

import com.supplychain.pipeline.config.NormalizationProperties;
import com.supplychain.pipeline.domain.EventType;
import com.supplychain.pipeline.domain.NormalizationWarning;
import com.supplychain.pipeline.domain.NormalizedEvent;
import com.supplychain.pipeline.domain.RawEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for EventNormalizer: canonical location, sectors, text and timestamps.
 */
class EventNormalizerTest {

    private EventNormalizer normalizer;

    @BeforeEach
    void setUp() {
        NormalizationProperties properties = new NormalizationProperties();
        normalizer = new EventNormalizer(new LocationCatalog(properties), new SectorCatalog(properties), new TimestampParser());
    }

    private static RawEvent.RawEventBuilder earthquake() {
        return RawEvent.builder()
                .title("  Earthquake damages  LA  port cranes ")
                .description("Cranes at the port are offline w/ inspections expected to take approx. 5 days.")
                .source(" usgs ")
                .location("LA")
                .severity("0.7")
                .impactSectors(List.of("Cars", "chips", "automotive"))
                .eventType("Natural Disaster")
                .publishedAt("2024-03-04T08:00:00Z")
                .url(" https://example.com/quake ");
    }

    @Test
    void normalizesEveryField() {
        NormalizedEvent event = normalizer.normalize(earthquake().build());

        assertThat(event.getTitle()).isEqualTo("Earthquake damages LA port cranes");
        assertThat(event.getDescription())
                .isEqualTo("Cranes at the port are offline with inspections expected to take approximately 5 days.");
        assertThat(event.getSource()).isEqualTo("usgs");
        assertThat(event.getLocation().getStandardName()).isEqualTo("Los Angeles");
        assertThat(event.getImpactSectors()).containsExactly("automotive", "electronics");
        assertThat(event.getEventType()).isEqualTo(EventType.NATURAL_DISASTER);
        assertThat(event.getSeverity()).isEqualTo(0.7);
        assertThat(event.isSeverityExplicit()).isTrue();
        assertThat(event.isSectorsExplicit()).isTrue();
        assertThat(event.getTimestamp()).isEqualTo(Instant.parse("2024-03-04T08:00:00Z"));
        assertThat(event.getUrl()).isEqualTo("https://example.com/quake");
        assertThat(event.getWarnings()).isEmpty();
    }

    @Test
    void normalizingNormalizedOutputChangesNothing() {
        NormalizedEvent once = normalizer.normalize(earthquake().build());
        RawEvent again = RawEvent.builder()
                .title(once.getTitle())
                .description(once.getDescription())
                .source(once.getSource())
                .location(once.getLocation().getStandardName())
                .severity(once.getSeverity())
                .impactSectors(once.getImpactSectors())
                .eventType(once.getEventType().getLabel())
                .publishedAt(once.getTimestamp().toString())
                .url(once.getUrl())
                .build();

        assertThat(normalizer.normalize(again)).isEqualTo(once);
    }

    @Test
    void unknownSectorIsKeptLowercasedWithWarning() {
        NormalizedEvent event = normalizer.normalize(earthquake().impactSectors(List.of("Quantum   Widgets")).build());

        assertThat(event.getImpactSectors()).containsExactly("quantum widgets");
        assertThat(event.getWarnings()).containsExactly(NormalizationWarning.SECTOR_UNRESOLVED);
    }

    @Test
    void unparseableTimestampFallsBackToNow() {
        Instant before = Instant.now();

        NormalizedEvent event = normalizer.normalize(earthquake().publishedAt("last tuesday").build());

        assertThat(event.getWarnings()).contains(NormalizationWarning.TIMESTAMP_FALLBACK);
        assertThat(event.getTimestamp()).isBetween(before, before.plus(Duration.ofSeconds(5)));
    }

    @Test
    void missingLocationIsGlobalAndUnknownLocationIsFlagged() {
        assertThat(normalizer.normalize(earthquake().location(null).build()).getLocation().getStandardName())
                .isEqualTo("Global");

        NormalizedEvent unknown = normalizer.normalize(earthquake().location("middle of nowhere").build());
        assertThat(unknown.getLocation().isResolved()).isFalse();
        assertThat(unknown.getWarnings()).contains(NormalizationWarning.LOCATION_UNRESOLVED);
    }

    @Test
    void severityDefaultsWhenMissingAndIsClamped() {
        NormalizedEvent missing = normalizer.normalize(earthquake().severity(null).build());
        assertThat(missing.getSeverity()).isEqualTo(0.5);
        assertThat(missing.isSeverityExplicit()).isFalse();

        assertThat(normalizer.normalize(earthquake().severity(3.0).build()).getSeverity()).isEqualTo(1.0);
        assertThat(normalizer.normalize(earthquake().severity(-2).build()).getSeverity()).isEqualTo(0.0);
    }

    @Test
    void missingSectorsAreNotExplicit() {
        NormalizedEvent event = normalizer.normalize(earthquake().impactSectors(null).build());

        assertThat(event.getImpactSectors()).isEmpty();
        assertThat(event.isSectorsExplicit()).isFalse();
    }

    @Test
    void unknownEventTypeIsOther() {
        assertThat(normalizer.normalize(earthquake().eventType("rumour").build()).getEventType()).isEqualTo(EventType.OTHER);
    }

    @Test
    void cleanTextReplacesTypographyAndIsIdempotent() {
        String raw = "Port\u00A0closed \u2014 \u201Cagain\u201D\u2026 w/ delays approx. 3 days &amp; more\u0007";

        String cleaned = EventNormalizer.cleanText(raw);

        assertThat(cleaned).isEqualTo("Port closed - \"again\"... with delays approximately 3 days & more");
        assertThat(EventNormalizer.cleanText(cleaned)).isEqualTo(cleaned);
        assertThat(EventNormalizer.cleanText(null)).isEmpty();

        String doubleEscaped = EventNormalizer.cleanText("Smith &amp;amp; Sons port closure");
        assertThat(doubleEscaped).isEqualTo("Smith & Sons port closure");
        assertThat(EventNormalizer.cleanText(doubleEscaped)).isEqualTo(doubleEscaped);
    }
}
