package com.supplychain.pipeline.normalize;

import com.supplychain.pipeline.config.NormalizationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Canonical industry sectors, the keywords that map onto them and the words that
 * indicate a sector in free text.
 */
@Component
public class SectorCatalog {

    private static final Pattern NON_ALNUM = Pattern.compile("[^\\p{L}\\p{N}]+");
    private static final int MIN_TEXT_KEYWORD_LENGTH = 3;

    private final Map<String, String> keywords;
    private final Map<String, List<Pattern>> textPatterns;

    public SectorCatalog(NormalizationProperties properties) {
        Map<String, String> table = new HashMap<>(builtInKeywords());
        properties.getExtraSectorKeywords().forEach((keyword, sector) -> table.put(key(keyword), key(sector)));
        new ArrayList<>(table.values()).forEach(sector -> table.putIfAbsent(sector, sector));
        this.keywords = Map.copyOf(table);

        Map<String, Set<String>> textWords = new LinkedHashMap<>();
        builtInTextKeywords().forEach((sector, words) -> textWords.put(sector, new LinkedHashSet<>(words)));
        table.forEach((keyword, sector) -> {
            if (keyword.length() >= MIN_TEXT_KEYWORD_LENGTH) {
                textWords.computeIfAbsent(sector, s -> new LinkedHashSet<>()).add(keyword.replace('_', ' '));
            }
        });
        Map<String, List<Pattern>> patterns = new LinkedHashMap<>();
        textWords.forEach((sector, words) -> {
            List<Pattern> compiled = new ArrayList<>();
            for (String word : words) {
                compiled.add(Pattern.compile("(?<![\\p{L}\\p{N}])" + Pattern.quote(word) + "(?:s|es)?(?![\\p{L}\\p{N}])"));
            }
            patterns.put(sector, List.copyOf(compiled));
        });
        this.textPatterns = patterns;
    }

    /**
     * Canonical tag for a collector-supplied sector: exact keyword, then any word inside
     * it (e.g. {@code oil_gas}). Empty when nothing matches.
     */
    public Optional<String> lookup(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String lowered = key(raw);
        String exact = keywords.get(lowered);
        if (exact == null) {
            exact = keywords.get(lowered.replaceAll("[\\s-]+", "_"));
        }
        if (exact != null) {
            return Optional.of(exact);
        }
        for (String token : NON_ALNUM.split(lowered)) {
            String byToken = keywords.get(token);
            if (byToken != null) {
                return Optional.of(byToken);
            }
        }
        return Optional.empty();
    }

    /** Sectors mentioned in the text, in catalog order. */
    public List<String> inferFromText(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String lowered = text.toLowerCase(Locale.ROOT);
        List<String> found = new ArrayList<>();
        textPatterns.forEach((sector, patterns) -> {
            if (patterns.stream().anyMatch(p -> p.matcher(lowered).find())) {
                found.add(sector);
            }
        });
        return found;
    }

    /** Whether the text contains any word associated with the (canonicalised) sector. */
    public boolean isMentioned(String sector, String text) {
        if (text == null) {
            return false;
        }
        String canonical = lookup(sector).orElse(sector == null ? "" : key(sector));
        List<Pattern> patterns = textPatterns.get(canonical);
        if (patterns == null) {
            return text.toLowerCase(Locale.ROOT).contains(canonical.replace('_', ' '));
        }
        String lowered = text.toLowerCase(Locale.ROOT);
        return patterns.stream().anyMatch(p -> p.matcher(lowered).find());
    }

    private static String key(String text) {
        return text.trim().toLowerCase(Locale.ROOT);
    }

    private static Map<String, String> builtInKeywords() {
        Map<String, String> m = new HashMap<>();
        for (String s : List.of("auto", "autos", "car", "cars", "vehicle", "vehicles", "automobile", "automobiles")) {
            m.put(s, "automotive");
        }
        for (String s : List.of("chip", "chips", "semiconductor", "semiconductors", "tech", "it", "electronic")) {
            m.put(s, "electronics");
        }
        for (String s : List.of("oil", "gas", "petroleum", "power", "electricity", "fuel")) {
            m.put(s, "energy");
        }
        for (String s : List.of("food", "farming", "crops", "livestock")) {
            m.put(s, "agriculture");
        }
        for (String s : List.of("shipping", "logistics", "freight", "cargo", "ports")) {
            m.put(s, "transportation");
        }
        for (String s : List.of("factories", "production", "plants", "industrial")) {
            m.put(s, "manufacturing");
        }
        for (String s : List.of("pharma", "pharmaceutical", "drugs", "medicine", "healthcare")) {
            m.put(s, "pharmaceuticals");
        }
        for (String s : List.of("beverage", "beverages", "food_and_beverage", "food_&_beverage")) {
            m.put(s, "food_beverage");
        }
        for (String s : List.of("textile", "apparel", "clothing", "garments")) {
            m.put(s, "textiles");
        }
        for (String s : List.of("aviation", "airlines", "aircraft")) {
            m.put(s, "aerospace");
        }
        m.put("chemical", "chemicals");
        m.put("building", "construction");
        m.put("consumer_goods", "retail");
        for (String s : List.of("automotive", "electronics", "energy", "agriculture", "transportation", "manufacturing",
                "pharmaceuticals", "food_beverage", "textiles", "construction", "retail", "aerospace", "chemicals")) {
            m.put(s, s);
        }
        return m;
    }

    private static Map<String, List<String>> builtInTextKeywords() {
        Map<String, List<String>> m = new LinkedHashMap<>();
        m.put("automotive", List.of("car", "vehicle", "auto", "automotive", "toyota", "ford"));
        m.put("electronics", List.of("chip", "semiconductor", "electronics", "computer", "phone", "samsung"));
        m.put("pharmaceuticals", List.of("drug", "medicine", "pharmaceutical", "vaccine", "healthcare"));
        m.put("food_beverage", List.of("food", "crop", "grain", "meat", "dairy", "beverage"));
        m.put("textiles", List.of("textile", "clothing", "fabric", "cotton", "fashion", "apparel"));
        m.put("construction", List.of("construction", "building", "cement", "steel", "lumber", "housing"));
        m.put("energy", List.of("oil", "gas", "energy", "power", "electricity", "renewable", "solar"));
        m.put("retail", List.of("retail", "store", "shopping", "consumer"));
        return m;
    }
}
