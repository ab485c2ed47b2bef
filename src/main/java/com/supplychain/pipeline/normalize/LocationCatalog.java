package com.supplychain.pipeline.normalize;

import com.supplychain.pipeline.config.NormalizationProperties;
import com.supplychain.pipeline.domain.Coordinates;
import com.supplychain.pipeline.domain.StandardizedLocation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Known ports, hubs and countries with their country, macro region and coordinates.
 * Read-only after construction.
 */
@Slf4j
@Component
public class LocationCatalog {

    static final String GLOBAL = "Global";

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern EDGE_PUNCTUATION = Pattern.compile("^[\\s.,;:!?'\"()\\-]+|[\\s.,;:!?'\"()\\-]+$");

    private static final Pattern QUALIFIED_NAME =
            Pattern.compile("(?<![\\p{L}\\p{N}])(new|north|south|east|west|upper|lower)\\s+$");

    private final Map<String, StandardizedLocation> entries;
    private final Map<String, String> aliases;
    private final Map<String, Pattern> searchPatterns;

    public LocationCatalog(NormalizationProperties properties) {
        Map<String, StandardizedLocation> known = new LinkedHashMap<>();
        registerHubs(known);
        registerCountries(known);
        this.entries = Map.copyOf(known);

        Map<String, String> aliasMap = new HashMap<>(builtInAliases());
        properties.getExtraLocationAliases().forEach((alias, target) -> {
            if (known.containsKey(key(target))) {
                aliasMap.put(key(alias), key(target));
            } else {
                log.warn("Ignoring location alias {} -> {}: target is not in the catalog", alias, target);
            }
        });
        this.aliases = Map.copyOf(aliasMap);

        // aliases are exact-match only
        Map<String, Pattern> patterns = new HashMap<>();
        for (String name : entries.keySet()) {
            if (!name.equals(key(GLOBAL))) {
                patterns.put(name, wordPattern(name));
            }
        }
        this.searchPatterns = Map.copyOf(patterns);
    }

    /**
     * Resolves free text to a catalog entry: alias, exact name, longest known name inside
     * the text, then a title-cased copy of the input marked unresolved. A country name
     * preceded by a directional or "new" qualifier names a different place and is skipped.
     */
    public StandardizedLocation resolve(String raw) {
        String cleaned = clean(raw);
        if (cleaned.isEmpty()) {
            return entries.get(key(GLOBAL));
        }
        String lookup = key(cleaned);

        String aliasTarget = aliases.get(lookup);
        if (aliasTarget != null) {
            return entries.get(aliasTarget);
        }
        StandardizedLocation exact = entries.get(lookup);
        if (exact != null) {
            return exact;
        }
        String bestKey = null;
        for (Map.Entry<String, Pattern> candidate : searchPatterns.entrySet()) {
            if (isBetterMatch(candidate.getKey(), bestKey)
                    && containsPlace(candidate.getKey(), candidate.getValue(), lookup)) {
                bestKey = candidate.getKey();
            }
        }
        if (bestKey != null) {
            return entries.get(bestKey);
        }
        return StandardizedLocation.builder()
                .standardName(titleCase(cleaned))
                .country("")
                .region("")
                .coordinates(Coordinates.UNKNOWN)
                .resolved(false)
                .build();
    }

    private boolean containsPlace(String name, Pattern pattern, String text) {
        boolean country = name.equals(key(entries.get(name).getCountry()));
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            if (!country || !QUALIFIED_NAME.matcher(text.substring(0, matcher.start())).find()) {
                return true;
            }
        }
        return false;
    }

    private static boolean isBetterMatch(String candidate, String best) {
        if (best == null || candidate.length() > best.length()) {
            return true;
        }
        return candidate.length() == best.length() && candidate.compareTo(best) < 0;
    }

    public boolean isKnown(String raw) {
        return resolve(raw).isResolved();
    }

    static String titleCase(String text) {
        return Arrays.stream(WHITESPACE.split(text.trim()))
                .filter(word -> !word.isEmpty())
                .map(word -> word.substring(0, 1).toUpperCase(Locale.ROOT) + word.substring(1).toLowerCase(Locale.ROOT))
                .collect(Collectors.joining(" "));
    }

    private static String clean(String raw) {
        if (raw == null) {
            return "";
        }
        String collapsed = WHITESPACE.matcher(raw).replaceAll(" ");
        return EDGE_PUNCTUATION.matcher(collapsed).replaceAll("");
    }

    private static String key(String text) {
        return text.trim().toLowerCase(Locale.ROOT);
    }

    private static Pattern wordPattern(String text) {
        return Pattern.compile("(?<![\\p{L}\\p{N}])" + Pattern.quote(text) + "(?![\\p{L}\\p{N}])");
    }

    private static Map<String, String> builtInAliases() {
        Map<String, String> m = new HashMap<>();
        m.put("la", "los angeles");
        m.put("l.a.", "los angeles");
        m.put("nyc", "new york");
        m.put("sf", "san francisco");
        m.put("uk", "united kingdom");
        m.put("great britain", "united kingdom");
        m.put("usa", "united states");
        m.put("us", "united states");
        m.put("u.s.", "united states");
        m.put("united states of america", "united states");
        m.put("prc", "china");
        m.put("mainland china", "china");
        m.put("hk", "hong kong");
        m.put("sg", "singapore");
        m.put("roc", "taiwan");
        m.put("korea", "south korea");
        m.put("republic of korea", "south korea");
        m.put("uae", "united arab emirates");
        m.put("holland", "netherlands");
        m.put("the netherlands", "netherlands");
        m.put("port of la", "port of los angeles");
        m.put("suez", "suez canal");
        m.put("saigon", "ho chi minh city");
        return m;
    }

    private static void registerHubs(Map<String, StandardizedLocation> m) {
        add(m, "Port of Los Angeles", "United States", "North America", 33.7361, -118.2640);
        add(m, "Port of Long Beach", "United States", "North America", 33.7701, -118.1937);
        add(m, "Long Beach", "United States", "North America", 33.7701, -118.1937);
        add(m, "Los Angeles", "United States", "North America", 34.0522, -118.2437);
        add(m, "San Francisco", "United States", "North America", 37.7749, -122.4194);
        add(m, "Port of New York", "United States", "North America", 40.6892, -74.0445);
        add(m, "New York", "United States", "North America", 40.7128, -74.0060);
        add(m, "Houston", "United States", "North America", 29.7604, -95.3698);
        add(m, "Savannah", "United States", "North America", 32.0809, -81.0912);
        add(m, "Vancouver", "Canada", "North America", 49.2827, -123.1207);
        add(m, "Mexico City", "Mexico", "North America", 19.4326, -99.1332);
        add(m, "Manzanillo", "Mexico", "North America", 19.1138, -104.3385);
        add(m, "Shanghai", "China", "Asia", 31.2304, 121.4737);
        add(m, "Shenzhen", "China", "Asia", 22.5431, 114.0579);
        add(m, "Ningbo", "China", "Asia", 29.8683, 121.5440);
        add(m, "Guangzhou", "China", "Asia", 23.1291, 113.2644);
        add(m, "Beijing", "China", "Asia", 39.9042, 116.4074);
        add(m, "Hong Kong", "China", "Asia", 22.3193, 114.1694);
        add(m, "Taipei", "Taiwan", "Asia", 25.0330, 121.5654);
        add(m, "Kaohsiung", "Taiwan", "Asia", 22.6273, 120.3014);
        add(m, "Hsinchu", "Taiwan", "Asia", 24.8138, 120.9675);
        add(m, "Tokyo", "Japan", "Asia", 35.6762, 139.6503);
        add(m, "Yokohama", "Japan", "Asia", 35.4437, 139.6380);
        add(m, "Seoul", "South Korea", "Asia", 37.5665, 126.9780);
        add(m, "Busan", "South Korea", "Asia", 35.1796, 129.0756);
        add(m, "Port of Singapore", "Singapore", "Asia", 1.2966, 103.8764);
        add(m, "Ho Chi Minh City", "Vietnam", "Asia", 10.8231, 106.6297);
        add(m, "Hanoi", "Vietnam", "Asia", 21.0278, 105.8342);
        add(m, "Bangkok", "Thailand", "Asia", 13.7563, 100.5018);
        add(m, "Kuala Lumpur", "Malaysia", "Asia", 3.1390, 101.6869);
        add(m, "Port Klang", "Malaysia", "Asia", 3.0000, 101.4000);
        add(m, "Jakarta", "Indonesia", "Asia", -6.2088, 106.8456);
        add(m, "Mumbai", "India", "Asia", 19.0760, 72.8777);
        add(m, "Chennai", "India", "Asia", 13.0827, 80.2707);
        add(m, "Dubai", "United Arab Emirates", "Middle East", 25.2048, 55.2708);
        add(m, "Suez Canal", "Egypt", "Middle East", 30.5852, 32.2654);
        add(m, "Rotterdam", "Netherlands", "Europe", 51.9225, 4.4792);
        add(m, "Amsterdam", "Netherlands", "Europe", 52.3676, 4.9041);
        add(m, "Antwerp", "Belgium", "Europe", 51.2194, 4.4025);
        add(m, "Hamburg", "Germany", "Europe", 53.5511, 9.9937);
        add(m, "Frankfurt", "Germany", "Europe", 50.1109, 8.6821);
        add(m, "Munich", "Germany", "Europe", 48.1351, 11.5820);
        add(m, "London", "United Kingdom", "Europe", 51.5074, -0.1278);
        add(m, "Felixstowe", "United Kingdom", "Europe", 51.9639, 1.3515);
        add(m, "Panama Canal", "Panama", "Latin America", 9.0800, -79.6800);
        add(m, "Santos", "Brazil", "Latin America", -23.9608, -46.3336);
    }

    private static void registerCountries(Map<String, StandardizedLocation> m) {
        m.put(key(GLOBAL), StandardizedLocation.builder()
                .standardName(GLOBAL).country("").region(GLOBAL)
                .coordinates(Coordinates.UNKNOWN).resolved(true).build());
        add(m, "China", "China", "Asia", 35.8617, 104.1954);
        add(m, "Taiwan", "Taiwan", "Asia", 23.6978, 120.9605);
        add(m, "South Korea", "South Korea", "Asia", 35.9078, 127.7669);
        add(m, "Japan", "Japan", "Asia", 36.2048, 138.2529);
        add(m, "Singapore", "Singapore", "Asia", 1.3521, 103.8198);
        add(m, "Vietnam", "Vietnam", "Asia", 14.0583, 108.2772);
        add(m, "Thailand", "Thailand", "Asia", 15.8700, 100.9925);
        add(m, "Malaysia", "Malaysia", "Asia", 4.2105, 101.9758);
        add(m, "Indonesia", "Indonesia", "Asia", -0.7893, 113.9213);
        add(m, "India", "India", "Asia", 20.5937, 78.9629);
        add(m, "United States", "United States", "North America", 37.0902, -95.7129);
        add(m, "Canada", "Canada", "North America", 56.1304, -106.3468);
        add(m, "Mexico", "Mexico", "North America", 23.6345, -102.5528);
        add(m, "Brazil", "Brazil", "Latin America", -14.2350, -51.9253);
        add(m, "Germany", "Germany", "Europe", 51.1657, 10.4515);
        add(m, "Netherlands", "Netherlands", "Europe", 52.1326, 5.2913);
        add(m, "Belgium", "Belgium", "Europe", 50.5039, 4.4699);
        add(m, "France", "France", "Europe", 46.2276, 2.2137);
        add(m, "Italy", "Italy", "Europe", 41.8719, 12.5674);
        add(m, "Poland", "Poland", "Europe", 51.9194, 19.1451);
        add(m, "United Kingdom", "United Kingdom", "Europe", 55.3781, -3.4360);
        add(m, "Egypt", "Egypt", "Middle East", 26.8206, 30.8025);
        add(m, "United Arab Emirates", "United Arab Emirates", "Middle East", 23.4241, 53.8478);
        add(m, "Panama", "Panama", "Latin America", 8.5380, -80.7821);
    }

    private static void add(Map<String, StandardizedLocation> m, String name, String country, String region,
                            double lat, double lon) {
        m.put(key(name), StandardizedLocation.builder()
                .standardName(name)
                .country(country)
                .region(region)
                .coordinates(new Coordinates(lat, lon))
                .resolved(true)
                .build());
    }
}
