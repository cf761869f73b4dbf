package com.demoAuto.salesAgent.catalog.scoring;

import com.demoAuto.salesAgent.catalog.model.VehicleRecord;

import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Text matching scores between a free-text query and a catalog record.
 *
 * <ul>
 *   <li>Keyword score: share of query words found as substrings of "make model version year".</li>
 *   <li>Model match: the record's model named as whole words of the query.</li>
 *   <li>Fuzzy score: Jaccard similarity of the normalized word sets of the query and "make model".</li>
 * </ul>
 */
public final class TextMatchScorer {

    /**
     * Fuzzy matches at or below this score are discarded.
     */
    public static final double FUZZY_THRESHOLD = 0.5;

    /**
     * Long brand names mapped to the short forms customers type. Applied in insertion order,
     * before punctuation is stripped.
     */
    private static final Map<String, String> SYNONYMS = new LinkedHashMap<>();

    static {
        SYNONYMS.put("volkswagen", "vw");
        SYNONYMS.put("chevrolet", "chevy");
        SYNONYMS.put("mercedes-benz", "mercedes");
        SYNONYMS.put("mercedes benz", "mercedes");
        SYNONYMS.put("land rover", "landrover");
        SYNONYMS.put("land-rover", "landrover");
    }

    private TextMatchScorer() {}

    public static double keywordScore(VehicleRecord vehicle, String query) {
        List<String> words = queryWords(query);
        if (words.isEmpty()) {
            return 0.0;
        }
        String searchable = searchableText(vehicle);
        long found = words.stream().filter(searchable::contains).count();
        return (double) found / words.size();
    }

    public static double fuzzyScore(VehicleRecord vehicle, String query) {
        String target = normalizeMakeModel(vehicle.getMake() + " " + vehicle.getModel());
        return jaccard(tokens(normalizeMakeModel(query)), tokens(target));
    }

    /**
     * True when every word of the record's model appears as a whole word of the query.
     */
    public static boolean namesModel(VehicleRecord vehicle, String query) {
        Set<String> model = tokens(normalizeMakeModel(vehicle.getModel()));
        return !model.isEmpty() && tokens(normalizeMakeModel(query)).containsAll(model);
    }

    /**
     * Lowercases, applies the brand synonym table, strips punctuation and collapses whitespace.
     */
    public static String normalizeMakeModel(String text) {
        if (text == null) {
            return "";
        }
        String normalized = text.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, String> synonym : SYNONYMS.entrySet()) {
            normalized = normalized.replace(synonym.getKey(), synonym.getValue());
        }
        normalized = normalized.replaceAll("[^\\p{L}\\p{N}\\s]", "");
        return String.join(" ", normalized.trim().split("\\s+"));
    }

    public static double jaccard(Set<String> a, Set<String> b) {
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        Set<String> intersection = new HashSet<>(a);
        intersection.retainAll(b);
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        return (double) intersection.size() / union.size();
    }

    static String searchableText(VehicleRecord vehicle) {
        return (vehicle.getMake() + " " + vehicle.getModel() + " "
                + (vehicle.getVersion() == null ? "" : vehicle.getVersion()) + " "
                + vehicle.getYear()).toLowerCase(Locale.ROOT);
    }

    static List<String> queryWords(String query) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        return Arrays.asList(query.toLowerCase(Locale.ROOT).trim().split("\\s+"));
    }

    private static Set<String> tokens(String normalized) {
        if (normalized.isBlank()) {
            return Set.of();
        }
        return new HashSet<>(Arrays.asList(normalized.split(" ")));
    }
}
