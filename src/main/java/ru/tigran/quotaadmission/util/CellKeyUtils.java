package ru.tigran.quotaadmission.util;

import ru.tigran.quotaadmission.dto.QuotaDimension;
import ru.tigran.quotaadmission.dto.QuotaRuleDTO;

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Utility class for quota cell keys.
 * Key format: "AGE=18-24" for a single rule, "AGE=18-24&COUNTRY=ES" for a composite cell.
 * Pairs are sorted by dimension name, values are URL-encoded so that a key can be parsed back.
 * The study-wide participant limit is counted under the reserved key {@link #TOTAL_KEY}.
 */
public class CellKeyUtils {

    public static final String TOTAL_KEY = "__TOTAL__";
    public static final String TOTAL_DIMENSION = "TOTAL";
    public static final String TOTAL_VALUE = "ALL";

    private static final String PAIR_SEPARATOR = "&";
    private static final String VALUE_SEPARATOR = "=";

    private CellKeyUtils() {
        // Private constructor to prevent instantiation
    }

    public static String singleKey(QuotaRuleDTO rule) {
        return pair(rule.dimension(), rule.value());
    }

    /**
     * Builds the key of a composite cell. Order of the given rules does not matter.
     *
     * @param rules contributing rules, at most one per dimension
     * @return deterministic cell key
     */
    public static String compositeKey(List<QuotaRuleDTO> rules) {
        return rules.stream()
                .sorted(Comparator.comparing(rule -> rule.dimension().name()))
                .map(rule -> pair(rule.dimension(), rule.value()))
                .collect(Collectors.joining(PAIR_SEPARATOR));
    }

    /**
     * Parses a cell key back into its (dimension, value) pairs, in key order.
     * Pairs with an unknown dimension are kept under their raw name.
     *
     * @param cellKey key produced by {@link #singleKey} or {@link #compositeKey}
     * @return dimension name to value
     */
    public static Map<String, String> parse(String cellKey) {
        Map<String, String> pairs = new LinkedHashMap<>();
        if (cellKey == null || cellKey.isEmpty()) {
            return pairs;
        }
        if (TOTAL_KEY.equals(cellKey)) {
            pairs.put(TOTAL_DIMENSION, TOTAL_VALUE);
            return pairs;
        }
        for (String pair : cellKey.split(PAIR_SEPARATOR)) {
            int separator = pair.indexOf(VALUE_SEPARATOR);
            if (separator < 0) {
                pairs.put(pair, "");
                continue;
            }
            String dimension = pair.substring(0, separator);
            String value = URLDecoder.decode(pair.substring(separator + 1), StandardCharsets.UTF_8);
            pairs.put(dimension, value);
        }
        return pairs;
    }

    public static String dimensionLabel(String cellKey) {
        return String.join(PAIR_SEPARATOR, new ArrayList<>(parse(cellKey).keySet()));
    }

    public static String valueLabel(String cellKey) {
        return String.join(PAIR_SEPARATOR, new ArrayList<>(parse(cellKey).values()));
    }

    private static String pair(QuotaDimension dimension, String value) {
        return dimension.name() + VALUE_SEPARATOR + URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
