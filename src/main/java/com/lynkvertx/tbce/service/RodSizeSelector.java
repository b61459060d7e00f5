package com.lynkvertx.tbce.service;

import com.lynkvertx.tbce.config.BracketCheckConfig;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Picks the smallest standard drop rod whose catalog tension capacity covers the rod demand.
 */
@Component
@RequiredArgsConstructor
public class RodSizeSelector {

    private static final Pattern METRIC_SIZE = Pattern.compile("M\\s*(\\d+)");

    private final BracketCheckConfig config;

    /**
     * Normalize a rod label to its metric size: "m 10 threaded rod" -> "M10".
     * Labels without a metric size are returned upper-cased.
     */
    public static String parseRodSize(String label) {
        if (label == null) return "";
        String upper = label.toUpperCase(Locale.ROOT);
        Matcher matcher = METRIC_SIZE.matcher(upper);
        return matcher.find() ? "M" + matcher.group(1) : upper.trim();
    }

    /**
     * Smallest size in the configured order whose capacity is >= the per-rod demand;
     * the largest size when none suffices.
     *
     * @param perRodDemandN tension per rod (N)
     * @param capacities    capacity (N) per rod label, labels normalized through {@link #parseRodSize}
     */
    public String requiredRodSize(double perRodDemandN, Map<String, Double> capacities) {
        Map<String, Double> bySize = new HashMap<>();
        for (Map.Entry<String, Double> entry : capacities.entrySet()) {
            if (entry.getValue() != null) {
                bySize.put(parseRodSize(entry.getKey()), entry.getValue());
            }
        }

        List<String> order = config.getRodSizeOrder();
        for (String size : order) {
            Double capacity = bySize.get(size);
            if (capacity != null && capacity > 0 && capacity >= perRodDemandN) {
                return size;
            }
        }
        return order.get(order.size() - 1);
    }

    /** True when both sizes are standard and the selected one is smaller than the minimum */
    public boolean isBelowMinimum(String selectedSize, String minimumSize) {
        List<String> order = config.getRodSizeOrder();
        int selected = order.indexOf(selectedSize);
        int minimum = order.indexOf(minimumSize);
        return selected >= 0 && minimum >= 0 && selected < minimum;
    }
}
