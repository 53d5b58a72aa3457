package ru.tigran.quotaadmission.dto;

import java.util.Collection;

/**
 * Политика вычисления лимита составной ячейки (CROSS_PRODUCT) из лимитов входящих в неё правил.
 */
public enum CompositeCapPolicy {
    MIN,
    MAX;

    public int apply(Collection<Integer> caps) {
        if (caps.isEmpty()) {
            throw new IllegalArgumentException("Composite cell needs at least one contributing rule");
        }
        return switch (this) {
            case MIN -> caps.stream().mapToInt(Integer::intValue).min().getAsInt();
            case MAX -> caps.stream().mapToInt(Integer::intValue).max().getAsInt();
        };
    }

    public static CompositeCapPolicy fromValue(String value) {
        if (value == null || value.isBlank()) {
            return MIN;
        }
        for (CompositeCapPolicy policy : values()) {
            if (policy.name().equalsIgnoreCase(value.trim())) {
                return policy;
            }
        }
        throw new IllegalArgumentException("Unknown composite cap policy: " + value);
    }
}
