package ru.tigran.quotaadmission.dto;

import java.util.Locale;
import java.util.Optional;

/**
 * Демографическое измерение, по которому настраиваются квоты.
 * key - имя поля в анкете участника (camelCase), name() - каноническое имя измерения.
 */
public enum QuotaDimension {
    AGE("age"),
    COUNTRY("country"),
    GENDER("gender"),
    EDUCATION_LEVEL("educationLevel"),
    HOUSEHOLD_INCOME("householdIncome"),
    EMPLOYMENT_STATUS("employmentStatus"),
    DAILY_HOURS_ONLINE("dailyHoursOnline"),
    TECHNICAL_PROFICIENCY("technicalProficiency");

    private final String key;

    QuotaDimension(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    /**
     * Resolves a demographics map key. Accepts the participant field name ("educationLevel")
     * and the dimension name ("EDUCATION_LEVEL"), case-insensitively.
     *
     * @param key raw key from the request
     * @return dimension, or empty for unrecognized keys
     */
    public static Optional<QuotaDimension> fromKey(String key) {
        if (key == null || key.isBlank()) {
            return Optional.empty();
        }
        String trimmed = key.trim();
        for (QuotaDimension dimension : values()) {
            if (dimension.key.equalsIgnoreCase(trimmed)
                    || dimension.name().equals(trimmed.toUpperCase(Locale.ROOT))) {
                return Optional.of(dimension);
            }
        }
        return Optional.empty();
    }
}
