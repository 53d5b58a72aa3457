package ru.tigran.quotaadmission.dto;

/**
 * Способ комбинирования измерений в конфигурации квот.
 */
public enum CombinationMode {
    /**
     * Each matching rule is its own cell; the participant must fit into every one of them.
     */
    PER_DIMENSION,
    /**
     * All matched (dimension, value) pairs form a single composite cell.
     */
    CROSS_PRODUCT
}
