package ru.tigran.quotaadmission.dto;

/**
 * Admission decision visible to callers of the validate endpoint.
 */
public enum ValidationStatus {
    QUALIFIED,
    NO_CONFIG,
    OVERQUOTA,
    ERROR
}
