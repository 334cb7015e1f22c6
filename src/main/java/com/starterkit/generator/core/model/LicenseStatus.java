package com.starterkit.generator.core.model;

/**
 * Lifecycle status of an issued license.
 */
public enum LicenseStatus {
    ACTIVE,
    REVOKED,
    EXPIRED
}
